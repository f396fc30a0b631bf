/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.ferry.bot;

import dev.mars.ferry.bot.admin.AdminChange;
import dev.mars.ferry.bot.admin.AdminDirectory;
import dev.mars.ferry.core.SubmissionRequest;
import dev.mars.ferry.core.TransferJob;
import dev.mars.ferry.core.exceptions.SubmissionRejectedException;
import dev.mars.ferry.transfer.StatusMessages;
import dev.mars.ferry.transfer.TransferCoordinator;
import io.vertx.core.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Maps inbound chat events onto the transfer coordinator and the admin directory.
 *
 * <p>Transport neutral: the messaging integration parses its updates into a {@link Sender}
 * plus either command text or an {@link InboundFile}, and supplies a {@link ReplyChannel}
 * for the conversation.</p>
 *
 * <h3>Commands:</h3>
 * <ul>
 *   <li>{@code /start} - resumes a paused bot when sent by an admin, otherwise greets</li>
 *   <li>{@code /pause} - cancels all work and closes admission (admin only)</li>
 *   <li>{@code /addadmin <user>}, {@code /removeadmin <user>} (admin only)</li>
 * </ul>
 * Unknown commands and plain text are ignored.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class CommandDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(CommandDispatcher.class);

    private final TransferCoordinator coordinator;
    private final AdminDirectory admins;

    public CommandDispatcher(TransferCoordinator coordinator, AdminDirectory admins) {
        this.coordinator = Objects.requireNonNull(coordinator, "Transfer coordinator cannot be null");
        this.admins = Objects.requireNonNull(admins, "Admin directory cannot be null");
    }

    /**
     * Handle a text message.
     *
     * @return completes once every reply has been sent
     */
    public Future<Void> onText(Sender sender, String text, ReplyChannel channel) {
        Optional<BotCommand> command = BotCommand.fromText(text);
        if (command.isEmpty()) {
            return Future.succeededFuture();
        }
        BotCommand botCommand = command.get();
        boolean isAdmin = admins.isAdmin(sender.getHandle());
        logger.debug("Command /{} from {} (admin={})", botCommand.getName(), sender.getHandle(), isAdmin);

        if (botCommand.isAdminOnly() && !isAdmin) {
            return channel.reply(BotMessages.ADMIN_ONLY_COMMAND);
        }
        switch (botCommand) {
            case START:
                return start(isAdmin, channel);
            case PAUSE:
                return pause(sender, channel);
            case ADD_ADMIN:
                return BotCommand.argument(text)
                        .map(handle -> reply(channel, admins.addAdmin(handle)))
                        .orElseGet(() -> channel.reply(BotMessages.ADD_ADMIN_USAGE));
            case REMOVE_ADMIN:
                return BotCommand.argument(text)
                        .map(handle -> reply(channel, admins.removeAdmin(handle)))
                        .orElseGet(() -> channel.reply(BotMessages.REMOVE_ADMIN_USAGE));
            default:
                return Future.succeededFuture();
        }
    }

    /**
     * Handle a message carrying a file: queue it for upload when the sender is an admin.
     *
     * @param file the attachment, or null when the message carried an unsupported one
     * @return the admitted job, or empty if the file was refused
     */
    public Future<Optional<TransferJob>> onFile(Sender sender, InboundFile file, ReplyChannel channel) {
        if (!admins.isAdmin(sender.getHandle())) {
            logger.info("Refused upload from non-admin {}", sender.getHandle());
            return channel.reply(BotMessages.ADMIN_ONLY_UPLOAD).map(Optional.empty());
        }
        if (file == null) {
            return channel.reply(BotMessages.UNSUPPORTED_FILE).map(Optional.empty());
        }

        SubmissionRequest request = SubmissionRequest.builder()
                .source(file.getSource())
                .name(file.resolveName())
                .contentType(file.resolveContentType())
                .requesterId(sender.getHandle())
                .statusHandle(channel.openStatusHandle())
                .build();
        try {
            TransferJob job = coordinator.submit(request);
            return Future.succeededFuture(Optional.of(job));
        } catch (SubmissionRejectedException e) {
            return channel.reply(StatusMessages.REJECTED).map(Optional.empty());
        }
    }

    private Future<Void> start(boolean isAdmin, ReplyChannel channel) {
        if (isAdmin && coordinator.isPaused()) {
            coordinator.resume();
            return channel.reply(BotMessages.RESUMED);
        }
        return channel.reply(BotMessages.WELCOME);
    }

    private Future<Void> pause(Sender sender, ReplyChannel channel) {
        return channel.reply(BotMessages.PAUSING)
                .recover(err -> {
                    logger.debug("Could not send pause acknowledgement: {}", err.getMessage());
                    return Future.succeededFuture();
                })
                .compose(v -> {
                    int cancelled = coordinator.pause();
                    logger.info("Paused by {}: {} queued task(s) cleared", sender.getHandle(), cancelled);
                    return channel.reply(BotMessages.paused(cancelled));
                });
    }

    private static Future<Void> reply(ReplyChannel channel, AdminChange change) {
        return channel.reply(change.message());
    }
}
