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

import dev.mars.ferry.bot.admin.InMemoryAdminDirectory;
import dev.mars.ferry.config.FerryConfiguration;
import dev.mars.ferry.core.JobStatus;
import dev.mars.ferry.core.TransferJob;
import dev.mars.ferry.transfer.CancellationCheck;
import dev.mars.ferry.transfer.FerryService;
import dev.mars.ferry.transfer.ProgressListener;
import dev.mars.ferry.transfer.StatusMessages;
import dev.mars.ferry.transfer.TransferBackend;
import dev.mars.ferry.transfer.TransferOutcome;
import dev.mars.ferry.transfer.TransferSource;
import io.vertx.core.Vertx;
import io.vertx.junit5.VertxExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.List;
import java.util.Properties;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

/**
 * Dispatcher wired to a real FerryService with a gated backend.
 */
@ExtendWith(VertxExtension.class)
class CommandDispatcherIntegrationTest {

    private static final Sender ADMIN = Sender.of("owner", 1L);

    private final CountDownLatch gate = new CountDownLatch(1);
    private FerryService service;
    private CommandDispatcher dispatcher;
    private RecordingReplyChannel channel;

    @BeforeEach
    void setUp(Vertx vertx) {
        TransferBackend backend = new TransferBackend() {
            @Override
            public String getBackendName() {
                return "Gated Drive";
            }

            @Override
            public TransferOutcome transfer(TransferSource source, ProgressListener progress,
                                            CancellationCheck cancellation) {
                progress.onProgress(0.5);
                while (gate.getCount() > 0) {
                    if (cancellation.isCancelled()) {
                        return TransferOutcome.cancelled();
                    }
                    try {
                        gate.await(5, TimeUnit.MILLISECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        return TransferOutcome.failed("interrupted", e);
                    }
                }
                return TransferOutcome.completed("id-" + source.getName());
            }
        };
        Properties props = new Properties();
        props.setProperty(FerryConfiguration.PROGRESS_THROTTLE_MS, "0");
        service = new FerryService(vertx, backend, new FerryConfiguration(props));
        dispatcher = new CommandDispatcher(service, new InMemoryAdminDirectory(List.of("@owner"), List.of()));
        channel = new RecordingReplyChannel("chat");
    }

    @AfterEach
    void tearDown() {
        gate.countDown();
    }

    private TransferJob upload(String name) {
        InboundFile file = InboundFile.builder()
                .kind(InboundFile.Kind.DOCUMENT)
                .source(() -> name.getBytes())
                .uniqueId(name)
                .fileName(name)
                .build();
        return dispatcher.onFile(ADMIN, file, channel).result().orElseThrow();
    }

    private String lastReply() {
        List<String> replies = channel.getReplies();
        return replies.get(replies.size() - 1);
    }

    @Test
    void testPauseCommandCancelsEverythingAndStartResumes() {
        TransferJob running = upload("one.pdf");
        TransferJob waiting = upload("two.pdf");
        await().atMost(10, TimeUnit.SECONDS).until(() -> running.getStatus() == JobStatus.UPLOADING);

        dispatcher.onText(ADMIN, "/pause", channel);

        assertThat(lastReply()).contains("1 queued tasks cleared");
        await().atMost(10, TimeUnit.SECONDS).until(() -> running.isTerminal() && waiting.isTerminal());
        assertThat(running.getStatus()).isEqualTo(JobStatus.CANCELLED);
        assertThat(waiting.getStatus()).isEqualTo(JobStatus.CANCELLED);

        dispatcher.onFile(ADMIN, InboundFile.builder()
                .kind(InboundFile.Kind.PHOTO).source(() -> new byte[0]).uniqueId("p1").build(), channel);
        assertThat(lastReply()).isEqualTo(StatusMessages.REJECTED);

        dispatcher.onText(ADMIN, "/start", channel);
        assertThat(lastReply()).isEqualTo(BotMessages.RESUMED);

        gate.countDown();
        TransferJob fresh = upload("three.pdf");
        await().atMost(10, TimeUnit.SECONDS).until(fresh::isTerminal);
        assertThat(fresh.getStatus()).isEqualTo(JobStatus.COMPLETED);

        RecordingReplyChannel.RecordingStatus status = channel.getStatuses().get(channel.getStatuses().size() - 1);
        await().atMost(10, TimeUnit.SECONDS)
                .until(() -> StatusMessages.completed("three.pdf", "id-three.pdf").equals(status.getLastText()));
    }
}
