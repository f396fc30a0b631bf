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

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Operator commands understood by the bot, with the description shown in the command menu.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public enum BotCommand {
    START("start", "Start or resume the bot", false),
    PAUSE("pause", "Stop and clear queue", true),
    ADD_ADMIN("addadmin", "Grant admin rights to a user", true),
    REMOVE_ADMIN("removeadmin", "Revoke admin rights from a user", true);

    private final String name;
    private final String description;
    private final boolean adminOnly;

    BotCommand(String name, String description, boolean adminOnly) {
        this.name = name;
        this.description = description;
        this.adminOnly = adminOnly;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public boolean isAdminOnly() {
        return adminOnly;
    }

    /**
     * Parse the command word of a message such as {@code /pause} or {@code /addadmin@ferry_bot bob}.
     *
     * @return the command, or empty for plain text and unknown commands
     */
    public static Optional<BotCommand> fromText(String text) {
        if (text == null || !text.startsWith("/")) {
            return Optional.empty();
        }
        String word = text.substring(1).split("\\s+", 2)[0];
        int mention = word.indexOf('@');
        String commandName = (mention >= 0 ? word.substring(0, mention) : word).toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(command -> command.name.equals(commandName))
                .findFirst();
    }

    /**
     * @return the text after the command word, trimmed, or empty if there is none
     */
    public static Optional<String> argument(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String[] parts = text.trim().split("\\s+", 2);
        return parts.length < 2 || parts[1].isBlank() ? Optional.empty() : Optional.of(parts[1].trim());
    }
}
