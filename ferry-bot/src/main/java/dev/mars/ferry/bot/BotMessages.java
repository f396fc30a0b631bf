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

/**
 * Reply text for operator commands.
 */
final class BotMessages {

    static final String WELCOME = "Hi! I'm your file uploader bot. Send me any file, photo, or video, "
            + "and I'll upload it to your storage folder one by one.";
    static final String RESUMED = "Bot resumed! I am now accepting new tasks.";
    static final String PAUSING = "Pausing bot and clearing all tasks... Please wait.";
    static final String ADMIN_ONLY_COMMAND = "This command is restricted to admins.";
    static final String ADMIN_ONLY_UPLOAD = "Only admins can upload files.";
    static final String UNSUPPORTED_FILE = "Unsupported file type.";
    static final String ADD_ADMIN_USAGE = "Usage: /addadmin <username>";
    static final String REMOVE_ADMIN_USAGE = "Usage: /removeadmin <username>";

    private BotMessages() {
    }

    static String paused(int cancelledCount) {
        return "Bot paused!\n\n"
                + "• Running task stopped.\n"
                + "• " + cancelledCount + " queued tasks cleared.\n"
                + "• New tasks will be rejected.\n\n"
                + "Send /start to resume.";
    }
}
