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

package dev.mars.ferry.transfer;

/**
 * Status text written to a job's status handle.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class StatusMessages {

    public static final String QUEUED = "Queued... Waiting for turn.";
    public static final String DRAINED_BY_PAUSE = "This task was cancelled because the bot was paused by an admin.";
    public static final String FORCE_STOPPED = "This task was force-stopped by an admin.";
    public static final String REJECTED = "The bot is currently paused by an admin. New tasks are not accepted.";

    private static final int BAR_CELLS = 10;

    private StatusMessages() {
    }

    public static String position(int position) {
        return "Queued... Position in line: " + position;
    }

    public static String downloading(String name) {
        return "Downloading " + name + "...";
    }

    public static String uploading(String name, String backendName) {
        return "Uploading " + name + " to " + backendName + "...";
    }

    /**
     * Progress line with a ten-cell bar, e.g. {@code [██████░░░░] 60%}.
     *
     * @param fraction progress between 0.0 and 1.0
     */
    public static String progress(String name, double fraction) {
        int percent = (int) Math.round(Math.max(0.0, Math.min(1.0, fraction)) * 100.0);
        int filled = percent / BAR_CELLS;
        return "Uploading " + name + "\n[" + "█".repeat(filled) + "░".repeat(BAR_CELLS - filled) + "] " + percent + "%";
    }

    public static String completed(String name, String destinationId) {
        return "Successfully uploaded!\nFile: `" + name + "`\nID: `" + destinationId + "`";
    }

    public static String authFailure(String error, String remediationHint) {
        return "Drive auth error:\n`" + error + "`\n\n" + remediationHint;
    }

    public static String uploadFailure(String error) {
        return "Upload failed:\n`" + error + "`";
    }

    public static String downloadFailure(String error) {
        return "Error: " + error;
    }
}
