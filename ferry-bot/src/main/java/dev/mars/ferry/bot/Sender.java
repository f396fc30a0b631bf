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

import java.util.Objects;

/**
 * The user an inbound message came from.
 */
public final class Sender {

    private final String username;
    private final long userId;

    private Sender(String username, long userId) {
        this.username = username;
        this.userId = userId;
    }

    /**
     * @param username the user's public name without {@code @}, may be null
     * @param userId   the numeric user id
     */
    public static Sender of(String username, long userId) {
        return new Sender(username, userId);
    }

    public String getUsername() {
        return username;
    }

    public long getUserId() {
        return userId;
    }

    /**
     * @return {@code @username}, or the numeric id when the user has no username
     */
    public String getHandle() {
        return username != null && !username.isBlank() ? "@" + username : String.valueOf(userId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Sender sender = (Sender) o;
        return userId == sender.userId && Objects.equals(username, sender.username);
    }

    @Override
    public int hashCode() {
        return Objects.hash(username, userId);
    }

    @Override
    public String toString() {
        return getHandle();
    }
}
