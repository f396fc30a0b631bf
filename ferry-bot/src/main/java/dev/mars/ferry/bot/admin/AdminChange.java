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

package dev.mars.ferry.bot.admin;

/**
 * Result of an administrator add or remove request.
 *
 * @param success whether the directory changed
 * @param message reply text for the operator
 */
public record AdminChange(boolean success, String message) {

    static AdminChange applied(String message) {
        return new AdminChange(true, message);
    }

    static AdminChange refused(String message) {
        return new AdminChange(false, message);
    }
}
