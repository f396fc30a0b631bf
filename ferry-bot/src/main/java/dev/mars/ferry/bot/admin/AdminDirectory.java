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

import java.util.Set;

/**
 * Allow-list of users permitted to submit files and run operator commands.
 *
 * <p>Handles are compared in normalized form: {@code @username}, or the numeric user id for
 * users without a username.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public interface AdminDirectory {

    boolean isAdmin(String handle);

    /**
     * Grant admin rights to a handle.
     */
    AdminChange addAdmin(String handle);

    /**
     * Revoke admin rights from a dynamically added handle. Permanent admins cannot be removed.
     */
    AdminChange removeAdmin(String handle);

    Set<String> getAllAdmins();
}
