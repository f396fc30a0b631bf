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

import dev.mars.ferry.core.StatusHandle;
import io.vertx.core.Future;

/**
 * The conversation an inbound message arrived on, as seen by the dispatcher.
 * Implemented by the messaging transport.
 */
public interface ReplyChannel {

    /**
     * Send a new message in reply.
     */
    Future<Void> reply(String text);

    /**
     * Create an editable status message for a transfer. The transport posts the message on
     * the first update and edits it on every later one.
     */
    StatusHandle openStatusHandle();
}
