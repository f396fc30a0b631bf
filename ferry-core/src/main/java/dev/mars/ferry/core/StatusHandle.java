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

package dev.mars.ferry.core;

import io.vertx.core.Future;

/**
 * Addressable destination for outbound status text, owned by the messaging collaborator
 * (for example an editable chat message). The core only writes through it.
 *
 * <p>Writes are best-effort: a failed future or a thrown exception is ignored by the core
 * and never changes job state. The core never has two writes in flight on the same handle.</p>
 */
public interface StatusHandle {

    /**
     * Stable identity of the handle, used to key progress throttling.
     *
     * @return the handle identifier
     */
    String getHandleId();

    /**
     * Replace the text shown on this handle.
     *
     * @param text the new status text
     * @return a future completing when the write has been accepted
     */
    Future<Void> update(String text);
}
