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

import java.io.IOException;

/**
 * Download primitive of the messaging collaborator: fetches the bytes a user sent.
 * Called from the blocking worker thread, never from the coordinating context.
 */
@FunctionalInterface
public interface PayloadSource {

    /**
     * Fetch the complete payload into memory.
     *
     * @return the payload bytes, never null
     * @throws IOException if the source channel cannot deliver the payload
     */
    byte[] fetch() throws IOException;
}
