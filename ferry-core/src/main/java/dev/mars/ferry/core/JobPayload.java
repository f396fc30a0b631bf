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

import java.util.Objects;

/**
 * The file a job carries: where its bytes come from plus the name and content type
 * used at the destination.
 *
 * @param source      download primitive for the payload bytes
 * @param name        destination file name
 * @param contentType MIME type, {@code application/octet-stream} when not supplied
 */
public record JobPayload(PayloadSource source, String name, String contentType) {

    public static final String DEFAULT_CONTENT_TYPE = "application/octet-stream";

    public JobPayload {
        Objects.requireNonNull(source, "Payload source cannot be null");
        Objects.requireNonNull(name, "Payload name cannot be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Payload name cannot be blank");
        }
        if (contentType == null || contentType.isBlank()) {
            contentType = DEFAULT_CONTENT_TYPE;
        }
    }
}
