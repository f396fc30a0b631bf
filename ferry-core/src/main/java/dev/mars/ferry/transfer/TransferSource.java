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

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.util.Objects;

/**
 * A payload materialized in memory and ready to be handed to a {@link TransferBackend}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class TransferSource {

    private final String jobId;
    private final String name;
    private final String contentType;
    private final String destination;
    private final byte[] content;

    public TransferSource(String jobId, String name, String contentType, String destination, byte[] content) {
        this.jobId = Objects.requireNonNull(jobId, "Job id cannot be null");
        this.name = Objects.requireNonNull(name, "Name cannot be null");
        this.contentType = Objects.requireNonNull(contentType, "Content type cannot be null");
        this.destination = destination != null ? destination : "";
        this.content = Objects.requireNonNull(content, "Content cannot be null");
    }

    public String getJobId() { return jobId; }

    public String getName() { return name; }

    public String getContentType() { return contentType; }

    /**
     * @return the destination folder or bucket id; empty for the backend's default location
     */
    public String getDestination() { return destination; }

    public long getSize() { return content.length; }

    /**
     * @return a fresh stream over the payload bytes
     */
    public InputStream openStream() {
        return new ByteArrayInputStream(content);
    }

    @Override
    public String toString() {
        return "TransferSource{" +
                "jobId='" + jobId + '\'' +
                ", name='" + name + '\'' +
                ", contentType='" + contentType + '\'' +
                ", destination='" + destination + '\'' +
                ", size=" + content.length +
                '}';
    }
}
