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

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable description of one inbound file-transfer submission.
 *
 * <p>Authorization of the requester happens before a request is built; the core uses
 * {@link #getRequesterId()} only to address status updates and for logging.</p>
 *
 * <h3>Usage Example:</h3>
 * <pre>{@code
 * SubmissionRequest request = SubmissionRequest.builder()
 *     .source(() -> download(fileRef))
 *     .name("report.pdf")
 *     .contentType("application/pdf")
 *     .requesterId("@alice")
 *     .statusHandle(replyMessage)
 *     .build();
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class SubmissionRequest {

    private final JobPayload payload;
    private final String requesterId;
    private final StatusHandle statusHandle;
    private final Instant submittedAt;

    private SubmissionRequest(Builder builder) {
        this.payload = new JobPayload(builder.source, builder.name, builder.contentType);
        this.requesterId = Objects.requireNonNull(builder.requesterId, "Requester id cannot be null");
        this.statusHandle = Objects.requireNonNull(builder.statusHandle, "Status handle cannot be null");
        this.submittedAt = builder.submittedAt != null ? builder.submittedAt : Instant.now();
    }

    public JobPayload getPayload() { return payload; }

    public String getRequesterId() { return requesterId; }

    public StatusHandle getStatusHandle() { return statusHandle; }

    public Instant getSubmittedAt() { return submittedAt; }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private PayloadSource source;
        private String name;
        private String contentType;
        private String requesterId;
        private StatusHandle statusHandle;
        private Instant submittedAt;

        public Builder source(PayloadSource source) {
            this.source = source;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder contentType(String contentType) {
            this.contentType = contentType;
            return this;
        }

        public Builder requesterId(String requesterId) {
            this.requesterId = requesterId;
            return this;
        }

        public Builder statusHandle(StatusHandle statusHandle) {
            this.statusHandle = statusHandle;
            return this;
        }

        public Builder submittedAt(Instant submittedAt) {
            this.submittedAt = submittedAt;
            return this;
        }

        /**
         * @return the request
         * @throws NullPointerException if source, name, requester or status handle is missing
         * @throws IllegalArgumentException if the name is blank
         */
        public SubmissionRequest build() {
            return new SubmissionRequest(this);
        }
    }

    @Override
    public String toString() {
        return "SubmissionRequest{" +
                "name='" + payload.name() + '\'' +
                ", contentType='" + payload.contentType() + '\'' +
                ", requesterId='" + requesterId + '\'' +
                ", submittedAt=" + submittedAt +
                '}';
    }
}
