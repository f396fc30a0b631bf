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

import dev.mars.ferry.core.PayloadSource;

import java.util.Objects;

/**
 * A file attached to an inbound message.
 *
 * <p>Photos carry no name or type of their own and are stored as
 * {@code photo_<uniqueId>.jpg}; videos without a name become {@code video_<uniqueId>.mp4}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class InboundFile {

    public enum Kind {
        DOCUMENT,
        PHOTO,
        VIDEO
    }

    static final String PHOTO_CONTENT_TYPE = "image/jpeg";

    private final Kind kind;
    private final PayloadSource source;
    private final String uniqueId;
    private final String fileName;
    private final String mimeType;

    private InboundFile(Builder builder) {
        this.kind = Objects.requireNonNull(builder.kind, "Kind cannot be null");
        this.source = Objects.requireNonNull(builder.source, "Source cannot be null");
        this.uniqueId = Objects.requireNonNull(builder.uniqueId, "Unique id cannot be null");
        this.fileName = builder.fileName;
        this.mimeType = builder.mimeType;
    }

    public Kind getKind() {
        return kind;
    }

    public PayloadSource getSource() {
        return source;
    }

    public String getUniqueId() {
        return uniqueId;
    }

    /**
     * @return the name the file is stored under
     */
    public String resolveName() {
        switch (kind) {
            case PHOTO:
                return "photo_" + uniqueId + ".jpg";
            case VIDEO:
                return hasText(fileName) ? fileName : "video_" + uniqueId + ".mp4";
            default:
                return hasText(fileName) ? fileName : "document_" + uniqueId;
        }
    }

    /**
     * @return the MIME type to store the file with, or null to let the core apply its default
     */
    public String resolveContentType() {
        return kind == Kind.PHOTO ? PHOTO_CONTENT_TYPE : mimeType;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "InboundFile{kind=" + kind + ", uniqueId='" + uniqueId + "', name='" + resolveName() + "'}";
    }

    public static class Builder {
        private Kind kind;
        private PayloadSource source;
        private String uniqueId;
        private String fileName;
        private String mimeType;

        public Builder kind(Kind kind) {
            this.kind = kind;
            return this;
        }

        public Builder source(PayloadSource source) {
            this.source = source;
            return this;
        }

        public Builder uniqueId(String uniqueId) {
            this.uniqueId = uniqueId;
            return this;
        }

        public Builder fileName(String fileName) {
            this.fileName = fileName;
            return this;
        }

        public Builder mimeType(String mimeType) {
            this.mimeType = mimeType;
            return this;
        }

        public InboundFile build() {
            return new InboundFile(this);
        }
    }
}
