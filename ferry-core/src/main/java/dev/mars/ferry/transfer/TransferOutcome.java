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

import java.util.Objects;
import java.util.Optional;

/**
 * Result of one transfer backend call. Operator cancellation is a kind of outcome of its own,
 * distinct from failure, so the worker can apply cancellation semantics without inspecting
 * error text.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class TransferOutcome {

    public enum Kind {
        COMPLETED,
        CANCELLED,
        FAILED
    }

    private static final TransferOutcome CANCELLED = new TransferOutcome(Kind.CANCELLED, null, null, null);

    private final Kind kind;
    private final String destinationId;
    private final String errorMessage;
    private final Throwable cause;

    private TransferOutcome(Kind kind, String destinationId, String errorMessage, Throwable cause) {
        this.kind = kind;
        this.destinationId = destinationId;
        this.errorMessage = errorMessage;
        this.cause = cause;
    }

    /**
     * @param destinationId the id the object store assigned to the uploaded file
     */
    public static TransferOutcome completed(String destinationId) {
        return new TransferOutcome(Kind.COMPLETED,
                Objects.requireNonNull(destinationId, "Destination id cannot be null"), null, null);
    }

    public static TransferOutcome cancelled() {
        return CANCELLED;
    }

    /**
     * @param errorMessage text shown to the requester
     * @param cause        underlying error, may be null
     */
    public static TransferOutcome failed(String errorMessage, Throwable cause) {
        return new TransferOutcome(Kind.FAILED, null,
                Objects.requireNonNull(errorMessage, "Error message cannot be null"), cause);
    }

    public Kind getKind() { return kind; }

    public boolean isCompleted() { return kind == Kind.COMPLETED; }

    public boolean isCancelled() { return kind == Kind.CANCELLED; }

    public boolean isFailed() { return kind == Kind.FAILED; }

    public Optional<String> getDestinationId() { return Optional.ofNullable(destinationId); }

    public Optional<String> getErrorMessage() { return Optional.ofNullable(errorMessage); }

    public Optional<Throwable> getCause() { return Optional.ofNullable(cause); }

    @Override
    public String toString() {
        return switch (kind) {
            case COMPLETED -> "TransferOutcome{COMPLETED, destinationId='" + destinationId + "'}";
            case CANCELLED -> "TransferOutcome{CANCELLED}";
            case FAILED -> "TransferOutcome{FAILED, error='" + errorMessage + "'}";
        };
    }
}
