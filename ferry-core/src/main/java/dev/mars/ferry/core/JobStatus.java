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

/**
 * Lifecycle states of a transfer job.
 *
 * <h3>State Transition Flow:</h3>
 * <pre>
 * QUEUED → DOWNLOADING → UPLOADING → {COMPLETED | FAILED | CANCELLED}
 *    ↓          ↓
 * CANCELLED  {FAILED | CANCELLED}
 * </pre>
 *
 * <h3>State Transition Rules:</h3>
 * <ul>
 *   <li>All jobs start in QUEUED when admitted</li>
 *   <li>QUEUED can only move forward; a job never returns to QUEUED</li>
 *   <li>COMPLETED, FAILED and CANCELLED are terminal: no further transitions</li>
 *   <li>DOWNLOADING and UPLOADING are the active states; at most one job holds
 *       one of them at any time</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 * @see TransferJob
 */
public enum JobStatus {

    /**
     * Admitted and waiting in the admission queue.
     */
    QUEUED,

    /**
     * Dequeued by the worker; payload bytes are being fetched from the source channel.
     */
    DOWNLOADING,

    /**
     * Payload is materialized and the transfer backend call is in flight.
     * Progress is reported only in this state.
     */
    UPLOADING,

    /**
     * The backend returned a destination identifier. Terminal.
     */
    COMPLETED,

    /**
     * Source fetch or backend call failed. Single attempt, never retried. Terminal.
     */
    FAILED,

    /**
     * Stopped by operator action, either drained from the queue or force-stopped
     * while active. Terminal.
     */
    CANCELLED;

    /**
     * @return {@code true} for COMPLETED, FAILED and CANCELLED
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * @return {@code true} while the worker is executing the job (DOWNLOADING or UPLOADING)
     */
    public boolean isActive() {
        return this == DOWNLOADING || this == UPLOADING;
    }

    /**
     * Checks whether a transition from this status to the given target status is valid.
     *
     * <p><strong>Valid transitions:</strong></p>
     * <pre>
     *   QUEUED      → DOWNLOADING, CANCELLED
     *   DOWNLOADING → UPLOADING, FAILED, CANCELLED
     *   UPLOADING   → COMPLETED, FAILED, CANCELLED
     *   COMPLETED   → (terminal)
     *   FAILED      → (terminal)
     *   CANCELLED   → (terminal)
     * </pre>
     *
     * @param target the target status
     * @return {@code true} if the transition is valid
     */
    public boolean canTransitionTo(JobStatus target) {
        return switch (this) {
            case QUEUED -> target == DOWNLOADING || target == CANCELLED;
            case DOWNLOADING -> target == UPLOADING || target == FAILED || target == CANCELLED;
            case UPLOADING -> target == COMPLETED || target == FAILED || target == CANCELLED;
            case COMPLETED, FAILED, CANCELLED -> false;
        };
    }

    /**
     * Returns all valid target statuses that this status can transition to.
     *
     * @return array of valid target statuses (empty for terminal states)
     */
    public JobStatus[] getValidTransitions() {
        return switch (this) {
            case QUEUED -> new JobStatus[]{DOWNLOADING, CANCELLED};
            case DOWNLOADING -> new JobStatus[]{UPLOADING, FAILED, CANCELLED};
            case UPLOADING -> new JobStatus[]{COMPLETED, FAILED, CANCELLED};
            case COMPLETED, FAILED, CANCELLED -> new JobStatus[0];
        };
    }
}
