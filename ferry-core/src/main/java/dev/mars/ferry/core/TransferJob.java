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
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Mutable representation of one user-submitted transfer request and its lifecycle state.
 *
 * <p>A job is created when a {@link SubmissionRequest} is admitted and is then driven through
 * {@link JobStatus} by the transfer worker. Every transition is a compare-and-set against the
 * transition table in {@link JobStatus#canTransitionTo(JobStatus)}, so a job that reached a
 * terminal state can never be mutated again and a job that left QUEUED never returns to it.</p>
 *
 * <h3>Thread Safety:</h3>
 * <p>State is held in atomic references. Transitions are normally made from the coordinating
 * context; the pause controller may cancel queued jobs from the operator's thread, which the
 * compare-and-set makes safe.</p>
 *
 * <h3>Lifecycle:</h3>
 * <pre>
 * 1. Created with QUEUED status and a process-unique id
 * 2. startDownload() when the worker dequeues it
 * 3. startUpload() once the payload bytes are materialized
 * 4. complete(), fail() or cancel() exactly once
 * </pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 * @see JobStatus
 */
public class TransferJob {

    private static final AtomicLong SEQUENCE = new AtomicLong();

    private final String jobId;
    private final JobPayload payload;
    private final String requesterId;
    private final StatusHandle statusHandle;
    private final Instant submittedAt;

    private final AtomicReference<JobStatus> status;
    private final AtomicReference<Instant> startTime;
    private final AtomicReference<Instant> endTime;
    private final AtomicReference<Instant> lastUpdateTime;
    private final AtomicReference<String> destinationId;
    private final AtomicReference<String> errorMessage;
    private final AtomicReference<Throwable> lastError;
    private final AtomicReference<CancellationReason> cancellationReason;

    /**
     * Fraction of the upload acknowledged by the backend, 0.0 to 1.0.
     */
    private volatile double progress;

    /**
     * Creates a QUEUED job for an admitted submission.
     *
     * @param request the admitted submission
     * @throws NullPointerException if request is null
     */
    public TransferJob(SubmissionRequest request) {
        Objects.requireNonNull(request, "Submission request cannot be null");
        this.jobId = "job-" + SEQUENCE.incrementAndGet();
        this.payload = request.getPayload();
        this.requesterId = request.getRequesterId();
        this.statusHandle = request.getStatusHandle();
        this.submittedAt = request.getSubmittedAt();
        this.status = new AtomicReference<>(JobStatus.QUEUED);
        this.startTime = new AtomicReference<>();
        this.endTime = new AtomicReference<>();
        this.lastUpdateTime = new AtomicReference<>(Instant.now());
        this.destinationId = new AtomicReference<>();
        this.errorMessage = new AtomicReference<>();
        this.lastError = new AtomicReference<>();
        this.cancellationReason = new AtomicReference<>();
    }

    // ========== GETTER METHODS ==========

    public String getJobId() { return jobId; }

    public JobPayload getPayload() { return payload; }

    public String getName() { return payload.name(); }

    public String getRequesterId() { return requesterId; }

    public StatusHandle getStatusHandle() { return statusHandle; }

    public Instant getSubmittedAt() { return submittedAt; }

    public JobStatus getStatus() { return status.get(); }

    /**
     * @return when the worker dequeued the job, or null while still queued (or drained)
     */
    public Instant getStartTime() { return startTime.get(); }

    /**
     * @return when the job reached its terminal state, or null if it has not
     */
    public Instant getEndTime() { return endTime.get(); }

    public Instant getLastUpdateTime() { return lastUpdateTime.get(); }

    public double getProgress() { return progress; }

    /**
     * @return the identifier returned by the backend, or null unless COMPLETED
     */
    public String getDestinationId() { return destinationId.get(); }

    public String getErrorMessage() { return errorMessage.get(); }

    public Throwable getLastError() { return lastError.get(); }

    public CancellationReason getCancellationReason() { return cancellationReason.get(); }

    public boolean isTerminal() { return status.get().isTerminal(); }

    // ========== STATUS MANAGEMENT METHODS ==========

    /**
     * QUEUED → DOWNLOADING. Records the start time.
     *
     * @return true if the transition happened
     */
    public boolean startDownload() {
        if (transition(JobStatus.DOWNLOADING)) {
            startTime.set(Instant.now());
            return true;
        }
        return false;
    }

    /**
     * DOWNLOADING → UPLOADING, once the payload has been materialized.
     *
     * @return true if the transition happened
     */
    public boolean startUpload() {
        return transition(JobStatus.UPLOADING);
    }

    /**
     * UPLOADING → COMPLETED.
     *
     * @param destinationId the identifier the backend assigned to the stored file
     * @return true if the transition happened
     */
    public boolean complete(String destinationId) {
        if (transition(JobStatus.COMPLETED)) {
            this.destinationId.set(destinationId);
            this.progress = 1.0;
            endTime.set(Instant.now());
            return true;
        }
        return false;
    }

    /**
     * DOWNLOADING or UPLOADING → FAILED.
     *
     * @param message human-readable error description
     * @param cause   the underlying error, may be null
     * @return true if the transition happened
     */
    public boolean fail(String message, Throwable cause) {
        if (transition(JobStatus.FAILED)) {
            errorMessage.set(message);
            lastError.set(cause);
            endTime.set(Instant.now());
            return true;
        }
        return false;
    }

    /**
     * Any non-terminal state → CANCELLED.
     *
     * @param reason whether the job was drained or force-stopped
     * @return true if the transition happened
     */
    public boolean cancel(CancellationReason reason) {
        if (transition(JobStatus.CANCELLED)) {
            cancellationReason.set(reason);
            endTime.set(Instant.now());
            return true;
        }
        return false;
    }

    /**
     * Records upload progress. Ignored unless the job is UPLOADING.
     *
     * @param fraction progress between 0.0 and 1.0; values outside are clamped
     * @return true if the value was recorded
     */
    public boolean updateProgress(double fraction) {
        if (status.get() != JobStatus.UPLOADING) {
            return false;
        }
        this.progress = Math.max(0.0, Math.min(1.0, fraction));
        updateLastUpdateTime();
        return true;
    }

    private boolean transition(JobStatus target) {
        while (true) {
            JobStatus current = status.get();
            if (!current.canTransitionTo(target)) {
                return false;
            }
            if (status.compareAndSet(current, target)) {
                updateLastUpdateTime();
                return true;
            }
        }
    }

    private void updateLastUpdateTime() {
        lastUpdateTime.set(Instant.now());
    }

    // ========== OBJECT METHODS ==========

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TransferJob that = (TransferJob) o;
        return Objects.equals(jobId, that.jobId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(jobId);
    }

    @Override
    public String toString() {
        return "TransferJob{" +
                "jobId='" + jobId + '\'' +
                ", name='" + payload.name() + '\'' +
                ", requesterId='" + requesterId + '\'' +
                ", status=" + getStatus() +
                ", progress=" + String.format("%.1f%%", progress * 100) +
                ", submittedAt=" + submittedAt +
                '}';
    }
}
