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

import dev.mars.ferry.core.CancellationReason;
import dev.mars.ferry.core.JobStatus;
import dev.mars.ferry.core.StatusHandle;
import dev.mars.ferry.core.TransferJob;
import dev.mars.ferry.core.exceptions.TransferAuthException;
import dev.mars.ferry.core.exceptions.TransferException;
import dev.mars.ferry.queue.AdmissionQueue;
import dev.mars.ferry.transfer.observability.JobTelemetryMetrics;
import io.vertx.core.Context;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.WorkerExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The single sequential executor of transfer jobs.
 *
 * <p>Coordination runs on one Vert.x {@link Context}: dequeueing, every job state transition,
 * progress throttling and status notifications. The blocking payload fetch and backend upload
 * are dispatched to a {@link WorkerExecutor} with exactly one thread, so two jobs can never
 * transfer at once. Progress reported by the backend is passed back to the coordinating context
 * as a message before it is applied.</p>
 *
 * <h3>Activations:</h3>
 * <p>{@link #activate()} starts an activation when the worker is idle and is a no-op otherwise.
 * An activation repeatedly takes the queue head and runs it to a terminal state. It ends when
 * the queue is empty, when admission is paused, or when a job ends cancelled. On going idle
 * the queue is checked once more so a job admitted while the activation was ending still runs.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class TransferWorker {

    private static final Logger logger = LoggerFactory.getLogger(TransferWorker.class);

    private static final String PHASE_DOWNLOAD = "download";
    private static final String PHASE_UPLOAD = "upload";

    private static final AtomicLong POOL_SEQUENCE = new AtomicLong(0);

    private final Context context;
    private final AdmissionQueue queue;
    private final TransferBackend backend;
    private final StatusNotifier notifier;
    private final ProgressThrottler throttler;
    private final JobTelemetryMetrics metrics;
    private final WorkerExecutor executor;
    private final String destination;
    private final String authRemediationHint;
    private final String poolName;

    private final AtomicBoolean activationRunning = new AtomicBoolean(false);
    private final AtomicReference<JobContext> activeJob = new AtomicReference<>();
    private volatile boolean closed;

    private TransferWorker(Builder builder) {
        this.context = Objects.requireNonNull(builder.context, "Context cannot be null");
        this.queue = Objects.requireNonNull(builder.queue, "Admission queue cannot be null");
        this.backend = Objects.requireNonNull(builder.backend, "Transfer backend cannot be null");
        this.notifier = Objects.requireNonNull(builder.notifier, "Status notifier cannot be null");
        this.throttler = Objects.requireNonNull(builder.throttler, "Progress throttler cannot be null");
        this.metrics = builder.metrics != null ? builder.metrics : JobTelemetryMetrics.getInstance();
        this.destination = builder.destination != null ? builder.destination : "";
        this.authRemediationHint = builder.authRemediationHint != null ? builder.authRemediationHint : "";
        Vertx vertx = Objects.requireNonNull(builder.vertx, "Vertx cannot be null");
        // shared executors are keyed by name; each worker needs its own single thread
        this.poolName = builder.poolName + "-" + POOL_SEQUENCE.incrementAndGet();
        this.executor = vertx.createSharedWorkerExecutor(poolName, 1,
                builder.maxExecuteTimeMs, TimeUnit.MILLISECONDS);
        logger.info("TransferWorker created: backend={}, pool={}", backend.getBackendName(), poolName);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Start an activation if none is running.
     *
     * @return true if this call started a new activation
     */
    public boolean activate() {
        if (closed || !activationRunning.compareAndSet(false, true)) {
            return false;
        }
        logger.debug("Worker activation started");
        context.runOnContext(v -> processNext());
        return true;
    }

    /**
     * Request cancellation of the job currently executing, if any.
     *
     * @return true if a job was active
     */
    public boolean cancelActive() {
        JobContext current = activeJob.get();
        if (current == null) {
            return false;
        }
        current.cancel();
        logger.info("Cancellation requested for active job {}", current.getJobId());
        return true;
    }

    public Optional<TransferJob> getActiveJob() {
        JobContext current = activeJob.get();
        return current != null ? Optional.of(current.getJob()) : Optional.empty();
    }

    public boolean isActive() {
        return activationRunning.get();
    }

    /**
     * @return the name of this worker's single-thread executor, unique within the process
     */
    public String getPoolName() {
        return poolName;
    }

    /**
     * Stop accepting activations, cancel the active job and release the worker thread.
     */
    public Future<Void> close() {
        closed = true;
        cancelActive();
        logger.info("TransferWorker closing");
        return executor.close();
    }

    private void processNext() {
        try {
            if (closed) {
                goIdle();
                return;
            }
            JobContext jobContext = claimNext();
            if (jobContext == null) {
                goIdle();
                return;
            }
            TransferJob job = jobContext.getJob();
            metrics.setQueueDepth(queue.size());
            notifier.publishPositions(queue.snapshot());

            execute(jobContext).onComplete(ar -> {
                JobStatus finalStatus = ar.succeeded() ? ar.result() : job.getStatus();
                logger.info("Job {} finished as {}", job.getJobId(), finalStatus);
                if (finalStatus == JobStatus.CANCELLED) {
                    goIdle();
                } else {
                    processNext();
                }
            });
        } catch (RuntimeException e) {
            logger.error("Unexpected error in worker activation", e);
            goIdle();
        }
    }

    private void goIdle() {
        activationRunning.set(false);
        logger.debug("Worker idle");
        if (!closed && !queue.getPauseState().isPaused() && !queue.isEmpty()) {
            activate();
        }
    }

    /**
     * Take the head of the queue and register it as the active job while the queue lock is
     * held, so a pause that misses the job in the queue still finds it through
     * {@link #cancelActive()}.
     *
     * @return the claimed job's context, or null if nothing can be claimed
     */
    JobContext claimNext() {
        AtomicReference<JobContext> claimed = new AtomicReference<>();
        queue.dequeue(job -> {
            JobContext jobContext = new JobContext(job, queue.getPauseState());
            activeJob.set(jobContext);
            claimed.set(jobContext);
        });
        return claimed.get();
    }

    /**
     * Run a claimed job to a terminal state. The returned future always succeeds with that state.
     */
    Future<JobStatus> execute(JobContext jobContext) {
        TransferJob job = jobContext.getJob();
        StatusHandle handle = job.getStatusHandle();

        if (!job.startDownload()) {
            activeJob.compareAndSet(jobContext, null);
            return Future.succeededFuture(job.getStatus());
        }
        if (jobContext.isCancellationRequested()) {
            return Future.succeededFuture(onCancelled(jobContext))
                    .onComplete(ar -> finish(jobContext));
        }

        logger.info("Starting job {} ({}) for {}", job.getJobId(), job.getName(), job.getRequesterId());
        notifier.notify(handle, StatusMessages.downloading(job.getName()));

        return executor.<byte[]>executeBlocking(() -> job.getPayload().source().fetch(), true)
                .transform(ar -> {
                    if (ar.failed()) {
                        return Future.succeededFuture(onDownloadFailed(jobContext, ar.cause()));
                    }
                    if (jobContext.isCancellationRequested()) {
                        return Future.succeededFuture(onCancelled(jobContext));
                    }
                    return upload(jobContext, ar.result());
                })
                .recover(err -> {
                    logger.error("Unexpected error executing job {}", job.getJobId(), err);
                    return Future.succeededFuture(onUploadFailed(jobContext, describe(err), err));
                })
                .onComplete(ar -> finish(jobContext));
    }

    private Future<JobStatus> upload(JobContext jobContext, byte[] content) {
        TransferJob job = jobContext.getJob();
        if (!job.startUpload()) {
            return Future.succeededFuture(job.getStatus());
        }
        notifier.notify(job.getStatusHandle(), StatusMessages.uploading(job.getName(), backend.getBackendName()));

        TransferSource source = new TransferSource(job.getJobId(), job.getName(),
                job.getPayload().contentType(), destination, content);
        ProgressListener progress = fraction -> context.runOnContext(v -> onProgress(job, fraction));
        CancellationCheck cancellation = jobContext.asCancellationCheck();

        return executor.<TransferOutcome>executeBlocking(() -> backend.transfer(source, progress, cancellation), true)
                .transform(ar -> Future.succeededFuture(ar.succeeded()
                        ? applyOutcome(jobContext, ar.result())
                        : applyError(jobContext, ar.cause())));
    }

    private void onProgress(TransferJob job, double fraction) {
        // late events for a finished job are dropped here
        if (!job.updateProgress(fraction)) {
            return;
        }
        StatusHandle handle = job.getStatusHandle();
        if (throttler.tryAcquire(handle.getHandleId())) {
            notifier.notify(handle, StatusMessages.progress(job.getName(), job.getProgress()));
        }
    }

    private JobStatus applyOutcome(JobContext jobContext, TransferOutcome outcome) {
        TransferJob job = jobContext.getJob();
        if (outcome == null) {
            return onUploadFailed(jobContext, "Transfer backend returned no outcome", null);
        }
        switch (outcome.getKind()) {
            case COMPLETED:
                String destinationId = outcome.getDestinationId().orElse("");
                if (job.complete(destinationId)) {
                    logger.info("Job {} uploaded as {}", job.getJobId(), destinationId);
                    metrics.recordCompleted(backend.getBackendName(), elapsedSeconds(job));
                    notifier.notify(job.getStatusHandle(), StatusMessages.completed(job.getName(), destinationId));
                }
                return job.getStatus();
            case CANCELLED:
                return onCancelled(jobContext);
            case FAILED:
            default:
                Throwable cause = outcome.getCause().orElse(null);
                String message = outcome.getErrorMessage().orElseGet(() -> describe(cause));
                return onUploadFailed(jobContext, message, cause);
        }
    }

    private JobStatus applyError(JobContext jobContext, Throwable error) {
        if (jobContext.isCancellationRequested()) {
            // operator cancellation wins over whatever the aborted call raised
            logger.debug("Job {} raised {} after cancellation was requested",
                    jobContext.getJobId(), error.toString());
            return onCancelled(jobContext);
        }
        if (!(error instanceof TransferException)) {
            logger.error("Transfer backend {} threw an unexpected error for job {}",
                    backend.getBackendName(), jobContext.getJobId(), error);
        }
        return onUploadFailed(jobContext, describe(error), error);
    }

    private JobStatus onDownloadFailed(JobContext jobContext, Throwable error) {
        TransferJob job = jobContext.getJob();
        String message = describe(error);
        if (job.fail(message, error)) {
            logger.warn("Download of job {} failed: {}", job.getJobId(), message);
            metrics.recordFailed(backend.getBackendName(), PHASE_DOWNLOAD, elapsedSeconds(job));
            notifier.notify(job.getStatusHandle(), StatusMessages.downloadFailure(message));
        }
        return job.getStatus();
    }

    private JobStatus onUploadFailed(JobContext jobContext, String message, Throwable cause) {
        TransferJob job = jobContext.getJob();
        if (job.fail(message, cause)) {
            metrics.recordFailed(backend.getBackendName(), PHASE_UPLOAD, elapsedSeconds(job));
            if (cause instanceof TransferAuthException) {
                logger.warn("Job {} failed to authenticate with {}: {}", job.getJobId(),
                        backend.getBackendName(), message);
                notifier.notify(job.getStatusHandle(), StatusMessages.authFailure(message, authRemediationHint));
            } else {
                logger.warn("Upload of job {} failed: {}", job.getJobId(), message);
                notifier.notify(job.getStatusHandle(), StatusMessages.uploadFailure(message));
            }
        }
        return job.getStatus();
    }

    private JobStatus onCancelled(JobContext jobContext) {
        TransferJob job = jobContext.getJob();
        if (job.cancel(CancellationReason.FORCE_STOPPED)) {
            logger.info("Job {} force-stopped by operator", job.getJobId());
            metrics.recordCancelled(CancellationReason.FORCE_STOPPED);
            notifier.notify(job.getStatusHandle(), StatusMessages.FORCE_STOPPED);
        }
        return job.getStatus();
    }

    private void finish(JobContext jobContext) {
        activeJob.compareAndSet(jobContext, null);
        throttler.discard(jobContext.getJob().getStatusHandle().getHandleId());
    }

    private static double elapsedSeconds(TransferJob job) {
        Instant start = job.getStartTime();
        Instant end = job.getEndTime() != null ? job.getEndTime() : Instant.now();
        return start != null ? Duration.between(start, end).toMillis() / 1000.0 : 0.0;
    }

    private static String describe(Throwable error) {
        if (error == null) {
            return "Unknown error";
        }
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    public static class Builder {
        private Vertx vertx;
        private Context context;
        private AdmissionQueue queue;
        private TransferBackend backend;
        private StatusNotifier notifier;
        private ProgressThrottler throttler;
        private JobTelemetryMetrics metrics;
        private String poolName = "ferry-transfer";
        private long maxExecuteTimeMs = 3_600_000L;
        private String destination;
        private String authRemediationHint;

        public Builder vertx(Vertx vertx) {
            this.vertx = vertx;
            return this;
        }

        public Builder context(Context context) {
            this.context = context;
            return this;
        }

        public Builder queue(AdmissionQueue queue) {
            this.queue = queue;
            return this;
        }

        public Builder backend(TransferBackend backend) {
            this.backend = backend;
            return this;
        }

        public Builder notifier(StatusNotifier notifier) {
            this.notifier = notifier;
            return this;
        }

        public Builder throttler(ProgressThrottler throttler) {
            this.throttler = throttler;
            return this;
        }

        public Builder metrics(JobTelemetryMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder poolName(String poolName) {
            this.poolName = poolName;
            return this;
        }

        public Builder maxExecuteTimeMs(long maxExecuteTimeMs) {
            this.maxExecuteTimeMs = maxExecuteTimeMs;
            return this;
        }

        public Builder destination(String destination) {
            this.destination = destination;
            return this;
        }

        public Builder authRemediationHint(String authRemediationHint) {
            this.authRemediationHint = authRemediationHint;
            return this;
        }

        public TransferWorker build() {
            return new TransferWorker(this);
        }
    }
}
