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

import dev.mars.ferry.config.FerryConfiguration;
import dev.mars.ferry.core.SubmissionRequest;
import dev.mars.ferry.core.TransferJob;
import dev.mars.ferry.core.exceptions.SubmissionRejectedException;
import dev.mars.ferry.queue.AdmissionQueue;
import dev.mars.ferry.queue.PauseState;
import dev.mars.ferry.transfer.observability.JobTelemetryMetrics;
import io.vertx.core.Context;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Vert.x based {@link TransferCoordinator}.
 *
 * <p>Wires the admission queue, the single transfer worker, the pause controller and the
 * status notifier around one coordinating context taken from the supplied {@link Vertx}
 * instance. The caller owns the Vert.x instance.</p>
 *
 * <h3>Usage:</h3>
 * <pre>{@code
 * FerryService service = new FerryService(vertx, backend, new FerryConfiguration());
 * TransferJob job = service.submit(SubmissionRequest.builder()
 *         .source(() -> bytes)
 *         .name("report.pdf")
 *         .requesterId("@alice")
 *         .statusHandle(handle)
 *         .build());
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class FerryService implements TransferCoordinator {

    private static final Logger logger = LoggerFactory.getLogger(FerryService.class);

    private final Context context;
    private final AdmissionQueue queue;
    private final StatusNotifier notifier;
    private final TransferWorker worker;
    private final PauseController pauseController;
    private final JobTelemetryMetrics metrics;

    public FerryService(Vertx vertx, TransferBackend backend, FerryConfiguration config) {
        Objects.requireNonNull(vertx, "Vertx cannot be null");
        Objects.requireNonNull(backend, "Transfer backend cannot be null");
        Objects.requireNonNull(config, "Configuration cannot be null");

        this.context = vertx.getOrCreateContext();
        this.queue = new AdmissionQueue(new PauseState());
        this.notifier = new StatusNotifier(context);
        this.metrics = JobTelemetryMetrics.getInstance();
        this.worker = TransferWorker.builder()
                .vertx(vertx)
                .context(context)
                .queue(queue)
                .backend(backend)
                .notifier(notifier)
                .throttler(new ProgressThrottler(Duration.ofMillis(config.getProgressThrottleMs())))
                .metrics(metrics)
                .poolName(config.getWorkerPoolName())
                .maxExecuteTimeMs(config.getWorkerMaxExecuteTimeMs())
                .destination(config.getTransferDestination())
                .authRemediationHint(config.getAuthRemediationHint())
                .build();
        this.pauseController = new PauseController(queue, worker, notifier, metrics);

        logger.info("FerryService initialized: backend={}, throttle={}ms",
                backend.getBackendName(), config.getProgressThrottleMs());
    }

    @Override
    public TransferJob submit(SubmissionRequest request) throws SubmissionRejectedException {
        TransferJob job;
        try {
            // queued notice is issued before the job becomes visible to the worker
            job = queue.enqueue(request, admitted ->
                    notifier.notify(admitted.getStatusHandle(), StatusMessages.QUEUED));
        } catch (SubmissionRejectedException e) {
            metrics.recordRejected();
            logger.info("Rejected submission from {}: {}", e.getRequesterId(), e.getMessage());
            throw e;
        }
        metrics.recordSubmitted();
        metrics.setQueueDepth(queue.size());
        logger.info("Accepted job {} ({}) from {}", job.getJobId(), job.getName(), job.getRequesterId());

        if (!worker.activate()) {
            context.runOnContext(v -> notifier.publishPositions(queue.snapshot()));
        }
        return job;
    }

    @Override
    public int pause() {
        return pauseController.pause();
    }

    @Override
    public boolean resume() {
        return pauseController.resume();
    }

    @Override
    public boolean isPaused() {
        return pauseController.isPaused();
    }

    @Override
    public OptionalInt positionOf(String jobId) {
        return queue.positionOf(jobId);
    }

    @Override
    public Optional<TransferJob> getJob(String jobId) {
        Optional<TransferJob> active = worker.getActiveJob().filter(job -> job.getJobId().equals(jobId));
        return active.isPresent() ? active : queue.find(jobId);
    }

    @Override
    public Optional<TransferJob> getActiveJob() {
        return worker.getActiveJob();
    }

    @Override
    public int getQueueSize() {
        return queue.size();
    }

    @Override
    public Future<Void> shutdown() {
        logger.info("Shutting down FerryService");
        pauseController.pause();
        return worker.close();
    }
}
