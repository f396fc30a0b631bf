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
import dev.mars.ferry.core.TransferJob;
import dev.mars.ferry.queue.AdmissionQueue;
import dev.mars.ferry.transfer.observability.JobTelemetryMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Operator switch that halts all pending and in-flight work.
 *
 * <p>Pausing closes admission and drains the queue in one step, cancels every drained job,
 * then asks the worker to abort its active job. Resuming only reopens admission; the worker
 * restarts on the next accepted submission. Both operations are idempotent.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class PauseController {

    private static final Logger logger = LoggerFactory.getLogger(PauseController.class);

    private final AdmissionQueue queue;
    private final TransferWorker worker;
    private final StatusNotifier notifier;
    private final JobTelemetryMetrics metrics;

    public PauseController(AdmissionQueue queue, TransferWorker worker, StatusNotifier notifier,
                           JobTelemetryMetrics metrics) {
        this.queue = Objects.requireNonNull(queue, "Admission queue cannot be null");
        this.worker = Objects.requireNonNull(worker, "Transfer worker cannot be null");
        this.notifier = Objects.requireNonNull(notifier, "Status notifier cannot be null");
        this.metrics = Objects.requireNonNull(metrics, "Metrics cannot be null");
    }

    /**
     * @return the number of queued jobs that were drained, not counting the active one
     */
    public int pause() {
        List<TransferJob> drained = queue.pauseAndDrain();
        metrics.setQueueDepth(0);
        for (TransferJob job : drained) {
            if (job.cancel(CancellationReason.DRAINED_BY_PAUSE)) {
                metrics.recordCancelled(CancellationReason.DRAINED_BY_PAUSE);
                notifier.notify(job.getStatusHandle(), StatusMessages.DRAINED_BY_PAUSE);
            }
        }
        boolean hadActive = worker.cancelActive();
        logger.info("Paused: drained {} queued job(s), active job {}", drained.size(),
                hadActive ? "cancelled" : "none");
        return drained.size();
    }

    /**
     * @return true if transfers were paused before this call
     */
    public boolean resume() {
        boolean resumed = queue.resume();
        if (resumed) {
            logger.info("Resumed: accepting new submissions");
        }
        return resumed;
    }

    public boolean isPaused() {
        return queue.getPauseState().isPaused();
    }
}
