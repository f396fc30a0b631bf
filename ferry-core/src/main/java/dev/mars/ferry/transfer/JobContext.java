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

import dev.mars.ferry.core.TransferJob;
import dev.mars.ferry.queue.PauseState;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Execution context of the job the worker is currently running.
 *
 * <p>Cancellation is requested either explicitly through {@link #cancel()} or implicitly by the
 * pause switch. The blocking transfer task polls {@link #isCancellationRequested()} as its
 * {@link CancellationCheck}; that read is the only job-related state the blocking side touches.</p>
 */
public class JobContext {
    private final TransferJob job;
    private final PauseState pauseState;
    private final AtomicBoolean cancelled;

    public JobContext(TransferJob job, PauseState pauseState) {
        this.job = job;
        this.pauseState = pauseState;
        this.cancelled = new AtomicBoolean(false);
    }

    public TransferJob getJob() {
        return job;
    }

    public String getJobId() {
        return job.getJobId();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public boolean isCancellationRequested() {
        return cancelled.get() || pauseState.isPaused();
    }

    public CancellationCheck asCancellationCheck() {
        return this::isCancellationRequested;
    }
}
