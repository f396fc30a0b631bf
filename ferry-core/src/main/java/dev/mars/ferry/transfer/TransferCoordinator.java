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

import dev.mars.ferry.core.SubmissionRequest;
import dev.mars.ferry.core.TransferJob;
import dev.mars.ferry.core.exceptions.SubmissionRejectedException;
import io.vertx.core.Future;

import java.util.Optional;
import java.util.OptionalInt;

/**
 * Entry point used by front-ends to submit transfers and by operators to control them.
 *
 * <p>Jobs are processed one at a time in submission order. Progress and terminal status are
 * written to each submission's status handle.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public interface TransferCoordinator {

    /**
     * Admit a transfer request and wake the worker if it is idle.
     *
     * @param request the submission
     * @return the QUEUED job; its id identifies the submission
     * @throws SubmissionRejectedException if transfers are paused; no job is created
     */
    TransferJob submit(SubmissionRequest request) throws SubmissionRejectedException;

    /**
     * Close admission, cancel every queued job and abort the active one.
     *
     * @return the number of queued jobs cancelled, excluding the active job
     */
    int pause();

    /**
     * Reopen admission. The worker is not restarted until the next submission.
     *
     * @return true if transfers were paused before this call
     */
    boolean resume();

    boolean isPaused();

    /**
     * @return the 1-based queue position, or empty if the job is not waiting in the queue
     */
    OptionalInt positionOf(String jobId);

    /**
     * Look up a job that is queued or currently executing.
     */
    Optional<TransferJob> getJob(String jobId);

    Optional<TransferJob> getActiveJob();

    int getQueueSize();

    /**
     * Pause and release the worker's resources.
     */
    Future<Void> shutdown();
}
