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

package dev.mars.ferry.queue;

import dev.mars.ferry.core.SubmissionRequest;
import dev.mars.ferry.core.TransferJob;
import dev.mars.ferry.core.exceptions.SubmissionRejectedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Unbounded FIFO of jobs that have been admitted but not started.
 * Insertion order is processing order.
 *
 * <p>All mutations and every change of the {@link PauseState} happen under one lock.
 * Admission checks the pause switch and appends in the same critical section, and
 * {@link #pauseAndDrain()} flips the switch and empties the queue in another, so no job can
 * slip in between a pause and its drain.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class AdmissionQueue {

    private static final Logger logger = LoggerFactory.getLogger(AdmissionQueue.class);

    static final String PAUSED_REJECTION = "Transfers are paused by an operator";

    private final PauseState pauseState;
    private final Deque<TransferJob> jobs = new ArrayDeque<>();
    private final Lock lock = new ReentrantLock();

    public AdmissionQueue(PauseState pauseState) {
        this.pauseState = Objects.requireNonNull(pauseState, "PauseState cannot be null");
    }

    public PauseState getPauseState() {
        return pauseState;
    }

    /**
     * Admit a submission: create its job and append it to the tail.
     * The job is only created once admission has succeeded.
     *
     * @param request the submission
     * @return the QUEUED job
     * @throws SubmissionRejectedException if transfers are paused
     */
    public TransferJob enqueue(SubmissionRequest request) throws SubmissionRejectedException {
        return enqueue(request, job -> { });
    }

    /**
     * Admit a submission and run {@code onAdmitted} inside the admission critical section,
     * before any other thread can observe the job in the queue.
     *
     * @param request    the submission
     * @param onAdmitted callback receiving the new job; must not block
     * @return the QUEUED job
     * @throws SubmissionRejectedException if transfers are paused
     */
    public TransferJob enqueue(SubmissionRequest request, Consumer<TransferJob> onAdmitted)
            throws SubmissionRejectedException {
        Objects.requireNonNull(request, "Submission request cannot be null");
        lock.lock();
        try {
            if (pauseState.isPaused()) {
                throw new SubmissionRejectedException(request.getRequesterId(), PAUSED_REJECTION);
            }
            TransferJob job = new TransferJob(request);
            jobs.addLast(job);
            logger.debug("Admitted {} ({}) at position {}", job.getJobId(), job.getName(), jobs.size());
            onAdmitted.accept(job);
            return job;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Pop the head for execution. Returns null while paused so a racing worker never
     * starts a job after the pause took effect.
     *
     * @return the head job, or null if the queue is empty or paused
     */
    public TransferJob dequeue() {
        return dequeue(job -> { });
    }

    /**
     * Pop the head and run {@code onDequeued} inside the same critical section, so a pause
     * either happens before the job leaves the queue or after the callback has registered it.
     *
     * @param onDequeued callback receiving the head job; must not block
     * @return the head job, or null if the queue is empty or paused
     */
    public TransferJob dequeue(Consumer<TransferJob> onDequeued) {
        Objects.requireNonNull(onDequeued, "Dequeue callback cannot be null");
        lock.lock();
        try {
            if (pauseState.isPaused()) {
                return null;
            }
            TransferJob job = jobs.pollFirst();
            if (job != null) {
                onDequeued.accept(job);
            }
            return job;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Atomically remove every queued job.
     *
     * @return the removed jobs in queue order
     */
    public List<TransferJob> dequeueAll() {
        lock.lock();
        try {
            return drainLocked();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Set the pause switch and drain the queue in one critical section.
     *
     * @return the removed jobs in queue order
     */
    public List<TransferJob> pauseAndDrain() {
        lock.lock();
        try {
            if (pauseState.set(true)) {
                logger.info("Admission closed");
            }
            return drainLocked();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Clear the pause switch.
     *
     * @return true if admission was closed before this call
     */
    public boolean resume() {
        lock.lock();
        try {
            boolean changed = pauseState.set(false);
            if (changed) {
                logger.info("Admission reopened");
            }
            return changed;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return jobs.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    /**
     * @param jobId the job to look for
     * @return the 1-based queue position, or empty if the job is not queued
     */
    public OptionalInt positionOf(String jobId) {
        lock.lock();
        try {
            int position = 1;
            for (TransferJob job : jobs) {
                if (job.getJobId().equals(jobId)) {
                    return OptionalInt.of(position);
                }
                position++;
            }
            return OptionalInt.empty();
        } finally {
            lock.unlock();
        }
    }

    public Optional<TransferJob> find(String jobId) {
        lock.lock();
        try {
            return jobs.stream().filter(job -> job.getJobId().equals(jobId)).findFirst();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return a copy of the queued jobs in order; later mutations do not affect it
     */
    public List<TransferJob> snapshot() {
        lock.lock();
        try {
            return new ArrayList<>(jobs);
        } finally {
            lock.unlock();
        }
    }

    private List<TransferJob> drainLocked() {
        List<TransferJob> drained = new ArrayList<>(jobs);
        jobs.clear();
        return drained;
    }
}
