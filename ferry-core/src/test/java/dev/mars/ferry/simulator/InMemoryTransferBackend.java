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

package dev.mars.ferry.simulator;

import dev.mars.ferry.core.exceptions.TransferAuthException;
import dev.mars.ferry.core.exceptions.TransferException;
import dev.mars.ferry.transfer.CancellationCheck;
import dev.mars.ferry.transfer.ProgressListener;
import dev.mars.ferry.transfer.TransferBackend;
import dev.mars.ferry.transfer.TransferOutcome;
import dev.mars.ferry.transfer.TransferSource;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory object store used in place of a real storage client.
 *
 * <p>Uploads proceed in a fixed number of chunks with a configurable delay between them,
 * reporting progress after each chunk and polling the cancellation check before each one.
 * Supports:
 * <ul>
 *   <li>Per-file failure injection (auth failure, thrown error, failed outcome)</li>
 *   <li>Holding a named upload at a given percentage until released or cancelled</li>
 *   <li>Recording start order and peak concurrency</li>
 * </ul>
 *
 * <h2>Usage Example:</h2>
 * <pre>{@code
 * InMemoryTransferBackend backend = new InMemoryTransferBackend();
 * backend.failOn("broken.pdf", InMemoryTransferBackend.FailureMode.AUTH_FAILURE, 50);
 * backend.holdAt("big.iso", 40);
 * }</pre>
 */
public class InMemoryTransferBackend implements TransferBackend {

    public enum FailureMode {
        /** Throw TransferAuthException */
        AUTH_FAILURE,
        /** Throw TransferException */
        UPLOAD_ERROR,
        /** Return a failed outcome */
        FAILED_OUTCOME,
        /** Throw an unchecked exception */
        UNEXPECTED
    }

    public static final String AUTH_ERROR_TEXT = "invalid_grant: token has been expired or revoked";
    public static final String UPLOAD_ERROR_TEXT = "storage quota exceeded";

    private final int chunkCount;
    private final long chunkDelayMs;

    private final Map<String, FailureMode> failures = new ConcurrentHashMap<>();
    private final Map<String, Integer> failAtPercent = new ConcurrentHashMap<>();
    private final Map<String, Integer> holds = new ConcurrentHashMap<>();
    private final Map<String, CountDownLatch> holdReached = new ConcurrentHashMap<>();
    private final Map<String, TransferSource> stored = new ConcurrentHashMap<>();
    private volatile boolean holdsReleased;

    private final List<String> startOrder = new CopyOnWriteArrayList<>();
    private final List<String> cancelled = new CopyOnWriteArrayList<>();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();
    private final AtomicLong idSequence = new AtomicLong();

    public InMemoryTransferBackend() {
        this(10, 20);
    }

    public InMemoryTransferBackend(int chunkCount, long chunkDelayMs) {
        this.chunkCount = chunkCount;
        this.chunkDelayMs = chunkDelayMs;
    }

    @Override
    public String getBackendName() {
        return "In-Memory Drive";
    }

    // ==================== Configuration ====================

    public void failOn(String name, FailureMode mode, int atPercent) {
        failures.put(name, mode);
        failAtPercent.put(name, atPercent);
    }

    /**
     * Block the named upload once it reaches {@code percent} until {@link #releaseHolds()}
     * is called or the upload is cancelled.
     */
    public void holdAt(String name, int percent) {
        holds.put(name, percent);
        holdReached.put(name, new CountDownLatch(1));
    }

    public void releaseHolds() {
        holdsReleased = true;
    }

    public boolean awaitHold(String name, long timeout, TimeUnit unit) throws InterruptedException {
        return holdReached.get(name).await(timeout, unit);
    }

    // ==================== Transfer ====================

    @Override
    public TransferOutcome transfer(TransferSource source, ProgressListener progress,
                                    CancellationCheck cancellation) throws TransferException {
        int current = inFlight.incrementAndGet();
        maxInFlight.accumulateAndGet(current, Math::max);
        startOrder.add(source.getName());
        try {
            String name = source.getName();
            FailureMode mode = failures.get(name);
            int failAt = failAtPercent.getOrDefault(name, 0);
            Integer holdAt = holds.get(name);

            for (int chunk = 1; chunk <= chunkCount; chunk++) {
                if (cancellation.isCancelled()) {
                    cancelled.add(name);
                    return TransferOutcome.cancelled();
                }
                sleep(chunkDelayMs);
                int percent = chunk * 100 / chunkCount;

                if (mode != null && percent >= failAt) {
                    switch (mode) {
                        case AUTH_FAILURE:
                            throw new TransferAuthException(AUTH_ERROR_TEXT);
                        case UPLOAD_ERROR:
                            throw new TransferException(UPLOAD_ERROR_TEXT);
                        case FAILED_OUTCOME:
                            return TransferOutcome.failed("rejected by storage", null);
                        default:
                            throw new IllegalStateException("simulated crash");
                    }
                }

                progress.onProgress(chunk / (double) chunkCount);

                if (holdAt != null && percent >= holdAt) {
                    holdReached.get(name).countDown();
                    while (!holdsReleased && !cancellation.isCancelled()) {
                        sleep(5);
                    }
                    holdAt = null;
                }
            }

            String id = "file-" + idSequence.incrementAndGet();
            stored.put(id, source);
            return TransferOutcome.completed(id);
        } finally {
            inFlight.decrementAndGet();
        }
    }

    private static void sleep(long millis) throws TransferException {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransferException("Upload interrupted", e);
        }
    }

    // ==================== Inspection ====================

    public List<String> getStartOrder() {
        return List.copyOf(startOrder);
    }

    public List<String> getCancelled() {
        return List.copyOf(cancelled);
    }

    public int getMaxInFlight() {
        return maxInFlight.get();
    }

    public int getStoredCount() {
        return stored.size();
    }

    public TransferSource getStored(String destinationId) {
        return stored.get(destinationId);
    }
}
