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

import dev.mars.ferry.core.JobStatus;
import dev.mars.ferry.core.StatusHandle;
import dev.mars.ferry.core.TransferJob;
import io.vertx.core.Context;
import io.vertx.core.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Best-effort writer of status text.
 *
 * <p>Every write is issued from the coordinating context and chained behind the previous
 * write to the same handle, so updates to one handle are delivered in order and never
 * overlap. Write failures are logged at debug level and swallowed; they never reach the
 * caller and never affect job state.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class StatusNotifier {

    private static final Logger logger = LoggerFactory.getLogger(StatusNotifier.class);

    private final Context context;
    private final Map<String, Future<Void>> pendingWrites = new ConcurrentHashMap<>();

    public StatusNotifier(Context context) {
        this.context = Objects.requireNonNull(context, "Context cannot be null");
    }

    /**
     * Queue a write of {@code text} to {@code handle}. Safe to call from any thread; writes
     * are applied in the order the calls were made.
     */
    public void notify(StatusHandle handle, String text) {
        context.runOnContext(v -> chain(handle, text));
    }

    /**
     * Republish the 1-based position of every queued job. Jobs that have left the QUEUED
     * state by the time the write is issued are skipped.
     *
     * @param queued queued jobs in order
     */
    public void publishPositions(List<TransferJob> queued) {
        int position = 1;
        for (TransferJob job : queued) {
            String text = StatusMessages.position(position++);
            // a job started or drained after the snapshot was taken must not get a stale position
            context.runOnContext(v -> {
                if (job.getStatus() == JobStatus.QUEUED) {
                    chain(job.getStatusHandle(), text);
                }
            });
        }
    }

    /**
     * @return number of handles with a write still in flight
     */
    public int getPendingHandleCount() {
        return pendingWrites.size();
    }

    private void chain(StatusHandle handle, String text) {
        String handleId = handle.getHandleId();
        Future<Void> previous = pendingWrites.getOrDefault(handleId, Future.succeededFuture());
        Future<Void> next = previous.transform(ar -> write(handle, text));
        pendingWrites.put(handleId, next);
        next.onComplete(ar -> pendingWrites.remove(handleId, next));
    }

    private Future<Void> write(StatusHandle handle, String text) {
        try {
            Future<Void> result = handle.update(text);
            if (result == null) {
                return Future.succeededFuture();
            }
            return result.recover(err -> {
                logger.debug("Status update to {} failed: {}", handle.getHandleId(), err.getMessage());
                return Future.succeededFuture();
            });
        } catch (RuntimeException e) {
            logger.debug("Status update to {} threw: {}", handle.getHandleId(), e.getMessage());
            return Future.succeededFuture();
        }
    }
}
