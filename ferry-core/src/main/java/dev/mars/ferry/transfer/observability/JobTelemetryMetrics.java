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

package dev.mars.ferry.transfer.observability;

import dev.mars.ferry.core.CancellationReason;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * OpenTelemetry metrics for the job queue.
 * <ul>
 *   <li>ferry.job.submitted (counter) - jobs admitted</li>
 *   <li>ferry.job.rejected (counter) - submissions refused while paused</li>
 *   <li>ferry.job.completed (counter)</li>
 *   <li>ferry.job.failed (counter), tagged with the failing phase</li>
 *   <li>ferry.job.cancelled (counter), tagged with the cancellation reason</li>
 *   <li>ferry.job.duration.seconds (histogram) - start to terminal state</li>
 *   <li>ferry.queue.depth (gauge)</li>
 * </ul>
 * Without an SDK registered on {@link GlobalOpenTelemetry} every instrument is a no-op.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class JobTelemetryMetrics {

    private static final Logger logger = LoggerFactory.getLogger(JobTelemetryMetrics.class);
    private static final String METER_NAME = "ferry-core";

    private static JobTelemetryMetrics instance;

    private final LongCounter jobsSubmitted;
    private final LongCounter jobsRejected;
    private final LongCounter jobsCompleted;
    private final LongCounter jobsFailed;
    private final LongCounter jobsCancelled;
    private final DoubleHistogram jobDuration;

    private final AtomicLong queueDepth = new AtomicLong(0);

    private static final AttributeKey<String> BACKEND_KEY = AttributeKey.stringKey("backend");
    private static final AttributeKey<String> PHASE_KEY = AttributeKey.stringKey("phase");
    private static final AttributeKey<String> REASON_KEY = AttributeKey.stringKey("reason");
    private static final AttributeKey<String> OUTCOME_KEY = AttributeKey.stringKey("outcome");

    private JobTelemetryMetrics() {
        Meter meter = GlobalOpenTelemetry.getMeter(METER_NAME);

        jobsSubmitted = meter.counterBuilder("ferry.job.submitted")
                .setDescription("Number of jobs admitted to the queue")
                .setUnit("1")
                .build();

        jobsRejected = meter.counterBuilder("ferry.job.rejected")
                .setDescription("Number of submissions rejected while paused")
                .setUnit("1")
                .build();

        jobsCompleted = meter.counterBuilder("ferry.job.completed")
                .setDescription("Number of jobs uploaded successfully")
                .setUnit("1")
                .build();

        jobsFailed = meter.counterBuilder("ferry.job.failed")
                .setDescription("Number of failed jobs")
                .setUnit("1")
                .build();

        jobsCancelled = meter.counterBuilder("ferry.job.cancelled")
                .setDescription("Number of cancelled jobs")
                .setUnit("1")
                .build();

        jobDuration = meter.histogramBuilder("ferry.job.duration.seconds")
                .setDescription("Time from job start to terminal state")
                .setUnit("s")
                .build();

        meter.gaugeBuilder("ferry.queue.depth")
                .setDescription("Number of jobs waiting in the queue")
                .ofLongs()
                .buildWithCallback(measurement -> measurement.record(queueDepth.get()));

        logger.info("JobTelemetryMetrics initialized");
    }

    public static synchronized JobTelemetryMetrics getInstance() {
        if (instance == null) {
            instance = new JobTelemetryMetrics();
        }
        return instance;
    }

    public void recordSubmitted() {
        jobsSubmitted.add(1);
    }

    public void recordRejected() {
        jobsRejected.add(1);
    }

    public void recordCompleted(String backend, double durationSeconds) {
        Attributes attrs = Attributes.of(BACKEND_KEY, backend);
        jobsCompleted.add(1, attrs);
        jobDuration.record(durationSeconds, Attributes.of(BACKEND_KEY, backend, OUTCOME_KEY, "completed"));
    }

    /**
     * @param phase "download" or "upload"
     */
    public void recordFailed(String backend, String phase, double durationSeconds) {
        jobsFailed.add(1, Attributes.of(BACKEND_KEY, backend, PHASE_KEY, phase));
        jobDuration.record(durationSeconds, Attributes.of(BACKEND_KEY, backend, OUTCOME_KEY, "failed"));
    }

    public void recordCancelled(CancellationReason reason) {
        jobsCancelled.add(1, Attributes.of(REASON_KEY, reason.name().toLowerCase()));
    }

    public void setQueueDepth(long depth) {
        queueDepth.set(depth);
    }

    public long getQueueDepth() {
        return queueDepth.get();
    }
}
