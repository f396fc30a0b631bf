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

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sampling throttle for progress notifications, keyed by status-handle identity.
 *
 * <p>An event passes when no event passed for the same key within the window; events inside
 * the window are dropped and never replayed. This is not a trailing-edge debounce: the last
 * dropped value is lost and only an event arriving after the window reopens produces an
 * update.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class ProgressThrottler {

    private final Duration window;
    private final Clock clock;
    private final Map<String, Instant> lastEmitted = new ConcurrentHashMap<>();

    public ProgressThrottler(Duration window) {
        this(window, Clock.systemUTC());
    }

    public ProgressThrottler(Duration window, Clock clock) {
        if (window.isNegative()) {
            throw new IllegalArgumentException("Throttle window cannot be negative");
        }
        this.window = window;
        this.clock = clock;
    }

    public Duration getWindow() {
        return window;
    }

    /**
     * Decide whether a progress event for the given key may be emitted now, and if so
     * start a new window for it.
     *
     * @param key status-handle identity
     * @return true if the event should be emitted
     */
    public boolean tryAcquire(String key) {
        Instant now = clock.instant();
        boolean[] acquired = new boolean[1];
        lastEmitted.compute(key, (k, last) -> {
            if (last == null || Duration.between(last, now).compareTo(window) >= 0) {
                acquired[0] = true;
                return now;
            }
            return last;
        });
        return acquired[0];
    }

    /**
     * Forget the timing record of a finished job.
     */
    public void discard(String key) {
        lastEmitted.remove(key);
    }

    public int getTrackedCount() {
        return lastEmitted.size();
    }

    @Override
    public String toString() {
        return String.format("ProgressThrottler{window=%dms, tracked=%d}", window.toMillis(), lastEmitted.size());
    }
}
