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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ProgressThrottler sampling behaviour against a controllable clock.
 */
class ProgressThrottlerTest {

    private MutableClock clock;
    private ProgressThrottler throttler;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-06-01T10:00:00Z"));
        throttler = new ProgressThrottler(Duration.ofSeconds(2), clock);
    }

    @Test
    void testFirstEventPasses() {
        assertTrue(throttler.tryAcquire("h1"));
    }

    @Test
    void testEventsInsideWindowAreDropped() {
        assertTrue(throttler.tryAcquire("h1"));
        clock.advance(Duration.ofMillis(500));
        assertFalse(throttler.tryAcquire("h1"));
        clock.advance(Duration.ofMillis(1499));
        assertFalse(throttler.tryAcquire("h1"));
    }

    @Test
    void testWindowReopensAtBoundary() {
        assertTrue(throttler.tryAcquire("h1"));
        clock.advance(Duration.ofSeconds(2));
        assertTrue(throttler.tryAcquire("h1"));
    }

    @Test
    void testDroppedEventIsNotReplayed() {
        assertTrue(throttler.tryAcquire("h1"));
        clock.advance(Duration.ofMillis(1900));
        assertFalse(throttler.tryAcquire("h1"));
        // the window restarts from the last emitted event, not the dropped one
        clock.advance(Duration.ofMillis(100));
        assertTrue(throttler.tryAcquire("h1"));
    }

    @Test
    void testKeysAreIndependent() {
        assertTrue(throttler.tryAcquire("h1"));
        assertTrue(throttler.tryAcquire("h2"));
        assertFalse(throttler.tryAcquire("h1"));
        assertEquals(2, throttler.getTrackedCount());
    }

    @Test
    void testDiscardForgetsKey() {
        throttler.tryAcquire("h1");
        throttler.discard("h1");

        assertEquals(0, throttler.getTrackedCount());
        assertTrue(throttler.tryAcquire("h1"));
    }

    @Test
    void testZeroWindowPassesEverything() {
        ProgressThrottler open = new ProgressThrottler(Duration.ZERO, clock);
        assertTrue(open.tryAcquire("h1"));
        assertTrue(open.tryAcquire("h1"));
    }

    @Test
    void testNegativeWindowRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ProgressThrottler(Duration.ofMillis(-1)));
    }

    static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
