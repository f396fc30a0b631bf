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

package dev.mars.ferry.core;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Parameterized tests for JobStatus transition validation.
 * Covers every (source, target) pair.
 */
class JobStatusTransitionTest {

    private static EnumSet<JobStatus> validTargets(JobStatus from) {
        return switch (from) {
            case QUEUED -> EnumSet.of(JobStatus.DOWNLOADING, JobStatus.CANCELLED);
            case DOWNLOADING -> EnumSet.of(JobStatus.UPLOADING, JobStatus.FAILED, JobStatus.CANCELLED);
            case UPLOADING -> EnumSet.of(JobStatus.COMPLETED, JobStatus.FAILED, JobStatus.CANCELLED);
            case COMPLETED, FAILED, CANCELLED -> EnumSet.noneOf(JobStatus.class);
        };
    }

    static Stream<Arguments> allJobStatusPairs() {
        List<Arguments> pairs = new ArrayList<>();
        for (JobStatus from : JobStatus.values()) {
            Set<JobStatus> valid = validTargets(from);
            for (JobStatus to : JobStatus.values()) {
                pairs.add(Arguments.of(from, to, valid.contains(to)));
            }
        }
        return pairs.stream();
    }

    static Stream<JobStatus> allJobStatuses() {
        return Arrays.stream(JobStatus.values());
    }

    @ParameterizedTest(name = "{0} → {1} should be {2}")
    @MethodSource("allJobStatusPairs")
    void canTransitionTo_coversAllPairs(JobStatus from, JobStatus to, boolean expected) {
        assertEquals(expected, from.canTransitionTo(to),
                () -> String.format("%s → %s should be %s", from, to, expected ? "valid" : "invalid"));
    }

    @ParameterizedTest(name = "getValidTransitions consistent for {0}")
    @MethodSource("allJobStatuses")
    void getValidTransitions_matchesCanTransitionTo(JobStatus from) {
        Set<JobStatus> fromMethod = EnumSet.noneOf(JobStatus.class);
        fromMethod.addAll(Arrays.asList(from.getValidTransitions()));

        Set<JobStatus> fromCanTransition = EnumSet.noneOf(JobStatus.class);
        for (JobStatus to : JobStatus.values()) {
            if (from.canTransitionTo(to)) {
                fromCanTransition.add(to);
            }
        }

        assertEquals(fromCanTransition, fromMethod,
                () -> String.format("getValidTransitions() and canTransitionTo() disagree for %s", from));
    }

    @ParameterizedTest(name = "{0} → {0} self-transition should be invalid")
    @MethodSource("allJobStatuses")
    void selfTransition_isNeverValid(JobStatus status) {
        assertFalse(status.canTransitionTo(status));
    }

    @ParameterizedTest(name = "nothing returns to QUEUED from {0}")
    @MethodSource("allJobStatuses")
    void noStateReturnsToQueued(JobStatus status) {
        assertFalse(status.canTransitionTo(JobStatus.QUEUED));
    }

    @Test
    void terminalStatesHaveNoTransitions() {
        for (JobStatus status : JobStatus.values()) {
            if (status.isTerminal()) {
                assertEquals(0, status.getValidTransitions().length, status + " should have no exits");
            }
        }
    }

    @Test
    void testIsActive() {
        assertTrue(JobStatus.DOWNLOADING.isActive());
        assertTrue(JobStatus.UPLOADING.isActive());

        assertFalse(JobStatus.QUEUED.isActive());
        assertFalse(JobStatus.COMPLETED.isActive());
        assertFalse(JobStatus.FAILED.isActive());
        assertFalse(JobStatus.CANCELLED.isActive());
    }

    @Test
    void testIsTerminal() {
        assertTrue(JobStatus.COMPLETED.isTerminal());
        assertTrue(JobStatus.FAILED.isTerminal());
        assertTrue(JobStatus.CANCELLED.isTerminal());

        assertFalse(JobStatus.QUEUED.isTerminal());
        assertFalse(JobStatus.DOWNLOADING.isTerminal());
        assertFalse(JobStatus.UPLOADING.isTerminal());
    }
}
