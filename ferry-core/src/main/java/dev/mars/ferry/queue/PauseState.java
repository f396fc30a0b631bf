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

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Operator pause switch shared by the admission path and the in-flight transfer call.
 *
 * <p>Reads are lock-free so the blocking transfer task can poll {@link #isPaused()} between
 * chunks. Writes happen only through {@link AdmissionQueue}, under its lock, so that flipping
 * the switch and draining the queue are one atomic step.</p>
 */
public class PauseState {

    private final AtomicBoolean paused = new AtomicBoolean(false);

    public boolean isPaused() {
        return paused.get();
    }

    /**
     * @return true if the state changed
     */
    boolean set(boolean value) {
        return paused.getAndSet(value) != value;
    }

    @Override
    public String toString() {
        return "PauseState{paused=" + paused.get() + '}';
    }
}
