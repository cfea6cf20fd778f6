package de.zeus.hems.model;

import java.time.Instant;

/**
 * Copyright 2025 Guido Zeuner - https://tiny-tool.de
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

/**
 * Outcome of one simulation cycle. {@code executed} is false when the cycle was skipped
 * because the previous one was still running.
 */
public record CycleReport(Instant startedAt,
                          boolean executed,
                          int dwellingCount,
                          int simulatedCount,
                          int skippedCount,
                          int failedCount,
                          int publishedCount,
                          long durationMs) {

    public static CycleReport notExecuted(Instant startedAt) {
        return new CycleReport(startedAt, false, 0, 0, 0, 0, 0, 0);
    }
}
