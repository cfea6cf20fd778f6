package de.zeus.hems.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

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

class LogFilterTest {

    @BeforeEach
    void setUp() {
        LogFilter.clearCache();
        LogFilter.setSuppressionWindow(Duration.ofMinutes(5));
    }

    @AfterEach
    void tearDown() {
        LogFilter.clearCache();
        LogFilter.setSuppressionWindow(Duration.ofMinutes(5));
    }

    @Test
    void log_repeatedMessageWithinWindow_isSuppressed() {
        assertTrue(LogFilter.logWarn(LogFilterTest.class, "No weather data for dwelling {}. Skipping.", "d1"));
        assertFalse(LogFilter.logWarn(LogFilterTest.class, "No weather data for dwelling {}. Skipping.", "d1"));
        assertTrue(LogFilter.logWarn(LogFilterTest.class, "No weather data for dwelling {}. Skipping.", "d2"),
                "Different arguments are a different message");
    }

    @Test
    void log_exceptionsAreKeyedByTypeAndMessage() {
        assertTrue(LogFilter.logError(LogFilterTest.class, "Fetch failed", new IllegalStateException("timeout")));
        assertFalse(LogFilter.logError(LogFilterTest.class, "Fetch failed", new IllegalStateException("timeout")));
        assertTrue(LogFilter.logError(LogFilterTest.class, "Fetch failed", new IllegalArgumentException("timeout")));
    }

    @Test
    void log_concurrentCallers_writeExactlyOnce() throws Exception {
        int threads = 16;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                results.add(executor.submit(() -> {
                    start.await();
                    return LogFilter.logWarn(LogFilterTest.class, "Weather API unavailable for {}", "d1");
                }));
            }
            start.countDown();

            int written = 0;
            for (Future<Boolean> result : results) {
                if (result.get(5, TimeUnit.SECONDS)) {
                    written++;
                }
            }
            assertEquals(1, written, "Only one of the racing callers may write the line");
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void clearCache_allowsMessageAgain() {
        assertTrue(LogFilter.logInfo(LogFilterTest.class, "Simulation started"));
        LogFilter.clearCache();

        assertTrue(LogFilter.logInfo(LogFilterTest.class, "Simulation started"));
    }

    @Test
    void zeroWindow_disablesSuppression() {
        LogFilter.setSuppressionWindow(Duration.ZERO);

        assertTrue(LogFilter.logDebug(LogFilterTest.class, "tick"));
        assertTrue(LogFilter.logDebug(LogFilterTest.class, "tick"));
    }
}
