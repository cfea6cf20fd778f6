package de.zeus.hems.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

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
 * Throttled logging for messages that would otherwise repeat every simulation cycle
 * (weather fallbacks, skipped dwellings, ignored extra batteries).
 * A message with identical class, template and arguments is written once per suppression
 * window; the next time it gets through, the number of swallowed repetitions is appended.
 */
public final class LogFilter {

    public static final String LOG_LEVEL_INFO = "INFO";
    public static final String LOG_LEVEL_WARN = "WARN";
    public static final String LOG_LEVEL_ERROR = "ERROR";
    public static final String LOG_LEVEL_DEBUG = "DEBUG";

    private static final Map<String, Window> windows = new ConcurrentHashMap<>();
    private static volatile long suppressionWindowMs = Duration.ofMinutes(5).toMillis();

    private LogFilter() {
    }

    /**
     * Logs a message with the specified level through the logger of the calling class,
     * unless the same message was already logged within the suppression window.
     *
     * @param callingClass The class from which the log originates.
     * @param level        The log level (INFO, WARN, ERROR, DEBUG).
     * @param message      The message template with {} placeholders.
     * @param args         The arguments to replace the placeholders.
     * @return True if the message was written, false if it was suppressed.
     */
    public static boolean log(Class<?> callingClass, String level, String message, Object... args) {
        Logger logger = LoggerFactory.getLogger(callingClass);
        long now = System.currentTimeMillis();
        String key = cacheKey(callingClass, message, args);

        // -1 marks a suppressed call, otherwise the count carried over from the closed window
        int[] carried = new int[1];
        windows.compute(key, (k, window) -> {
            if (window != null && now - window.openedAt < suppressionWindowMs) {
                window.suppressed.incrementAndGet();
                carried[0] = -1;
                return window;
            }
            carried[0] = window == null ? 0 : window.suppressed.get();
            return new Window(now);
        });
        if (carried[0] < 0) {
            return false;
        }
        int suppressed = carried[0];
        windows.entrySet().removeIf(entry -> now - entry.getValue().openedAt > 2 * suppressionWindowMs);

        String text = suppressed > 0 ? message + " (repeated " + suppressed + " times)" : message;
        switch (level.toUpperCase()) {
            case LOG_LEVEL_INFO:
                logger.info(text, args);
                break;
            case LOG_LEVEL_WARN:
                logger.warn(text, args);
                break;
            case LOG_LEVEL_ERROR:
                logger.error(text, args);
                break;
            case LOG_LEVEL_DEBUG:
            default:
                logger.debug(text, args);
                break;
        }
        return true;
    }

    public static boolean logInfo(Class<?> callingClass, String message, Object... args) {
        return log(callingClass, LOG_LEVEL_INFO, message, args);
    }

    public static boolean logWarn(Class<?> callingClass, String message, Object... args) {
        return log(callingClass, LOG_LEVEL_WARN, message, args);
    }

    public static boolean logError(Class<?> callingClass, String message, Object... args) {
        return log(callingClass, LOG_LEVEL_ERROR, message, args);
    }

    public static boolean logDebug(Class<?> callingClass, String message, Object... args) {
        return log(callingClass, LOG_LEVEL_DEBUG, message, args);
    }

    /**
     * Changes the suppression window. A zero window disables throttling.
     */
    public static void setSuppressionWindow(Duration window) {
        suppressionWindowMs = Math.max(0, window.toMillis());
    }

    /**
     * Forgets all throttling state (tests, manual reset).
     */
    public static void clearCache() {
        windows.clear();
    }

    private static String cacheKey(Class<?> callingClass, String message, Object... args) {
        StringBuilder keyBuilder = new StringBuilder(callingClass.getName()).append(':').append(message);
        if (args != null) {
            for (Object arg : args) {
                // Throwables differ per occurrence; key them by type and message only
                if (arg instanceof Throwable) {
                    Throwable t = (Throwable) arg;
                    keyBuilder.append(':').append(t.getClass().getName()).append('/').append(t.getMessage());
                } else {
                    keyBuilder.append(':').append(arg);
                }
            }
        }
        return keyBuilder.toString();
    }

    private static final class Window {
        private final long openedAt;
        private final AtomicInteger suppressed = new AtomicInteger();

        private Window(long openedAt) {
            this.openedAt = openedAt;
        }
    }
}
