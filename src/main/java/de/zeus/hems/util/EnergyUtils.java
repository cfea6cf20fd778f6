package de.zeus.hems.util;

import java.time.LocalDate;

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
 * Unit conversions and small numeric helpers shared by the simulation.
 */
public final class EnergyUtils {

    // Seconds per hour constant for energy integration
    public static final double SECONDS_PER_HOUR = 3600.0;
    // Watts per kilowatt
    public static final double WATTS_PER_KW = 1000.0;

    private EnergyUtils() {
    }

    /**
     * Energy delivered by a constant power over a time step.
     *
     * @param powerW  Power in watts.
     * @param seconds Duration in seconds.
     * @return Energy in kWh.
     */
    public static double energyIncrementKwh(double powerW, double seconds) {
        return powerW / WATTS_PER_KW * (seconds / SECONDS_PER_HOUR);
    }

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    public static double round(double value, int decimals) {
        double factor = Math.pow(10, decimals);
        return Math.round(value * factor) / factor;
    }

    /**
     * Checks whether the "today" counters recorded for {@code countersDate} belong to an
     * earlier local day than {@code localDate}. Counters without a recorded date are treated
     * as belonging to the current day.
     *
     * @param countersDate ISO date the counters were last accumulated on, may be null.
     * @param localDate    The dwelling's current local date.
     */
    public static boolean isNewCountingPeriod(String countersDate, LocalDate localDate) {
        return countersDate != null && !countersDate.equals(localDate.toString());
    }
}
