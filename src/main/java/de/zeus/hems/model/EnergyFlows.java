package de.zeus.hems.model;

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
 * Power flows of one dwelling for one cycle, all in watts.
 *
 * @param netGridPower Signed power at the grid connection, positive while importing.
 * @param batteryPower Signed battery power, positive while charging.
 */
public record EnergyFlows(double solarToLoad,
                          double solarToBattery,
                          double solarToGrid,
                          double batteryToLoad,
                          double gridToLoad,
                          double gridToBattery,
                          double netGridPower,
                          double batteryPower) {
}
