package de.zeus.hems.simulation;

import de.zeus.hems.config.SimulationProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

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

@Component
public class SimulationInitializer {

    private static final Logger logger = LoggerFactory.getLogger(SimulationInitializer.class);

    private final SimulationScheduler simulationScheduler;
    private final SimulationProperties simulationProperties;

    public SimulationInitializer(SimulationScheduler simulationScheduler, SimulationProperties simulationProperties) {
        this.simulationScheduler = simulationScheduler;
        this.simulationProperties = simulationProperties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void startSimulationOnStartup() {
        if (!simulationProperties.isAutoStart()) {
            logger.info("Simulation auto start is disabled.");
            return;
        }
        simulationScheduler.start();
    }
}
