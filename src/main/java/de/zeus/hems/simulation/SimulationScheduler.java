package de.zeus.hems.simulation;

import de.zeus.hems.config.LogFilter;
import de.zeus.hems.config.SimulationProperties;
import de.zeus.hems.entity.Dwelling;
import de.zeus.hems.model.CycleReport;
import de.zeus.hems.model.DwellingLocation;
import de.zeus.hems.model.DwellingSummary;
import de.zeus.hems.model.DwellingUpdate;
import de.zeus.hems.model.WeatherSample;
import de.zeus.hems.repository.DwellingRepository;
import de.zeus.hems.service.UpdatePublisher;
import de.zeus.hems.service.WeatherService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import javax.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

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
 * Drives the periodic simulation of all dwellings.
 *
 * A cycle reads all dwellings, fetches their weather in one batch, simulates each dwelling
 * independently and finally publishes every produced update. A failing dwelling is logged and
 * skipped; nothing that happens inside a cycle stops the schedule.
 */
@Service
public class SimulationScheduler {

    private static final Logger logger = LoggerFactory.getLogger(SimulationScheduler.class);

    private final DwellingRepository dwellingRepository;
    private final WeatherService weatherService;
    private final DwellingSimulator dwellingSimulator;
    private final UpdatePublisher updatePublisher;
    private final TaskScheduler taskScheduler;
    private final SimulationProperties simulationProperties;
    private final Clock clock;

    private final AtomicBoolean cycleInProgress = new AtomicBoolean(false);
    private ScheduledFuture<?> scheduledCycle;
    private volatile CycleReport lastReport;

    public SimulationScheduler(DwellingRepository dwellingRepository,
                               WeatherService weatherService,
                               DwellingSimulator dwellingSimulator,
                               UpdatePublisher updatePublisher,
                               @Qualifier("simulationTaskScheduler") TaskScheduler taskScheduler,
                               SimulationProperties simulationProperties,
                               Clock clock) {
        this.dwellingRepository = dwellingRepository;
        this.weatherService = weatherService;
        this.dwellingSimulator = dwellingSimulator;
        this.updatePublisher = updatePublisher;
        this.taskScheduler = taskScheduler;
        this.simulationProperties = simulationProperties;
        this.clock = clock;
    }

    /**
     * Starts the periodic simulation. The first cycle runs right away.
     *
     * @return True if the simulation was started, false if it was already running.
     */
    public synchronized boolean start() {
        if (isRunning()) {
            logger.info("Simulation is already running.");
            return false;
        }
        Duration interval = Duration.ofMillis(simulationProperties.getIntervalMs());
        scheduledCycle = taskScheduler.scheduleAtFixedRate(this::runScheduledCycle, interval);
        logger.info("Simulation started with an interval of {} ms.", interval.toMillis());
        return true;
    }

    /**
     * Stops scheduling new cycles. A cycle that is currently running is allowed to finish.
     *
     * @return True if the simulation was stopped, false if it was not running.
     */
    public synchronized boolean stop() {
        if (!isRunning()) {
            return false;
        }
        scheduledCycle.cancel(false);
        scheduledCycle = null;
        logger.info("Simulation stopped.");
        return true;
    }

    @PreDestroy
    public void shutdown() {
        stop();
    }

    public synchronized boolean isRunning() {
        return scheduledCycle != null && !scheduledCycle.isCancelled();
    }

    public Optional<CycleReport> getLastReport() {
        return Optional.ofNullable(lastReport);
    }

    void runScheduledCycle() {
        try {
            runCycle();
        } catch (Exception e) {
            // An exception escaping here would cancel the fixed-rate task
            logger.error("Simulation cycle failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Runs one simulation cycle for all dwellings.
     *
     * @return What the cycle did; not executed if another cycle was still in progress.
     */
    public CycleReport runCycle() {
        Instant startedAt = clock.instant();
        if (!cycleInProgress.compareAndSet(false, true)) {
            LogFilter.logWarn(SimulationScheduler.class, "Previous simulation cycle still in progress. Skipping this tick.");
            return CycleReport.notExecuted(startedAt);
        }
        try {
            CycleReport report = executeCycle(startedAt);
            lastReport = report;
            return report;
        } finally {
            cycleInProgress.set(false);
        }
    }

    private CycleReport executeCycle(Instant startedAt) {
        logger.debug("Simulation cycle started at {}", startedAt);
        List<Dwelling> dwellings = dwellingRepository.findAll();
        if (dwellings.isEmpty()) {
            logger.debug("No dwellings to simulate.");
            return new CycleReport(startedAt, true, 0, 0, 0, 0, 0, elapsedMs(startedAt));
        }

        List<DwellingLocation> locations = new ArrayList<>();
        for (Dwelling dwelling : dwellings) {
            locations.add(new DwellingLocation(dwelling.getDwellingId(), dwelling.getLocation()));
        }
        Map<String, WeatherSample> weatherByDwelling = weatherService.getManyCurrent(locations);

        List<DwellingUpdate> updates = new ArrayList<>();
        int skipped = 0;
        int failed = 0;
        for (Dwelling dwelling : dwellings) {
            String dwellingId = dwelling.getDwellingId();
            WeatherSample weather = weatherByDwelling.get(dwellingId);
            if (weather == null) {
                LogFilter.logWarn(SimulationScheduler.class, "No weather data for dwelling {}. Skipping.", dwellingId);
                skipped++;
                continue;
            }
            try {
                Optional<DwellingUpdate> update = dwellingSimulator.simulate(dwelling, weather);
                if (update.isPresent()) {
                    updates.add(update.get());
                } else {
                    skipped++;
                }
            } catch (Exception e) {
                failed++;
                LogFilter.logError(SimulationScheduler.class, "Error simulating dwelling {}", dwellingId, e);
            }
        }

        int published = 0;
        for (DwellingUpdate update : updates) {
            if (publish(update)) {
                published++;
            }
        }

        CycleReport report = new CycleReport(startedAt, true, dwellings.size(), updates.size(),
                skipped, failed, published, elapsedMs(startedAt));
        logger.debug("Simulation cycle finished: {}", report);
        return report;
    }

    private boolean publish(DwellingUpdate update) {
        boolean delivered = true;
        try {
            updatePublisher.publishDwellingUpdate(update.dwellingId(), update);
        } catch (Exception e) {
            delivered = false;
            LogFilter.logError(SimulationScheduler.class, "Failed to publish update for dwelling {}: {}",
                    update.dwellingId(), e.getMessage());
        }
        try {
            updatePublisher.publishSummary(update.dwellingId(), DwellingSummary.of(update));
        } catch (Exception e) {
            delivered = false;
            LogFilter.logError(SimulationScheduler.class, "Failed to publish summary for dwelling {}: {}",
                    update.dwellingId(), e.getMessage());
        }
        return delivered;
    }

    private long elapsedMs(Instant startedAt) {
        return Duration.between(startedAt, clock.instant()).toMillis();
    }
}
