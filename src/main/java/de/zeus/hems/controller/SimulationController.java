package de.zeus.hems.controller;

import de.zeus.hems.model.ApiResponse;
import de.zeus.hems.model.CycleReport;
import de.zeus.hems.model.DwellingSummary;
import de.zeus.hems.model.DwellingUpdate;
import de.zeus.hems.service.LatestUpdateCache;
import de.zeus.hems.simulation.SimulationScheduler;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

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
 * Simulation lifecycle and the latest published results.
 */
@RestController
@RequestMapping("/api")
public class SimulationController {

    private final SimulationScheduler simulationScheduler;
    private final LatestUpdateCache latestUpdateCache;

    public SimulationController(SimulationScheduler simulationScheduler, LatestUpdateCache latestUpdateCache) {
        this.simulationScheduler = simulationScheduler;
        this.latestUpdateCache = latestUpdateCache;
    }

    @GetMapping("/simulation/status")
    public ApiResponse<Map<String, Object>> getStatus() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("running", simulationScheduler.isRunning());
        status.put("lastCycle", simulationScheduler.getLastReport().orElse(null));
        List<DwellingSummary> summaries = latestUpdateCache.getLatestSummaries();
        status.put("dwellings", summaries);
        return ApiResponse.ok("Simulation status", status);
    }

    @PostMapping("/simulation/start")
    public ApiResponse<Boolean> start() {
        boolean started = simulationScheduler.start();
        return ApiResponse.ok(started ? "Simulation started" : "Simulation already running", simulationScheduler.isRunning());
    }

    @PostMapping("/simulation/stop")
    public ApiResponse<Boolean> stop() {
        boolean stopped = simulationScheduler.stop();
        return ApiResponse.ok(stopped ? "Simulation stopped" : "Simulation was not running", simulationScheduler.isRunning());
    }

    @PostMapping("/simulation/run")
    public ResponseEntity<ApiResponse<CycleReport>> runOnce() {
        CycleReport report = simulationScheduler.runCycle();
        if (!report.executed()) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(new ApiResponse<>(false, HttpStatus.CONFLICT, "A simulation cycle is already in progress", report));
        }
        return ResponseEntity.ok(ApiResponse.ok("Simulation cycle executed", report));
    }

    @GetMapping("/dwellings/{dwellingId}/latest")
    public ResponseEntity<ApiResponse<DwellingUpdate>> getLatest(@PathVariable String dwellingId) {
        return latestUpdateCache.getLatestUpdate(dwellingId)
                .map(update -> ResponseEntity.ok(ApiResponse.ok("Latest simulation result", update)))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(ApiResponse.error(HttpStatus.NOT_FOUND, "No simulation result for dwelling " + dwellingId)));
    }
}
