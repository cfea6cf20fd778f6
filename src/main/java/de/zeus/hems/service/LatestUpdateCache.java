package de.zeus.hems.service;

import de.zeus.hems.event.DwellingSummaryEvent;
import de.zeus.hems.event.DwellingUpdatedEvent;
import de.zeus.hems.model.DwellingSummary;
import de.zeus.hems.model.DwellingUpdate;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

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
 * Subscriber keeping the newest detail update and summary per dwelling for clients that poll.
 */
@Component
public class LatestUpdateCache {

    private final Map<String, DwellingUpdate> latestUpdates = new ConcurrentHashMap<>();
    private final Map<String, DwellingSummary> latestSummaries = new ConcurrentHashMap<>();

    @EventListener
    public void onDwellingUpdated(DwellingUpdatedEvent event) {
        DwellingUpdate update = event.getUpdate();
        latestUpdates.merge(update.dwellingId(), update,
                (previous, next) -> next.timestamp().isBefore(previous.timestamp()) ? previous : next);
    }

    @EventListener
    public void onDwellingSummary(DwellingSummaryEvent event) {
        DwellingSummary summary = event.getSummary();
        latestSummaries.merge(summary.dwellingId(), summary,
                (previous, next) -> next.timestamp().isBefore(previous.timestamp()) ? previous : next);
    }

    public Optional<DwellingUpdate> getLatestUpdate(String dwellingId) {
        return Optional.ofNullable(latestUpdates.get(dwellingId));
    }

    public List<DwellingSummary> getLatestSummaries() {
        List<DwellingSummary> summaries = new ArrayList<>(latestSummaries.values());
        summaries.sort(Comparator.comparing(DwellingSummary::dwellingId));
        return summaries;
    }
}
