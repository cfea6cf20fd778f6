package de.zeus.hems.service;

import de.zeus.hems.event.DwellingSummaryEvent;
import de.zeus.hems.event.DwellingUpdatedEvent;
import de.zeus.hems.model.DwellingSummary;
import de.zeus.hems.model.DwellingUpdate;
import de.zeus.hems.model.EnergyFlows;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.Collections;
import java.util.List;

import static de.zeus.hems.DeviceFixtures.weather;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

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
 * Publishing through application events and keeping the newest result per dwelling.
 */
class LatestUpdateCacheTest {

    private static final Instant T1 = Instant.parse("2026-06-21T12:00:00Z");
    private static final Instant T2 = Instant.parse("2026-06-21T12:00:30Z");

    @Test
    void eventPublisher_wrapsUpdateAndSummaryInEvents() {
        ApplicationEventPublisher eventPublisher = mock(ApplicationEventPublisher.class);
        EventUpdatePublisher publisher = new EventUpdatePublisher(eventPublisher);
        DwellingUpdate update = update("d1", T1);

        publisher.publishDwellingUpdate("d1", update);
        publisher.publishSummary("d1", DwellingSummary.of(update));

        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(eventPublisher, times(2)).publishEvent(captor.capture());
        DwellingUpdatedEvent updated = (DwellingUpdatedEvent) captor.getAllValues().get(0);
        DwellingSummaryEvent summary = (DwellingSummaryEvent) captor.getAllValues().get(1);
        assertSame(update, updated.getUpdate());
        assertEquals("d1", summary.getSummary().dwellingId());
    }

    @Test
    void onDwellingUpdated_keepsNewestPerDwelling() {
        LatestUpdateCache cache = new LatestUpdateCache();
        DwellingUpdate older = update("d1", T1);
        DwellingUpdate newer = update("d1", T2);

        cache.onDwellingUpdated(new DwellingUpdatedEvent(this, newer));
        cache.onDwellingUpdated(new DwellingUpdatedEvent(this, older));

        assertSame(newer, cache.getLatestUpdate("d1").orElseThrow());
        assertTrue(cache.getLatestUpdate("d2").isEmpty());
    }

    @Test
    void getLatestSummaries_sortedByDwelling() {
        LatestUpdateCache cache = new LatestUpdateCache();

        cache.onDwellingSummary(new DwellingSummaryEvent(this, DwellingSummary.of(update("d2", T1))));
        cache.onDwellingSummary(new DwellingSummaryEvent(this, DwellingSummary.of(update("d1", T1))));

        List<DwellingSummary> summaries = cache.getLatestSummaries();
        assertEquals("d1", summaries.get(0).dwellingId());
        assertEquals("d2", summaries.get(1).dwellingId());
    }

    private static DwellingUpdate update(String dwellingId, Instant timestamp) {
        return new DwellingUpdate(dwellingId, Collections.emptyList(),
                new EnergyFlows(0, 0, 0, 0, 0, 0, 0, 0), timestamp, weather(0, 20, 0));
    }
}
