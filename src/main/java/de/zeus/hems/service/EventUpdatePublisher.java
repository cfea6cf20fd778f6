package de.zeus.hems.service;

import de.zeus.hems.event.DwellingSummaryEvent;
import de.zeus.hems.event.DwellingUpdatedEvent;
import de.zeus.hems.model.DwellingSummary;
import de.zeus.hems.model.DwellingUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

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
 * Publishes simulation results as application events; subscribers are
 * {@code @EventListener} beans such as {@link LatestUpdateCache}.
 */
@Service
public class EventUpdatePublisher implements UpdatePublisher {

    private static final Logger logger = LoggerFactory.getLogger(EventUpdatePublisher.class);

    private final ApplicationEventPublisher eventPublisher;

    public EventUpdatePublisher(ApplicationEventPublisher eventPublisher) {
        this.eventPublisher = eventPublisher;
    }

    @Override
    public void publishDwellingUpdate(String dwellingId, DwellingUpdate update) {
        eventPublisher.publishEvent(new DwellingUpdatedEvent(this, update));
        logger.debug("Published update for dwelling {} with {} devices", dwellingId, update.devices().size());
    }

    @Override
    public void publishSummary(String dwellingId, DwellingSummary summary) {
        eventPublisher.publishEvent(new DwellingSummaryEvent(this, summary));
    }
}
