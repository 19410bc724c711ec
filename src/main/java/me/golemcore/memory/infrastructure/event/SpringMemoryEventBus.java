package me.golemcore.memory.infrastructure.event;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.domain.model.MemoryChangedEvent;
import me.golemcore.memory.port.outbound.MemoryEventPort;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Hands memory change notifications to the application context, where any
 * {@code @EventListener} for {@link MemoryChangedEvent} picks them up on the
 * publishing thread.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SpringMemoryEventBus implements MemoryEventPort {

    private final ApplicationEventPublisher applicationEvents;

    @Override
    public void publish(MemoryChangedEvent event) {
        log.debug("[MemoryEvents] {} {}/{} v{}", event.kind(), event.projectId(), event.key(),
                event.version());
        applicationEvents.publishEvent(event);
    }
}
