package me.golemcore.memory.adapter.outbound.activity;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.domain.model.MemoryChangedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Audit trail of committed memory changes, written to the {@code activity}
 * logger off the request thread.
 */
@Component
@Slf4j(topic = "activity")
public class ActivityLogListener {

    @Async
    @EventListener
    public void onMemoryChanged(MemoryChangedEvent event) {
        log.info("[Activity] {} org={} project={} key={} actor={}{}",
                event.kind(), event.orgId(), event.projectId(), event.key(),
                event.actorId() != null ? event.actorId() : "-",
                event.version() != null ? " version=" + event.version() : "");
    }
}
