package me.golemcore.scheduler.infrastructure.config;

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

import me.golemcore.scheduler.domain.exception.PersistenceException;
import me.golemcore.scheduler.domain.model.SyncResult;
import me.golemcore.scheduler.domain.service.JobRegistry;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Loads every registry from the brain once the application is ready, and
 * disarms them on shutdown. Records stay in the brain across restarts.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RegistrySynchronizer {

    private final List<JobRegistry> registries;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        for (JobRegistry registry : registries) {
            try {
                SyncResult result = registry.sync();
                log.info("[Sync] {}: {} jobs armed", registry.namespace(), result.armed());
            } catch (PersistenceException e) {
                log.error("[Sync] Failed to load {} from the brain: {}", registry.namespace(), e.getMessage(), e);
            }
        }
    }

    @PreDestroy
    public void shutdown() {
        registries.forEach(JobRegistry::shutdown);
    }
}
