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

import me.golemcore.scheduler.adapter.outbound.delivery.LoggingDeliveryAdapter;
import me.golemcore.scheduler.domain.model.JobNamespace;
import me.golemcore.scheduler.domain.service.JobPersistenceService;
import me.golemcore.scheduler.domain.service.JobRegistry;
import me.golemcore.scheduler.domain.service.SchedulingEngine;
import me.golemcore.scheduler.infrastructure.i18n.MessageService;
import me.golemcore.scheduler.infrastructure.scheduling.ExecutorJobTimer;
import me.golemcore.scheduler.port.outbound.DeliveryPort;
import me.golemcore.scheduler.port.outbound.TemplateRendererPort;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Spring configuration wiring the scheduling core.
 *
 * <p>
 * This configuration:
 * <ul>
 * <li>Provides the UTC clock and the shared {@link ObjectMapper}</li>
 * <li>Creates the timer thread and the delivery executor</li>
 * <li>Creates one {@link JobRegistry} per {@link JobNamespace}</li>
 * <li>Falls back to {@link LoggingDeliveryAdapter} when no chat transport
 * provides a {@link DeliveryPort}</li>
 * </ul>
 *
 * @see RegistrySynchronizer
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class SchedulerConfiguration {

    private final SchedulerProperties properties;
    private final MessageService messageService;

    @Bean
    public static Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorJobTimer jobTimer(Clock clock) {
        return new ExecutorJobTimer(clock);
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService deliveryExecutor() {
        int threads = Math.max(1, properties.getDelivery().getThreads());
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "job-delivery-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    @ConditionalOnMissingBean(DeliveryPort.class)
    public DeliveryPort deliveryPort() {
        log.info("No chat transport configured, deliveries will be logged only");
        return new LoggingDeliveryAdapter();
    }

    @Bean
    public SchedulingEngine schedulingEngine(ExecutorJobTimer jobTimer, ExecutorService deliveryExecutor,
            DeliveryPort deliveryPort, TemplateRendererPort templateRenderer, Clock clock) {
        return new SchedulingEngine(jobTimer, deliveryExecutor, deliveryPort, templateRenderer, clock);
    }

    @Bean
    public JobRegistry reminderRegistry(JobPersistenceService persistence, SchedulingEngine schedulingEngine) {
        return new JobRegistry(JobNamespace.REMINDERS, persistence, schedulingEngine);
    }

    @Bean
    public JobRegistry scheduleRegistry(JobPersistenceService persistence, SchedulingEngine schedulingEngine) {
        return new JobRegistry(JobNamespace.SCHEDULES, persistence, schedulingEngine);
    }

    @PostConstruct
    public void init() {
        messageService.setLanguage(properties.getLanguage());
        log.info("GolemCore Scheduler starting...");
        log.info("Storage Path: {}", properties.getStorage().getLocal().getBasePath());
        log.info("Deny external control: {}", properties.isDenyExternalControl());
        log.info("Known rooms: {}", properties.getRooms().size());
    }
}
