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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Centralized configuration properties for the scheduler, bound from
 * application.properties under the {@code scheduler.*} prefix:
 * <ul>
 * <li>{@link StorageProperties} - where the brain is kept</li>
 * <li>{@link DeliveryProperties} - delivery executor sizing</li>
 * <li>{@link RoomProperties} - the static room directory</li>
 * <li>{@code deny-external-control} - restrict listing and changes to the
 * requesting room</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "scheduler")
@Data
public class SchedulerProperties {

    private boolean denyExternalControl = false;
    private String language = "en";
    private StorageProperties storage = new StorageProperties();
    private DeliveryProperties delivery = new DeliveryProperties();
    private List<RoomProperties> rooms = new ArrayList<>();

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
        private String brainDirectory = "brain";
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore/scheduler";
    }

    @Data
    public static class DeliveryProperties {
        /** Threads available to concurrent deliveries of different jobs. */
        private int threads = 4;
    }

    @Data
    public static class RoomProperties {
        private String id;
        private String name;
        private boolean publicRoom = true;
        private boolean joined = true;
    }
}
