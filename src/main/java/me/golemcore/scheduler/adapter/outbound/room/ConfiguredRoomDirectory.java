package me.golemcore.scheduler.adapter.outbound.room;

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

import me.golemcore.scheduler.infrastructure.config.SchedulerProperties;
import me.golemcore.scheduler.infrastructure.config.SchedulerProperties.RoomProperties;
import me.golemcore.scheduler.port.outbound.RoomDirectoryPort;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Room directory backed by the {@code scheduler.rooms} list. A chat adapter
 * with a live view of its rooms replaces this bean with its own
 * {@link RoomDirectoryPort}.
 */
@Component
@RequiredArgsConstructor
public class ConfiguredRoomDirectory implements RoomDirectoryPort {

    private final SchedulerProperties properties;

    @Override
    public Optional<String> resolveRoomId(String nameOrId) {
        if (nameOrId == null || nameOrId.isBlank()) {
            return Optional.empty();
        }
        String wanted = stripHash(nameOrId.trim());
        return findById(wanted)
                .or(() -> properties.getRooms().stream()
                        .filter(room -> room.getName() != null
                                && room.getName().toLowerCase(Locale.ROOT).equals(wanted.toLowerCase(Locale.ROOT)))
                        .findFirst())
                .map(RoomProperties::getId);
    }

    @Override
    public boolean isNonPublic(String roomId) {
        return findById(roomId).map(room -> !room.isPublicRoom()).orElse(true);
    }

    @Override
    public Set<String> publiclyJoinedRoomIds() {
        Set<String> ids = new LinkedHashSet<>();
        for (RoomProperties room : properties.getRooms()) {
            if (room.isPublicRoom() && room.isJoined() && room.getId() != null) {
                ids.add(room.getId());
            }
        }
        return ids;
    }

    @Override
    public boolean isBotPresent(String roomId, String requesterRoom) {
        if (roomId == null) {
            return false;
        }
        // The bot is obviously present in the room it was addressed from.
        if (roomId.equals(requesterRoom)) {
            return true;
        }
        return findById(roomId).map(RoomProperties::isJoined).orElse(false);
    }

    @Override
    public Optional<String> roomName(String roomId) {
        return findById(roomId).map(RoomProperties::getName);
    }

    private Optional<RoomProperties> findById(String roomId) {
        if (roomId == null) {
            return Optional.empty();
        }
        return properties.getRooms().stream()
                .filter(room -> roomId.equals(room.getId()))
                .findFirst();
    }

    private static String stripHash(String value) {
        return value.startsWith("#") ? value.substring(1) : value;
    }
}
