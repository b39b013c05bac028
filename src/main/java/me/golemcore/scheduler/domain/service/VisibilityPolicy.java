package me.golemcore.scheduler.domain.service;

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

import me.golemcore.scheduler.domain.model.ListScope;
import me.golemcore.scheduler.domain.model.ScheduledJob;
import me.golemcore.scheduler.domain.model.VisibilityDecision;
import me.golemcore.scheduler.domain.model.VisibilityDecision.DenialReason;
import me.golemcore.scheduler.domain.model.VisibilityRequest;
import me.golemcore.scheduler.infrastructure.config.SchedulerProperties;
import me.golemcore.scheduler.port.outbound.RoomDirectoryPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Decides which jobs a requester may list, target, update, or cancel.
 *
 * <p>
 * Listing scopes:
 * <ul>
 * <li>no room argument - jobs delivered to the requesting room</li>
 * <li>{@code all} - jobs in publicly joined rooms, plus the requesting room when
 * it is not public</li>
 * <li>a room name or id - only if the bot is present there, and for a
 * non-public room only from inside it</li>
 * </ul>
 * Direct-message requests are further restricted to the requester's own jobs.
 * With {@code scheduler.deny-external-control} every request is treated as
 * current-room scoped.
 *
 * <p>
 * Decisions are made before any room name is rendered, so a refusal never
 * discloses rooms the requester cannot see.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VisibilityPolicy {

    public static final String SCOPE_ALL = "all";

    private final RoomDirectoryPort roomDirectory;
    private final SchedulerProperties properties;

    /**
     * Resolve a list request into the set of rooms (and owner) it may see.
     */
    public VisibilityDecision resolve(VisibilityRequest request) {
        String ownerFilter = request.directMessage() ? request.requestingUserId() : null;

        if (!request.hasRoomArgument() || properties.isDenyExternalControl()) {
            return VisibilityDecision.allowed(ListScope.CURRENT_ROOM, roomsOf(request.requestingRoom()),
                    ownerFilter, true);
        }

        String argument = request.roomArgument().trim();
        if (SCOPE_ALL.equals(argument.toLowerCase(Locale.ROOT))) {
            Set<String> rooms = new LinkedHashSet<>(roomDirectory.publiclyJoinedRoomIds());
            boolean fromNonPublicRoom = !request.directMessage()
                    && request.requestingRoom() != null
                    && roomDirectory.isNonPublic(request.requestingRoom());
            if (fromNonPublicRoom) {
                rooms.add(request.requestingRoom());
            }
            return VisibilityDecision.allowed(ListScope.ALL, rooms, ownerFilter, fromNonPublicRoom);
        }

        return resolveExplicitRoom(argument, request.requestingRoom())
                .map(roomId -> VisibilityDecision.allowed(ListScope.EXPLICIT_ROOM, Set.of(roomId), ownerFilter,
                        roomId.equals(request.requestingRoom())))
                .orElseGet(() -> VisibilityDecision.denied(explicitDenial(argument, request.requestingRoom())));
    }

    /**
     * Resolve the room a new job should be delivered to. Without a room
     * argument this is the requesting room.
     */
    public VisibilityDecision resolveTarget(VisibilityRequest request) {
        if (!request.hasRoomArgument()) {
            return VisibilityDecision.allowed(ListScope.CURRENT_ROOM, roomsOf(request.requestingRoom()), null, true);
        }
        String argument = request.roomArgument().trim();
        Optional<String> roomId = resolveExplicitRoom(argument, request.requestingRoom());
        if (roomId.isEmpty()) {
            return VisibilityDecision.denied(explicitDenial(argument, request.requestingRoom()));
        }
        if (properties.isDenyExternalControl() && !roomId.get().equals(request.requestingRoom())) {
            return VisibilityDecision.denied(DenialReason.EXTERNAL_CONTROL_DISABLED);
        }
        return VisibilityDecision.allowed(ListScope.EXPLICIT_ROOM, Set.of(roomId.get()), null,
                roomId.get().equals(request.requestingRoom()));
    }

    /**
     * Whether the requester may update or cancel a job.
     */
    public VisibilityDecision checkMutation(ScheduledJob job, VisibilityRequest request) {
        String jobRoom = job.getDeliveryRoom();
        boolean sameRoom = Objects.equals(jobRoom, request.requestingRoom());
        if (properties.isDenyExternalControl() && !sameRoom) {
            log.debug("[Visibility] External control of job {} refused", job.getId());
            return VisibilityDecision.denied(DenialReason.EXTERNAL_CONTROL_DISABLED);
        }
        boolean isOwner = Objects.equals(job.getOwner().id(), request.requestingUserId());
        if (!sameRoom && !isOwner && roomDirectory.isNonPublic(jobRoom)) {
            log.debug("[Visibility] Job {} lives in a non-public room, refused", job.getId());
            return VisibilityDecision.denied(DenialReason.PRIVATE_ROOM);
        }
        return VisibilityDecision.allowed(ListScope.EXPLICIT_ROOM, Set.of(jobRoom), null, sameRoom);
    }

    /**
     * Jobs of a registry visible under an allowed decision.
     */
    public List<ScheduledJob> visibleJobs(JobRegistry registry, VisibilityDecision decision) {
        if (!decision.allowed()) {
            return List.of();
        }
        return registry.list(decision::permits);
    }

    private Optional<String> resolveExplicitRoom(String argument, String requestingRoom) {
        Optional<String> roomId = roomDirectory.resolveRoomId(argument);
        if (roomId.isEmpty() || !roomDirectory.isBotPresent(roomId.get(), requestingRoom)) {
            return Optional.empty();
        }
        if (roomDirectory.isNonPublic(roomId.get()) && !roomId.get().equals(requestingRoom)) {
            return Optional.empty();
        }
        return roomId;
    }

    private DenialReason explicitDenial(String argument, String requestingRoom) {
        Optional<String> roomId = roomDirectory.resolveRoomId(argument);
        if (roomId.isEmpty() || !roomDirectory.isBotPresent(roomId.get(), requestingRoom)) {
            return DenialReason.ROOM_UNAVAILABLE;
        }
        return DenialReason.PRIVATE_ROOM;
    }

    private static Set<String> roomsOf(String room) {
        return room != null ? Set.of(room) : Set.of();
    }
}
