package me.golemcore.scheduler.domain.model;

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

import java.util.Set;

/**
 * Result of a visibility or mutation check. An allowed decision carries the
 * room ids (and, for direct messages, the owner) a job must match; a denied
 * decision carries the reason so callers can reply with a refusal instead of an
 * empty list.
 */
public record VisibilityDecision(
        boolean allowed,
        ListScope scope,
        Set<String> roomIds,
        String ownerFilter,
        boolean includesRequestingRoom,
        DenialReason denialReason) {

    /**
     * Why a request was refused.
     */
    public enum DenialReason {
        /** Unknown room, or the bot is not present in it. */
        ROOM_UNAVAILABLE,
        /** Non-public room addressed from outside it. */
        PRIVATE_ROOM,
        /** Cross-room control is switched off by the operator. */
        EXTERNAL_CONTROL_DISABLED
    }

    public static VisibilityDecision allowed(ListScope scope, Set<String> roomIds, String ownerFilter,
            boolean includesRequestingRoom) {
        return new VisibilityDecision(true, scope, Set.copyOf(roomIds), ownerFilter, includesRequestingRoom, null);
    }

    public static VisibilityDecision denied(DenialReason reason) {
        return new VisibilityDecision(false, null, Set.of(), null, false, reason);
    }

    /**
     * Whether a job falls inside this decision.
     */
    public boolean permits(ScheduledJob job) {
        if (!allowed) {
            return false;
        }
        if (!roomIds.contains(job.getDeliveryRoom())) {
            return false;
        }
        return ownerFilter == null || ownerFilter.equals(job.getOwner().id());
    }

    /**
     * Single room of an allowed {@link ListScope#EXPLICIT_ROOM} or
     * {@link ListScope#CURRENT_ROOM} decision.
     */
    public String singleRoomId() {
        return roomIds.size() == 1 ? roomIds.iterator().next() : null;
    }
}
