package me.golemcore.scheduler.port.outbound;

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

import java.util.Optional;
import java.util.Set;

/**
 * Port answering room questions for the visibility policy: which rooms exist,
 * which are public, and where the bot is present.
 */
public interface RoomDirectoryPort {

    /**
     * Resolve a room name or id to a room id.
     */
    Optional<String> resolveRoomId(String nameOrId);

    /**
     * Whether a room is invite-only, private, or a direct conversation. Unknown
     * rooms count as non-public.
     */
    boolean isNonPublic(String roomId);

    /**
     * Ids of the public rooms the bot has joined.
     */
    Set<String> publiclyJoinedRoomIds();

    /**
     * Whether the bot can see the given room from the requester's room.
     */
    boolean isBotPresent(String roomId, String requesterRoom);

    /**
     * Display name of a room, for list replies.
     */
    Optional<String> roomName(String roomId);
}
