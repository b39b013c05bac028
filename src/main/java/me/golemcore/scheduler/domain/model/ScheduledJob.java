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

import me.golemcore.scheduler.domain.exception.CorruptRecordException;
import me.golemcore.scheduler.domain.exception.InvalidPatternException;
import lombok.Builder;
import lombok.Getter;

import java.util.Objects;

/**
 * A single scheduled message. Identity, pattern, owner, rooms and template are
 * fixed for the job's lifetime; a changed template or delivery metadata yields
 * a replacement instance sharing the same id.
 */
@Getter
public final class ScheduledJob {

    private final String id;
    private final JobPattern pattern;
    private final JobOwner owner;
    private final String deliveryRoom;
    private final String messageTemplate;
    private final MessageMetadata metadata;
    private final boolean postInThread;
    private final JobCompletion completion;

    @Builder(toBuilder = true)
    private ScheduledJob(String id, JobPattern pattern, JobOwner owner, String deliveryRoom,
            String messageTemplate, MessageMetadata metadata, boolean postInThread, JobCompletion completion) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Job id is required");
        }
        this.id = id;
        this.pattern = Objects.requireNonNull(pattern, "pattern");
        this.owner = Objects.requireNonNull(owner, "owner");
        this.deliveryRoom = deliveryRoom != null ? deliveryRoom : owner.room();
        if (this.deliveryRoom == null) {
            throw new IllegalArgumentException("Delivery room is required");
        }
        if (messageTemplate == null || messageTemplate.isBlank()) {
            throw new IllegalArgumentException("Message template must not be blank");
        }
        this.messageTemplate = messageTemplate;
        this.metadata = metadata != null ? metadata : MessageMetadata.of(null);
        this.postInThread = postInThread;
        this.completion = completion != null ? completion : JobCompletion.none();
    }

    public JobKind getKind() {
        return pattern.kind();
    }

    public boolean isRecurring() {
        return pattern.isRecurring();
    }

    public ScheduledJob withMetadata(MessageMetadata newMetadata) {
        return toBuilder().metadata(newMetadata).build();
    }

    public ScheduledJob withMessageTemplate(String newTemplate) {
        return toBuilder().messageTemplate(newTemplate).build();
    }

    public StoredJob serialize() {
        String originRoom = Objects.equals(owner.room(), deliveryRoom) ? null : owner.room();
        return new StoredJob(
                pattern.raw(),
                new StoredJob.Owner(owner.id(), owner.name(), deliveryRoom, originRoom),
                messageTemplate,
                metadata,
                postInThread);
    }

    /**
     * Rebuild a job from its stored tuple.
     *
     * @throws CorruptRecordException
     *             if a required field is missing or the pattern no longer
     *             classifies
     */
    public static ScheduledJob deserialize(String id, StoredJob stored) {
        if (stored == null) {
            throw new CorruptRecordException(id, "record is empty");
        }
        StoredJob.Owner storedOwner = stored.owner();
        if (storedOwner == null || isBlank(storedOwner.id())) {
            throw new CorruptRecordException(id, "owner is missing");
        }
        if (isBlank(storedOwner.room())) {
            throw new CorruptRecordException(id, "room is missing");
        }
        if (isBlank(stored.messageTemplate())) {
            throw new CorruptRecordException(id, "message is missing");
        }
        if (stored.metadata() == null) {
            throw new CorruptRecordException(id, "metadata is missing");
        }

        JobPattern pattern;
        try {
            pattern = JobPattern.classify(stored.pattern());
        } catch (InvalidPatternException e) {
            throw new CorruptRecordException(id, e.getMessage(), e);
        }

        String ownerRoom = storedOwner.originRoom() != null ? storedOwner.originRoom() : storedOwner.room();
        return ScheduledJob.builder()
                .id(id)
                .pattern(pattern)
                .owner(new JobOwner(storedOwner.id(), storedOwner.name(), ownerRoom))
                .deliveryRoom(storedOwner.room())
                .messageTemplate(stored.messageTemplate())
                .metadata(stored.metadata())
                .postInThread(stored.postInThread())
                .build();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    @Override
    public String toString() {
        return "ScheduledJob{id=" + id + ", pattern=" + pattern.raw() + ", room=" + deliveryRoom + "}";
    }
}
