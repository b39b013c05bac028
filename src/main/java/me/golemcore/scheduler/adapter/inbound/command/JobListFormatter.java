package me.golemcore.scheduler.adapter.inbound.command;

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

import me.golemcore.scheduler.domain.model.ScheduledJob;
import me.golemcore.scheduler.domain.service.JobRegistry;
import me.golemcore.scheduler.port.outbound.RoomDirectoryPort;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.List;

/**
 * Renders job lists for chat replies. One-off jobs come first, soonest first,
 * followed by recurring jobs in id order. Each line reads
 * {@code id: [when] #room: message}, with the last delivery link when known.
 *
 * <p>
 * Callers pass only jobs that already passed the visibility check.
 */
@Component
@RequiredArgsConstructor
public class JobListFormatter {

    static final DateTimeFormatter FIRE_TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm")
            .withZone(ZoneOffset.UTC);

    private static final Comparator<ScheduledJob> ONE_OFF_ORDER = Comparator
            .comparing((ScheduledJob job) -> job.getPattern().fireAt())
            .thenComparing(ScheduledJob::getId, JobRegistry.ID_ORDER);

    private final RoomDirectoryPort roomDirectory;

    public String format(List<ScheduledJob> jobs) {
        StringBuilder sb = new StringBuilder();
        jobs.stream()
                .filter(job -> !job.isRecurring())
                .sorted(ONE_OFF_ORDER)
                .forEach(job -> appendLine(sb, job, FIRE_TIME_FORMAT.format(job.getPattern().fireAt()) + " UTC"));
        jobs.stream()
                .filter(ScheduledJob::isRecurring)
                .sorted(Comparator.comparing(ScheduledJob::getId, JobRegistry.ID_ORDER))
                .forEach(job -> appendLine(sb, job, job.getPattern().raw()));
        return sb.toString();
    }

    private void appendLine(StringBuilder sb, ScheduledJob job, String when) {
        String room = roomDirectory.roomName(job.getDeliveryRoom()).orElse(job.getDeliveryRoom());
        sb.append(job.getId()).append(": [").append(when).append("] #").append(room)
                .append(": ").append(job.getMessageTemplate());
        String lastUrl = job.getMetadata().lastUrl();
        if (lastUrl != null) {
            sb.append(" (").append(lastUrl).append(")");
        }
        sb.append("\n");
    }
}
