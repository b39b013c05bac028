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

import me.golemcore.scheduler.domain.component.JobTimer;
import me.golemcore.scheduler.domain.exception.InThePastException;
import me.golemcore.scheduler.domain.exception.InvalidPatternException;
import me.golemcore.scheduler.domain.model.DeliveryReceipt;
import me.golemcore.scheduler.domain.model.DeliveryRequest;
import me.golemcore.scheduler.domain.model.JobPattern;
import me.golemcore.scheduler.domain.model.ScheduledJob;
import me.golemcore.scheduler.port.outbound.DeliveryPort;
import me.golemcore.scheduler.port.outbound.TemplateRendererPort;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Arms and disarms job timers and drives each fire.
 *
 * <p>
 * A fire runs on the delivery executor: the template is rendered (falling back
 * to the raw text on failure), the message is handed to the {@link DeliveryPort},
 * and only once that delivery attempt has completed is the next timer armed
 * (recurring jobs) or the job retired (one-off jobs). Two fires of the same job
 * therefore never overlap, while fires of different jobs are independent.
 *
 * <p>
 * Nothing thrown while firing escapes to the timer thread.
 *
 * @see JobRegistry
 */
@Slf4j
public class SchedulingEngine {

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE.withZone(ZoneOffset.UTC);
    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm").withZone(ZoneOffset.UTC);

    private final JobTimer timer;
    private final Executor deliveryExecutor;
    private final DeliveryPort deliveryPort;
    private final TemplateRendererPort templateRenderer;
    private final Clock clock;

    public SchedulingEngine(JobTimer timer, Executor deliveryExecutor, DeliveryPort deliveryPort,
            TemplateRendererPort templateRenderer, Clock clock) {
        this.timer = timer;
        this.deliveryExecutor = deliveryExecutor;
        this.deliveryPort = deliveryPort;
        this.templateRenderer = templateRenderer;
        this.clock = clock;
    }

    /**
     * Receives the outcome of fires. Called without any engine lock held.
     */
    public interface FireListener {

        /**
         * A delivery succeeded. Called before the job is re-armed or retired.
         */
        void onDelivered(ArmedJob armed, DeliveryReceipt receipt);

        /**
         * A job fired for the last time and will not be armed again.
         */
        void onRetired(ArmedJob armed);
    }

    /**
     * First fire time of a job, validated against the current clock.
     *
     * @throws InThePastException
     *             if a one-off instant is not strictly after now
     * @throws InvalidPatternException
     *             if a cron expression never fires again
     */
    public Instant firstFireTime(JobPattern pattern) {
        Instant now = clock.instant();
        if (pattern.isRecurring()) {
            Instant next = pattern.nextAfter(now);
            if (next == null) {
                throw new InvalidPatternException(pattern.raw(), "cron expression never fires");
            }
            return next;
        }
        if (!pattern.fireAt().isAfter(now)) {
            throw new InThePastException(pattern.fireAt(), now);
        }
        return pattern.fireAt();
    }

    /**
     * Arm a job. Fails fast instead of firing immediately when a one-off instant
     * already passed.
     */
    public ArmedJob arm(ScheduledJob job, FireListener listener) {
        Instant first = firstFireTime(job.getPattern());
        ArmedJob armed = new ArmedJob(job);
        scheduleAt(armed, first, listener);
        log.debug("[Engine] Armed job {} for {}", job.getId(), first);
        return armed;
    }

    /**
     * Disarm a job. Terminal: an in-flight delivery may still complete, but no
     * follow-up fire is armed.
     *
     * @return true if the job was live
     */
    public boolean disarm(ArmedJob armed) {
        boolean canceled = armed.cancel();
        if (canceled) {
            log.debug("[Engine] Disarmed job {}", armed.id());
        }
        return canceled;
    }

    private void scheduleAt(ArmedJob armed, Instant at, FireListener listener) {
        boolean scheduled = armed.arm(at, when -> timer.schedule(() -> dispatch(armed, listener), when));
        if (!scheduled) {
            log.debug("[Engine] Job {} no longer live, not re-armed", armed.id());
        }
    }

    private void dispatch(ArmedJob armed, FireListener listener) {
        try {
            deliveryExecutor.execute(() -> fire(armed, listener));
        } catch (RejectedExecutionException e) {
            log.error("[Engine] Could not dispatch job {}: {}", armed.id(), e.getMessage());
        }
    }

    void fire(ArmedJob armed, FireListener listener) {
        if (!armed.beginFiring()) {
            return;
        }
        ScheduledJob job = armed.job();
        log.debug("[Engine] Firing job {}", job.getId());

        CompletableFuture<DeliveryReceipt> delivery;
        try {
            DeliveryRequest request = buildRequest(job, renderMessage(job));
            delivery = deliveryPort.deliver(request);
            if (delivery == null) {
                delivery = CompletableFuture.failedFuture(
                        new IllegalStateException("Delivery port returned no result"));
            }
        } catch (RuntimeException e) { // NOSONAR - one job's failure must not halt the engine
            delivery = CompletableFuture.failedFuture(e);
        }

        delivery.whenComplete((receipt, error) -> complete(armed, listener, receipt, error));
    }

    private void complete(ArmedJob armed, FireListener listener, DeliveryReceipt receipt, Throwable error) {
        try {
            if (error != null) {
                log.error("[Engine] Delivery of job {} failed: {}", armed.id(), rootMessage(error));
            } else if (receipt != null) {
                listener.onDelivered(armed, receipt);
            }
        } catch (RuntimeException e) { // NOSONAR - metadata write-back is best effort
            log.warn("[Engine] Post-delivery update of job {} failed: {}", armed.id(), e.getMessage());
        } finally {
            afterFire(armed, listener);
        }
    }

    private void afterFire(ArmedJob armed, FireListener listener) {
        try {
            ScheduledJob job = armed.job();
            if (job.isRecurring()) {
                Instant base = latest(clock.instant(), armed.nextFireAt());
                Instant next = job.getPattern().nextAfter(base);
                if (next != null) {
                    scheduleAt(armed, next, listener);
                    return;
                }
                log.info("[Engine] Cron expression of job {} has no further fire times", job.getId());
            }
            if (armed.retire()) {
                log.debug("[Engine] Retired job {}", job.getId());
                listener.onRetired(armed);
            }
        } catch (RuntimeException e) { // NOSONAR - keep the timer thread alive
            log.error("[Engine] Failed to re-arm job {}: {}", armed.id(), e.getMessage(), e);
        }
    }

    private String renderMessage(ScheduledJob job) {
        try {
            return templateRenderer.render(job.getMessageTemplate(), renderContext(job));
        } catch (RuntimeException e) { // NOSONAR - a raw message beats a dropped one
            log.error("[Engine] Problem processing message of job {}: {}", job.getId(), e.getMessage());
            return job.getMessageTemplate();
        }
    }

    private Map<String, String> renderContext(ScheduledJob job) {
        Instant now = clock.instant();
        Map<String, String> context = new LinkedHashMap<>();
        context.put("jobId", job.getId());
        context.put("user", job.getOwner().name() != null ? job.getOwner().name() : job.getOwner().id());
        context.put("userId", job.getOwner().id());
        context.put("room", job.getDeliveryRoom());
        context.put("date", DATE_FORMAT.format(now));
        context.put("time", TIME_FORMAT.format(now));
        return context;
    }

    private DeliveryRequest buildRequest(ScheduledJob job, String message) {
        String threadId = null;
        if (job.isPostInThread()) {
            threadId = job.getMetadata().threadId() != null
                    ? job.getMetadata().threadId()
                    : job.getMetadata().messageId();
        }
        return new DeliveryRequest(
                job.getId(),
                job.getDeliveryRoom(),
                job.getOwner(),
                message,
                job.isPostInThread(),
                threadId,
                job.getMetadata().messageId());
    }

    private static Instant latest(Instant a, Instant b) {
        if (b == null) {
            return a;
        }
        return a.isAfter(b) ? a : b;
    }

    private static String rootMessage(Throwable error) {
        Throwable current = error;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current.getMessage();
    }
}
