package me.golemcore.scheduler.infrastructure.scheduling;

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
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * {@link JobTimer} backed by a single daemon scheduler thread. Delays are
 * computed against the injected clock when the task is scheduled. Canceled
 * tasks leave the queue immediately.
 */
@Slf4j
public class ExecutorJobTimer implements JobTimer {

    private static final int SHUTDOWN_WAIT_SECONDS = 5;

    private final ScheduledThreadPoolExecutor scheduler;
    private final Clock clock;

    public ExecutorJobTimer(Clock clock) {
        this.clock = clock;
        this.scheduler = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r, "job-timer");
            t.setDaemon(true);
            return t;
        });
        this.scheduler.setRemoveOnCancelPolicy(true);
    }

    @Override
    public TimerHandle schedule(Runnable task, Instant at) {
        long delayMillis = Math.max(0, Duration.between(clock.instant(), at).toMillis());
        ScheduledFuture<?> future = scheduler.schedule(() -> runSafely(task), delayMillis, TimeUnit.MILLISECONDS);
        return new FutureHandle(future, at);
    }

    int queuedTasks() {
        return scheduler.getQueue().size();
    }

    public void shutdown() {
        scheduler.shutdownNow();
        try {
            if (!scheduler.awaitTermination(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("[Timer] Scheduler thread did not stop in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("[Timer] Shut down");
    }

    private void runSafely(Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) { // NOSONAR - a failing task must not kill the timer thread
            log.error("[Timer] Timer task failed: {}", e.getMessage(), e);
        }
    }

    private record FutureHandle(ScheduledFuture<?> future, Instant fireAt) implements TimerHandle {

        @Override
        public void cancel() {
            future.cancel(false);
        }

        @Override
        public Instant getFireAt() {
            return fireAt;
        }
    }
}
