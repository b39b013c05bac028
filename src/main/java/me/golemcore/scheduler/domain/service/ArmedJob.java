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

import me.golemcore.scheduler.domain.component.JobTimer.TimerHandle;
import me.golemcore.scheduler.domain.model.ScheduledJob;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * A job together with its live timer. Tracks the per-job state machine
 * {@code ARMED -> FIRING -> ARMED | RETIRED}, with {@code CANCELED} reachable
 * from any non-terminal state.
 *
 * <p>
 * State transitions and the timer handle are guarded by this object's monitor.
 * Callers must not hold it while calling back into a registry.
 */
public final class ArmedJob {

    public enum State {
        PENDING, ARMED, FIRING, RETIRED, CANCELED
    }

    private final AtomicReference<ScheduledJob> job;
    private TimerHandle handle;
    private State state = State.PENDING;
    private Instant nextFireAt;

    ArmedJob(ScheduledJob job) {
        this.job = new AtomicReference<>(job);
    }

    public ScheduledJob job() {
        return job.get();
    }

    public String id() {
        return job.get().getId();
    }

    ScheduledJob updateJob(UnaryOperator<ScheduledJob> update) {
        return job.updateAndGet(update);
    }

    public synchronized State state() {
        return state;
    }

    public synchronized Instant nextFireAt() {
        return nextFireAt;
    }

    public synchronized boolean isLive() {
        return state != State.RETIRED && state != State.CANCELED;
    }

    synchronized boolean arm(Instant at, Function<Instant, TimerHandle> scheduler) {
        if (!isLive()) {
            return false;
        }
        handle = scheduler.apply(at);
        nextFireAt = at;
        state = State.ARMED;
        return true;
    }

    synchronized boolean beginFiring() {
        if (state != State.ARMED) {
            return false;
        }
        handle = null;
        state = State.FIRING;
        return true;
    }

    synchronized boolean retire() {
        if (!isLive()) {
            return false;
        }
        state = State.RETIRED;
        nextFireAt = null;
        return true;
    }

    synchronized boolean cancel() {
        if (!isLive()) {
            return false;
        }
        state = State.CANCELED;
        nextFireAt = null;
        if (handle != null) {
            handle.cancel();
            handle = null;
        }
        return true;
    }
}
