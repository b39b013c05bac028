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

import me.golemcore.scheduler.domain.exception.CorruptRecordException;
import me.golemcore.scheduler.domain.exception.InThePastException;
import me.golemcore.scheduler.domain.exception.InvalidPatternException;
import me.golemcore.scheduler.domain.exception.JobNotFoundException;
import me.golemcore.scheduler.domain.exception.PersistenceException;
import me.golemcore.scheduler.domain.model.DeliveryReceipt;
import me.golemcore.scheduler.domain.model.JobCompletion;
import me.golemcore.scheduler.domain.model.JobNamespace;
import me.golemcore.scheduler.domain.model.JobOwner;
import me.golemcore.scheduler.domain.model.JobPattern;
import me.golemcore.scheduler.domain.model.MessageMetadata;
import me.golemcore.scheduler.domain.model.ScheduledJob;
import me.golemcore.scheduler.domain.model.SyncResult;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Authoritative in-process map of live jobs for one namespace.
 *
 * <p>
 * Every mutation (create, cancel, update, sync, and the metadata write-back
 * after a delivery) runs under this registry's monitor, so the in-memory map
 * and the brain never disagree outside a single write. Validation happens
 * before anything is touched: a rejected request leaves both unchanged.
 *
 * <p>
 * Lifecycle: construct, call {@link #sync()} once the brain is available, call
 * {@link #shutdown()} when the process stops. Shutdown disarms timers without
 * deleting records.
 *
 * @see SchedulingEngine
 * @see JobPersistenceService
 */
@Slf4j
public class JobRegistry {

    static final int MAX_JOB_ID = 10_000;

    /**
     * Numeric ids sort numerically; anything else falls back to text order.
     */
    public static final Comparator<String> ID_ORDER = (a, b) -> {
        boolean numericA = isNumeric(a);
        boolean numericB = isNumeric(b);
        if (numericA && numericB) {
            int byLength = Integer.compare(a.length(), b.length());
            return byLength != 0 ? byLength : a.compareTo(b);
        }
        if (numericA != numericB) {
            return numericA ? -1 : 1;
        }
        return a.compareTo(b);
    };

    private final JobNamespace namespace;
    private final JobPersistenceService persistence;
    private final SchedulingEngine engine;
    private final Random random;
    private final Map<String, ArmedJob> jobs = new HashMap<>();
    private final SchedulingEngine.FireListener fireListener = new RegistryFireListener();

    public JobRegistry(JobNamespace namespace, JobPersistenceService persistence, SchedulingEngine engine) {
        this(namespace, persistence, engine, new Random());
    }

    public JobRegistry(JobNamespace namespace, JobPersistenceService persistence, SchedulingEngine engine,
            Random random) {
        this.namespace = namespace;
        this.persistence = persistence;
        this.engine = engine;
        this.random = random;
    }

    public JobNamespace namespace() {
        return namespace;
    }

    /**
     * Create, persist, and arm a plain job.
     *
     * @return the allocated id
     * @throws InvalidPatternException
     *             if the pattern is neither cron nor a date/time
     * @throws InThePastException
     *             if a one-off instant is not strictly in the future
     * @throws PersistenceException
     *             if the brain rejects the write; nothing is armed
     */
    public String create(JobOwner owner, String deliveryRoom, String pattern, String messageTemplate,
            MessageMetadata metadata, boolean postInThread) {
        return create(owner, deliveryRoom, pattern, messageTemplate, metadata, postInThread, JobCompletion.none());
    }

    /**
     * Create, persist, and arm a job with a completion hook.
     */
    public synchronized String create(JobOwner owner, String deliveryRoom, String pattern,
            String messageTemplate, MessageMetadata metadata, boolean postInThread, JobCompletion completion) {
        if (owner == null) {
            throw new IllegalArgumentException("Owner is required");
        }
        JobPattern classified = JobPattern.classify(pattern);
        engine.firstFireTime(classified);

        ScheduledJob job = ScheduledJob.builder()
                .id(allocateId())
                .pattern(classified)
                .owner(owner)
                .deliveryRoom(deliveryRoom)
                .messageTemplate(messageTemplate)
                .metadata(metadata)
                .postInThread(postInThread)
                .completion(completion)
                .build();

        persistence.save(namespace, job);
        try {
            armAndRegister(job);
        } catch (RuntimeException e) {
            deleteQuietly(job.getId());
            throw e;
        }
        log.info("[Registry] Created {} job {} ({}) for room {}",
                namespace, job.getId(), job.getKind(), job.getDeliveryRoom());
        return job.getId();
    }

    /**
     * Disarm and forget a job, deleting its record first. If the delete fails
     * the job stays armed and the failure propagates.
     *
     * @throws JobNotFoundException
     *             if no live job has this id
     */
    public synchronized ScheduledJob cancel(String id) {
        ArmedJob armed = requireLive(id);
        persistence.delete(namespace, id);
        engine.disarm(armed);
        jobs.remove(id);
        ScheduledJob job = armed.job();
        notifyCompletion(job);
        log.info("[Registry] Canceled {} job {}", namespace, id);
        return job;
    }

    /**
     * Replace a job's message template. The old timer is disarmed and a
     * replacement sharing the same id, pattern, owner and metadata is persisted
     * and armed, so the id is never armed twice.
     *
     * @throws JobNotFoundException
     *             if no live job has this id
     */
    public synchronized ScheduledJob update(String id, String newMessageTemplate) {
        ArmedJob armed = requireLive(id);
        ScheduledJob replacement = armed.job().withMessageTemplate(newMessageTemplate);
        engine.firstFireTime(replacement.getPattern());

        persistence.save(namespace, replacement);
        engine.disarm(armed);
        jobs.remove(id);
        try {
            armAndRegister(replacement);
        } catch (RuntimeException e) {
            deleteQuietly(id);
            throw e;
        }
        log.info("[Registry] Updated {} job {}", namespace, id);
        return replacement;
    }

    /**
     * Rebuild the registry from the brain.
     */
    public SyncResult sync() {
        return sync(persistence.loadAll(namespace));
    }

    /**
     * Arm every record not already live, skip corrupt records, drop one-off
     * records whose instant passed while the process was down, and disarm live
     * jobs whose record no longer exists, running their completion hooks.
     * Running it twice arms nothing new.
     */
    public synchronized SyncResult sync(Map<String, JsonNode> records) {
        int armedCount = 0;
        int skipped = 0;
        int expired = 0;

        for (Map.Entry<String, JsonNode> entry : records.entrySet()) {
            String id = entry.getKey();
            if (jobs.containsKey(id)) {
                continue;
            }
            try {
                armAndRegister(persistence.decode(id, entry.getValue()));
                armedCount++;
            } catch (CorruptRecordException e) {
                log.warn("[Registry] Skipping corrupt {} record {}: {}", namespace, id, e.getMessage());
                skipped++;
            } catch (InThePastException e) {
                log.info("[Registry] Dropping {} job {}: its time {} passed while offline",
                        namespace, id, e.getFireAt());
                deleteQuietly(id);
                expired++;
            } catch (InvalidPatternException e) {
                log.warn("[Registry] Skipping {} record {}: {}", namespace, id, e.getMessage());
                skipped++;
            }
        }

        int removed = 0;
        Set<String> stored = records.keySet();
        for (String id : new ArrayList<>(jobs.keySet())) {
            if (!stored.contains(id)) {
                ArmedJob armed = jobs.remove(id);
                engine.disarm(armed);
                notifyCompletion(armed.job());
                removed++;
            }
        }

        log.info("[Registry] Synced {}: {} armed, {} skipped, {} expired, {} removed, {} live",
                namespace, armedCount, skipped, expired, removed, jobs.size());
        return new SyncResult(armedCount, skipped, expired, removed);
    }

    /**
     * Live jobs matching a predicate, ordered by id.
     */
    public synchronized List<ScheduledJob> list(Predicate<ScheduledJob> predicate) {
        return jobs.values().stream()
                .map(ArmedJob::job)
                .filter(predicate)
                .sorted(Comparator.comparing(ScheduledJob::getId, ID_ORDER))
                .toList();
    }

    public synchronized Optional<ScheduledJob> find(String id) {
        return Optional.ofNullable(jobs.get(id)).map(ArmedJob::job);
    }

    public synchronized Optional<ArmedJob> findArmed(String id) {
        return Optional.ofNullable(jobs.get(id));
    }

    public synchronized int size() {
        return jobs.size();
    }

    /**
     * Disarm every timer, keeping the records for the next start.
     */
    public synchronized void shutdown() {
        jobs.values().forEach(engine::disarm);
        log.info("[Registry] Disarmed {} {} jobs", jobs.size(), namespace);
        jobs.clear();
    }

    private void armAndRegister(ScheduledJob job) {
        ArmedJob armed = engine.arm(job, fireListener);
        jobs.put(job.getId(), armed);
    }

    private ArmedJob requireLive(String id) {
        ArmedJob armed = jobs.get(id);
        if (armed == null) {
            throw new JobNotFoundException(id);
        }
        return armed;
    }

    private String allocateId() {
        if (jobs.size() >= MAX_JOB_ID) {
            throw new IllegalStateException("No free " + namespace + " ids left");
        }
        Set<String> storedIds = persistence.loadAll(namespace).keySet();
        while (true) {
            String candidate = Integer.toString(random.nextInt(MAX_JOB_ID));
            if (!jobs.containsKey(candidate) && !storedIds.contains(candidate)) {
                return candidate;
            }
        }
    }

    private void deleteQuietly(String id) {
        try {
            persistence.delete(namespace, id);
        } catch (PersistenceException e) {
            log.warn("[Registry] Failed to delete {} record {}: {}", namespace, id, e.getMessage());
        }
    }

    private void notifyCompletion(ScheduledJob job) {
        try {
            job.getCompletion().completed(job);
        } catch (RuntimeException e) { // NOSONAR - creator callbacks must not break the registry
            log.warn("[Registry] Completion callback of job {} failed: {}", job.getId(), e.getMessage());
        }
    }

    private static boolean isNumeric(String value) {
        if (value.isEmpty()) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            if (!Character.isDigit(value.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private final class RegistryFireListener implements SchedulingEngine.FireListener {

        @Override
        public void onDelivered(ArmedJob armed, DeliveryReceipt receipt) {
            synchronized (JobRegistry.this) {
                if (jobs.get(armed.id()) != armed) {
                    return;
                }
                ScheduledJob job = armed.job();
                if (!job.isRecurring() && !job.isPostInThread()) {
                    return;
                }
                ScheduledJob updated = armed.updateJob(current -> current.withMetadata(
                        current.getMetadata().withDelivery(receipt.resolvedThreadId(), receipt.url())));
                if (!updated.isRecurring()) {
                    return;
                }
                try {
                    persistence.save(namespace, updated);
                    log.debug("[Registry] Saved thread {} of job {}", updated.getMetadata().threadId(), updated.getId());
                } catch (PersistenceException e) {
                    log.warn("[Registry] Failed to save delivery metadata of job {}: {}",
                            updated.getId(), e.getMessage());
                }
            }
        }

        @Override
        public void onRetired(ArmedJob armed) {
            ScheduledJob job;
            synchronized (JobRegistry.this) {
                if (jobs.get(armed.id()) != armed) {
                    return;
                }
                jobs.remove(armed.id());
                deleteQuietly(armed.id());
                job = armed.job();
                log.info("[Registry] Retired {} job {}", namespace, job.getId());
            }
            notifyCompletion(job);
        }
    }
}
