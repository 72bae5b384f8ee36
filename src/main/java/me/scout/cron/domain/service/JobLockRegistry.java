package me.scout.cron.domain.service;

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

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-job mutual exclusion for read-modify-write sequences on a job's schedule
 * state and runs. Locks are reentrant, so an operation holding a job's lock may
 * call another operation that takes the same lock.
 */
@Component
public class JobLockRegistry {

    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T withJobLock(String jobId, Supplier<T> action) {
        Objects.requireNonNull(jobId, "jobId");
        ReentrantLock lock = acquire(jobId);
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void withJobLock(String jobId, Runnable action) {
        withJobLock(jobId, () -> {
            action.run();
            return null;
        });
    }

    /**
     * Drop the lock of a deleted job. A lock that is held or waited on stays
     * registered.
     */
    public void forget(String jobId) {
        locks.computeIfPresent(jobId, (id, lock) -> lock.isLocked() || lock.hasQueuedThreads() ? lock : null);
    }

    boolean isTracked(String jobId) {
        return locks.containsKey(jobId);
    }

    // A lock forgotten between lookup and lock() is stale; retry with the
    // registered one.
    private ReentrantLock acquire(String jobId) {
        while (true) {
            ReentrantLock lock = locks.computeIfAbsent(jobId, id -> new ReentrantLock());
            lock.lock();
            if (locks.get(jobId) == lock) {
                return lock;
            }
            lock.unlock();
        }
    }

    boolean isLockedByCurrentThread(String jobId) {
        ReentrantLock lock = locks.get(jobId);
        return lock != null && lock.isHeldByCurrentThread();
    }
}
