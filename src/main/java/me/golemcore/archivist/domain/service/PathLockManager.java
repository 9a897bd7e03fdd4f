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

package me.golemcore.archivist.domain.service;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-path locks serializing lifecycle transitions. Multi-path acquisition
 * always locks in path order, so two callers locking overlapping sets cannot
 * deadlock.
 *
 * <p>
 * A path keeps its lock only while some caller holds or waits for it.
 */
@Component
public class PathLockManager {

    private final Map<String, LockEntry> locks = new ConcurrentHashMap<>();

    public PathLock lock(String path) {
        return lockAll(List.of(path));
    }

    public PathLock lockAll(Collection<String> paths) {
        List<String> acquired = new ArrayList<>();
        try {
            for (String path : new TreeSet<>(paths)) {
                LockEntry entry = locks.compute(path, (key, existing) -> {
                    LockEntry target = existing != null ? existing : new LockEntry();
                    target.users++;
                    return target;
                });
                entry.lock.lock();
                acquired.add(path);
            }
        } catch (RuntimeException e) {
            release(acquired);
            throw e;
        }
        return new PathLock(acquired);
    }

    boolean isLocked(String path) {
        LockEntry entry = locks.get(path);
        return entry != null && entry.lock.isLocked();
    }

    int trackedPaths() {
        return locks.size();
    }

    private void release(List<String> acquired) {
        for (int i = acquired.size() - 1; i >= 0; i--) {
            String path = acquired.get(i);
            locks.get(path).lock.unlock();
            forget(path);
        }
    }

    private void forget(String path) {
        locks.computeIfPresent(path, (key, entry) -> --entry.users == 0 ? null : entry);
    }

    // users is only read and written inside map compute calls for its key
    private static final class LockEntry {

        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }

    /**
     * Held locks; closing releases them in reverse order.
     */
    public final class PathLock implements AutoCloseable {

        private final List<String> held;

        private PathLock(List<String> held) {
            this.held = held;
        }

        @Override
        public void close() {
            release(held);
        }
    }
}
