/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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
 */

package dev.mars.tokenflow.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Append-only, sequence-numbered record of every observable event in a simulation run.
 * <p>
 * The scheduler is the single writer. Any number of readers may query the log while it grows;
 * an entry becomes visible only once it is fully built and sequenced. Sequence numbers start at 1.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public class ActivityLog {

    private static final Logger logger = LoggerFactory.getLogger(ActivityLog.class);

    private final List<HistoryEntry> entries = new ArrayList<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Clock clock;
    private long lastSequence;

    public ActivityLog() {
        this(Clock.systemUTC());
    }

    public ActivityLog(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
    }

    /**
     * Stamps the draft with the next sequence number and the current wall time, then appends it.
     *
     * @return the sequence number assigned to the entry
     */
    public long append(HistoryEntry.Builder draft) {
        Objects.requireNonNull(draft, "Entry cannot be null");
        lock.writeLock().lock();
        try {
            long sequence = lastSequence + 1;
            HistoryEntry entry = draft.build(sequence, clock.millis());
            entries.add(entry);
            lastSequence = sequence;
            logger.trace("Appended #{} {} at node {}", sequence, entry.action(), entry.nodeId());
            return sequence;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public List<HistoryEntry> entries() {
        lock.readLock().lock();
        try {
            return List.copyOf(entries);
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<HistoryEntry> query(HistoryFilter filter) {
        Objects.requireNonNull(filter, "Filter cannot be null");
        lock.readLock().lock();
        try {
            List<HistoryEntry> result = new ArrayList<>();
            for (HistoryEntry entry : entries) {
                if (filter.matches(entry)) {
                    result.add(entry);
                }
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<HistoryEntry> forNode(String nodeId) {
        return query(HistoryFilter.builder().nodeId(nodeId).build());
    }

    /**
     * Groups entries by node id, nodes in order of their first entry.
     */
    public Map<String, List<HistoryEntry>> byNode() {
        Map<String, List<HistoryEntry>> grouped = new LinkedHashMap<>();
        for (HistoryEntry entry : entries()) {
            grouped.computeIfAbsent(entry.nodeId(), k -> new ArrayList<>()).add(entry);
        }
        return grouped;
    }

    public Optional<HistoryEntry> latest() {
        lock.readLock().lock();
        try {
            return entries.isEmpty() ? Optional.empty() : Optional.of(entries.get(entries.size() - 1));
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public long getLastSequence() {
        lock.readLock().lock();
        try {
            return lastSequence;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Replaces the whole log with previously recorded entries, for restoring a saved run.
     * Entries must be in strictly increasing sequence order.
     */
    public void load(List<HistoryEntry> recorded) {
        long previous = 0;
        for (HistoryEntry entry : recorded) {
            if (entry.sequence() <= previous) {
                throw new IllegalArgumentException("Entries out of sequence at #" + entry.sequence());
            }
            previous = entry.sequence();
        }
        lock.writeLock().lock();
        try {
            entries.clear();
            entries.addAll(recorded);
            lastSequence = previous;
        } finally {
            lock.writeLock().unlock();
        }
        logger.debug("Loaded {} activity entries", recorded.size());
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            entries.clear();
            lastSequence = 0;
        } finally {
            lock.writeLock().unlock();
        }
    }
}
