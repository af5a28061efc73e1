package com.phillippitts.speakagent.service.skill;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Per-owner record of the most recent entries a skill produced. Older entries are evicted once
 * an owner holds {@code maxPerOwner} of them.
 */
final class RecentEntries<T> {

    static final int DEFAULT_MAX_PER_OWNER = 100;

    private final int maxPerOwner;
    private final ConcurrentMap<String, Deque<T>> byOwner = new ConcurrentHashMap<>();

    RecentEntries(int maxPerOwner) {
        if (maxPerOwner < 1) {
            throw new IllegalArgumentException("maxPerOwner must be >= 1, got " + maxPerOwner);
        }
        this.maxPerOwner = maxPerOwner;
    }

    void add(String ownerId, T entry) {
        Deque<T> entries = byOwner.computeIfAbsent(ownerId, id -> new ArrayDeque<>());
        synchronized (entries) {
            entries.addLast(entry);
            while (entries.size() > maxPerOwner) {
                entries.removeFirst();
            }
        }
    }

    /** Entries of the owner, oldest first. */
    List<T> of(String ownerId) {
        Deque<T> entries = byOwner.get(ownerId);
        if (entries == null) {
            return List.of();
        }
        synchronized (entries) {
            return List.copyOf(entries);
        }
    }
}
