/**
 * Copyright 2026 The Retention Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.retention.collapser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Pending values of a collapser keyed by collapse group, plus the two watermarks shared by all keys.
 * <p>
 * All state is guarded by one exclusive lock. Entries chosen by {@link #drain} are removed while that lock is held,
 * so a value is handed out exactly once and a later {@link #offer} for the same key starts a new entry.
 *
 * @param <K> key type
 * @param <V> value type
 */
public class PendingStore<K, V> {

    /**
     * Outcome of an {@link PendingStore#offer}.
     */
    public enum Offer {
        /** the key was absent and the value is now pending */
        ADDED,
        /** the key already had a pending value which was kept */
        DUPLICATE,
        /** the key was absent but the store is at capacity, the value was dropped */
        REJECTED,
        /** null value, nothing stored */
        IGNORED
    }

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<K, PendingEntry<K, V>> entries = new HashMap<K, PendingEntry<K, V>>();
    private final long retentionDuration;
    private final long maxDuration;
    private final int maxEntries;

    private long lastExec;
    private long nextExec;

    /**
     * @param now construction time, becomes the initial <code>lastExec</code>
     * @param retentionDuration retention window in milliseconds
     * @param maxDuration ceiling since the last flush in milliseconds
     * @param maxEntries maximum number of distinct pending keys
     */
    public PendingStore(long now, long retentionDuration, long maxDuration, int maxEntries) {
        this.retentionDuration = retentionDuration;
        this.maxDuration = maxDuration;
        this.maxEntries = maxEntries;
        this.lastExec = now;
        this.nextExec = now + retentionDuration;
    }

    /**
     * Store <code>value</code> for <code>key</code> unless a value is already pending for it, and re-arm the retention window in every case.
     */
    public Offer offer(K key, V value, long now) {
        if (key == null) {
            throw new NullPointerException("key");
        }
        lock.lock();
        try {
            nextExec = now + retentionDuration;
            if (value == null) {
                return Offer.IGNORED;
            }
            if (entries.containsKey(key)) {
                return Offer.DUPLICATE;
            }
            if (entries.size() >= maxEntries) {
                return Offer.REJECTED;
            }
            entries.put(key, new PendingEntry<K, V>(key, value));
            return Offer.ADDED;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove and return every entry that is due at <code>now</code>.
     * <p>
     * The watermarks are moved forward on the first due entry, so later entries of the same non-forced pass are measured
     * against the freshly reset window. A forced pass returns all entries.
     */
    public List<PendingEntry<K, V>> drain(long now, boolean force) {
        lock.lock();
        try {
            if (entries.isEmpty()) {
                return Collections.emptyList();
            }
            List<PendingEntry<K, V>> due = new ArrayList<PendingEntry<K, V>>();
            Iterator<PendingEntry<K, V>> it = entries.values().iterator();
            while (it.hasNext()) {
                PendingEntry<K, V> entry = it.next();
                if (TimingPolicy.shouldFlush(now, lastExec, nextExec, maxDuration, force)) {
                    it.remove();
                    due.add(entry);
                    lastExec = now;
                    nextExec = now + retentionDuration;
                }
            }
            return due;
        } finally {
            lock.unlock();
        }
    }

    public V get(K key) {
        lock.lock();
        try {
            PendingEntry<K, V> entry = entries.get(key);
            return entry == null ? null : entry.getValue();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return copy of the pending values at the time of the call
     */
    public Map<K, V> snapshot() {
        lock.lock();
        try {
            Map<K, V> copy = new LinkedHashMap<K, V>();
            for (PendingEntry<K, V> entry : entries.values()) {
                copy.put(entry.getKey(), entry.getValue());
            }
            return Collections.unmodifiableMap(copy);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public long getLastExec() {
        lock.lock();
        try {
            return lastExec;
        } finally {
            lock.unlock();
        }
    }

    public long getNextExec() {
        lock.lock();
        try {
            return nextExec;
        } finally {
            lock.unlock();
        }
    }

}
