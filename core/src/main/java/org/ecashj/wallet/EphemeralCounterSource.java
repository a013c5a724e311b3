/*
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.ecashj.wallet;

import com.google.common.collect.ImmutableMap;
import org.ecashj.core.InvalidConfigurationException;
import org.ecashj.utils.Threading;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.GuardedBy;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * In-memory {@link CounterSource}. Each keyset has its own cursor guarded by its own fair lock, so reservations
 * for one keyset are served first come first served while different keysets never contend. Nothing is
 * persisted: callers that need recovery should store the {@link OperationCounters} a wallet reports, or a
 * {@link #snapshot()}, and seed a new instance with it.
 */
public class EphemeralCounterSource implements MutableCounterSource, InspectableCounterSource {
    private static final Logger log = LoggerFactory.getLogger(EphemeralCounterSource.class);

    private static class Cursor {
        final ReentrantLock lock;
        @GuardedBy("lock") long next;

        Cursor(String keysetId, long next) {
            this.lock = Threading.lock("counter-" + keysetId, true);
            this.next = next;
        }
    }

    private final ConcurrentMap<String, Cursor> cursors = new ConcurrentHashMap<>();

    public EphemeralCounterSource() {
    }

    /** Creates a source whose cursors start at the given values. */
    public EphemeralCounterSource(Map<String, Long> initial) {
        for (Map.Entry<String, Long> entry : initial.entrySet()) {
            if (entry.getValue() < 0)
                throw new InvalidConfigurationException("Initial counter for " + entry.getKey() + " is negative");
            cursors.put(entry.getKey(), new Cursor(entry.getKey(), entry.getValue()));
        }
    }

    private Cursor cursor(String keysetId) {
        checkNotNull(keysetId);
        return cursors.computeIfAbsent(keysetId, id -> new Cursor(id, 0));
    }

    /** Reads the cursor without creating an entry for an unseen keyset. */
    private long peek(String keysetId) {
        checkNotNull(keysetId);
        Cursor cursor = cursors.get(keysetId);
        if (cursor == null)
            return 0;
        cursor.lock.lock();
        try {
            return cursor.next;
        } finally {
            cursor.lock.unlock();
        }
    }

    @Override
    public CounterRange reserve(String keysetId, int n) {
        if (n < 0)
            throw new InvalidConfigurationException("reserve called with negative count: " + n);
        if (n == 0)
            return new CounterRange(peek(keysetId), 0);
        Cursor cursor = cursor(keysetId);
        cursor.lock.lock();
        try {
            long start = cursor.next;
            cursor.next = start + n;
            log.debug("reserved counters {}..{} for keyset {}", start, start + n - 1, keysetId);
            return new CounterRange(start, n);
        } finally {
            cursor.lock.unlock();
        }
    }

    @Override
    public void advanceToAtLeast(String keysetId, long minNext) {
        checkNotNull(keysetId);
        // cursors never go below zero
        if (minNext <= 0)
            return;
        Cursor cursor = cursor(keysetId);
        cursor.lock.lock();
        try {
            if (minNext > cursor.next) {
                log.debug("advancing counter for keyset {} from {} to {}", keysetId, cursor.next, minNext);
                cursor.next = minNext;
            }
        } finally {
            cursor.lock.unlock();
        }
    }

    @Override
    public void setNext(String keysetId, long next) {
        if (next < 0)
            throw new InvalidConfigurationException("setNext: negative next not allowed: " + next);
        Cursor cursor = cursor(keysetId);
        cursor.lock.lock();
        try {
            cursor.next = next;
        } finally {
            cursor.lock.unlock();
        }
    }

    @Override
    public Map<String, Long> snapshot() {
        ImmutableMap.Builder<String, Long> builder = ImmutableMap.builder();
        for (Map.Entry<String, Cursor> entry : cursors.entrySet()) {
            Cursor cursor = entry.getValue();
            cursor.lock.lock();
            try {
                builder.put(entry.getKey(), cursor.next);
            } finally {
                cursor.lock.unlock();
            }
        }
        return builder.build();
    }
}
