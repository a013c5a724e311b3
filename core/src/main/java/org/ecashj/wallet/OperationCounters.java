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

import com.google.common.base.MoreObjects;

import java.util.Objects;

/**
 * The counters one wallet operation reserved, reported so callers can persist them for recovery.
 * For example a start of 5 and a count of 3 covers counters 5, 6 and 7, and the next free counter is 8.
 */
public final class OperationCounters {
    private final String keysetId;
    private final long start;
    private final int count;

    public OperationCounters(String keysetId, CounterRange range) {
        this(keysetId, range.getStart(), range.getCount());
    }

    public OperationCounters(String keysetId, long start, int count) {
        this.keysetId = keysetId;
        this.start = start;
        this.count = count;
    }

    public String getKeysetId() {
        return keysetId;
    }

    public long getStart() {
        return start;
    }

    public int getCount() {
        return count;
    }

    public long getNext() {
        return start + count;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        OperationCounters other = (OperationCounters) o;
        return start == other.start && count == other.count && keysetId.equals(other.keysetId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(keysetId, start, count);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("keysetId", keysetId).add("start", start).add("count", count)
                .add("next", getNext()).toString();
    }
}
