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

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A block of reserved derivation counters. The usable counters are {@code start} up to
 * {@code start + count - 1}; a range with a count of zero reserves nothing and reports where the cursor is.
 */
public final class CounterRange {
    private final long start;
    private final int count;

    public CounterRange(long start, int count) {
        checkArgument(start >= 0, "start must not be negative: %s", start);
        checkArgument(count >= 0, "count must not be negative: %s", count);
        this.start = start;
        this.count = count;
    }

    public long getStart() {
        return start;
    }

    public int getCount() {
        return count;
    }

    /** The first counter after this range. */
    public long getNext() {
        return start + count;
    }

    public boolean isEmpty() {
        return count == 0;
    }

    public boolean overlaps(CounterRange other) {
        return !isEmpty() && !other.isEmpty() && start < other.getNext() && other.start < getNext();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CounterRange other = (CounterRange) o;
        return start == other.start && count == other.count;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(start) * 31 + count;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("start", start).add("count", count).toString();
    }
}
