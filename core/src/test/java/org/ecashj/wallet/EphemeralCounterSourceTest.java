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
import org.junit.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class EphemeralCounterSourceTest {
    private static final String KEYSET = "009a1f293253e41e";
    private static final String OTHER = "00ad268c4d1f5826";

    @Test
    public void reservesConsecutiveRanges() {
        EphemeralCounterSource source = new EphemeralCounterSource();
        assertEquals(new CounterRange(0, 3), source.reserve(KEYSET, 3));
        assertEquals(new CounterRange(3, 2), source.reserve(KEYSET, 2));
        assertEquals(new CounterRange(0, 1), source.reserve(OTHER, 1));
        assertEquals(ImmutableMap.of(KEYSET, 5L, OTHER, 1L), source.snapshot());
    }

    @Test
    public void reserveZeroPeeks() {
        EphemeralCounterSource source = new EphemeralCounterSource(ImmutableMap.of(KEYSET, 42L));
        CounterRange peek = source.reserve(KEYSET, 0);
        assertEquals(42, peek.getStart());
        assertTrue(peek.isEmpty());
        assertEquals(new CounterRange(42, 1), source.reserve(KEYSET, 1));
    }

    @Test
    public void peekingUnseenKeysetsLeavesSnapshotEmpty() {
        EphemeralCounterSource source = new EphemeralCounterSource();
        assertEquals(new CounterRange(0, 0), source.reserve(KEYSET, 0));
        source.advanceToAtLeast(OTHER, -1);
        source.advanceToAtLeast(OTHER, 0);
        assertTrue(source.snapshot().isEmpty());
        source.advanceToAtLeast(OTHER, 3);
        assertEquals(ImmutableMap.of(OTHER, 3L), source.snapshot());
    }

    @Test
    public void negativeReservationLeavesCursorAlone() {
        EphemeralCounterSource source = new EphemeralCounterSource(ImmutableMap.of(KEYSET, 7L));
        try {
            source.reserve(KEYSET, -1);
            fail();
        } catch (InvalidConfigurationException x) {
            // expected
        }
        assertEquals(7, source.reserve(KEYSET, 0).getStart());
    }

    @Test
    public void advanceNeverMovesBackwards() {
        EphemeralCounterSource source = new EphemeralCounterSource();
        source.advanceToAtLeast(KEYSET, 10);
        assertEquals(10, source.reserve(KEYSET, 0).getStart());
        source.advanceToAtLeast(KEYSET, 4);
        assertEquals(10, source.reserve(KEYSET, 0).getStart());
        source.setNext(KEYSET, 4);
        assertEquals(4, source.reserve(KEYSET, 0).getStart());
    }

    @Test(expected = InvalidConfigurationException.class)
    public void negativeSetNext() {
        new EphemeralCounterSource().setNext(KEYSET, -1);
    }

    @Test(expected = InvalidConfigurationException.class)
    public void negativeInitialCounter() {
        new EphemeralCounterSource(ImmutableMap.of(KEYSET, -5L));
    }

    @Test
    public void concurrentReservationsAreDisjoint() throws Exception {
        final EphemeralCounterSource source = new EphemeralCounterSource();
        final int threads = 8;
        final int perThread = 200;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        final CountDownLatch start = new CountDownLatch(1);
        List<Future<List<CounterRange>>> futures = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            final int size = t % 4 + 1;
            futures.add(executor.submit(new Callable<List<CounterRange>>() {
                @Override
                public List<CounterRange> call() throws Exception {
                    start.await();
                    List<CounterRange> ranges = new ArrayList<>();
                    for (int i = 0; i < perThread; i++)
                        ranges.add(source.reserve(KEYSET, size));
                    return ranges;
                }
            }));
        }
        start.countDown();
        List<CounterRange> all = new ArrayList<>();
        long total = 0;
        for (Future<List<CounterRange>> future : futures) {
            for (CounterRange range : future.get(30, TimeUnit.SECONDS)) {
                all.add(range);
                total += range.getCount();
            }
        }
        executor.shutdown();

        Collections.sort(all, (a, b) -> Long.compare(a.getStart(), b.getStart()));
        long expectedStart = 0;
        for (CounterRange range : all) {
            assertEquals(expectedStart, range.getStart());
            expectedStart = range.getNext();
        }
        for (int i = 1; i < all.size(); i++)
            assertFalse(all.get(i - 1).overlaps(all.get(i)));
        assertEquals(total, source.reserve(KEYSET, 0).getStart());
    }
}
