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

import org.ecashj.core.CounterCapabilityUnsupportedException;

/**
 * <p>Hands out deterministic derivation counters, one monotonic cursor per keyset. Two outputs derived from the
 * same keyset and counter share a secret, so a counter must never be handed out twice.</p>
 *
 * <p>Implementations serialize all calls for one keyset id and serve waiting callers in arrival order. Calls
 * for different keysets may run in parallel.</p>
 *
 * @see MutableCounterSource
 * @see InspectableCounterSource
 */
public interface CounterSource {
    /**
     * Reserves {@code n} consecutive counters for the keyset and moves the cursor past them. Concurrent callers
     * always get disjoint ranges. Reserving zero counters changes nothing and returns the current cursor with a
     * count of zero.
     *
     * @throws org.ecashj.core.InvalidConfigurationException if {@code n} is negative; the cursor is unchanged
     */
    CounterRange reserve(String keysetId, int n);

    /**
     * Moves the cursor forward to {@code minNext} if it is behind, never backwards. Used after a restore found
     * signatures at counters this source has not handed out yet.
     *
     * @throws CounterCapabilityUnsupportedException if this source cannot be advanced
     */
    default void advanceToAtLeast(String keysetId, long minNext) {
        throw new CounterCapabilityUnsupportedException("advanceToAtLeast");
    }
}
