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

import java.util.Map;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A friendlier view of a wallet's {@link CounterSource}. Capabilities the underlying source lacks are reported
 * with a {@link CounterCapabilityUnsupportedException}, never silently skipped.
 */
public class WalletCounters {
    private final CounterSource source;

    public WalletCounters(CounterSource source) {
        this.source = checkNotNull(source);
    }

    /** The counter the next reservation for this keyset would start at. */
    public long peekNext(String keysetId) {
        return source.reserve(keysetId, 0).getStart();
    }

    /** Bumps the cursor if it is behind {@code minNext}; does nothing if it is already ahead. */
    public void advanceToAtLeast(String keysetId, long minNext) {
        source.advanceToAtLeast(keysetId, minNext);
    }

    /** Hard sets the cursor. */
    public void setNext(String keysetId, long next) {
        if (!(source instanceof MutableCounterSource))
            throw new CounterCapabilityUnsupportedException("setNext");
        ((MutableCounterSource) source).setNext(keysetId, next);
    }

    /** The next counter per keyset. */
    public Map<String, Long> snapshot() {
        if (!(source instanceof InspectableCounterSource))
            throw new CounterCapabilityUnsupportedException("snapshot");
        return ((InspectableCounterSource) source).snapshot();
    }
}
