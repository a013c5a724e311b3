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

package org.ecashj.core;

import com.google.common.collect.ImmutableList;
import org.ecashj.utils.Threading;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import javax.annotation.concurrent.GuardedBy;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * In-memory {@link KeysetRegistry} for a single unit. Keysets in other units are ignored when added.
 */
public class KeyChain implements KeysetRegistry {
    private static final Logger log = LoggerFactory.getLogger(KeyChain.class);

    private final String unit;
    private final ReentrantLock lock = Threading.lock("keychain");
    @GuardedBy("lock")
    private final LinkedHashMap<String, Keyset> keysets = new LinkedHashMap<>();

    public KeyChain(String unit) {
        this.unit = checkNotNull(unit);
    }

    public KeyChain(String unit, Collection<Keyset> keysets) {
        this(unit);
        addKeysets(keysets);
    }

    public String getUnit() {
        return unit;
    }

    public void addKeysets(Collection<Keyset> keysets) {
        lock.lock();
        try {
            for (Keyset keyset : keysets) {
                if (!unit.equals(keyset.getUnit())) {
                    log.debug("ignoring keyset {} in unit {}", keyset.getId(), keyset.getUnit());
                    continue;
                }
                this.keysets.put(keyset.getId(), keyset);
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Keyset getKeyset(@Nullable String id) {
        if (id == null)
            return getActiveKeyset();
        lock.lock();
        try {
            Keyset keyset = keysets.get(id);
            if (keyset == null)
                throw new InvalidConfigurationException("No keyset found with id " + id);
            return keyset;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Keyset getActiveKeyset() {
        return getCheapestKeyset();
    }

    /**
     * Returns the active, hex-identified keyset with the lowest input fee. Ties go to the keyset that was added
     * first.
     */
    public Keyset getCheapestKeyset() {
        lock.lock();
        try {
            Keyset cheapest = null;
            for (Map.Entry<String, Keyset> entry : keysets.entrySet()) {
                Keyset keyset = entry.getValue();
                if (!keyset.isActive() || !keyset.hasHexId())
                    continue;
                if (cheapest == null || keyset.getFeePerInput() < cheapest.getFeePerInput())
                    cheapest = keyset;
            }
            if (cheapest == null)
                throw new InvalidConfigurationException("No active keyset found for unit " + unit);
            return cheapest;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public ImmutableList<Keyset> getKeysets() {
        lock.lock();
        try {
            return ImmutableList.copyOf(keysets.values());
        } finally {
            lock.unlock();
        }
    }
}
