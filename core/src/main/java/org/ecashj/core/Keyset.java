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

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ImmutableSortedSet;

import javax.annotation.Nullable;
import java.util.Map;
import java.util.regex.Pattern;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A versioned set of issuer signing keys, one public key per supported amount, together with the fee the issuer
 * charges for every proof of this keyset spent as an input. The fee is expressed in parts per thousand of one
 * unit per input.
 */
public final class Keyset {
    private static final Pattern HEX = Pattern.compile("^[0-9a-fA-F]+$");

    private final String id;
    private final String unit;
    private final boolean active;
    private final long feePerInput;
    @Nullable
    private final Long finalExpiry;
    private final ImmutableSortedMap<Long, String> keys;

    public Keyset(String id, String unit, boolean active, long feePerInput, Map<Long, String> keys) {
        this(id, unit, active, feePerInput, null, keys);
    }

    public Keyset(String id, String unit, boolean active, long feePerInput, @Nullable Long finalExpiry,
                  Map<Long, String> keys) {
        checkArgument(feePerInput >= 0, "feePerInput must not be negative: %s", feePerInput);
        this.id = checkNotNull(id);
        this.unit = checkNotNull(unit);
        this.active = active;
        this.feePerInput = feePerInput;
        this.finalExpiry = finalExpiry;
        this.keys = ImmutableSortedMap.copyOf(keys);
        for (Long amount : this.keys.keySet())
            checkArgument(amount > 0, "keyset amounts must be positive: %s", amount);
    }

    public String getId() {
        return id;
    }

    public String getUnit() {
        return unit;
    }

    public boolean isActive() {
        return active;
    }

    /** Fee per input, in parts per thousand. */
    public long getFeePerInput() {
        return feePerInput;
    }

    @Nullable
    public Long getFinalExpiry() {
        return finalExpiry;
    }

    /** Modern keyset ids are hex strings; legacy ones were base64. */
    public boolean hasHexId() {
        return HEX.matcher(id).matches();
    }

    public ImmutableSortedMap<Long, String> getKeys() {
        return keys;
    }

    public ImmutableSortedSet<Long> getAmounts() {
        return keys.keySet();
    }

    public boolean hasAmount(long amount) {
        return keys.containsKey(amount);
    }

    /** Public key the issuer signs the given amount with, as a compressed point in hex. */
    public String getKey(long amount) {
        String key = keys.get(amount);
        if (key == null)
            throw new InvalidConfigurationException("Keyset " + id + " has no key for amount " + amount);
        return key;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("id", id)
                .add("unit", unit)
                .add("active", active)
                .add("feePerInput", feePerInput)
                .add("amounts", keys.size())
                .toString();
    }
}
