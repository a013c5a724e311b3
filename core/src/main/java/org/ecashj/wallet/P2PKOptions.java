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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.ecashj.core.InvalidConfigurationException;

import javax.annotation.Nullable;
import java.util.Arrays;
import java.util.List;

/**
 * Spending conditions for pay-to-public-key locked outputs. The first lock key goes in the secret's data
 * field, the others become the {@code pubkeys} tag. Set the fields directly, like a {@code SendRequest}.
 */
public class P2PKOptions {
    /** Tags the wallet writes itself. They may not appear in {@link #additionalTags}. */
    public static final ImmutableSet<String> RESERVED_TAGS =
            ImmutableSet.of("locktime", "pubkeys", "n_sigs", "refund", "n_sigs_refund");

    /** Keys that can unlock the output, hex encoded. At least one. */
    public final ImmutableList<String> pubkeys;

    /** Unix time after which the refund keys may spend the output, if set. */
    @Nullable public Long locktime = null;

    /** Keys that can spend the output once {@link #locktime} has passed. */
    public List<String> refundKeys = ImmutableList.of();

    /** How many of {@link #pubkeys} must sign. Clamped to 1..pubkeys.size(). */
    public int requiredSignatures = 1;

    /** How many of {@link #refundKeys} must sign. Clamped to 1..refundKeys.size(). */
    public int requiredRefundSignatures = 1;

    /** Extra tags, each a key followed by its values. */
    public List<List<String>> additionalTags = ImmutableList.of();

    private P2PKOptions(List<String> pubkeys) {
        if (pubkeys.isEmpty())
            throw new InvalidConfigurationException("P2PK lock requires at least one public key");
        this.pubkeys = ImmutableList.copyOf(pubkeys);
    }

    public static P2PKOptions lockTo(String... pubkeys) {
        return new P2PKOptions(Arrays.asList(pubkeys));
    }

    public static P2PKOptions lockTo(List<String> pubkeys) {
        return new P2PKOptions(pubkeys);
    }
}
