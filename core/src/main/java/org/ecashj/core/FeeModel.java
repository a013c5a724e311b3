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

import java.util.Collection;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Input fees. Every proof spent costs its keyset's fee rate in parts per thousand; the fee charged for a
 * transaction is the sum over all inputs, divided by 1000 and rounded up so that any fractional unit is paid by
 * the spender.
 */
public class FeeModel {
    private final KeysetRegistry registry;

    public FeeModel(KeysetRegistry registry) {
        this.registry = checkNotNull(registry);
    }

    /** Fee rate of the keyset, parts per thousand per input. */
    public long getFeePpk(String keysetId) {
        return registry.getKeyset(checkNotNull(keysetId)).getFeePerInput();
    }

    public long getFeePpk(Proof proof) {
        try {
            return getFeePpk(proof.getKeysetId());
        } catch (InvalidConfigurationException x) {
            throw new InvalidConfigurationException("Could not get fee. No keyset found for keyset id: "
                    + proof.getKeysetId(), x);
        }
    }

    /** Fee the issuer charges for spending all of {@code proofs} together. */
    public long getFeesForProofs(Collection<Proof> proofs) {
        long sumPpk = 0;
        for (Proof proof : proofs)
            sumPpk += getFeePpk(proof);
        return feeFromPpk(sumPpk);
    }

    /** Fee for spending {@code inputs} proofs of the given keyset. */
    public long getFeesForKeyset(int inputs, String keysetId) {
        checkArgument(inputs >= 0, "inputs must not be negative: %s", inputs);
        return feeFromPpk(inputs * getFeePpk(keysetId));
    }

    /** Rounds a parts-per-thousand total up to whole units. */
    public static long feeFromPpk(long sumPpk) {
        if (sumPpk <= 0)
            return 0;
        return (sumPpk + 999) / 1000;
    }
}
