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

package org.ecashj.mint;

import com.google.common.base.MoreObjects;
import org.ecashj.core.DleqProof;

import javax.annotation.Nullable;

/**
 * The mint's signature {@code C_} on one {@link BlindedMessage}, with an optional DLEQ proof that it was made
 * with the keyset's key for {@link #getAmount()}.
 */
public final class BlindedSignature {
    private final String keysetId;
    private final long amount;
    private final String c_;
    @Nullable private final DleqProof dleq;

    public BlindedSignature(String keysetId, long amount, String c_) {
        this(keysetId, amount, c_, null);
    }

    public BlindedSignature(String keysetId, long amount, String c_, @Nullable DleqProof dleq) {
        this.keysetId = keysetId;
        this.amount = amount;
        this.c_ = c_;
        this.dleq = dleq;
    }

    public String getKeysetId() {
        return keysetId;
    }

    public long getAmount() {
        return amount;
    }

    public String getC_() {
        return c_;
    }

    @Nullable
    public DleqProof getDleq() {
        return dleq;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("id", keysetId).add("amount", amount).add("C_", c_)
                .omitNullValues().add("dleq", dleq).toString();
    }
}
