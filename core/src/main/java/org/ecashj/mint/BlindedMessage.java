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

import java.util.Objects;

/**
 * An output sent to the mint for signing: the amount it should be worth, the keyset to sign it with and the
 * blinded point {@code B_}.
 */
public final class BlindedMessage {
    private final long amount;
    private final String keysetId;
    private final String b_;

    public BlindedMessage(long amount, String keysetId, String b_) {
        this.amount = amount;
        this.keysetId = keysetId;
        this.b_ = b_;
    }

    public long getAmount() {
        return amount;
    }

    public String getKeysetId() {
        return keysetId;
    }

    /** The blinded point, hex encoded. */
    public String getB_() {
        return b_;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        BlindedMessage other = (BlindedMessage) o;
        return amount == other.amount && keysetId.equals(other.keysetId) && b_.equals(other.b_);
    }

    @Override
    public int hashCode() {
        return Objects.hash(amount, keysetId, b_);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("amount", amount).add("id", keysetId).add("B_", b_).toString();
    }
}
