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

import javax.annotation.Nullable;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A spendable ecash token: an amount in the keyset's unit, the secret the issuer signed and the unblinded
 * signature {@code C}. Proofs are immutable. Two proofs are equal when they carry the same keyset id and
 * secret, which is also how the issuer tells them apart.
 */
public final class Proof {
    private final String keysetId;
    private final long amount;
    private final String secret;
    private final String c;
    @Nullable
    private final DleqProof dleq;
    @Nullable
    private final String witness;

    public Proof(String keysetId, long amount, String secret, String c) {
        this(keysetId, amount, secret, c, null, null);
    }

    public Proof(String keysetId, long amount, String secret, String c, @Nullable DleqProof dleq,
                 @Nullable String witness) {
        checkArgument(amount >= 0, "amount must not be negative: %s", amount);
        this.keysetId = checkNotNull(keysetId);
        this.amount = amount;
        this.secret = checkNotNull(secret);
        this.c = checkNotNull(c);
        this.dleq = dleq;
        this.witness = witness;
    }

    public String getKeysetId() {
        return keysetId;
    }

    public long getAmount() {
        return amount;
    }

    public String getSecret() {
        return secret;
    }

    public byte[] getSecretBytes() {
        return secret.getBytes(StandardCharsets.UTF_8);
    }

    /** Unblinded signature, a compressed secp256k1 point in hex. */
    public String getC() {
        return c;
    }

    @Nullable
    public DleqProof getDleq() {
        return dleq;
    }

    public boolean hasDleq() {
        return dleq != null;
    }

    @Nullable
    public String getWitness() {
        return witness;
    }

    /** Returns a copy without the DLEQ proof, which would otherwise let the issuer link this proof to its minting. */
    public Proof withoutDleq() {
        return dleq == null ? this : new Proof(keysetId, amount, secret, c, null, witness);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Proof other = (Proof) o;
        return keysetId.equals(other.keysetId) && secret.equals(other.secret);
    }

    @Override
    public int hashCode() {
        return Objects.hash(keysetId, secret);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("id", keysetId)
                .add("amount", amount)
                .omitNullValues()
                .add("dleq", dleq)
                .toString();
    }
}
