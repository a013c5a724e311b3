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

import org.ecashj.crypto.BlindSignatureScheme;
import org.ecashj.crypto.Secp256k1BlindSignatureScheme;

import javax.annotation.Nullable;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static org.ecashj.wallet.EcashConstants.DEFAULT_DENOMINATION_TARGET;
import static org.ecashj.wallet.EcashConstants.DEFAULT_UNIT;

/**
 * Settings for one {@link Wallet}. Nothing here is global: two wallets with different options can share a
 * mint connection.
 */
public class WalletOptions {
    private String unit = DEFAULT_UNIT;
    @Nullable private String keysetId;
    @Nullable private byte[] seed;
    private SecretsPolicy secretsPolicy = SecretsPolicy.AUTO;
    @Nullable private CounterSource counterSource;
    @Nullable private Long initialCounter;
    private int denominationTarget = DEFAULT_DENOMINATION_TARGET;
    private SelectionOptions selectionOptions = SelectionOptions.defaults();
    private BlindSignatureScheme blindSignatureScheme = new Secp256k1BlindSignatureScheme();

    public WalletOptions() {
    }

    WalletOptions(WalletOptions other) {
        this.unit = other.unit;
        this.keysetId = other.keysetId;
        this.seed = other.seed;
        this.secretsPolicy = other.secretsPolicy;
        this.counterSource = other.counterSource;
        this.initialCounter = other.initialCounter;
        this.denominationTarget = other.denominationTarget;
        this.selectionOptions = other.selectionOptions;
        this.blindSignatureScheme = other.blindSignatureScheme;
    }

    public String getUnit() {
        return unit;
    }

    public WalletOptions setUnit(String unit) {
        this.unit = checkNotNull(unit);
        return this;
    }

    @Nullable
    public String getKeysetId() {
        return keysetId;
    }

    /** Keyset the wallet creates outputs in. By default the cheapest active keyset. */
    public WalletOptions setKeysetId(@Nullable String keysetId) {
        this.keysetId = keysetId;
        return this;
    }

    @Nullable
    public byte[] getSeed() {
        return seed == null ? null : seed.clone();
    }

    /** BIP-39 seed for deterministic secrets. */
    public WalletOptions setSeed(@Nullable byte[] seed) {
        this.seed = seed == null ? null : seed.clone();
        return this;
    }

    public SecretsPolicy getSecretsPolicy() {
        return secretsPolicy;
    }

    public WalletOptions setSecretsPolicy(SecretsPolicy secretsPolicy) {
        this.secretsPolicy = checkNotNull(secretsPolicy);
        return this;
    }

    @Nullable
    public CounterSource getCounterSource() {
        return counterSource;
    }

    /** Where counters come from. By default a new {@link EphemeralCounterSource}. */
    public WalletOptions setCounterSource(@Nullable CounterSource counterSource) {
        this.counterSource = counterSource;
        return this;
    }

    @Nullable
    public Long getInitialCounter() {
        return initialCounter;
    }

    /**
     * First counter of the wallet's keyset. Only applies to the default counter source; a source passed to
     * {@link #setCounterSource} keeps its own state.
     */
    public WalletOptions setInitialCounter(@Nullable Long initialCounter) {
        checkArgument(initialCounter == null || initialCounter >= 0, "initialCounter must not be negative");
        this.initialCounter = initialCounter;
        return this;
    }

    public int getDenominationTarget() {
        return denominationTarget;
    }

    public WalletOptions setDenominationTarget(int denominationTarget) {
        checkArgument(denominationTarget > 0, "denominationTarget must be positive");
        this.denominationTarget = denominationTarget;
        return this;
    }

    public SelectionOptions getSelectionOptions() {
        return selectionOptions;
    }

    public WalletOptions setSelectionOptions(SelectionOptions selectionOptions) {
        this.selectionOptions = checkNotNull(selectionOptions);
        return this;
    }

    public BlindSignatureScheme getBlindSignatureScheme() {
        return blindSignatureScheme;
    }

    public WalletOptions setBlindSignatureScheme(BlindSignatureScheme blindSignatureScheme) {
        this.blindSignatureScheme = checkNotNull(blindSignatureScheme);
        return this;
    }
}
