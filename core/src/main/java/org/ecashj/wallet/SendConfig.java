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

import org.ecashj.wallet.listeners.CountersReservedListener;

import javax.annotation.Nullable;

/** Options for {@link Wallet#send}. */
public class SendConfig {
    /** Keyset for the new outputs. Null means the wallet's keyset, and allows sending without a swap. */
    @Nullable public String keysetId = null;

    /**
     * If true the sent proofs are worth the amount plus what the receiver will pay in fees to spend them, so
     * the receiver nets exactly the amount.
     */
    public boolean includeFees = false;

    /** Notified of the counters this send reserves, in addition to the wallet's listeners. */
    @Nullable public CountersReservedListener countersReservedListener = null;

    public static SendConfig defaults() {
        return new SendConfig();
    }

    public static SendConfig includingFees() {
        SendConfig config = new SendConfig();
        config.includeFees = true;
        return config;
    }
}
