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

import org.ecashj.core.Proof;
import org.ecashj.wallet.listeners.CountersReservedListener;

import javax.annotation.Nullable;
import java.util.Collection;

/** Options for {@link Wallet#receive}. */
public class ReceiveConfig {
    @Nullable public String keysetId = null;

    /** Refuse tokens whose proofs do not all carry a DLEQ proof that verifies. */
    public boolean requireDleq = false;

    /** Proofs the wallet already holds, to pick denominations that balance the wallet. */
    @Nullable public Collection<Proof> proofsWeHave = null;

    @Nullable public CountersReservedListener countersReservedListener = null;

    public static ReceiveConfig defaults() {
        return new ReceiveConfig();
    }
}
