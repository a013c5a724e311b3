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

import org.ecashj.wallet.listeners.ChangeOutputsCreatedListener;
import org.ecashj.wallet.listeners.CountersReservedListener;

import javax.annotation.Nullable;

/** Options for {@link Wallet#meltProofs}. */
public class MeltProofsConfig {
    @Nullable public String keysetId = null;

    @Nullable public CountersReservedListener countersReservedListener = null;

    /** Receives the blank change outputs before the melt is sent. */
    @Nullable public ChangeOutputsCreatedListener changeOutputsCreatedListener = null;

    public static MeltProofsConfig defaults() {
        return new MeltProofsConfig();
    }
}
