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

/** Options for {@link Wallet#sendOffline}. */
public class SendOfflineConfig {
    /** Only send proofs carrying a DLEQ proof that verifies, and keep the DLEQ proofs on them so the receiver can check. */
    public boolean requireDleq = false;

    /** Select proofs worth the amount plus their own input fees. */
    public boolean includeFees = false;

    /** Fail rather than overpay when no subset hits the amount exactly. */
    public boolean exactMatch = true;

    public static SendOfflineConfig defaults() {
        return new SendOfflineConfig();
    }
}
