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

import org.ecashj.core.Keyset;
import org.ecashj.core.Proof;
import org.ecashj.mint.BlindedMessage;
import org.ecashj.mint.BlindedSignature;

import java.math.BigInteger;

/**
 * One output of a wallet operation: the blinded message sent to the mint, plus what is needed to turn the
 * mint's signature on it into a {@link Proof}. An output request belongs to exactly one operation and must not
 * be sent twice.
 */
public interface OutputRequest {
    BlindedMessage getBlindedMessage();

    BigInteger getBlindingFactor();

    /** The secret as sent in the resulting proof. */
    byte[] getSecret();

    /** Unblinds the mint's signature with the keyset's key for the signed amount. */
    Proof toProof(BlindedSignature signature, Keyset keyset);

    default long getAmount() {
        return getBlindedMessage().getAmount();
    }
}
