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

package org.ecashj.crypto;

import org.ecashj.core.Proof;

import javax.annotation.Nullable;
import java.math.BigInteger;

/**
 * The blind signature primitive. A wallet blinds a secret before sending it to the issuer and unblinds the
 * issuer's signature afterwards; the issuer never sees the secret it signed. Implementations are stateless.
 */
public interface BlindSignatureScheme {

    /** A blinded message together with the blinding factor that produced it. */
    final class Blinded {
        public final String blindedMessage;
        public final BigInteger blindingFactor;

        public Blinded(String blindedMessage, BigInteger blindingFactor) {
            this.blindedMessage = blindedMessage;
            this.blindingFactor = blindingFactor;
        }
    }

    /**
     * Blinds {@code secret}. When {@code blindingFactor} is null a fresh random one is drawn.
     *
     * @return the blinded point, hex encoded, and the blinding factor used
     */
    Blinded blind(byte[] secret, @Nullable BigInteger blindingFactor);

    /**
     * Removes the blinding from an issuer signature.
     *
     * @param blindedSignature the issuer's signature on the blinded message, hex encoded
     * @param blindingFactor the factor the message was blinded with
     * @param mintPublicKey the issuer's public key for the signed amount, hex encoded
     * @return the unblinded signature, hex encoded
     */
    String unblind(String blindedSignature, BigInteger blindingFactor, String mintPublicKey);

    /**
     * Checks the proof's DLEQ proof against the issuer key for its amount, showing that {@code C} was signed with
     * that key. A proof without a DLEQ proof, or with a malformed one, does not verify.
     *
     * @param mintPublicKey the issuer's public key for the proof's amount, hex encoded
     */
    boolean verifyDleq(Proof proof, String mintPublicKey);
}
