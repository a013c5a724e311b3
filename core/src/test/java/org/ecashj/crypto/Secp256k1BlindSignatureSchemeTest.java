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

import com.google.common.io.BaseEncoding;
import org.bouncycastle.math.ec.ECPoint;
import org.ecashj.core.DleqProof;
import org.ecashj.core.Proof;
import org.junit.Test;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;

import static org.ecashj.crypto.Secp256k1BlindSignatureScheme.CURVE;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

public class Secp256k1BlindSignatureSchemeTest {
    private static final BaseEncoding HEX = BaseEncoding.base16().lowerCase();

    private final Secp256k1BlindSignatureScheme scheme = new Secp256k1BlindSignatureScheme();

    private static String encode(ECPoint point) {
        return HEX.encode(point.normalize().getEncoded(true));
    }

    @Test
    public void hashToCurve() {
        assertEquals("024cce997d3b518f739663b757deaec95bcd9473c30a14ac2fd04023a739d1a725",
                encode(Secp256k1BlindSignatureScheme.hashToCurve(new byte[32])));
        byte[] one = new byte[32];
        one[31] = 1;
        assertEquals("022e7158e11c9506f1aa4248bf531298daa7febd6194f003edcd9b93ade6253acf",
                encode(Secp256k1BlindSignatureScheme.hashToCurve(one)));
    }

    @Test
    public void blindWithGivenFactor() {
        byte[] secret = "test_message".getBytes(StandardCharsets.UTF_8);
        BigInteger r = BigInteger.ONE;
        BlindSignatureScheme.Blinded blinded = scheme.blind(secret, r);
        ECPoint expected = Secp256k1BlindSignatureScheme.hashToCurve(secret).add(CURVE.getG());
        assertEquals(encode(expected), blinded.blindedMessage);
        assertEquals(r, blinded.blindingFactor);
    }

    @Test
    public void randomFactorsDiffer() {
        byte[] secret = "same".getBytes(StandardCharsets.UTF_8);
        assertNotEquals(scheme.blind(secret, null).blindedMessage, scheme.blind(secret, null).blindedMessage);
    }

    @Test
    public void unblindRecoversSignatureOnSecret() {
        BigInteger k = new BigInteger("7f3a2b", 16);
        String mintKey = encode(CURVE.getG().multiply(k));
        byte[] secret = "407915bc212be61a77e3e6d2aeb4c727980bda51cd06a6afc29e2861768a7837".getBytes(StandardCharsets.UTF_8);

        BlindSignatureScheme.Blinded blinded = scheme.blind(secret, null);
        ECPoint c_ = Secp256k1BlindSignatureScheme.decodePoint(blinded.blindedMessage).multiply(k);
        String c = scheme.unblind(encode(c_), blinded.blindingFactor, mintKey);

        assertEquals(encode(Secp256k1BlindSignatureScheme.hashToCurve(secret).multiply(k)), c);
    }

    @Test(expected = IllegalArgumentException.class)
    public void zeroBlindingFactorRejected() {
        scheme.blind(new byte[1], BigInteger.ZERO);
    }

    private static final String DLEQ_MINT_KEY = "0279be667ef9dcbbac55a06295ce870b07029bfcdb2dce28d959f2815b16f81798";
    private static final String DLEQ_E = "b31e58ac6527f34975ffab13e70a48b6d2b0d35abc4b03f0151f09ee1a9763d4";
    private static final String DLEQ_S = "8fbae004c59e754d71df67e392b6ae4e29293113ddc2ec86592a0431d16306d8";
    private static final String DLEQ_R = "a6d13fcd7a18442e6076f5e1e7c887ad5de40a019824bdfa9fe740d302e8d861";

    private static Proof dleqProof(String e, String s, String r) {
        return new Proof("00882760bfa2eb41", 1, "daf4dd00a2b68a0858a80450f52c8a7d2ccf87d375e43e216e0c571f089f63e9",
                "024369d2d22a80ecf78f3937da9d5f30c1b9f74f0c32684d583cca0fa6a61cdcfc", new DleqProof(e, s, r), null);
    }

    @Test
    public void verifyDleq() {
        assertTrue(scheme.verifyDleq(dleqProof(DLEQ_E, DLEQ_S, DLEQ_R), DLEQ_MINT_KEY));
    }

    @Test
    public void tamperedDleqFails() {
        String otherScalar = "0000000000000000000000000000000000000000000000000000000000000001";
        assertFalse(scheme.verifyDleq(dleqProof(otherScalar, DLEQ_S, DLEQ_R), DLEQ_MINT_KEY));
        assertFalse(scheme.verifyDleq(dleqProof(DLEQ_E, otherScalar, DLEQ_R), DLEQ_MINT_KEY));
        assertFalse(scheme.verifyDleq(dleqProof(DLEQ_E, DLEQ_S, otherScalar), DLEQ_MINT_KEY));
        assertFalse(scheme.verifyDleq(dleqProof(DLEQ_E, DLEQ_S, DLEQ_R), encode(CURVE.getG().multiply(BigInteger.TEN))));
        assertFalse(scheme.verifyDleq(dleqProof("zz", DLEQ_S, DLEQ_R), DLEQ_MINT_KEY));
    }

    @Test
    public void missingDleqFails() {
        Proof proof = dleqProof(DLEQ_E, DLEQ_S, DLEQ_R).withoutDleq();
        assertFalse(scheme.verifyDleq(proof, DLEQ_MINT_KEY));
    }
}
