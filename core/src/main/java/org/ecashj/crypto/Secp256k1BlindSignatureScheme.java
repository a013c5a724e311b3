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
import com.google.common.primitives.Bytes;
import org.bouncycastle.asn1.x9.X9ECParameters;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.ec.CustomNamedCurves;
import org.bouncycastle.crypto.params.ECDomainParameters;
import org.bouncycastle.math.ec.ECPoint;
import org.ecashj.core.DleqProof;
import org.ecashj.core.Proof;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Blind Diffie-Hellman key exchange over secp256k1, as used by Cashu mints.
 *
 * <p>The wallet maps its secret to a curve point {@code Y = hashToCurve(secret)} and sends
 * {@code B_ = Y + rG}. The mint answers {@code C_ = kB_} and the wallet recovers {@code C = C_ - rK = kY}.</p>
 */
public class Secp256k1BlindSignatureScheme implements BlindSignatureScheme {
    private static final Logger log = LoggerFactory.getLogger(Secp256k1BlindSignatureScheme.class);

    private static final X9ECParameters CURVE_PARAMS = CustomNamedCurves.getByName("secp256k1");
    public static final ECDomainParameters CURVE = new ECDomainParameters(CURVE_PARAMS.getCurve(),
            CURVE_PARAMS.getG(), CURVE_PARAMS.getN(), CURVE_PARAMS.getH());

    private static final byte[] DOMAIN_SEPARATOR = "Secp256k1_HashToCurve_Cashu_".getBytes(StandardCharsets.US_ASCII);
    private static final int MAX_HASH_TO_CURVE_ITERATIONS = 1 << 16;
    private static final BaseEncoding HEX = BaseEncoding.base16().lowerCase();

    private final SecureRandom random;

    public Secp256k1BlindSignatureScheme() {
        this(new SecureRandom());
    }

    public Secp256k1BlindSignatureScheme(SecureRandom random) {
        this.random = random;
    }

    @Override
    public Blinded blind(byte[] secret, @Nullable BigInteger blindingFactor) {
        BigInteger r = blindingFactor != null ? blindingFactor : randomScalar();
        checkArgument(r.signum() > 0 && r.compareTo(CURVE.getN()) < 0, "blinding factor out of range");
        ECPoint y = hashToCurve(secret);
        ECPoint blinded = y.add(CURVE.getG().multiply(r)).normalize();
        return new Blinded(HEX.encode(blinded.getEncoded(true)), r);
    }

    @Override
    public String unblind(String blindedSignature, BigInteger blindingFactor, String mintPublicKey) {
        ECPoint c_ = decodePoint(blindedSignature);
        ECPoint k = decodePoint(mintPublicKey);
        ECPoint c = c_.subtract(k.multiply(blindingFactor)).normalize();
        return HEX.encode(c.getEncoded(true));
    }

    /**
     * Verifies the DLEQ proof {@code (e, s, r)} by re-blinding the unblinded signature: {@code B_ = Y + rG},
     * {@code C_ = C + rA}, then {@code R1 = sG - eA}, {@code R2 = sB_ - eC_} and {@code e == hashE(R1, R2, A, C_)}.
     * A missing {@code r} is taken as zero.
     */
    @Override
    public boolean verifyDleq(Proof proof, String mintPublicKey) {
        DleqProof dleq = proof.getDleq();
        if (dleq == null)
            return false;
        try {
            byte[] eBytes = HEX.decode(dleq.getE().toLowerCase());
            BigInteger e = new BigInteger(1, eBytes);
            BigInteger s = new BigInteger(1, HEX.decode(dleq.getS().toLowerCase()));
            BigInteger r = dleq.getR() != null ? new BigInteger(1, HEX.decode(dleq.getR().toLowerCase())) : BigInteger.ZERO;
            if (e.compareTo(CURVE.getN()) >= 0 || s.compareTo(CURVE.getN()) >= 0 || r.compareTo(CURVE.getN()) >= 0)
                return false;

            ECPoint a = decodePoint(mintPublicKey);
            ECPoint c = decodePoint(proof.getC());
            ECPoint y = hashToCurve(proof.getSecretBytes());
            ECPoint c_ = c.add(a.multiply(r)).normalize();
            ECPoint b_ = y.add(CURVE.getG().multiply(r)).normalize();
            ECPoint r1 = CURVE.getG().multiply(s).subtract(a.multiply(e)).normalize();
            ECPoint r2 = b_.multiply(s).subtract(c_.multiply(e)).normalize();
            return MessageDigest.isEqual(hashE(r1, r2, a, c_), eBytes);
        } catch (IllegalArgumentException x) {
            log.debug("malformed DLEQ proof on {}: {}", proof.getC(), x.getMessage());
            return false;
        }
    }

    /** The DLEQ challenge: sha256 over the concatenated lowercase hex of the uncompressed points. */
    public static byte[] hashE(ECPoint... points) {
        StringBuilder joined = new StringBuilder();
        for (ECPoint point : points)
            joined.append(HEX.encode(point.getEncoded(false)));
        return sha256(joined.toString().getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Deterministically maps a message to a curve point: hash the domain separated message, then try
     * {@code 02 || sha256(hash || counter)} for increasing little-endian counters until it decodes.
     */
    public static ECPoint hashToCurve(byte[] message) {
        byte[] msgHash = sha256(Bytes.concat(DOMAIN_SEPARATOR, message));
        for (int counter = 0; counter < MAX_HASH_TO_CURVE_ITERATIONS; counter++) {
            byte[] counterBytes = new byte[] {
                    (byte) counter, (byte) (counter >>> 8), (byte) (counter >>> 16), (byte) (counter >>> 24)
            };
            byte[] candidate = Bytes.concat(new byte[] {0x02}, sha256(Bytes.concat(msgHash, counterBytes)));
            ECPoint point = tryDecodePoint(candidate);
            if (point != null)
                return point;
        }
        throw new IllegalStateException("No valid point found");
    }

    public static ECPoint decodePoint(String hex) {
        return CURVE.getCurve().decodePoint(HEX.decode(hex.toLowerCase())).normalize();
    }

    @Nullable
    private static ECPoint tryDecodePoint(byte[] encoded) {
        try {
            return CURVE.getCurve().decodePoint(encoded);
        } catch (IllegalArgumentException x) {
            // x is not on the curve, the caller moves on to the next counter
            return null;
        }
    }

    static byte[] sha256(byte[] input) {
        SHA256Digest digest = new SHA256Digest();
        digest.update(input, 0, input.length);
        byte[] out = new byte[digest.getDigestSize()];
        digest.doFinal(out, 0);
        return out;
    }

    private BigInteger randomScalar() {
        BigInteger r;
        do {
            r = new BigInteger(256, random);
        } while (r.signum() == 0 || r.compareTo(CURVE.getN()) >= 0);
        return r;
    }
}
