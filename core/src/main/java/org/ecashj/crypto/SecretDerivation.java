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
import com.google.common.primitives.Longs;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.digests.SHA512Digest;
import org.bouncycastle.crypto.macs.HMac;
import org.bouncycastle.crypto.params.KeyParameter;
import org.bouncycastle.math.ec.ECPoint;
import org.ecashj.core.InvalidConfigurationException;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.regex.Pattern;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Derives proof secrets and blinding factors from a wallet seed, a keyset id and a counter, so that outputs can
 * be regenerated during a restore.
 *
 * <p>Keysets with a {@code 01} id prefix use HMAC-SHA256 keyed with the seed, over the id, the counter and a
 * byte telling the secret and the blinding factor apart. Older {@code 00} prefixed and
 * legacy base64 ids use BIP-32 derivation along {@code m/129372'/0'/keyset'/counter'/(0|1)}.</p>
 */
public class SecretDerivation {
    private static final Pattern HEX = Pattern.compile("^[0-9a-fA-F]+$");
    private static final byte[] KDF_PREFIX = "Cashu_KDF_HMAC_SHA256".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] BIP32_SEED_KEY = "Bitcoin seed".getBytes(StandardCharsets.US_ASCII);
    private static final int PURPOSE = 129372;
    private static final int HARDENED_BIT = 0x80000000;
    private static final BigInteger KEYSET_MODULUS = BigInteger.valueOf((1L << 31) - 1);
    private static final BigInteger N = Secp256k1BlindSignatureScheme.CURVE.getN();

    private enum DerivationType {
        SECRET(0),
        BLINDING_FACTOR(1);

        final int index;

        DerivationType(int index) {
            this.index = index;
        }
    }

    private SecretDerivation() {
    }

    public static byte[] deriveSecret(byte[] seed, String keysetId, long counter) {
        return derive(seed, keysetId, counter, DerivationType.SECRET);
    }

    public static BigInteger deriveBlindingFactor(byte[] seed, String keysetId, long counter) {
        return new BigInteger(1, derive(seed, keysetId, counter, DerivationType.BLINDING_FACTOR));
    }

    private static byte[] derive(byte[] seed, String keysetId, long counter, DerivationType type) {
        checkArgument(counter >= 0, "counter must not be negative: %s", counter);
        boolean hex = HEX.matcher(keysetId).matches();
        if (hex && keysetId.startsWith("01"))
            return deriveHmac(seed, keysetId, counter, type);
        if (hex && keysetId.startsWith("00"))
            return deriveBip32(seed, keysetIdInt(keysetId), counter, type);
        if (!hex && BaseEncoding.base64().canDecode(keysetId))
            return deriveBip32(seed, keysetIdInt(keysetId), counter, type);
        throw new InvalidConfigurationException("Unrecognized keyset ID version " + keysetId.substring(0, Math.min(2, keysetId.length())));
    }

    private static byte[] deriveHmac(byte[] seed, String keysetId, long counter, DerivationType type) {
        byte[] message = Bytes.concat(KDF_PREFIX, BaseEncoding.base16().decode(keysetId.toUpperCase()),
                Longs.toByteArray(counter), new byte[] {(byte) type.index});
        byte[] digest = hmac(new HMac(new SHA256Digest()), seed, message);
        if (type == DerivationType.BLINDING_FACTOR) {
            BigInteger x = new BigInteger(1, digest);
            if (x.compareTo(N) >= 0)
                return toBytes32(x.subtract(N));
            if (x.signum() == 0)
                throw new IllegalStateException("Derived invalid blinding scalar r == 0");
        }
        return digest;
    }

    static long keysetIdInt(String keysetId) {
        byte[] bytes = HEX.matcher(keysetId).matches()
                ? BaseEncoding.base16().decode(keysetId.toUpperCase())
                : BaseEncoding.base64().decode(keysetId);
        return new BigInteger(1, bytes).mod(KEYSET_MODULUS).longValue();
    }

    private static byte[] deriveBip32(byte[] seed, long keysetInt, long counter, DerivationType type) {
        checkArgument(counter < (1L << 31), "counter too large for hardened derivation: %s", counter);
        byte[] i = hmac(new HMac(new SHA512Digest()), BIP32_SEED_KEY, seed);
        BigInteger key = new BigInteger(1, Arrays.copyOfRange(i, 0, 32));
        byte[] chainCode = Arrays.copyOfRange(i, 32, 64);
        checkKey(key);
        int[] path = {PURPOSE | HARDENED_BIT, HARDENED_BIT, (int) keysetInt | HARDENED_BIT,
                (int) counter | HARDENED_BIT, type.index};
        for (int index : path) {
            byte[] data;
            if ((index & HARDENED_BIT) != 0) {
                data = Bytes.concat(new byte[] {0}, toBytes32(key), intToBytes(index));
            } else {
                ECPoint pub = Secp256k1BlindSignatureScheme.CURVE.getG().multiply(key).normalize();
                data = Bytes.concat(pub.getEncoded(true), intToBytes(index));
            }
            byte[] child = hmac(new HMac(new SHA512Digest()), chainCode, data);
            BigInteger il = new BigInteger(1, Arrays.copyOfRange(child, 0, 32));
            checkKey(il);
            key = il.add(key).mod(N);
            checkKey(key);
            chainCode = Arrays.copyOfRange(child, 32, 64);
        }
        return toBytes32(key);
    }

    private static void checkKey(BigInteger key) {
        if (key.signum() == 0 || key.compareTo(N) >= 0)
            throw new IllegalStateException("Could not derive private key");
    }

    private static byte[] hmac(HMac mac, byte[] key, byte[] message) {
        mac.init(new KeyParameter(key));
        mac.update(message, 0, message.length);
        byte[] out = new byte[mac.getMacSize()];
        mac.doFinal(out, 0);
        return out;
    }

    private static byte[] intToBytes(int value) {
        return new byte[] {(byte) (value >>> 24), (byte) (value >>> 16), (byte) (value >>> 8), (byte) value};
    }

    private static byte[] toBytes32(BigInteger value) {
        byte[] raw = value.toByteArray();
        byte[] out = new byte[32];
        int length = Math.min(raw.length, 32);
        System.arraycopy(raw, raw.length - length, out, 32 - length, length);
        return out;
    }
}
