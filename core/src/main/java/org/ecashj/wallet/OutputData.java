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

import com.google.common.base.MoreObjects;
import com.google.common.io.BaseEncoding;
import org.ecashj.core.Amounts;
import org.ecashj.core.DleqProof;
import org.ecashj.core.InvalidConfigurationException;
import org.ecashj.core.Keyset;
import org.ecashj.core.Proof;
import org.ecashj.crypto.BlindSignatureScheme;
import org.ecashj.crypto.SecretDerivation;
import org.ecashj.mint.BlindedMessage;
import org.ecashj.mint.BlindedSignature;
import org.json.JSONArray;
import org.json.JSONObject;

import javax.annotation.Nullable;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The standard {@link OutputRequest}: a secret, the factor it was blinded with and the resulting blinded
 * message. Secrets are either random, derived from the wallet seed and a counter, or a pay-to-public-key
 * spending condition.
 */
public class OutputData implements OutputRequest {
    /** Longest secret a mint is expected to accept. */
    public static final int MAX_SECRET_LENGTH = 1024;

    private static final SecureRandom random = new SecureRandom();
    private static final BaseEncoding HEX = BaseEncoding.base16().lowerCase();

    private final BlindedMessage blindedMessage;
    private final BigInteger blindingFactor;
    private final byte[] secret;
    private final BlindSignatureScheme scheme;

    public OutputData(BlindedMessage blindedMessage, BigInteger blindingFactor, byte[] secret,
                      BlindSignatureScheme scheme) {
        this.blindedMessage = checkNotNull(blindedMessage);
        this.blindingFactor = checkNotNull(blindingFactor);
        this.secret = secret.clone();
        this.scheme = checkNotNull(scheme);
    }

    @Override
    public BlindedMessage getBlindedMessage() {
        return blindedMessage;
    }

    @Override
    public BigInteger getBlindingFactor() {
        return blindingFactor;
    }

    @Override
    public byte[] getSecret() {
        return secret.clone();
    }

    @Override
    public Proof toProof(BlindedSignature signature, Keyset keyset) {
        String c = scheme.unblind(signature.getC_(), blindingFactor, keyset.getKey(signature.getAmount()));
        DleqProof dleq = null;
        if (signature.getDleq() != null)
            dleq = new DleqProof(signature.getDleq().getE(), signature.getDleq().getS(), toHex32(blindingFactor));
        return new Proof(signature.getKeysetId(), signature.getAmount(), new String(secret, StandardCharsets.UTF_8),
                c, dleq, null);
    }

    public static List<OutputData> createRandomData(long amount, Keyset keyset, @Nullable List<Long> split,
                                                    BlindSignatureScheme scheme) {
        List<OutputData> outputs = new ArrayList<>();
        for (long a : Amounts.splitAmount(amount, keyset, split))
            outputs.add(createSingleRandomData(a, keyset.getId(), scheme));
        return outputs;
    }

    public static OutputData createSingleRandomData(long amount, String keysetId, BlindSignatureScheme scheme) {
        byte[] entropy = new byte[32];
        random.nextBytes(entropy);
        return blind(amount, keysetId, HEX.encode(entropy).getBytes(StandardCharsets.UTF_8), null, scheme);
    }

    /**
     * Creates outputs whose secrets and blinding factors are derived from {@code seed}. The i-th output uses
     * counter {@code counter + i}, so the caller must own that whole range.
     */
    public static List<OutputData> createDeterministicData(long amount, byte[] seed, long counter, Keyset keyset,
                                                           @Nullable List<Long> split, BlindSignatureScheme scheme) {
        List<Long> amounts = Amounts.splitAmount(amount, keyset, split);
        List<OutputData> outputs = new ArrayList<>(amounts.size());
        for (int i = 0; i < amounts.size(); i++)
            outputs.add(createSingleDeterministicData(amounts.get(i), seed, counter + i, keyset.getId(), scheme));
        return outputs;
    }

    public static OutputData createSingleDeterministicData(long amount, byte[] seed, long counter, String keysetId,
                                                           BlindSignatureScheme scheme) {
        byte[] secret = HEX.encode(SecretDerivation.deriveSecret(seed, keysetId, counter))
                .getBytes(StandardCharsets.UTF_8);
        BigInteger r = SecretDerivation.deriveBlindingFactor(seed, keysetId, counter);
        return blind(amount, keysetId, secret, r, scheme);
    }

    public static List<OutputData> createP2PKData(P2PKOptions options, long amount, Keyset keyset,
                                                  @Nullable List<Long> split, BlindSignatureScheme scheme) {
        List<OutputData> outputs = new ArrayList<>();
        for (long a : Amounts.splitAmount(amount, keyset, split))
            outputs.add(createSingleP2PKData(options, a, keyset.getId(), scheme));
        return outputs;
    }

    /**
     * Creates an output locked to {@code options}. The secret is a well-known {@code ["P2PK", {...}]} secret
     * with a random nonce.
     */
    public static OutputData createSingleP2PKData(P2PKOptions options, long amount, String keysetId,
                                                  BlindSignatureScheme scheme) {
        List<String> lockKeys = options.pubkeys;
        List<String> refundKeys = options.refundKeys;
        int requiredLock = Math.max(1, Math.min(options.requiredSignatures, lockKeys.size()));
        int requiredRefund = Math.max(1, Math.min(options.requiredRefundSignatures,
                refundKeys.isEmpty() ? 1 : refundKeys.size()));

        JSONArray tags = new JSONArray();
        if (options.locktime != null)
            tags.put(new JSONArray().put("locktime").put(String.valueOf(options.locktime)));
        if (lockKeys.size() > 1) {
            JSONArray pubkeys = new JSONArray().put("pubkeys");
            lockKeys.subList(1, lockKeys.size()).forEach(pubkeys::put);
            tags.put(pubkeys);
            if (requiredLock > 1)
                tags.put(new JSONArray().put("n_sigs").put(String.valueOf(requiredLock)));
        }
        if (!refundKeys.isEmpty()) {
            JSONArray refund = new JSONArray().put("refund");
            refundKeys.forEach(refund::put);
            tags.put(refund);
            if (requiredRefund > 1)
                tags.put(new JSONArray().put("n_sigs_refund").put(String.valueOf(requiredRefund)));
        }
        for (List<String> tag : options.additionalTags) {
            if (tag.isEmpty() || P2PKOptions.RESERVED_TAGS.contains(tag.get(0)))
                throw new InvalidConfigurationException("additionalTags must not use reserved key \""
                        + (tag.isEmpty() ? "" : tag.get(0)) + "\"");
            tags.put(new JSONArray(tag));
        }

        byte[] nonce = new byte[32];
        random.nextBytes(nonce);
        JSONObject body = new JSONObject();
        body.put("nonce", HEX.encode(nonce));
        body.put("data", lockKeys.get(0));
        body.put("tags", tags);
        String secret = new JSONArray().put("P2PK").put(body).toString();
        if (secret.length() > MAX_SECRET_LENGTH)
            throw new InvalidConfigurationException("Secret too long (" + secret.length()
                    + " characters), maximum is " + MAX_SECRET_LENGTH);
        return blind(amount, keysetId, secret.getBytes(StandardCharsets.UTF_8), null, scheme);
    }

    public static long sumOutputAmounts(Collection<? extends OutputRequest> outputs) {
        long sum = 0;
        for (OutputRequest output : outputs)
            sum += output.getAmount();
        return sum;
    }

    private static OutputData blind(long amount, String keysetId, byte[] secret, @Nullable BigInteger r,
                                    BlindSignatureScheme scheme) {
        BlindSignatureScheme.Blinded blinded = scheme.blind(secret, r);
        return new OutputData(new BlindedMessage(amount, keysetId, blinded.blindedMessage),
                blinded.blindingFactor, secret, scheme);
    }

    private static String toHex32(BigInteger value) {
        String hex = value.toString(16);
        StringBuilder padded = new StringBuilder(64);
        for (int i = hex.length(); i < 64; i++)
            padded.append('0');
        return padded.append(hex).toString();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("amount", getAmount()).add("B_", blindedMessage.getB_())
                .toString();
    }
}
