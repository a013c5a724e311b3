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

import com.google.common.collect.ImmutableMap;
import com.google.common.io.BaseEncoding;
import org.ecashj.core.Amounts;
import org.ecashj.core.FeeModel;
import org.ecashj.core.InvalidConfigurationException;
import org.ecashj.core.KeyChain;
import org.ecashj.core.Keyset;
import org.ecashj.core.Proof;
import org.ecashj.crypto.Secp256k1BlindSignatureScheme;
import org.ecashj.crypto.SecretDerivation;
import org.ecashj.testing.TestKeysets;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.Before;
import org.junit.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class OutputPlannerTest {
    private static final BaseEncoding HEX = BaseEncoding.base16().lowerCase();
    private static final byte[] SEED = new byte[64];
    private static final String LOCK_KEY = "02a9acc1e48c25eeeb9289b5031cc57da9fe72f3fe2861d264bdc074209b107ba2";

    private final Keyset free = TestKeysets.powersOfTwo("009a1f293253e41e", 0);
    private final Keyset cheap = TestKeysets.powersOfTwo("00aaaaaaaaaaaaaa", 100);
    private final Keyset pricey = TestKeysets.powersOfTwo("00bbbbbbbbbbbbbb", 1000);

    private FeeModel feeModel;
    private EphemeralCounterSource counters;
    private OutputPlanner planner;

    static {
        Arrays.fill(SEED, (byte) 7);
    }

    @Before
    public void setUp() {
        feeModel = new FeeModel(new KeyChain("sat", Arrays.asList(free, cheap, pricey)));
        counters = new EphemeralCounterSource();
        planner = new OutputPlanner(feeModel, counters, SEED, new Secp256k1BlindSignatureScheme(), 3);
    }

    private static List<Long> amounts(List<OutputRequest> outputs) {
        List<Long> amounts = new ArrayList<>();
        for (OutputRequest output : outputs)
            amounts.add(output.getAmount());
        return amounts;
    }

    @Test
    public void randomOutputsSplitDefaultWay() {
        List<OutputRequest> outputs = planner.plan(13, free, OutputType.random());
        assertEquals(Arrays.asList(8L, 4L, 1L), amounts(outputs));
        for (OutputRequest output : outputs)
            assertEquals(free.getId(), output.getBlindedMessage().getKeysetId());
    }

    @Test
    public void nothingPlannedForNonPositiveAmounts() {
        assertTrue(planner.plan(0, free, OutputType.random()).isEmpty());
        assertTrue(planner.plan(-3, free, OutputType.deterministic(0)).isEmpty());
        assertEquals(0, counters.reserve(free.getId(), 0).getStart());
    }

    @Test
    public void explicitDenominationsMustAddUp() {
        assertEquals(Arrays.asList(1L, 1L, 4L),
                amounts(planner.plan(6, free, OutputType.random(Arrays.asList(1L, 1L, 4L)))));
        try {
            planner.plan(7, free, OutputType.random(Arrays.asList(1L, 1L, 4L)));
            fail();
        } catch (InvalidConfigurationException x) {
            assertTrue(x.getMessage().contains("sum mismatch"));
        }
    }

    @Test
    public void feeInclusionSettlesOnFixedPoint() {
        OutputSpec spec = planner.configureOutputs(10, pricey, OutputType.random(), true, null);
        List<Long> denominations = spec.getOutputType().getDenominations();
        assertEquals(14, spec.getAmount());
        assertEquals(Arrays.asList(8L, 2L, 4L), denominations);
        assertEquals(spec.getAmount(), Amounts.sum(denominations));
        assertTrue(feeModel.getFeesForKeyset(denominations.size(), pricey.getId()) <= spec.getAmount() - 10);

        spec = planner.configureOutputs(10, cheap, OutputType.random(), true, null);
        assertEquals(11, spec.getAmount());
        assertEquals(Arrays.asList(8L, 2L, 1L), spec.getOutputType().getDenominations());

        spec = planner.configureOutputs(10, free, OutputType.random(), true, null);
        assertEquals(10, spec.getAmount());
    }

    @Test
    public void feeInclusionCoversEveryOutput() {
        for (long amount = 1; amount < 200; amount += 3) {
            OutputSpec spec = planner.configureOutputs(amount, pricey, OutputType.random(), true, null);
            List<Long> denominations = spec.getOutputType().getDenominations();
            assertEquals(spec.getAmount(), Amounts.sum(denominations));
            long fee = spec.getAmount() - amount;
            assertTrue(fee >= feeModel.getFeesForKeyset(denominations.size(), pricey.getId()));
        }
    }

    @Test
    public void denominationsFollowProofsWeHave() {
        List<Proof> have = new ArrayList<>();
        long[] held = {1, 2, 4, 4, 4, 8};
        for (int i = 0; i < held.length; i++)
            have.add(new Proof(free.getId(), held[i], "s" + i, "c"));
        OutputSpec spec = planner.configureOutputs(22, free, OutputType.random(), false, have);
        assertEquals(Arrays.asList(1L, 1L, 2L, 2L, 8L, 8L), spec.getOutputType().getDenominations());
    }

    @Test
    public void customOutputs() {
        List<OutputData> data = OutputData.createRandomData(5, free, null, new Secp256k1BlindSignatureScheme());
        OutputType custom = OutputType.custom(data);
        List<OutputRequest> outputs = planner.plan(5, free, custom);
        assertEquals(data.size(), outputs.size());
        assertEquals(data.get(0), outputs.get(0));
        try {
            planner.plan(6, free, custom);
            fail();
        } catch (InvalidConfigurationException x) {
            assertTrue(x.getMessage().contains("does not match amount"));
        }
        try {
            planner.configureOutputs(5, free, custom, true, null);
            fail();
        } catch (InvalidConfigurationException x) {
            assertTrue(x.getMessage().contains("automatic fee inclusion"));
        }
    }

    @Test
    public void autoCountersReservedOncePerOutput() {
        counters.setNext(free.getId(), 10);
        List<OutputRequest> outputs = planner.plan(5, free, OutputType.deterministic(0));
        assertEquals(2, outputs.size());
        assertEquals(12, counters.reserve(free.getId(), 0).getStart());
        for (int i = 0; i < outputs.size(); i++) {
            byte[] expected = HEX.encode(SecretDerivation.deriveSecret(SEED, free.getId(), 10 + i))
                    .getBytes(StandardCharsets.UTF_8);
            assertArrayEquals(expected, outputs.get(i).getSecret());
            assertEquals(SecretDerivation.deriveBlindingFactor(SEED, free.getId(), 10 + i),
                    outputs.get(i).getBlindingFactor());
        }
    }

    @Test
    public void explicitCounterReservesNothing() {
        List<OutputRequest> outputs = planner.plan(1, free, OutputType.deterministic(5));
        assertEquals(0, counters.reserve(free.getId(), 0).getStart());
        assertEquals(SecretDerivation.deriveBlindingFactor(SEED, free.getId(), 5), outputs.get(0).getBlindingFactor());
    }

    @Test
    public void oneReservationCoversSeveralSpecs() {
        counters.setNext(free.getId(), 10);
        OutputSpec send = planner.configureOutputs(3, free, OutputType.deterministic(0), false, null);
        OutputSpec random = planner.configureOutputs(3, free, OutputType.random(), false, null);
        OutputSpec keep = planner.configureOutputs(7, free, OutputType.deterministic(0), false, null);

        OutputPlanner.AutoCounters auto = planner.reserveAutoCounters(free.getId(), send, random, keep);

        assertEquals(new OperationCounters(free.getId(), 10, 5), auto.getUsed());
        assertEquals(10, ((OutputType.Deterministic) auto.getSpecs().get(0).getOutputType()).getCounter());
        assertEquals(OutputType.Kind.RANDOM, auto.getSpecs().get(1).getOutputType().getKind());
        assertEquals(12, ((OutputType.Deterministic) auto.getSpecs().get(2).getOutputType()).getCounter());
        assertEquals(15, counters.reserve(free.getId(), 0).getStart());

        assertNull(planner.reserveAutoCounters(free.getId(), random).getUsed());
    }

    @Test
    public void concurrentPlansNeverShareSecrets() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(4);
        List<Future<List<OutputRequest>>> futures = new ArrayList<>();
        for (int i = 0; i < 16; i++)
            futures.add(executor.submit(() -> planner.plan(31, free, OutputType.deterministic(0))));
        Set<String> secrets = new HashSet<>();
        int count = 0;
        for (Future<List<OutputRequest>> future : futures) {
            for (OutputRequest output : future.get(30, TimeUnit.SECONDS)) {
                secrets.add(new String(output.getSecret(), StandardCharsets.UTF_8));
                count++;
            }
        }
        executor.shutdown();
        assertEquals(16 * 5, count);
        assertEquals(count, secrets.size());
        assertEquals(count, counters.reserve(free.getId(), 0).getStart());
    }

    @Test(expected = InvalidConfigurationException.class)
    public void deterministicWithoutSeed() {
        OutputPlanner noSeed = new OutputPlanner(feeModel, counters, null, new Secp256k1BlindSignatureScheme(), 3);
        noSeed.plan(4, free, OutputType.deterministic(1));
    }

    @Test
    public void lockedOutputs() {
        P2PKOptions options = P2PKOptions.lockTo(LOCK_KEY);
        options.locktime = 1700000000L;
        List<OutputRequest> outputs = planner.plan(3, free, OutputType.locked(options));
        assertEquals(2, outputs.size());
        JSONArray secret = new JSONArray(new String(outputs.get(0).getSecret(), StandardCharsets.UTF_8));
        assertEquals("P2PK", secret.getString(0));
        JSONObject body = secret.getJSONObject(1);
        assertEquals(LOCK_KEY, body.getString("data"));
        assertEquals(64, body.getString("nonce").length());
        JSONArray locktime = body.getJSONArray("tags").getJSONArray(0);
        assertEquals("locktime", locktime.getString(0));
        assertEquals("1700000000", locktime.getString(1));
    }

    @Test
    public void multisigAndRefundTags() {
        P2PKOptions options = P2PKOptions.lockTo(LOCK_KEY, "02" + repeat('b', 64), "02" + repeat('c', 64));
        options.requiredSignatures = 2;
        options.refundKeys = Collections.singletonList("03" + repeat('d', 64));
        JSONArray tags = new JSONArray(new String(planner.plan(1, free, OutputType.locked(options)).get(0).getSecret(),
                StandardCharsets.UTF_8)).getJSONObject(1).getJSONArray("tags");
        assertEquals("pubkeys", tags.getJSONArray(0).getString(0));
        assertEquals(3, tags.getJSONArray(0).length());
        assertEquals("n_sigs", tags.getJSONArray(1).getString(0));
        assertEquals("2", tags.getJSONArray(1).getString(1));
        assertEquals("refund", tags.getJSONArray(2).getString(0));
        assertEquals(3, tags.length());
    }

    @Test(expected = InvalidConfigurationException.class)
    public void reservedAdditionalTag() {
        P2PKOptions options = P2PKOptions.lockTo(LOCK_KEY);
        options.additionalTags = Collections.singletonList(Arrays.asList("locktime", "1"));
        planner.plan(1, free, OutputType.locked(options));
    }

    @Test(expected = InvalidConfigurationException.class)
    public void secretTooLong() {
        P2PKOptions options = P2PKOptions.lockTo(LOCK_KEY);
        options.additionalTags = Collections.singletonList(Arrays.asList("memo", repeat('x', 1100)));
        planner.plan(1, free, OutputType.locked(options));
    }

    @Test(expected = InvalidConfigurationException.class)
    public void lockNeedsAKey() {
        P2PKOptions.lockTo(Collections.<String>emptyList());
    }

    @Test
    public void factoryOutputs() {
        final List<Long> requested = new ArrayList<>();
        OutputDataFactory factory = (amount, keyset) -> {
            requested.add(amount);
            return OutputData.createSingleRandomData(amount, keyset.getId(), new Secp256k1BlindSignatureScheme());
        };
        List<OutputRequest> outputs = planner.plan(6, free, OutputType.factory(factory));
        assertEquals(Arrays.asList(4L, 2L), requested);
        assertEquals(2, outputs.size());
    }

    @Test
    public void blanks() {
        List<OutputRequest> outputs = planner.createOutputData(0, free,
                OutputType.random(Collections.nCopies(3, 0L)));
        assertEquals(Arrays.asList(0L, 0L, 0L), amounts(outputs));
    }

    @Test
    public void initialCountersAreHonoured() {
        EphemeralCounterSource seeded = new EphemeralCounterSource(ImmutableMap.of(free.getId(), 100L));
        OutputPlanner seededPlanner = new OutputPlanner(feeModel, seeded, SEED, new Secp256k1BlindSignatureScheme(), 3);
        List<OutputRequest> outputs = seededPlanner.plan(1, free, OutputType.deterministic(0));
        assertEquals(SecretDerivation.deriveBlindingFactor(SEED, free.getId(), 100), outputs.get(0).getBlindingFactor());
    }

    private static String repeat(char c, int n) {
        char[] chars = new char[n];
        Arrays.fill(chars, c);
        return new String(chars);
    }
}
