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

import com.google.common.collect.ImmutableList;
import org.ecashj.core.Amounts;
import org.ecashj.core.FeeModel;
import org.ecashj.core.InvalidConfigurationException;
import org.ecashj.core.Keyset;
import org.ecashj.core.Proof;
import org.ecashj.crypto.BlindSignatureScheme;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static org.ecashj.wallet.EcashConstants.MAX_FEE_ITERATIONS;

/**
 * <p>Turns an amount and an {@link OutputType} into concrete outputs. Planning happens in three steps, which
 * the wallet runs separately so that one counter reservation can cover several sets of outputs:</p>
 *
 * <ol>
 *     <li>{@link #configureOutputs} fixes the denominations, and grows the amount by the receiver's future
 *     spending fee when asked to.</li>
 *     <li>{@link #reserveAutoCounters} reserves real counters for deterministic outputs that asked for
 *     automatic assignment with a counter of zero.</li>
 *     <li>{@link #createOutputData} creates the secrets and blinded messages.</li>
 * </ol>
 *
 * <p>{@link #plan(long, Keyset, OutputType)} runs all three for a single set of outputs.</p>
 */
public class OutputPlanner {
    private static final Logger log = LoggerFactory.getLogger(OutputPlanner.class);

    private final FeeModel feeModel;
    private final CounterSource counterSource;
    @Nullable private final byte[] seed;
    private final BlindSignatureScheme scheme;
    private final int denominationTarget;

    public OutputPlanner(FeeModel feeModel, CounterSource counterSource, @Nullable byte[] seed,
                         BlindSignatureScheme scheme, int denominationTarget) {
        checkArgument(denominationTarget > 0, "denominationTarget must be positive: %s", denominationTarget);
        this.feeModel = checkNotNull(feeModel);
        this.counterSource = checkNotNull(counterSource);
        this.seed = seed == null ? null : seed.clone();
        this.scheme = checkNotNull(scheme);
        this.denominationTarget = denominationTarget;
    }

    /** Outputs for {@code amount}, without fee augmentation. An amount of zero or less plans nothing. */
    public List<OutputRequest> plan(long amount, Keyset keyset, OutputType outputType) {
        return plan(amount, keyset, outputType, false);
    }

    /**
     * Outputs for {@code amount}. With {@code includeFees} the outputs are worth more than {@code amount}: the
     * extra pays the fee the receiver will be charged for spending them.
     */
    public List<OutputRequest> plan(long amount, Keyset keyset, OutputType outputType, boolean includeFees) {
        if (amount <= 0) {
            log.warn("Asked to plan outputs for a non-positive amount {}, planning none", amount);
            return ImmutableList.of();
        }
        OutputSpec spec = configureOutputs(amount, keyset, outputType, includeFees, null);
        spec = reserveAutoCounters(keyset.getId(), spec).getSpecs().get(0);
        return createOutputData(spec.getAmount(), keyset, spec.getOutputType());
    }

    /**
     * Fixes the denominations of a set of outputs.
     *
     * <p>Explicit denominations, or the amounts of custom outputs, must add up to {@code amount}. Without
     * explicit denominations the amount is split so that, together with {@code proofsWeHave}, the wallet holds
     * about the denomination target of each amount; with no such hint it is split the default way.</p>
     *
     * <p>With {@code includeFees}, denominations are appended to cover the fee the receiver pays to spend all
     * of the outputs. Those extra outputs raise the fee again, so the fee is raised one unit at a time until it
     * covers every output.</p>
     *
     * @throws InvalidConfigurationException if the denominations do not add up, if custom outputs are combined
     * with {@code includeFees}, or if the fee does not settle
     */
    public OutputSpec configureOutputs(long amount, Keyset keyset, OutputType outputType, boolean includeFees,
                                       @Nullable Collection<Proof> proofsWeHave) {
        if (outputType.getKind() == OutputType.Kind.CUSTOM) {
            if (includeFees)
                throw new InvalidConfigurationException("The custom OutputType does not support automatic fee inclusion");
            long customTotal = OutputData.sumOutputAmounts(((OutputType.Custom) outputType).getData());
            if (customTotal != amount)
                throw new InvalidConfigurationException("Custom output data total (" + customTotal
                        + ") does not match amount (" + amount + ")");
            return new OutputSpec(amount, outputType);
        }

        List<Long> denominations = new ArrayList<>();
        if (outputType.hasDenominations()) {
            checkDenominationSum(outputType.getDenominations(), amount);
            denominations.addAll(outputType.getDenominations());
        } else if (proofsWeHave != null && !proofsWeHave.isEmpty()) {
            denominations.addAll(Amounts.getKeepAmounts(proofsWeHave, amount, keyset, denominationTarget));
        }
        if (denominations.isEmpty())
            denominations.addAll(Amounts.splitAmount(amount, keyset));

        long newAmount = amount;
        if (includeFees) {
            long receiveFee = feeModel.getFeesForKeyset(denominations.size(), keyset.getId());
            List<Long> feeAmounts = Amounts.splitAmount(receiveFee, keyset);
            int iterations = 0;
            while (feeModel.getFeesForKeyset(denominations.size() + feeAmounts.size(), keyset.getId()) > receiveFee) {
                if (++iterations > MAX_FEE_ITERATIONS)
                    throw new InvalidConfigurationException("Receive fee for keyset " + keyset.getId()
                            + " did not settle after " + MAX_FEE_ITERATIONS + " iterations");
                receiveFee++;
                feeAmounts = Amounts.splitAmount(receiveFee, keyset);
            }
            newAmount += receiveFee;
            denominations.addAll(feeAmounts);
        }
        return new OutputSpec(newAmount, outputType.withDenominations(denominations));
    }

    /** How many counters a configured spec needs reserved: one per output if it asked for automatic assignment. */
    public static int countersNeeded(OutputSpec spec) {
        OutputType type = spec.getOutputType();
        if (type.getKind() != OutputType.Kind.DETERMINISTIC || !((OutputType.Deterministic) type).isAutoCounter())
            return 0;
        List<Long> denominations = type.getDenominations();
        return denominations == null ? 0 : denominations.size();
    }

    /** Specs with their counters assigned, and the reservation made for them, if any. */
    public static final class AutoCounters {
        private final ImmutableList<OutputSpec> specs;
        @Nullable private final OperationCounters used;

        AutoCounters(List<OutputSpec> specs, @Nullable OperationCounters used) {
            this.specs = ImmutableList.copyOf(specs);
            this.used = used;
        }

        public ImmutableList<OutputSpec> getSpecs() {
            return specs;
        }

        @Nullable
        public OperationCounters getUsed() {
            return used;
        }
    }

    /**
     * Makes one reservation covering every spec that needs counters and hands out consecutive blocks of it in
     * the order the specs are given. Specs that need none come back unchanged.
     */
    public AutoCounters reserveAutoCounters(String keysetId, OutputSpec... specs) {
        return reserveAutoCounters(keysetId, Arrays.asList(specs));
    }

    public AutoCounters reserveAutoCounters(String keysetId, List<OutputSpec> specs) {
        int total = 0;
        for (OutputSpec spec : specs)
            total += countersNeeded(spec);
        if (total == 0)
            return new AutoCounters(specs, null);

        CounterRange range = counterSource.reserve(keysetId, total);
        long cursor = range.getStart();
        List<OutputSpec> patched = new ArrayList<>(specs.size());
        for (OutputSpec spec : specs) {
            int need = countersNeeded(spec);
            if (need == 0) {
                patched.add(spec);
                continue;
            }
            patched.add(spec.withOutputType(((OutputType.Deterministic) spec.getOutputType()).withCounter(cursor)));
            cursor += need;
        }
        return new AutoCounters(patched, new OperationCounters(keysetId, range));
    }

    /**
     * Creates the outputs for a configured spec. An amount of zero is allowed and, with zero denominations,
     * creates blank outputs.
     *
     * @throws InvalidConfigurationException if the denominations do not add up to {@code amount}, or
     * deterministic outputs are requested without a seed
     */
    public List<OutputRequest> createOutputData(long amount, Keyset keyset, OutputType outputType) {
        if (amount < 0) {
            log.warn("Amount was negative: {}", amount);
            return ImmutableList.of();
        }
        if (outputType.getKind() != OutputType.Kind.CUSTOM && outputType.hasDenominations())
            checkDenominationSum(outputType.getDenominations(), amount);
        List<Long> denominations = outputType.getDenominations();
        switch (outputType.getKind()) {
            case RANDOM:
                return new ArrayList<>(OutputData.createRandomData(amount, keyset, denominations, scheme));
            case DETERMINISTIC:
                if (seed == null)
                    throw new InvalidConfigurationException("Deterministic outputs require a seed configured in the wallet");
                long counter = ((OutputType.Deterministic) outputType).getCounter();
                return new ArrayList<>(OutputData.createDeterministicData(amount, seed, counter, keyset,
                        denominations, scheme));
            case LOCKED:
                return new ArrayList<>(OutputData.createP2PKData(((OutputType.Locked) outputType).getOptions(),
                        amount, keyset, denominations, scheme));
            case FACTORY: {
                OutputDataFactory factory = ((OutputType.Factory) outputType).getFactory();
                List<OutputRequest> outputs = new ArrayList<>();
                for (long a : Amounts.splitAmount(amount, keyset, denominations))
                    outputs.add(factory.create(a, keyset));
                return outputs;
            }
            case CUSTOM: {
                List<OutputRequest> data = ((OutputType.Custom) outputType).getData();
                long customTotal = OutputData.sumOutputAmounts(data);
                if (customTotal != amount)
                    throw new InvalidConfigurationException("Custom output data total (" + customTotal
                            + ") does not match amount (" + amount + ")");
                return new ArrayList<>(data);
            }
            default:
                throw new InvalidConfigurationException("Invalid OutputType " + outputType.getKind());
        }
    }

    private static void checkDenominationSum(List<Long> denominations, long amount) {
        long splitSum = Amounts.sum(denominations);
        if (splitSum != amount)
            throw new InvalidConfigurationException("Custom denominations sum mismatch: " + splitSum
                    + " != " + amount);
    }
}
