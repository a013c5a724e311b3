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
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Sets;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.MoreExecutors;
import org.ecashj.core.Amounts;
import org.ecashj.core.CounterCapabilityUnsupportedException;
import org.ecashj.core.FeeModel;
import org.ecashj.core.InsufficientFundsException;
import org.ecashj.core.InvalidConfigurationException;
import org.ecashj.core.KeyChain;
import org.ecashj.core.Keyset;
import org.ecashj.core.MintProtocolException;
import org.ecashj.core.Proof;
import org.ecashj.core.SelectionTimeoutException;
import org.ecashj.core.Token;
import org.ecashj.crypto.BlindSignatureScheme;
import org.ecashj.mint.BlindedMessage;
import org.ecashj.mint.BlindedSignature;
import org.ecashj.mint.MeltPayload;
import org.ecashj.mint.MeltQuote;
import org.ecashj.mint.MeltResponse;
import org.ecashj.mint.MintConnection;
import org.ecashj.mint.MintPayload;
import org.ecashj.mint.RestoreResponse;
import org.ecashj.utils.ListenerRegistration;
import org.ecashj.utils.Threading;
import org.ecashj.wallet.listeners.ChangeOutputsCreatedListener;
import org.ecashj.wallet.listeners.CountersReservedListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * <p>An ecash wallet bound to one mint, one unit and one keyset. The wallet does not store proofs: every
 * operation takes the proofs it may spend and returns the proofs that result, and the caller keeps them.</p>
 *
 * <p>Operations that talk to the mint return a {@link ListenableFuture}. Anything wrong with the arguments,
 * including too few funds, is thrown from the call itself before the mint is contacted. A failing mint call
 * fails the returned future with the transport's exception. Counters reserved before such a failure stay
 * reserved; they are skipped, never reused.</p>
 *
 * <p>Several operations may be in flight at once. The only state they share is the {@link CounterSource}, which
 * serializes reservations per keyset.</p>
 */
public class Wallet {
    private static final Logger log = LoggerFactory.getLogger(Wallet.class);

    private final MintConnection mint;
    private final KeyChain keyChain;
    private final WalletOptions options;
    private final String keysetId;
    @Nullable private final byte[] seed;
    private final CounterSource counterSource;
    private final FeeModel feeModel;
    private final ProofSelector selector;
    private final OutputPlanner planner;
    private final TransactionAssembler assembler = new TransactionAssembler();
    private final BlindSignatureScheme scheme;

    private final CopyOnWriteArrayList<ListenerRegistration<CountersReservedListener>> countersReservedListeners
            = new CopyOnWriteArrayList<>();
    private final CopyOnWriteArrayList<ListenerRegistration<ChangeOutputsCreatedListener>> changeOutputsCreatedListeners
            = new CopyOnWriteArrayList<>();

    public Wallet(MintConnection mint, KeyChain keyChain) {
        this(mint, keyChain, new WalletOptions());
    }

    public Wallet(MintConnection mint, KeyChain keyChain, WalletOptions options) {
        this.mint = checkNotNull(mint);
        this.keyChain = checkNotNull(keyChain);
        this.options = new WalletOptions(options);
        if (!keyChain.getUnit().equals(options.getUnit()))
            throw new InvalidConfigurationException("Key chain unit " + keyChain.getUnit()
                    + " does not match wallet unit " + options.getUnit());
        this.keysetId = options.getKeysetId() != null
                ? keyChain.getKeyset(options.getKeysetId()).getId()
                : keyChain.getCheapestKeyset().getId();
        this.seed = options.getSeed();
        if (options.getCounterSource() != null) {
            this.counterSource = options.getCounterSource();
        } else if (options.getInitialCounter() != null) {
            this.counterSource = new EphemeralCounterSource(ImmutableMap.of(keysetId, options.getInitialCounter()));
        } else {
            this.counterSource = new EphemeralCounterSource();
        }
        this.scheme = options.getBlindSignatureScheme();
        this.feeModel = new FeeModel(keyChain);
        this.selector = new RgliProofSelector(feeModel, options.getSelectionOptions());
        this.planner = new OutputPlanner(feeModel, counterSource, seed, scheme, options.getDenominationTarget());
    }

    /**
     * Returns a wallet for another keyset of the same mint. It shares this wallet's mint connection, key chain,
     * seed, options and counter source. Listeners are not carried over.
     */
    public Wallet withKeyset(String id) {
        return withKeyset(id, counterSource);
    }

    public Wallet withKeyset(String id, CounterSource counterSource) {
        WalletOptions copy = new WalletOptions(options).setKeysetId(id).setCounterSource(counterSource);
        return new Wallet(mint, keyChain, copy);
    }

    public MintConnection getMint() {
        return mint;
    }

    public KeyChain getKeyChain() {
        return keyChain;
    }

    public String getUnit() {
        return keyChain.getUnit();
    }

    /** The keyset new outputs are created in unless an operation names another. */
    public String getKeysetId() {
        return keysetId;
    }

    public WalletCounters getCounters() {
        return new WalletCounters(counterSource);
    }

    public OutputPlanner getOutputPlanner() {
        return planner;
    }

    /**
     * The output type used when an operation does not name one: random for the {@code RANDOM} policy,
     * automatically counted deterministic outputs for {@code DETERMINISTIC}, and for {@code AUTO} whichever of
     * the two the presence of a seed allows.
     *
     * @throws InvalidConfigurationException if the policy is deterministic and the wallet has no seed
     */
    public OutputType defaultOutputType() {
        switch (options.getSecretsPolicy()) {
            case RANDOM:
                return OutputType.random();
            case DETERMINISTIC:
                if (seed == null)
                    throw new InvalidConfigurationException("Deterministic policy requires a seed");
                return OutputType.deterministic(0);
            default:
                return seed != null ? OutputType.deterministic(0) : OutputType.random();
        }
    }

    // --- fees and selection ---

    /** Fee the mint charges to spend {@code proofs} together. */
    public long getFeesForProofs(List<Proof> proofs) {
        return feeModel.getFeesForProofs(proofs);
    }

    /** Fee for spending {@code inputs} proofs of one keyset. */
    public long getFeesForKeyset(int inputs, String keysetId) {
        return feeModel.getFeesForKeyset(inputs, keysetId);
    }

    /**
     * Picks proofs worth {@code amount}, after their own input fees when {@code includeFees} is set. Never
     * contacts the mint. Without a solution every proof is returned in {@code keep}.
     *
     * @throws SelectionTimeoutException if {@code exactMatch} is set and no match was found in time
     */
    public SendResponse selectProofsToSend(List<Proof> proofs, long amount, boolean includeFees, boolean exactMatch) {
        return selector.select(proofs, amount, includeFees, exactMatch);
    }

    // --- send ---

    /**
     * Picks proofs to hand over directly, without a swap. With the default exact match the selection must be
     * worth exactly {@code amount}; if no subset is, {@code send} comes back empty. DLEQ proofs are removed from
     * the sent proofs unless {@link SendOfflineConfig#requireDleq} is set.
     *
     * @throws InsufficientFundsException if the proofs are worth less than {@code amount}
     * @throws SelectionTimeoutException if an exact match could not be found in time
     */
    public SendResponse sendOffline(long amount, List<Proof> proofs, SendOfflineConfig config)
            throws InsufficientFundsException {
        List<Proof> candidates = proofs;
        if (config.requireDleq) {
            candidates = new ArrayList<>();
            for (Proof proof : proofs) {
                if (hasValidDleq(proof))
                    candidates.add(proof);
            }
        }
        long available = Amounts.sumProofs(candidates);
        if (available < amount)
            throw new InsufficientFundsException(amount - available, "Not enough funds available to send");

        SendResponse selection = selector.select(candidates, amount, config.includeFees, config.exactMatch);
        Set<Proof> selected = Sets.newIdentityHashSet();
        selected.addAll(selection.getSend());
        List<Proof> keep = new ArrayList<>(proofs.size());
        for (Proof proof : proofs) {
            if (!selected.contains(proof))
                keep.add(proof);
        }
        List<Proof> send = new ArrayList<>(selection.getSend().size());
        for (Proof proof : selection.getSend())
            send.add(config.requireDleq ? proof : proof.withoutDleq());
        return new SendResponse(keep, send);
    }

    public ListenableFuture<SendResponse> send(long amount, List<Proof> proofs) throws InsufficientFundsException {
        return send(amount, proofs, SendConfig.defaults(), new OutputConfig());
    }

    public ListenableFuture<SendResponse> send(long amount, List<Proof> proofs, SendConfig config)
            throws InsufficientFundsException {
        return send(amount, proofs, config, new OutputConfig());
    }

    /**
     * <p>Splits {@code proofs} into proofs worth {@code amount} to hand over and proofs to keep.</p>
     *
     * <p>If plain random outputs in the wallet's own keyset would do, the wallet first looks for proofs that
     * already add up to the amount exactly and hands those over without contacting the mint. Otherwise it swaps:
     * it selects proofs covering the send outputs plus the swap fee, and has the mint sign new send outputs and
     * change outputs. Proofs that were not needed are returned in {@code keep} after the change.</p>
     *
     * @throws InsufficientFundsException if the proofs cannot cover the amount and the fees
     * @throws InvalidConfigurationException if the output types are inconsistent with the amount
     */
    public ListenableFuture<SendResponse> send(long amount, List<Proof> proofs, SendConfig config,
                                               OutputConfig outputConfig) throws InsufficientFundsException {
        OutputType sendType = outputConfig.send != null ? outputConfig.send : defaultOutputType();
        OutputType keepType = outputConfig.keep != null ? outputConfig.keep : defaultOutputType();

        SendResponse offline = tryExactOfflineSend(amount, proofs, config, outputConfig);
        if (offline != null)
            return Futures.immediateFuture(offline);

        Keyset keyset = getKeyset(config.keysetId);
        OutputSpec sendSpec = planner.configureOutputs(amount, keyset, sendType, config.includeFees, null);

        // selected proofs must also pay for the swap itself
        SendResponse selection = selector.select(proofs, sendSpec.getAmount(), true, false);
        List<Proof> selectedProofs = selection.getSend();
        List<Proof> unselectedProofs = selection.getKeep();
        if (selectedProofs.isEmpty()) {
            long missing = sendSpec.getAmount() + feeModel.getFeesForProofs(proofs) - Amounts.sumProofs(proofs);
            throw new InsufficientFundsException(Math.max(missing, 0), "Not enough funds available to send");
        }

        long selectedSum = Amounts.sumProofs(selectedProofs);
        long swapFee = feeModel.getFeesForProofs(selectedProofs);
        long changeAmount = selectedSum - swapFee - sendSpec.getAmount();
        if (changeAmount < 0)
            throw new InsufficientFundsException(-changeAmount, "Not enough funds available for swap");

        // we receive the change ourselves, so no fee is added to it
        OutputSpec keepSpec = planner.configureOutputs(changeAmount, keyset, keepType, false, unselectedProofs);

        OutputPlanner.AutoCounters autoCounters = planner.reserveAutoCounters(keyset.getId(), sendSpec, keepSpec);
        sendSpec = autoCounters.getSpecs().get(0);
        keepSpec = autoCounters.getSpecs().get(1);
        notifyCountersReserved(autoCounters.getUsed(), config.countersReservedListener);
        log.debug("send counters {}, send {}, keep {}", autoCounters.getUsed(), sendSpec, keepSpec);

        List<OutputRequest> sendOutputs = planner.createOutputData(sendSpec.getAmount(), keyset, sendSpec.getOutputType());
        List<OutputRequest> keepOutputs = planner.createOutputData(keepSpec.getAmount(), keyset, keepSpec.getOutputType());
        SwapTransaction transaction = assembler.assemble(selectedProofs, keepOutputs, sendOutputs);

        return Futures.transform(mint.swap(transaction.getPayload()), signatures -> {
            SendResponse swapped = assembler.reconstruct(transaction, signatures, keyset);
            List<Proof> keep = new ArrayList<>(swapped.getKeep());
            keep.addAll(unselectedProofs);
            log.debug("SEND COMPLETED: unselected {}, keep {}, send {}", Amounts.amountsOf(unselectedProofs),
                    Amounts.amountsOf(swapped.getKeep()), Amounts.amountsOf(swapped.getSend()));
            return new SendResponse(keep, swapped.getSend());
        }, MoreExecutors.directExecutor());
    }

    /** The no-swap path of {@link #send}, or null if a swap is needed. */
    @Nullable
    private SendResponse tryExactOfflineSend(long amount, List<Proof> proofs, SendConfig config,
                                             OutputConfig outputConfig) {
        List<String> reasons = new ArrayList<>();
        if (config.keysetId != null)
            reasons.add("keysetId override");
        if (defaultOutputType().getKind() == OutputType.Kind.DETERMINISTIC)
            reasons.add("wallet default is deterministic");
        if (outputConfig.send != null && !outputConfig.send.isPlainRandom())
            reasons.add("non-default send output type");
        if (outputConfig.keep != null && !outputConfig.keep.isPlainRandom())
            reasons.add("non-default keep output type");
        if (!reasons.isEmpty()) {
            log.debug("Options require a swap: {}", reasons);
            return null;
        }

        SendOfflineConfig offlineConfig = new SendOfflineConfig();
        offlineConfig.includeFees = config.includeFees;
        offlineConfig.exactMatch = true;
        try {
            SendResponse offline = sendOffline(amount, proofs, offlineConfig);
            long expectedFee = config.includeFees ? feeModel.getFeesForProofs(offline.getSend()) : 0;
            if (!offline.getSend().isEmpty() && Amounts.sumProofs(offline.getSend()) == amount + expectedFee) {
                log.info("Successful exactMatch offline selection!");
                return offline;
            }
        } catch (InsufficientFundsException | SelectionTimeoutException x) {
            log.debug("ExactMatch offline selection failed: {}", x.getMessage());
        }
        return null;
    }

    /** True when the proof carries a DLEQ proof that verifies against the key of its own keyset and amount. */
    private boolean hasValidDleq(Proof proof) {
        if (!proof.hasDleq())
            return false;
        Keyset keyset = keyChain.getKeyset(proof.getKeysetId());
        return scheme.verifyDleq(proof, keyset.getKey(proof.getAmount()));
    }

    // --- receive ---

    public ListenableFuture<List<Proof>> receive(Token token) {
        return receive(token, ReceiveConfig.defaults(), null);
    }

    /**
     * Swaps the proofs of a token for fresh proofs only this wallet knows. The new proofs are worth the token's
     * value minus the mint's input fee.
     *
     * @throws InvalidConfigurationException if the token is from another mint or in another unit, lacks
     * required DLEQ proofs, or is worth no more than its fee
     */
    public ListenableFuture<List<Proof>> receive(Token token, ReceiveConfig config, @Nullable OutputType outputType) {
        OutputType type = outputType != null ? outputType : defaultOutputType();
        String tokenMint = sanitizeUrl(token.getMintUrl());
        if (!tokenMint.equals(sanitizeUrl(mint.getMintUrl())))
            throw new InvalidConfigurationException("Token belongs to a different mint: " + tokenMint);
        if (!token.getUnit().equals(getUnit()))
            throw new InvalidConfigurationException("Token is not in wallet unit: " + token.getUnit());

        List<Proof> proofs = token.getProofs();
        long totalAmount = Amounts.sumProofs(proofs);
        if (totalAmount == 0)
            return Futures.immediateFuture(ImmutableList.of());

        Keyset keyset = getKeyset(config.keysetId);
        if (config.requireDleq) {
            for (Proof proof : proofs) {
                if (!hasValidDleq(proof))
                    throw new InvalidConfigurationException("Token contains proofs with invalid or missing DLEQ");
            }
        }

        long netAmount = totalAmount - feeModel.getFeesForProofs(proofs);
        if (netAmount <= 0)
            throw new InvalidConfigurationException("Token amount " + totalAmount + " does not cover its fees");
        OutputSpec spec = planner.configureOutputs(netAmount, keyset, type, false, config.proofsWeHave);
        OutputPlanner.AutoCounters autoCounters = planner.reserveAutoCounters(keyset.getId(), spec);
        spec = autoCounters.getSpecs().get(0);
        notifyCountersReserved(autoCounters.getUsed(), config.countersReservedListener);
        log.debug("receive counters {}, receive {}", autoCounters.getUsed(), spec);

        List<OutputRequest> outputs = planner.createOutputData(spec.getAmount(), keyset, spec.getOutputType());
        SwapTransaction transaction = assembler.assemble(proofs, outputs, ImmutableList.of());
        return Futures.transform(mint.swap(transaction.getPayload()), signatures -> {
            List<Proof> received = assembler.reconstruct(transaction, signatures, keyset).getKeep();
            log.debug("RECEIVE COMPLETED: {}", Amounts.amountsOf(received));
            return received;
        }, MoreExecutors.directExecutor());
    }

    // --- mint ---

    public ListenableFuture<List<Proof>> mintProofs(long amount, String quote) {
        return mintProofs(amount, quote, MintProofsConfig.defaults(), null);
    }

    /**
     * Has the mint sign new proofs worth {@code amount} against a paid quote.
     *
     * @throws InvalidConfigurationException if {@code amount} is not positive
     */
    public ListenableFuture<List<Proof>> mintProofs(long amount, String quote, MintProofsConfig config,
                                                    @Nullable OutputType outputType) {
        OutputType type = outputType != null ? outputType : defaultOutputType();
        if (amount <= 0)
            throw new InvalidConfigurationException("Invalid mint amount: must be positive: " + amount);

        Keyset keyset = getKeyset(config.keysetId);
        OutputSpec spec = planner.configureOutputs(amount, keyset, type, false, config.proofsWeHave);
        OutputPlanner.AutoCounters autoCounters = planner.reserveAutoCounters(keyset.getId(), spec);
        spec = autoCounters.getSpecs().get(0);
        notifyCountersReserved(autoCounters.getUsed(), config.countersReservedListener);
        log.debug("mint counters {}, mint {}", autoCounters.getUsed(), spec);

        List<OutputRequest> outputs = planner.createOutputData(spec.getAmount(), keyset, spec.getOutputType());
        MintPayload payload = new MintPayload(quote, blindedMessages(outputs));
        return Futures.transform(mint.mint(payload), signatures -> {
            if (signatures.size() != outputs.size())
                throw new MintProtocolException("Mint returned " + signatures.size() + " signatures, expected "
                        + outputs.size());
            List<Proof> proofs = new ArrayList<>(outputs.size());
            for (int i = 0; i < outputs.size(); i++)
                proofs.add(outputs.get(i).toProof(signatures.get(i), keyset));
            log.debug("MINT COMPLETED: {}", Amounts.amountsOf(proofs));
            return proofs;
        }, MoreExecutors.directExecutor());
    }

    // --- melt ---

    public ListenableFuture<MeltProofsResponse> meltProofs(MeltQuote quote, List<Proof> proofs) {
        return meltProofs(quote, proofs, MeltProofsConfig.defaults(), null);
    }

    /**
     * <p>Spends {@code proofs} to pay a melt quote. Whatever the proofs are worth beyond the quote amount is a
     * fee reserve; the mint returns the unused part of it as change by signing blank outputs. The wallet sends
     * {@code max(1, ceil(log2(feeReserve)))} blanks, enough to represent any change up to the reserve.</p>
     *
     * <p>The blanks are published to {@link ChangeOutputsCreatedListener}s before the melt is sent, so that a
     * melt left pending can be finished later with {@link #completeMelt}.</p>
     *
     * @throws InvalidConfigurationException if {@code outputType} is custom, since blanks carry no amount
     */
    public ListenableFuture<MeltProofsResponse> meltProofs(MeltQuote quote, List<Proof> proofs,
                                                           MeltProofsConfig config, @Nullable OutputType outputType) {
        OutputType type = outputType != null ? outputType : defaultOutputType();
        Keyset keyset = getKeyset(config.keysetId);
        long feeReserve = Amounts.sumProofs(proofs) - quote.getAmount();
        List<OutputRequest> outputData = ImmutableList.of();

        if (feeReserve > 0) {
            if (type.getKind() == OutputType.Kind.CUSTOM)
                throw new InvalidConfigurationException("Custom OutputType not supported for melt change (must be 0-sat blanks)");
            int count = blankCount(feeReserve);
            List<Long> denominations = Collections.nCopies(count, 0L);
            log.debug("Creating {} blanks for fee reserve {}", count, feeReserve);
            OutputSpec spec = new OutputSpec(0, type.withDenominations(denominations));
            OutputPlanner.AutoCounters autoCounters = planner.reserveAutoCounters(keyset.getId(), spec);
            spec = autoCounters.getSpecs().get(0);
            notifyCountersReserved(autoCounters.getUsed(), config.countersReservedListener);
            log.debug("melt counters {}, melt {}", autoCounters.getUsed(), spec);
            outputData = planner.createOutputData(0, keyset, spec.getOutputType());
        }

        List<Proof> inputs = new ArrayList<>(proofs.size());
        for (Proof proof : proofs)
            inputs.add(proof.withoutDleq());
        MeltPayload payload = new MeltPayload(quote.getQuote(), inputs, blindedMessages(outputData));
        MeltBlanks blanks = new MeltBlanks(payload, outputData, keyset, quote);
        notifyChangeOutputsCreated(blanks, config.changeOutputsCreatedListener);
        return Futures.transform(mint.melt(payload), response -> toMeltResponse(blanks, response),
                MoreExecutors.directExecutor());
    }

    /** Resends a melt that was left pending and unblinds whatever change the mint returns now. */
    public ListenableFuture<MeltProofsResponse> completeMelt(MeltBlanks blanks) {
        return Futures.transform(mint.melt(blanks.getPayload()), response -> toMeltResponse(blanks, response),
                MoreExecutors.directExecutor());
    }

    /** Enough blanks to hold any amount up to {@code feeReserve} in powers of two, and at least one. */
    static int blankCount(long feeReserve) {
        checkArgument(feeReserve > 0, "feeReserve must be positive: %s", feeReserve);
        int ceilLog2 = 64 - Long.numberOfLeadingZeros(feeReserve - 1);
        return Math.max(1, ceilLog2);
    }

    private MeltProofsResponse toMeltResponse(MeltBlanks blanks, MeltResponse response) {
        List<BlindedSignature> signatures = response.getChange();
        List<OutputRequest> outputData = blanks.getOutputData();
        if (signatures.size() > outputData.size())
            throw new MintProtocolException("Mint returned " + signatures.size() + " signatures, but only "
                    + outputData.size() + " blanks were provided");
        // the mint may sign fewer blanks than we sent
        List<Proof> change = new ArrayList<>(signatures.size());
        for (int i = 0; i < signatures.size(); i++)
            change.add(outputData.get(i).toProof(signatures.get(i), blanks.getKeyset()));
        log.debug("MELT COMPLETED: change {}", Amounts.amountsOf(change));
        return new MeltProofsResponse(blanks.getQuote().withState(response.getState()), change);
    }

    // --- restore ---

    /**
     * Regenerates the deterministic blanks for counters {@code start} to {@code start + count - 1} and asks the
     * mint which of them it has signed. Restored proofs take the amount the mint signed.
     *
     * @throws InvalidConfigurationException if the wallet has no seed
     */
    public ListenableFuture<RestoreResult> restore(long start, int count, @Nullable String keysetId) {
        checkArgument(start >= 0, "start must not be negative: %s", start);
        checkArgument(count >= 0, "count must not be negative: %s", count);
        if (seed == null)
            throw new InvalidConfigurationException("Wallet must be initialized with a seed to use restore");
        Keyset keyset = getKeyset(keysetId);
        List<OutputData> outputData = OutputData.createDeterministicData(0, seed, start, keyset,
                Collections.nCopies(count, 0L), scheme);

        return Futures.transform(mint.restore(blindedMessages(outputData)), response -> {
            Map<String, BlindedSignature> signatureByOutput = signaturesByOutput(response);
            List<Proof> restored = new ArrayList<>();
            Long lastCounterWithSignature = null;
            for (int i = 0; i < outputData.size(); i++) {
                BlindedSignature signature = signatureByOutput.get(outputData.get(i).getBlindedMessage().getB_());
                if (signature == null)
                    continue;
                lastCounterWithSignature = start + i;
                restored.add(outputData.get(i).toProof(signature, keyset));
            }
            return new RestoreResult(restored, lastCounterWithSignature);
        }, MoreExecutors.directExecutor());
    }

    public ListenableFuture<RestoreResult> batchRestore() {
        return batchRestore(EcashConstants.DEFAULT_RESTORE_GAP_LIMIT, EcashConstants.DEFAULT_RESTORE_BATCH_SIZE, 0,
                null);
    }

    /**
     * Restores batch after batch, starting at {@code counter}, until {@code ceil(gapLimit / batchSize)}
     * consecutive batches come back empty. Afterwards the counter source is advanced past the last counter that
     * had a signature, so restored counters are not handed out again.
     */
    public ListenableFuture<RestoreResult> batchRestore(int gapLimit, int batchSize, long counter,
                                                        @Nullable String keysetId) {
        checkArgument(gapLimit > 0, "gapLimit must be positive: %s", gapLimit);
        checkArgument(batchSize > 0, "batchSize must be positive: %s", batchSize);
        String id = getKeyset(keysetId).getId();
        int requiredEmptyBatches = (gapLimit + batchSize - 1) / batchSize;
        ListenableFuture<RestoreResult> restored = restoreBatches(id, batchSize, counter, requiredEmptyBatches, 0,
                ImmutableList.of(), null);
        return Futures.transform(restored, result -> {
            if (result.getLastCounterWithSignature() != null) {
                long next = result.getLastCounterWithSignature() + 1;
                try {
                    counterSource.advanceToAtLeast(id, next);
                } catch (CounterCapabilityUnsupportedException x) {
                    log.warn("Could not advance counter for keyset {} to {}", id, next, x);
                }
            }
            return result;
        }, MoreExecutors.directExecutor());
    }

    private ListenableFuture<RestoreResult> restoreBatches(String keysetId, int batchSize, long counter,
                                                           int requiredEmptyBatches, int emptyBatchesFound,
                                                           List<Proof> restored, @Nullable Long lastCounter) {
        if (emptyBatchesFound >= requiredEmptyBatches)
            return Futures.immediateFuture(new RestoreResult(restored, lastCounter));
        return Futures.transformAsync(restore(counter, batchSize, keysetId), batch -> {
            if (batch.getProofs().isEmpty())
                return restoreBatches(keysetId, batchSize, counter + batchSize, requiredEmptyBatches,
                        emptyBatchesFound + 1, restored, lastCounter);
            List<Proof> all = new ArrayList<>(restored);
            all.addAll(batch.getProofs());
            log.debug("restored {} proofs from counters {}..{}", batch.getProofs().size(), counter,
                    counter + batchSize - 1);
            return restoreBatches(keysetId, batchSize, counter + batchSize, requiredEmptyBatches, 0, all,
                    batch.getLastCounterWithSignature());
        }, MoreExecutors.directExecutor());
    }

    // --- listeners ---

    /** Adds a listener for counter reservations. Runs on the given executor. */
    public void addCountersReservedListener(Executor executor, CountersReservedListener listener) {
        countersReservedListeners.add(new ListenerRegistration<>(listener, executor));
    }

    public void addCountersReservedListener(CountersReservedListener listener) {
        addCountersReservedListener(Threading.SAME_THREAD, listener);
    }

    public boolean removeCountersReservedListener(CountersReservedListener listener) {
        return ListenerRegistration.removeFromList(listener, countersReservedListeners);
    }

    public void addChangeOutputsCreatedListener(Executor executor, ChangeOutputsCreatedListener listener) {
        changeOutputsCreatedListeners.add(new ListenerRegistration<>(listener, executor));
    }

    public void addChangeOutputsCreatedListener(ChangeOutputsCreatedListener listener) {
        addChangeOutputsCreatedListener(Threading.SAME_THREAD, listener);
    }

    public boolean removeChangeOutputsCreatedListener(ChangeOutputsCreatedListener listener) {
        return ListenerRegistration.removeFromList(listener, changeOutputsCreatedListeners);
    }

    private void notifyCountersReserved(@Nullable OperationCounters counters,
                                        @Nullable CountersReservedListener callListener) {
        if (counters == null)
            return;
        if (callListener != null)
            Threading.notifyListener(Threading.SAME_THREAD, "CountersReserved",
                    () -> callListener.onCountersReserved(counters));
        for (ListenerRegistration<CountersReservedListener> registration : countersReservedListeners)
            Threading.notifyListener(registration.executor, "CountersReserved",
                    () -> registration.listener.onCountersReserved(counters));
    }

    private void notifyChangeOutputsCreated(MeltBlanks blanks, @Nullable ChangeOutputsCreatedListener callListener) {
        if (callListener != null)
            Threading.notifyListener(Threading.SAME_THREAD, "ChangeOutputsCreated",
                    () -> callListener.onChangeOutputsCreated(blanks));
        for (ListenerRegistration<ChangeOutputsCreatedListener> registration : changeOutputsCreatedListeners)
            Threading.notifyListener(registration.executor, "ChangeOutputsCreated",
                    () -> registration.listener.onChangeOutputsCreated(blanks));
    }

    // --- helpers ---

    private Keyset getKeyset(@Nullable String id) {
        return keyChain.getKeyset(id != null ? id : keysetId);
    }

    private static List<BlindedMessage> blindedMessages(List<? extends OutputRequest> outputs) {
        List<BlindedMessage> messages = new ArrayList<>(outputs.size());
        for (OutputRequest output : outputs)
            messages.add(output.getBlindedMessage());
        return messages;
    }

    private static Map<String, BlindedSignature> signaturesByOutput(RestoreResponse response) {
        Map<String, BlindedSignature> map = new HashMap<>();
        for (int i = 0; i < response.getOutputs().size(); i++)
            map.put(response.getOutputs().get(i).getB_(), response.getSignatures().get(i));
        return map;
    }

    private static String sanitizeUrl(String url) {
        String sanitized = url.trim();
        while (sanitized.endsWith("/"))
            sanitized = sanitized.substring(0, sanitized.length() - 1);
        return sanitized;
    }
}
