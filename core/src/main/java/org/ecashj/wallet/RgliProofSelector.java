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

import com.google.common.base.Stopwatch;
import com.google.common.collect.Sets;
import org.ecashj.core.FeeModel;
import org.ecashj.core.Proof;
import org.ecashj.core.SelectionTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * <p>Randomized greedy selection with local improvement (RGLI). Each trial fills a random subset up to the
 * target, then tries to swap each chosen proof for an unchosen one that brings the total closer to the target.
 * The best subset over all trials wins, where "best" means the smallest overpayment including input fees; a
 * slightly cheaper keyset breaks ties.</p>
 *
 * <p>Fee adjusted proof values are kept in parts per thousand ({@code amount * 1000 - feePpk}) so that
 * fractional fees survive sorting and searching. The fee actually charged for a subset is the sum of its fee
 * rates divided by 1000, rounded up.</p>
 *
 * <p>The search is bounded by a trial count and a wall clock budget shared across trials. An exact match that
 * runs out of time fails with {@link SelectionTimeoutException}; a close match returns the best subset found.</p>
 */
public class RgliProofSelector implements ProofSelector {
    private static final Logger log = LoggerFactory.getLogger(RgliProofSelector.class);

    private static final long NO_SOLUTION = Long.MAX_VALUE;
    private static final Comparator<Candidate> BY_VALUE = Comparator.comparingLong(c -> c.exFee);

    private final FeeModel feeModel;
    private final SelectionOptions options;

    private static class Candidate {
        final Proof proof;
        final long amount;
        final long feePpk;
        // value net of fees, times 1000
        final long exFee;

        Candidate(Proof proof, long feePpk, boolean includeFees) {
            this.proof = proof;
            this.amount = proof.getAmount();
            this.feePpk = feePpk;
            this.exFee = amount * 1000 - (includeFees ? feePpk : 0);
        }
    }

    public RgliProofSelector(FeeModel feeModel) {
        this(feeModel, SelectionOptions.defaults());
    }

    public RgliProofSelector(FeeModel feeModel, SelectionOptions options) {
        this.feeModel = checkNotNull(feeModel);
        this.options = checkNotNull(options);
    }

    @Override
    public SendResponse select(List<Proof> proofs, long target, boolean includeFees, boolean exactMatch) {
        Stopwatch watch = Stopwatch.createStarted(options.getTicker());
        Random random = options.getRandom();

        long totalAmount = 0;
        long totalFeePpk = 0;
        List<Candidate> spendable = new ArrayList<>(proofs.size());
        for (Proof proof : proofs) {
            Candidate candidate = new Candidate(proof, feeModel.getFeePpk(proof), includeFees);
            // a proof worth no more than its own fee is not worth spending
            if (includeFees && candidate.exFee <= 0)
                continue;
            spendable.add(candidate);
            totalAmount += candidate.amount;
            totalFeePpk += candidate.feePpk;
        }
        spendable.sort(BY_VALUE);

        // Drop proofs too large to ever be useful. An exact match can use nothing above the target; a close
        // match can use up to the smallest value that covers the target on its own.
        if (!spendable.isEmpty()) {
            int endIndex;
            if (exactMatch) {
                endIndex = binarySearch(spendable, target * 1000, true) + 1;
            } else {
                int biggerIndex = binarySearch(spendable, target * 1000, false);
                if (biggerIndex >= 0)
                    endIndex = binarySearch(spendable, spendable.get(biggerIndex).exFee, true) + 1;
                else
                    endIndex = spendable.size();
            }
            for (Candidate removed : spendable.subList(endIndex, spendable.size())) {
                totalAmount -= removed.amount;
                totalFeePpk -= removed.feePpk;
            }
            spendable = new ArrayList<>(spendable.subList(0, endIndex));
        }

        long totalNetSum = netSum(totalAmount, totalFeePpk, includeFees);
        if (target <= 0 || target > totalNetSum)
            return new SendResponse(proofs, Collections.emptyList());

        long maxOverAmount = Math.min(Math.min(
                target + (target * options.getMaxOverPercent() + 99) / 100,
                target + options.getMaxOverAmount()),
                totalNetSum);

        List<Candidate> bestSubset = null;
        long bestDelta = NO_SOLUTION;
        long bestAmount = 0;
        long bestFeePpk = 0;

        for (int trial = 0; trial < options.getMaxTrials(); trial++) {
            // Phase 1: randomized greedy fill
            List<Candidate> subset = new ArrayList<>();
            long amount = 0;
            long feePpk = 0;
            List<Candidate> shuffled = new ArrayList<>(spendable);
            Collections.shuffle(shuffled, random);
            for (Candidate candidate : shuffled) {
                long newAmount = amount + candidate.amount;
                long newFeePpk = feePpk + candidate.feePpk;
                long netSum = netSum(newAmount, newFeePpk, includeFees);
                if (exactMatch && netSum > target)
                    break;
                subset.add(candidate);
                amount = newAmount;
                feePpk = newFeePpk;
                if (netSum >= target)
                    break;
            }

            // Phase 2: for each chosen proof, look for an unchosen one that lands closer to the target
            Set<Candidate> chosen = Sets.newIdentityHashSet();
            chosen.addAll(subset);
            List<Candidate> others = new ArrayList<>(spendable.size());
            for (Candidate candidate : spendable) {
                if (!chosen.contains(candidate))
                    others.add(candidate);
            }
            List<Integer> order = new ArrayList<>(subset.size());
            for (int i = 0; i < subset.size(); i++)
                order.add(i);
            Collections.shuffle(order, random);
            if (order.size() > options.getMaxSwaps())
                order = order.subList(0, options.getMaxSwaps());
            for (int i : order) {
                long netSum = netSum(amount, feePpk, includeFees);
                if (isAcceptable(netSum, target, maxOverAmount, exactMatch))
                    break;
                Candidate p = subset.get(i);
                long tempAmount = amount - p.amount;
                long tempFeePpk = feePpk - p.feePpk;
                long missing = target - netSum(tempAmount, tempFeePpk, includeFees);
                // an exact match may only replace with something larger, and never past the target
                int qIndex = binarySearch(others, missing * 1000, exactMatch);
                if (qIndex < 0)
                    continue;
                Candidate q = others.get(qIndex);
                if ((!exactMatch || q.exFee > p.exFee) && (missing >= 0 || q.exFee <= p.exFee)) {
                    subset.set(i, q);
                    amount = tempAmount + q.amount;
                    feePpk = tempFeePpk + q.feePpk;
                    others.remove(qIndex);
                    insertSorted(others, p);
                }
            }

            long delta = delta(amount, feePpk, target, includeFees);
            if (delta < bestDelta) {
                log.debug("best selection found in trial #{}: amount {}, delta {}/1000", trial, amount, delta);
                bestSubset = new ArrayList<>(subset);
                bestSubset.sort(BY_VALUE.reversed());
                bestDelta = delta;
                bestAmount = amount;
                bestFeePpk = feePpk;

                // Phase 3: drop the smallest proofs while the rest still covers the target, so the new best
                // subset does not overpay in value or in fees
                List<Candidate> trimmed = new ArrayList<>(bestSubset);
                while (trimmed.size() > 1 && bestDelta > 0) {
                    Candidate p = trimmed.remove(trimmed.size() - 1);
                    long tempAmount = bestAmount - p.amount;
                    long tempFeePpk = bestFeePpk - p.feePpk;
                    long tempDelta = delta(tempAmount, tempFeePpk, target, includeFees);
                    if (tempDelta == NO_SOLUTION || tempDelta >= bestDelta)
                        break;
                    bestSubset = new ArrayList<>(trimmed);
                    bestDelta = tempDelta;
                    bestAmount = tempAmount;
                    bestFeePpk = tempFeePpk;
                }
            }

            if (bestSubset != null && bestDelta != NO_SOLUTION
                    && isAcceptable(netSum(bestAmount, bestFeePpk, includeFees), target, maxOverAmount, exactMatch))
                break;

            long elapsed = watch.elapsed(TimeUnit.MILLISECONDS);
            if (elapsed > options.getMaxTimeMillis()) {
                if (exactMatch)
                    throw new SelectionTimeoutException(elapsed);
                log.warn("Proof selection took too long. Returning best selection so far.");
                break;
            }
        }

        if (bestSubset == null || bestDelta == NO_SOLUTION)
            return new SendResponse(proofs, Collections.emptyList());

        List<Proof> send = new ArrayList<>(bestSubset.size());
        Set<Proof> sent = Sets.newIdentityHashSet();
        for (Candidate candidate : bestSubset) {
            send.add(candidate.proof);
            sent.add(candidate.proof);
        }
        List<Proof> keep = new ArrayList<>(proofs.size() - send.size());
        for (Proof proof : proofs) {
            if (!sent.contains(proof))
                keep.add(proof);
        }
        log.info("Proof selection took {}ms", watch.elapsed(TimeUnit.MILLISECONDS));
        return new SendResponse(keep, send);
    }

    private static boolean isAcceptable(long netSum, long target, long maxOverAmount, boolean exactMatch) {
        return netSum == target || (!exactMatch && netSum >= target && netSum <= maxOverAmount);
    }

    private static long netSum(long amount, long feePpk, boolean includeFees) {
        return amount - (includeFees ? FeeModel.feeFromPpk(feePpk) : 0);
    }

    /**
     * Overpayment of a subset in parts per thousand: its value plus its fee rate above the target. Subsets that
     * fall short of the target after fees have no delta.
     */
    private static long delta(long amount, long feePpk, long target, boolean includeFees) {
        if (netSum(amount, feePpk, includeFees) < target)
            return NO_SOLUTION;
        return (amount - target) * 1000 + feePpk;
    }

    /**
     * Binary search over candidates sorted by value. With {@code lessOrEqual} returns the rightmost index whose
     * value is at most {@code value}, otherwise the leftmost index whose value is at least {@code value}.
     * Returns -1 if there is none.
     */
    private static int binarySearch(List<Candidate> sorted, long value, boolean lessOrEqual) {
        int left = 0;
        int right = sorted.size() - 1;
        int result = -1;
        while (left <= right) {
            int mid = (left + right) >>> 1;
            long midValue = sorted.get(mid).exFee;
            if (lessOrEqual ? midValue <= value : midValue >= value) {
                result = mid;
                if (lessOrEqual)
                    left = mid + 1;
                else
                    right = mid - 1;
            } else {
                if (lessOrEqual)
                    right = mid - 1;
                else
                    left = mid + 1;
            }
        }
        return result;
    }

    private static void insertSorted(List<Candidate> sorted, Candidate candidate) {
        int left = 0;
        int right = sorted.size();
        while (left < right) {
            int mid = (left + right) >>> 1;
            if (sorted.get(mid).exFee < candidate.exFee)
                left = mid + 1;
            else
                right = mid;
        }
        sorted.add(left, candidate);
    }
}
