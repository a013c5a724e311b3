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

package org.ecashj.core;

import com.google.common.collect.Lists;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Static helpers for splitting amounts into the denominations a keyset supports.
 */
public class Amounts {

    public enum SortOrder {
        ASCENDING,
        DESCENDING
    }

    private Amounts() {
    }

    public static List<Long> splitAmount(long value, Keyset keyset) {
        return splitAmount(value, keyset, null, null);
    }

    public static List<Long> splitAmount(long value, Keyset keyset, @Nullable List<Long> split) {
        return splitAmount(value, keyset, split, null);
    }

    /**
     * Splits {@code value} into amounts the keyset has keys for. A caller supplied {@code split} is used first and
     * the remainder is filled greedily, largest amount first. Zero entries in the split are only kept when
     * {@code value} is zero, which is how blank outputs are requested. The result is left in the order it was
     * built unless an order is given.
     *
     * @throws InvalidConfigurationException if the split exceeds the value, uses an amount the keyset does not
     * support, or the value cannot be represented
     */
    public static List<Long> splitAmount(long value, Keyset keyset, @Nullable List<Long> split,
                                         @Nullable SortOrder order) {
        if (value < 0)
            throw new InvalidConfigurationException("Cannot split a negative amount: " + value);
        List<Long> chunks = new ArrayList<>();
        if (split != null && !split.isEmpty()) {
            long splitSum = sum(split);
            if (splitSum > value)
                throw new InvalidConfigurationException("Split is greater than total amount: " + splitSum + " > " + value);
            for (long amount : split) {
                if (amount == 0) {
                    if (value == 0)
                        chunks.add(0L);
                    continue;
                }
                if (!keyset.hasAmount(amount))
                    throw new InvalidConfigurationException("Provided amount " + amount
                            + " does not match the amounts of keyset " + keyset.getId());
                chunks.add(amount);
            }
            value -= splitSum;
        }
        for (long amount : keyset.getAmounts().descendingSet()) {
            long count = value / amount;
            for (long i = 0; i < count; ++i)
                chunks.add(amount);
            value %= amount;
        }
        if (value != 0)
            throw new InvalidConfigurationException("Keyset " + keyset.getId() + " cannot represent remainder " + value);
        if (order == SortOrder.ASCENDING)
            Collections.sort(chunks);
        else if (order == SortOrder.DESCENDING)
            chunks.sort(Collections.reverseOrder());
        return chunks;
    }

    /**
     * Chooses denominations for {@code amountToKeep} so that the wallet ends up holding about {@code targetCount}
     * proofs of every amount. Amounts we already hold fewer than {@code targetCount} of are topped up first,
     * smallest first; whatever is left is split the default way. The result is sorted ascending.
     */
    public static List<Long> getKeepAmounts(Collection<Proof> proofsWeHave, long amountToKeep, Keyset keyset,
                                            int targetCount) {
        List<Long> amountsWeWant = new ArrayList<>();
        long wanted = 0;
        for (long amount : keyset.getAmounts()) {
            long countWeHave = proofsWeHave.stream().filter(p -> p.getAmount() == amount).count();
            long countWeWant = Math.max(targetCount - countWeHave, 0);
            for (long i = 0; i < countWeWant; ++i) {
                if (wanted + amount > amountToKeep)
                    break;
                amountsWeWant.add(amount);
                wanted += amount;
            }
        }
        long amountDiff = amountToKeep - wanted;
        if (amountDiff > 0)
            amountsWeWant.addAll(splitAmount(amountDiff, keyset));
        Collections.sort(amountsWeWant);
        return amountsWeWant;
    }

    public static long sum(Collection<Long> amounts) {
        long total = 0;
        for (long amount : amounts)
            total += amount;
        return total;
    }

    public static long sumProofs(Collection<Proof> proofs) {
        long total = 0;
        for (Proof proof : proofs)
            total += proof.getAmount();
        return total;
    }

    public static List<Long> amountsOf(Collection<Proof> proofs) {
        List<Long> amounts = Lists.newArrayListWithExpectedSize(proofs.size());
        for (Proof proof : proofs)
            amounts.add(proof.getAmount());
        return amounts;
    }
}
