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

import com.google.common.collect.ImmutableList;
import org.ecashj.testing.TestKeysets;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertEquals;

public class AmountsTest {
    private static final Keyset KEYSET = TestKeysets.powersOfTwo("009a1f293253e41e", 0);

    private static List<Proof> proofs(long... amounts) {
        List<Proof> proofs = new ArrayList<>();
        for (int i = 0; i < amounts.length; i++)
            proofs.add(new Proof(KEYSET.getId(), amounts[i], "secret" + i, "c"));
        return proofs;
    }

    @Test
    public void splitGreedyLargestFirst() {
        assertEquals(Arrays.asList(8L, 4L, 1L), Amounts.splitAmount(13, KEYSET));
        assertEquals(Arrays.asList(4096L, 4096L, 2L), Amounts.splitAmount(8194, KEYSET));
        assertEquals(Collections.emptyList(), Amounts.splitAmount(0, KEYSET));
    }

    @Test
    public void splitUsesCustomSplitFirst() {
        assertEquals(Arrays.asList(1L, 1L, 2L, 1L), Amounts.splitAmount(5, KEYSET, Arrays.asList(1L, 1L)));
        assertEquals(Arrays.asList(1L, 1L, 1L, 2L),
                Amounts.splitAmount(5, KEYSET, Arrays.asList(1L, 1L), Amounts.SortOrder.ASCENDING));
        assertEquals(Arrays.asList(2L, 1L, 1L, 1L),
                Amounts.splitAmount(5, KEYSET, Arrays.asList(1L, 1L), Amounts.SortOrder.DESCENDING));
    }

    @Test
    public void zeroEntriesOnlyKeptForBlanks() {
        assertEquals(Arrays.asList(0L, 0L, 0L), Amounts.splitAmount(0, KEYSET, Arrays.asList(0L, 0L, 0L)));
        assertEquals(Arrays.asList(2L, 1L), Amounts.splitAmount(3, KEYSET, Arrays.asList(0L, 2L)));
    }

    @Test(expected = InvalidConfigurationException.class)
    public void splitLargerThanValue() {
        Amounts.splitAmount(3, KEYSET, Arrays.asList(2L, 2L));
    }

    @Test(expected = InvalidConfigurationException.class)
    public void splitWithUnsupportedAmount() {
        Amounts.splitAmount(6, KEYSET, Collections.singletonList(3L));
    }

    @Test(expected = InvalidConfigurationException.class)
    public void remainderNotRepresentable() {
        Keyset coarse = TestKeysets.withAmounts("00ffffffffffffff", "sat", 0, true, 2, 4);
        Amounts.splitAmount(5, coarse);
    }

    @Test
    public void keepAmountsTopUpToTarget() {
        List<Proof> have = proofs(1, 2, 4, 4, 4, 8);
        assertEquals(Arrays.asList(1L, 1L, 2L, 2L, 8L, 8L), Amounts.getKeepAmounts(have, 22, KEYSET, 3));
        assertEquals(Arrays.asList(1L, 1L, 1L, 1L, 2L, 2L, 2L, 4L, 8L), Amounts.getKeepAmounts(have, 22, KEYSET, 4));
    }

    @Test
    public void keepAmountsAlwaysAddUp() {
        List<Proof> have = proofs(1, 1, 1, 2, 2, 2, 4, 4, 4);
        for (long keep = 0; keep < 300; keep += 7)
            assertEquals(keep, Amounts.sum(Amounts.getKeepAmounts(have, keep, KEYSET, 3)));
    }

    @Test
    public void sums() {
        assertEquals(15, Amounts.sumProofs(proofs(1, 2, 4, 8)));
        assertEquals(ImmutableList.of(1L, 2L, 4L, 8L), Amounts.amountsOf(proofs(1, 2, 4, 8)));
        assertEquals(0, Amounts.sum(Collections.emptyList()));
    }
}
