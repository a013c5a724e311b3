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

import org.ecashj.core.Amounts;
import org.ecashj.core.FeeModel;
import org.ecashj.core.Proof;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Random;

import static org.junit.Assert.assertEquals;

@RunWith(Parameterized.class)
public class RgliExactMatchTest {
    private static final long[] MIXED = {1, 1, 1, 2, 2, 4, 4, 8, 8, 16, 32};
    private static final long[] DENOMINATED = {1, 1, 1, 2, 2, 2, 4, 4, 4, 8, 8, 8, 16, 16, 16, 32, 32, 32, 64, 64, 64};

    private final String wallet;
    private final long[] amounts;
    private final String keysetId;
    private final long target;

    public RgliExactMatchTest(String wallet, long[] amounts, String keysetId, long target) {
        this.wallet = wallet;
        this.amounts = amounts;
        this.keysetId = keysetId;
        this.target = target;
    }

    @Parameterized.Parameters(name = "{0} -> {3}")
    public static Collection<Object[]> data() {
        List<Object[]> data = new ArrayList<>();
        for (long target = 1; target <= Amounts.sum(asList(MIXED)); target += 3)
            data.add(new Object[] {"mixed", MIXED, RgliProofSelectorTest.FREE, target});
        for (long target = 1; target <= 350; target += 7)
            data.add(new Object[] {"denominated", DENOMINATED, RgliProofSelectorTest.FREE, target});
        for (long target = 1; target < 70; target += 4)
            data.add(new Object[] {"mixed with fees", MIXED, RgliProofSelectorTest.CHEAP, target});
        return data;
    }

    private static List<Long> asList(long[] amounts) {
        List<Long> list = new ArrayList<>();
        for (long amount : amounts)
            list.add(amount);
        return list;
    }

    @Test
    public void findsExactMatch() {
        FeeModel feeModel = RgliProofSelectorTest.newFeeModel();
        List<Proof> proofs = new ArrayList<>();
        for (int i = 0; i < amounts.length; i++)
            proofs.add(new Proof(keysetId, amounts[i], wallet + i, "c"));
        boolean includeFees = feeModel.getFeePpk(keysetId) > 0;
        RgliProofSelector selector = new RgliProofSelector(feeModel,
                SelectionOptions.defaults().setRandom(new Random(target)));

        SendResponse response = selector.select(proofs, target, includeFees, true);

        long fee = includeFees ? feeModel.getFeesForProofs(response.getSend()) : 0;
        assertEquals(target, Amounts.sumProofs(response.getSend()) - fee);
        assertEquals(proofs.size(), response.getKeep().size() + response.getSend().size());
    }
}
