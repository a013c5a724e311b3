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

import org.ecashj.testing.TestKeysets;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class FeeModelTest {
    private static final String CHEAP = "00aaaaaaaaaaaaaa";
    private static final String PRICEY = "00bbbbbbbbbbbbbb";

    private FeeModel feeModel;

    @Before
    public void setUp() {
        KeyChain keyChain = new KeyChain("sat", Arrays.asList(
                TestKeysets.powersOfTwo(CHEAP, 100),
                TestKeysets.powersOfTwo(PRICEY, 1000)));
        feeModel = new FeeModel(keyChain);
    }

    private static List<Proof> proofs(String keysetId, int count) {
        List<Proof> proofs = new ArrayList<>();
        for (int i = 0; i < count; i++)
            proofs.add(new Proof(keysetId, 1, keysetId + i, "c"));
        return proofs;
    }

    @Test
    public void feesRoundUp() {
        assertEquals(0, feeModel.getFeesForProofs(Collections.emptyList()));
        assertEquals(1, feeModel.getFeesForProofs(proofs(CHEAP, 1)));
        assertEquals(1, feeModel.getFeesForProofs(proofs(CHEAP, 10)));
        assertEquals(2, feeModel.getFeesForProofs(proofs(CHEAP, 11)));
        assertEquals(3, feeModel.getFeesForProofs(proofs(PRICEY, 3)));
    }

    @Test
    public void feesSumAcrossKeysetsBeforeRounding() {
        List<Proof> mixed = new ArrayList<>(proofs(CHEAP, 5));
        mixed.addAll(proofs(PRICEY, 1));
        // 500 + 1000 ppk
        assertEquals(2, feeModel.getFeesForProofs(mixed));
    }

    @Test
    public void feesForKeyset() {
        assertEquals(0, feeModel.getFeesForKeyset(0, CHEAP));
        assertEquals(1, feeModel.getFeesForKeyset(4, CHEAP));
        assertEquals(7, feeModel.getFeesForKeyset(7, PRICEY));
        assertEquals(100, feeModel.getFeePpk(CHEAP));
    }

    @Test
    public void feeFromPpk() {
        assertEquals(0, FeeModel.feeFromPpk(0));
        assertEquals(1, FeeModel.feeFromPpk(1));
        assertEquals(1, FeeModel.feeFromPpk(1000));
        assertEquals(2, FeeModel.feeFromPpk(1001));
    }

    @Test
    public void unknownKeyset() {
        try {
            feeModel.getFeesForProofs(proofs("00cccccccccccccc", 1));
            fail();
        } catch (InvalidConfigurationException x) {
            assertTrue(x.getMessage().contains("No keyset found for keyset id: 00cccccccccccccc"));
        }
    }
}
