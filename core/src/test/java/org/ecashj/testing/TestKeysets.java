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


package org.ecashj.testing;

import org.ecashj.core.Keyset;

import java.util.Map;
import java.util.TreeMap;

/** Keysets whose keys are placeholders, for code that only looks at ids, amounts and fees. */
public class TestKeysets {
    private TestKeysets() {
    }

    public static Keyset powersOfTwo(String id, long feePerInput) {
        return powersOfTwo(id, feePerInput, true);
    }

    public static Keyset powersOfTwo(String id, long feePerInput, boolean active) {
        long[] amounts = new long[13];
        for (int i = 0; i < amounts.length; i++)
            amounts[i] = 1L << i;
        return withAmounts(id, "sat", feePerInput, active, amounts);
    }

    public static Keyset withAmounts(String id, String unit, long feePerInput, boolean active, long... amounts) {
        Map<Long, String> keys = new TreeMap<>();
        for (long amount : amounts)
            keys.put(amount, "02" + String.format("%064x", amount));
        return new Keyset(id, unit, active, feePerInput, keys);
    }
}
