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
import com.google.common.primitives.Booleans;
import com.google.common.primitives.Ints;
import org.ecashj.mint.SwapPayload;

import java.util.List;

/**
 * A swap ready to send. The mint wants outputs in ascending amount order, which is not the order the wallet
 * planned them in, so the transaction remembers how to map back:
 * {@code sortedIndices[wirePosition]} is the planning position of the output sent at {@code wirePosition}, and
 * {@code keepVector[wirePosition]} says whether that output is change.
 */
public final class SwapTransaction {
    private final SwapPayload payload;
    private final ImmutableList<OutputRequest> outputData;
    private final boolean[] keepVector;
    private final int[] sortedIndices;

    SwapTransaction(SwapPayload payload, List<OutputRequest> outputData, boolean[] keepVector, int[] sortedIndices) {
        this.payload = payload;
        this.outputData = ImmutableList.copyOf(outputData);
        this.keepVector = keepVector.clone();
        this.sortedIndices = sortedIndices.clone();
    }

    public SwapPayload getPayload() {
        return payload;
    }

    /** Outputs in planning order: keep outputs first, then send outputs. */
    public ImmutableList<OutputRequest> getOutputData() {
        return outputData;
    }

    /** Per wire position, whether the output is kept. */
    public List<Boolean> getKeepVector() {
        return Booleans.asList(keepVector.clone());
    }

    /** Per wire position, the planning position of the output. */
    public List<Integer> getSortedIndices() {
        return Ints.asList(sortedIndices.clone());
    }

    boolean isKept(int wirePosition) {
        return keepVector[wirePosition];
    }

    int planningIndex(int wirePosition) {
        return sortedIndices[wirePosition];
    }

    public int getOutputCount() {
        return sortedIndices.length;
    }
}
