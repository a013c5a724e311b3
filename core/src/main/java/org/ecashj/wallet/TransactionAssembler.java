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

import org.ecashj.core.Keyset;
import org.ecashj.core.MintProtocolException;
import org.ecashj.core.Proof;
import org.ecashj.mint.BlindedMessage;
import org.ecashj.mint.BlindedSignature;
import org.ecashj.mint.SwapPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Merges keep and send outputs into one swap and splits the mint's answer back into keep and send proofs.
 */
public class TransactionAssembler {
    private static final Logger log = LoggerFactory.getLogger(TransactionAssembler.class);

    /**
     * Builds a swap spending {@code inputs}. Outputs go on the wire sorted by amount; outputs of equal amount
     * keep their planning order.
     */
    public SwapTransaction assemble(List<Proof> inputs, List<? extends OutputRequest> keepOutputs,
                                    List<? extends OutputRequest> sendOutputs) {
        List<OutputRequest> merged = new ArrayList<>(keepOutputs.size() + sendOutputs.size());
        merged.addAll(keepOutputs);
        merged.addAll(sendOutputs);

        Integer[] order = new Integer[merged.size()];
        for (int i = 0; i < order.length; i++)
            order[i] = i;
        // Arrays.sort on objects is stable
        Arrays.sort(order, Comparator.comparingLong(i -> merged.get(i).getAmount()));

        int[] sortedIndices = new int[order.length];
        boolean[] keepVector = new boolean[order.length];
        List<BlindedMessage> wireOutputs = new ArrayList<>(order.length);
        for (int wire = 0; wire < order.length; wire++) {
            int planning = order[wire];
            sortedIndices[wire] = planning;
            keepVector[wire] = planning < keepOutputs.size();
            wireOutputs.add(merged.get(planning).getBlindedMessage());
        }
        List<Proof> preparedInputs = new ArrayList<>(inputs.size());
        for (Proof input : inputs)
            preparedInputs.add(input.withoutDleq());
        log.debug("assembled swap: {} inputs, wire order {}, keep vector {}", inputs.size(),
                Arrays.toString(sortedIndices), Arrays.toString(keepVector));
        return new SwapTransaction(new SwapPayload(preparedInputs, wireOutputs), merged, keepVector, sortedIndices);
    }

    /**
     * Unblinds the mint's signatures, given one per output in wire order, and returns the resulting proofs
     * split into keep and send, each in planning order.
     *
     * @throws MintProtocolException if the number of signatures does not match the number of outputs
     */
    public SendResponse reconstruct(SwapTransaction transaction, List<BlindedSignature> signatures, Keyset keyset) {
        int count = transaction.getOutputCount();
        if (signatures.size() != count)
            throw new MintProtocolException("Mint returned " + signatures.size() + " signatures, expected " + count);
        Proof[] byPlanning = new Proof[count];
        boolean[] keptByPlanning = new boolean[count];
        for (int wire = 0; wire < count; wire++) {
            int planning = transaction.planningIndex(wire);
            byPlanning[planning] = transaction.getOutputData().get(planning).toProof(signatures.get(wire), keyset);
            keptByPlanning[planning] = transaction.isKept(wire);
        }
        List<Proof> keep = new ArrayList<>();
        List<Proof> send = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            if (keptByPlanning[i])
                keep.add(byPlanning[i]);
            else
                send.add(byPlanning[i]);
        }
        return new SendResponse(keep, send);
    }
}
