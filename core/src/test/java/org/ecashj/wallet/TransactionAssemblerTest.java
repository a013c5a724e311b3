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

import com.google.common.util.concurrent.Futures;
import org.ecashj.core.Amounts;
import org.ecashj.core.DleqProof;
import org.ecashj.core.Keyset;
import org.ecashj.core.MintProtocolException;
import org.ecashj.core.Proof;
import org.ecashj.crypto.BlindSignatureScheme;
import org.ecashj.crypto.Secp256k1BlindSignatureScheme;
import org.ecashj.mint.BlindedMessage;
import org.ecashj.mint.BlindedSignature;
import org.ecashj.mint.SwapPayload;
import org.ecashj.testing.FakeMint;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;

public class TransactionAssemblerTest {
    private final BlindSignatureScheme scheme = new Secp256k1BlindSignatureScheme();
    private final TransactionAssembler assembler = new TransactionAssembler();
    private FakeMint mint;
    private Keyset keyset;

    @Before
    public void setUp() {
        mint = FakeMint.withDefaultKeyset();
        keyset = mint.getKeyset(FakeMint.KEYSET_ID);
    }

    private static List<Long> wireAmounts(SwapPayload payload) {
        List<Long> amounts = new ArrayList<>();
        for (BlindedMessage output : payload.getOutputs())
            amounts.add(output.getAmount());
        return amounts;
    }

    @Test
    public void outputsGoOnTheWireSortedAndComeBackInPlanningOrder() throws Exception {
        List<OutputData> keep = OutputData.createRandomData(5, keyset, Arrays.asList(4L, 1L), scheme);
        List<OutputData> send = OutputData.createRandomData(3, keyset, Arrays.asList(2L, 1L), scheme);
        List<Proof> inputs = mint.issue(8);

        SwapTransaction transaction = assembler.assemble(inputs, keep, send);

        assertEquals(Arrays.asList(1L, 1L, 2L, 4L), wireAmounts(transaction.getPayload()));
        assertEquals(Arrays.asList(1, 3, 2, 0), transaction.getSortedIndices());
        assertEquals(Arrays.asList(true, false, false, true), transaction.getKeepVector());
        assertSame(keep.get(1).getBlindedMessage(), transaction.getPayload().getOutputs().get(0));
        assertSame(send.get(1).getBlindedMessage(), transaction.getPayload().getOutputs().get(1));

        List<BlindedSignature> signatures = Futures.getDone(mint.swap(transaction.getPayload()));
        SendResponse response = assembler.reconstruct(transaction, signatures, keyset);

        assertEquals(Arrays.asList(4L, 1L), Amounts.amountsOf(response.getKeep()));
        assertEquals(Arrays.asList(2L, 1L), Amounts.amountsOf(response.getSend()));
        assertEquals(new String(keep.get(0).getSecret(), "UTF-8"), response.getKeep().get(0).getSecret());
        assertEquals(new String(send.get(1).getSecret(), "UTF-8"), response.getSend().get(1).getSecret());

        // the unblinded proofs are spendable
        List<Proof> all = new ArrayList<>(response.getKeep());
        all.addAll(response.getSend());
        List<OutputData> change = OutputData.createRandomData(8, keyset, null, scheme);
        Futures.getDone(mint.swap(assembler.assemble(all, change, Collections.<OutputData>emptyList()).getPayload()));
    }

    @Test
    public void inputsLoseTheirDleq() {
        Proof issued = mint.issue(2).get(0);
        Proof withDleq = new Proof(issued.getKeysetId(), 2, issued.getSecret(), issued.getC(),
                new DleqProof("e", "s", "r"), null);
        SwapTransaction transaction = assembler.assemble(Collections.singletonList(withDleq),
                OutputData.createRandomData(2, keyset, null, scheme), Collections.<OutputData>emptyList());
        Proof sent = transaction.getPayload().getInputs().get(0);
        assertFalse(sent.hasDleq());
        assertNull(sent.getDleq());
        assertEquals(withDleq, sent);
    }

    @Test(expected = MintProtocolException.class)
    public void signatureCountMustMatch() {
        List<OutputData> keep = OutputData.createRandomData(3, keyset, null, scheme);
        SwapTransaction transaction = assembler.assemble(mint.issue(2, 1), keep, Collections.<OutputData>emptyList());
        List<BlindedSignature> signatures = mint.signDirectly(transaction.getPayload().getOutputs());
        assembler.reconstruct(transaction, signatures.subList(0, 1), keyset);
    }
}
