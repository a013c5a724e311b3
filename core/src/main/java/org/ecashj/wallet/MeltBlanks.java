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
import org.ecashj.core.Keyset;
import org.ecashj.mint.MeltPayload;
import org.ecashj.mint.MeltQuote;

import java.util.List;

/** Everything needed to resend a melt and unblind its change later. */
public final class MeltBlanks {
    private final MeltPayload payload;
    private final ImmutableList<OutputRequest> outputData;
    private final Keyset keyset;
    private final MeltQuote quote;

    public MeltBlanks(MeltPayload payload, List<? extends OutputRequest> outputData, Keyset keyset, MeltQuote quote) {
        this.payload = payload;
        this.outputData = ImmutableList.copyOf(outputData);
        this.keyset = keyset;
        this.quote = quote;
    }

    public MeltPayload getPayload() {
        return payload;
    }

    public ImmutableList<OutputRequest> getOutputData() {
        return outputData;
    }

    public Keyset getKeyset() {
        return keyset;
    }

    public MeltQuote getQuote() {
        return quote;
    }
}
