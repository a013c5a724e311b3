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

package org.ecashj.mint;

import com.google.common.collect.ImmutableList;

import java.util.List;

/** Outputs to sign against a paid mint quote. */
public final class MintPayload {
    private final String quote;
    private final ImmutableList<BlindedMessage> outputs;

    public MintPayload(String quote, List<BlindedMessage> outputs) {
        this.quote = quote;
        this.outputs = ImmutableList.copyOf(outputs);
    }

    public String getQuote() {
        return quote;
    }

    public ImmutableList<BlindedMessage> getOutputs() {
        return outputs;
    }
}
