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
import org.ecashj.core.Proof;

import java.util.List;

/**
 * Inputs to melt against a quote, plus blank outputs the mint may sign to return an unspent fee reserve.
 */
public final class MeltPayload {
    private final String quote;
    private final ImmutableList<Proof> inputs;
    private final ImmutableList<BlindedMessage> outputs;

    public MeltPayload(String quote, List<Proof> inputs, List<BlindedMessage> outputs) {
        this.quote = quote;
        this.inputs = ImmutableList.copyOf(inputs);
        this.outputs = ImmutableList.copyOf(outputs);
    }

    public String getQuote() {
        return quote;
    }

    public ImmutableList<Proof> getInputs() {
        return inputs;
    }

    public ImmutableList<BlindedMessage> getOutputs() {
        return outputs;
    }
}
