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

import static com.google.common.base.Preconditions.checkArgument;

/**
 * The subset of restore outputs the mint has signed before, paired index by index with those signatures.
 */
public final class RestoreResponse {
    private final ImmutableList<BlindedMessage> outputs;
    private final ImmutableList<BlindedSignature> signatures;

    public RestoreResponse(List<BlindedMessage> outputs, List<BlindedSignature> signatures) {
        checkArgument(outputs.size() == signatures.size(), "outputs and signatures differ in length: %s != %s",
                outputs.size(), signatures.size());
        this.outputs = ImmutableList.copyOf(outputs);
        this.signatures = ImmutableList.copyOf(signatures);
    }

    public ImmutableList<BlindedMessage> getOutputs() {
        return outputs;
    }

    public ImmutableList<BlindedSignature> getSignatures() {
        return signatures;
    }
}
