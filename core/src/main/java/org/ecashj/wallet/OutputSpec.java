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

import com.google.common.base.MoreObjects;

/**
 * A planned set of outputs: the total they will be worth, which may include an amount added to cover the
 * receiver's fees, and the output type with its final denominations filled in.
 */
public final class OutputSpec {
    private final long amount;
    private final OutputType outputType;

    public OutputSpec(long amount, OutputType outputType) {
        this.amount = amount;
        this.outputType = outputType;
    }

    public long getAmount() {
        return amount;
    }

    public OutputType getOutputType() {
        return outputType;
    }

    public OutputSpec withOutputType(OutputType outputType) {
        return new OutputSpec(amount, outputType);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("amount", amount).add("outputType", outputType).toString();
    }
}
