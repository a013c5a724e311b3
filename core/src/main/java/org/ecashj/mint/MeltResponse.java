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

import javax.annotation.Nullable;
import java.util.List;

/** The mint's answer to a melt. {@code change} is empty until the payment settles. */
public final class MeltResponse {
    private final String quote;
    private final MeltQuote.State state;
    private final ImmutableList<BlindedSignature> change;

    public MeltResponse(String quote, MeltQuote.State state, @Nullable List<BlindedSignature> change) {
        this.quote = quote;
        this.state = state;
        this.change = change == null ? ImmutableList.of() : ImmutableList.copyOf(change);
    }

    public String getQuote() {
        return quote;
    }

    public MeltQuote.State getState() {
        return state;
    }

    public ImmutableList<BlindedSignature> getChange() {
        return change;
    }
}
