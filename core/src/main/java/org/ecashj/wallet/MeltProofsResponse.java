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
import org.ecashj.core.Proof;
import org.ecashj.mint.MeltQuote;

import java.util.List;

/** The updated quote and any fee change the mint returned. */
public final class MeltProofsResponse {
    private final MeltQuote quote;
    private final ImmutableList<Proof> change;

    public MeltProofsResponse(MeltQuote quote, List<Proof> change) {
        this.quote = quote;
        this.change = ImmutableList.copyOf(change);
    }

    public MeltQuote getQuote() {
        return quote;
    }

    public ImmutableList<Proof> getChange() {
        return change;
    }
}
