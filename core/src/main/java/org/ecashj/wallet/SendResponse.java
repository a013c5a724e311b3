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
import com.google.common.collect.ImmutableList;
import org.ecashj.core.Amounts;
import org.ecashj.core.Proof;

import java.util.List;

/** The result of splitting proofs for a payment: what to hand over and what stays in the wallet. */
public final class SendResponse {
    private final ImmutableList<Proof> keep;
    private final ImmutableList<Proof> send;

    public SendResponse(List<Proof> keep, List<Proof> send) {
        this.keep = ImmutableList.copyOf(keep);
        this.send = ImmutableList.copyOf(send);
    }

    public ImmutableList<Proof> getKeep() {
        return keep;
    }

    public ImmutableList<Proof> getSend() {
        return send;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("keep", Amounts.amountsOf(keep))
                .add("send", Amounts.amountsOf(send)).toString();
    }
}
