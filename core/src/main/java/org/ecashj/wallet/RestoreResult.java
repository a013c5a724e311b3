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

import javax.annotation.Nullable;
import java.util.List;

/** Proofs recovered from the mint, and the highest counter that had a signature. */
public final class RestoreResult {
    private final ImmutableList<Proof> proofs;
    @Nullable private final Long lastCounterWithSignature;

    public RestoreResult(List<Proof> proofs, @Nullable Long lastCounterWithSignature) {
        this.proofs = ImmutableList.copyOf(proofs);
        this.lastCounterWithSignature = lastCounterWithSignature;
    }

    public ImmutableList<Proof> getProofs() {
        return proofs;
    }

    /** Null if nothing was restored. */
    @Nullable
    public Long getLastCounterWithSignature() {
        return lastCounterWithSignature;
    }
}
