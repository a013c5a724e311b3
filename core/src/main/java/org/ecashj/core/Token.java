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

package org.ecashj.core;

import com.google.common.collect.ImmutableList;

import javax.annotation.Nullable;
import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Decoded ecash token: proofs issued by a single mint in a single unit. Encoding and decoding of the text forms
 * happens elsewhere.
 */
public final class Token {
    private final String mintUrl;
    private final String unit;
    private final ImmutableList<Proof> proofs;
    @Nullable
    private final String memo;

    public Token(String mintUrl, String unit, List<Proof> proofs) {
        this(mintUrl, unit, proofs, null);
    }

    public Token(String mintUrl, String unit, List<Proof> proofs, @Nullable String memo) {
        this.mintUrl = checkNotNull(mintUrl);
        this.unit = checkNotNull(unit);
        this.proofs = ImmutableList.copyOf(proofs);
        this.memo = memo;
    }

    public String getMintUrl() {
        return mintUrl;
    }

    public String getUnit() {
        return unit;
    }

    public ImmutableList<Proof> getProofs() {
        return proofs;
    }

    @Nullable
    public String getMemo() {
        return memo;
    }
}
