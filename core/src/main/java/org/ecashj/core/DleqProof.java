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

import com.google.common.base.MoreObjects;

import javax.annotation.Nullable;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Discrete log equality proof attached to a signature, hex encoded. {@code r} is the blinding factor and is
 * only present once the proof has been unblinded by its owner.
 */
public final class DleqProof {
    private final String e;
    private final String s;
    @Nullable
    private final String r;

    public DleqProof(String e, String s, @Nullable String r) {
        this.e = checkNotNull(e);
        this.s = checkNotNull(s);
        this.r = r;
    }

    public String getE() {
        return e;
    }

    public String getS() {
        return s;
    }

    @Nullable
    public String getR() {
        return r;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DleqProof other = (DleqProof) o;
        return e.equals(other.e) && s.equals(other.s) && Objects.equals(r, other.r);
    }

    @Override
    public int hashCode() {
        return Objects.hash(e, s, r);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("e", e).add("s", s).toString();
    }
}
