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

import org.ecashj.core.Proof;

import java.util.List;

/**
 * Chooses which proofs to spend for a target amount. A selector never fails for lack of funds: it returns every
 * proof in {@code keep} and nothing in {@code send}, and the caller decides whether that is an error.
 */
public interface ProofSelector {
    /**
     * @param proofs candidate proofs
     * @param target amount the selected proofs must be worth, after fees if {@code includeFees} is set
     * @param includeFees whether each proof's input fee is deducted from its value
     * @param exactMatch whether the selection must hit the target exactly rather than meet or exceed it
     * @return a partition of {@code proofs}
     * @throws org.ecashj.core.SelectionTimeoutException if an exact match could not be found in time
     */
    SendResponse select(List<Proof> proofs, long target, boolean includeFees, boolean exactMatch);
}
