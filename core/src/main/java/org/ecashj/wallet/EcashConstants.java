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

public class EcashConstants {
    public static final String DEFAULT_UNIT = "sat";

    // Proof selection. 40-80 trials is where randomized greedy selection stops improving.
    public static final int SELECTION_MAX_TRIALS = 60;
    public static final int SELECTION_MAX_OVER_PERCENT = 0;
    public static final long SELECTION_MAX_OVER_AMOUNT = 0;
    public static final long SELECTION_MAX_TIME_MILLIS = 1000;
    public static final int SELECTION_MAX_SWAPS = 5000;

    // Keep about this many proofs of each denomination when choosing change amounts
    public static final int DEFAULT_DENOMINATION_TARGET = 3;

    // Bound on the loop that grows a send amount until it covers the receiver's fee
    public static final int MAX_FEE_ITERATIONS = 1000;

    // Restore
    public static final int DEFAULT_RESTORE_GAP_LIMIT = 300;
    public static final int DEFAULT_RESTORE_BATCH_SIZE = 100;

    private EcashConstants() {
    }
}
