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

import com.google.common.base.Ticker;

import java.security.SecureRandom;
import java.util.Random;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static org.ecashj.wallet.EcashConstants.SELECTION_MAX_OVER_AMOUNT;
import static org.ecashj.wallet.EcashConstants.SELECTION_MAX_OVER_PERCENT;
import static org.ecashj.wallet.EcashConstants.SELECTION_MAX_SWAPS;
import static org.ecashj.wallet.EcashConstants.SELECTION_MAX_TIME_MILLIS;
import static org.ecashj.wallet.EcashConstants.SELECTION_MAX_TRIALS;

/**
 * Tuning for {@link RgliProofSelector}. The acceptable overage settings only matter for close matches: a
 * selection whose fee adjusted value is at most {@code maxOverPercent} percent and at most
 * {@code maxOverAmount} above the target ends the search early. Both default to zero.
 */
public class SelectionOptions {
    private int maxTrials = SELECTION_MAX_TRIALS;
    private int maxOverPercent = SELECTION_MAX_OVER_PERCENT;
    private long maxOverAmount = SELECTION_MAX_OVER_AMOUNT;
    private long maxTimeMillis = SELECTION_MAX_TIME_MILLIS;
    private int maxSwaps = SELECTION_MAX_SWAPS;
    private Random random = new SecureRandom();
    private Ticker ticker = Ticker.systemTicker();

    public static SelectionOptions defaults() {
        return new SelectionOptions();
    }

    public int getMaxTrials() { return maxTrials; }
    public int getMaxOverPercent() { return maxOverPercent; }
    public long getMaxOverAmount() { return maxOverAmount; }
    public long getMaxTimeMillis() { return maxTimeMillis; }
    public int getMaxSwaps() { return maxSwaps; }
    public Random getRandom() { return random; }
    public Ticker getTicker() { return ticker; }

    public SelectionOptions setMaxTrials(int maxTrials) {
        checkArgument(maxTrials > 0, "maxTrials must be positive");
        this.maxTrials = maxTrials;
        return this;
    }

    public SelectionOptions setMaxOverPercent(int maxOverPercent) {
        checkArgument(maxOverPercent >= 0, "maxOverPercent must not be negative");
        this.maxOverPercent = maxOverPercent;
        return this;
    }

    public SelectionOptions setMaxOverAmount(long maxOverAmount) {
        checkArgument(maxOverAmount >= 0, "maxOverAmount must not be negative");
        this.maxOverAmount = maxOverAmount;
        return this;
    }

    public SelectionOptions setMaxTimeMillis(long maxTimeMillis) {
        checkArgument(maxTimeMillis >= 0, "maxTimeMillis must not be negative");
        this.maxTimeMillis = maxTimeMillis;
        return this;
    }

    public SelectionOptions setMaxSwaps(int maxSwaps) {
        checkArgument(maxSwaps >= 0, "maxSwaps must not be negative");
        this.maxSwaps = maxSwaps;
        return this;
    }

    /** Source of the shuffles. Seed it in tests for repeatable selections. */
    public SelectionOptions setRandom(Random random) {
        this.random = checkNotNull(random);
        return this;
    }

    /** Clock for the selection time budget. */
    public SelectionOptions setTicker(Ticker ticker) {
        this.ticker = checkNotNull(ticker);
        return this;
    }
}
