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

import com.google.common.base.MoreObjects;

import javax.annotation.Nullable;

/**
 * A melt quote: the mint agrees to pay {@link #getRequest()} for {@link #getAmount()} plus at most
 * {@link #getFeeReserve()} in fees.
 */
public final class MeltQuote {
    public enum State {
        UNPAID,
        PENDING,
        PAID
    }

    private final String quote;
    private final long amount;
    private final long feeReserve;
    private final String unit;
    private final String request;
    private final State state;

    public MeltQuote(String quote, long amount, long feeReserve, String unit, String request, State state) {
        this.quote = quote;
        this.amount = amount;
        this.feeReserve = feeReserve;
        this.unit = unit;
        this.request = request;
        this.state = state;
    }

    public String getQuote() {
        return quote;
    }

    public long getAmount() {
        return amount;
    }

    public long getFeeReserve() {
        return feeReserve;
    }

    public String getUnit() {
        return unit;
    }

    public String getRequest() {
        return request;
    }

    public State getState() {
        return state;
    }

    /** Copy of this quote with the state reported by a later melt call. */
    public MeltQuote withState(@Nullable State newState) {
        return newState == null ? this : new MeltQuote(quote, amount, feeReserve, unit, request, newState);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("quote", quote).add("amount", amount)
                .add("feeReserve", feeReserve).add("unit", unit).add("state", state).toString();
    }
}
