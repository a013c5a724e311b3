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

import javax.annotation.Nullable;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * How the outputs of an operation are created. Every kind except {@link Kind#CUSTOM} may carry explicit
 * denominations, which must then add up to the output amount; without them the amount is split the default way.
 * Instances are immutable; the {@code with} methods return copies.
 */
public abstract class OutputType {
    public enum Kind {
        /** Random secrets. */
        RANDOM,
        /** Secrets derived from the wallet seed. A counter of zero asks the wallet to reserve counters. */
        DETERMINISTIC,
        /** Pay-to-public-key locked secrets. */
        LOCKED,
        /** Outputs built one by one by an {@link OutputDataFactory}. */
        FACTORY,
        /** Pre-built outputs, used as they are. */
        CUSTOM
    }

    @Nullable protected final ImmutableList<Long> denominations;

    private OutputType(@Nullable List<Long> denominations) {
        this.denominations = denominations == null ? null : ImmutableList.copyOf(denominations);
    }

    public abstract Kind getKind();

    /** Explicit denominations, or null if the amount should be split the default way. */
    @Nullable
    public ImmutableList<Long> getDenominations() {
        return denominations;
    }

    public boolean hasDenominations() {
        return denominations != null && !denominations.isEmpty();
    }

    /** Returns a copy with the given denominations. */
    public abstract OutputType withDenominations(List<Long> denominations);

    /** True for a random type without explicit denominations, the only kind an offline send can satisfy. */
    public boolean isPlainRandom() {
        return getKind() == Kind.RANDOM && !hasDenominations();
    }

    public static Random random() {
        return new Random(null);
    }

    public static Random random(List<Long> denominations) {
        return new Random(denominations);
    }

    public static Deterministic deterministic(long counter) {
        return new Deterministic(counter, null);
    }

    public static Deterministic deterministic(long counter, List<Long> denominations) {
        return new Deterministic(counter, denominations);
    }

    public static Locked locked(P2PKOptions options) {
        return new Locked(options, null);
    }

    public static Locked locked(P2PKOptions options, List<Long> denominations) {
        return new Locked(options, denominations);
    }

    public static Factory factory(OutputDataFactory factory) {
        return new Factory(factory, null);
    }

    public static Factory factory(OutputDataFactory factory, List<Long> denominations) {
        return new Factory(factory, denominations);
    }

    public static Custom custom(List<? extends OutputRequest> data) {
        return new Custom(data);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).omitNullValues().add("kind", getKind())
                .add("denominations", denominations).toString();
    }

    public static final class Random extends OutputType {
        private Random(@Nullable List<Long> denominations) {
            super(denominations);
        }

        @Override
        public Kind getKind() {
            return Kind.RANDOM;
        }

        @Override
        public Random withDenominations(List<Long> denominations) {
            return new Random(denominations);
        }
    }

    public static final class Deterministic extends OutputType {
        private final long counter;

        private Deterministic(long counter, @Nullable List<Long> denominations) {
            super(denominations);
            checkArgument(counter >= 0, "counter must not be negative: %s", counter);
            this.counter = counter;
        }

        @Override
        public Kind getKind() {
            return Kind.DETERMINISTIC;
        }

        /** The first counter to derive from, or zero to have one reserved automatically. */
        public long getCounter() {
            return counter;
        }

        public boolean isAutoCounter() {
            return counter == 0;
        }

        public Deterministic withCounter(long counter) {
            return new Deterministic(counter, denominations);
        }

        @Override
        public Deterministic withDenominations(List<Long> denominations) {
            return new Deterministic(counter, denominations);
        }

        @Override
        public String toString() {
            return MoreObjects.toStringHelper(this).omitNullValues().add("kind", getKind()).add("counter", counter)
                    .add("denominations", denominations).toString();
        }
    }

    public static final class Locked extends OutputType {
        private final P2PKOptions options;

        private Locked(P2PKOptions options, @Nullable List<Long> denominations) {
            super(denominations);
            this.options = checkNotNull(options);
        }

        @Override
        public Kind getKind() {
            return Kind.LOCKED;
        }

        public P2PKOptions getOptions() {
            return options;
        }

        @Override
        public Locked withDenominations(List<Long> denominations) {
            return new Locked(options, denominations);
        }
    }

    public static final class Factory extends OutputType {
        private final OutputDataFactory factory;

        private Factory(OutputDataFactory factory, @Nullable List<Long> denominations) {
            super(denominations);
            this.factory = checkNotNull(factory);
        }

        @Override
        public Kind getKind() {
            return Kind.FACTORY;
        }

        public OutputDataFactory getFactory() {
            return factory;
        }

        @Override
        public Factory withDenominations(List<Long> denominations) {
            return new Factory(factory, denominations);
        }
    }

    public static final class Custom extends OutputType {
        private final ImmutableList<OutputRequest> data;

        private Custom(List<? extends OutputRequest> data) {
            super(null);
            this.data = ImmutableList.copyOf(data);
        }

        @Override
        public Kind getKind() {
            return Kind.CUSTOM;
        }

        public ImmutableList<OutputRequest> getData() {
            return data;
        }

        /** Custom outputs have fixed amounts. */
        @Override
        public Custom withDenominations(List<Long> denominations) {
            throw new UnsupportedOperationException("custom outputs cannot be re-denominated");
        }
    }
}
