package dev.bykey.aggregation;

import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Supplier;

/**
 * Per-key reduction: a neutral starting accumulator and a rule that folds one
 * contributed value into it.
 *
 * <p>The accumulation kernel calls {@link #identity()} once per distinct key,
 * on the first occurrence of that key, and then {@link #combine(Object, Object)}
 * once per contributed value, in input order. {@code combine} may mutate the
 * accumulator and return it, or return a new accumulator; the returned value
 * replaces the stored one. It must not return {@code null}.
 *
 * <p>A reduction whose running state differs from the reported shape should
 * implement {@link FinishingReduction} instead.
 *
 * @param <V> the type of contributed values
 * @param <A> the accumulator type
 */
public interface Reduction<V, A> {

    /**
     * Returns the starting accumulator for a newly seen key.
     *
     * @return the neutral accumulator
     */
    A identity();

    /**
     * Folds a contributed value into the accumulator.
     *
     * @param accumulator the running accumulator for the key
     * @param value the contributed value
     * @return the accumulator to store for the key
     */
    A combine(A accumulator, V value);

    /**
     * Creates a reduction whose accumulators come from {@code identity}.
     *
     * @param identity creates a fresh accumulator per key
     * @param combine folds a value into an accumulator
     * @param <V> the type of contributed values
     * @param <A> the accumulator type
     * @return a new Reduction
     */
    static <V, A> Reduction<V, A> of(Supplier<? extends A> identity, BiFunction<? super A, ? super V, ? extends A> combine) {
        Objects.requireNonNull(identity, "identity must not be null");
        Objects.requireNonNull(combine, "combine must not be null");
        return new Reduction<>() {
            @Override
            public A identity() {
                return identity.get();
            }

            @Override
            public A combine(A accumulator, V value) {
                return combine.apply(accumulator, value);
            }
        };
    }

    /**
     * Creates a reduction that starts every key from the same initial value.
     *
     * <p>The initial value is shared by all keys, so it should be immutable
     * (a boxed number, a string, a record).
     *
     * @param initial the starting accumulator of every key
     * @param combine folds a value into an accumulator
     * @param <V> the type of contributed values
     * @param <A> the accumulator type
     * @return a new Reduction
     */
    static <V, A> Reduction<V, A> startingWith(A initial, BiFunction<? super A, ? super V, ? extends A> combine) {
        return of(() -> initial, combine);
    }

    /**
     * Returns a reduction that counts contributions, ignoring their value.
     *
     * @return the counting reduction
     */
    static Reduction<Object, Long> counting() {
        return startingWith(0L, (count, ignored) -> count + 1);
    }
}
