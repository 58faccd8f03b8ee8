package dev.bykey.aggregation;

import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * A {@link Reduction} with a finishing step that turns the running accumulator
 * into the reported result.
 *
 * <p>The accumulator can hold cheap running state (for example a sum and a
 * count) while the derived shape (the average) is materialized once per key,
 * after the whole input has been folded.
 *
 * <pre>{@code
 * FinishingReduction<Integer, double[], Double> average = FinishingReduction.of(
 *     () -> new double[2],
 *     (acc, v) -> { acc[0] += v; acc[1]++; return acc; },
 *     acc -> acc[1] > 0 ? acc[0] / acc[1] : 0.0
 * );
 * }</pre>
 *
 * @param <V> the type of contributed values
 * @param <A> the accumulator type
 * @param <R> the finished result type
 */
public interface FinishingReduction<V, A, R> extends Reduction<V, A> {

    /**
     * Transforms a complete accumulator into the reported result.
     * Called once per key, after the traversal.
     *
     * @param accumulator the accumulator of one key
     * @return the finished result for that key
     */
    R finish(A accumulator);

    /**
     * Creates a finishing reduction from functional components.
     *
     * @param identity creates a fresh accumulator per key
     * @param combine folds a value into an accumulator
     * @param finish turns an accumulator into the reported result
     * @param <V> the type of contributed values
     * @param <A> the accumulator type
     * @param <R> the finished result type
     * @return a new FinishingReduction
     */
    static <V, A, R> FinishingReduction<V, A, R> of(
            Supplier<? extends A> identity,
            BiFunction<? super A, ? super V, ? extends A> combine,
            Function<? super A, ? extends R> finish) {
        Objects.requireNonNull(identity, "identity must not be null");
        Objects.requireNonNull(combine, "combine must not be null");
        Objects.requireNonNull(finish, "finish must not be null");
        return new FinishingReduction<>() {
            @Override
            public A identity() {
                return identity.get();
            }

            @Override
            public A combine(A accumulator, V value) {
                return combine.apply(accumulator, value);
            }

            @Override
            public R finish(A accumulator) {
                return finish.apply(accumulator);
            }
        };
    }
}
