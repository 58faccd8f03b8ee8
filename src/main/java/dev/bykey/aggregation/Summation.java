package dev.bykey.aggregation;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;
import java.util.function.BinaryOperator;

/**
 * Zero and addition for a value type, used by accumulate-by.
 *
 * @param <T> the summed type
 */
public interface Summation<T> extends Reduction<T, T> {

    Summation<Integer> INTEGER = of(0, Integer::sum);
    Summation<Long> LONG = of(0L, Long::sum);
    Summation<Double> DOUBLE = of(0.0, Double::sum);
    Summation<BigInteger> BIG_INTEGER = of(BigInteger.ZERO, BigInteger::add);
    Summation<BigDecimal> BIG_DECIMAL = of(BigDecimal.ZERO, BigDecimal::add);

    /**
     * Returns the additive identity.
     */
    T zero();

    /**
     * Adds two values.
     */
    T plus(T left, T right);

    @Override
    default T identity() {
        return zero();
    }

    @Override
    default T combine(T accumulator, T value) {
        return plus(accumulator, value);
    }

    /**
     * Returns the same addition with a different starting value: every per-key
     * total starts at {@code bias} instead of zero.
     *
     * @param bias added once to every per-key total
     * @return the biased reduction
     */
    default Reduction<T, T> startingAt(T bias) {
        return Reduction.startingWith(bias, this::plus);
    }

    /**
     * Creates a summation from a zero value and an addition operator.
     *
     * @param zero the additive identity, shared by every key
     * @param plus the addition
     * @param <T> the summed type
     * @return a new Summation
     */
    static <T> Summation<T> of(T zero, BinaryOperator<T> plus) {
        Objects.requireNonNull(plus, "plus must not be null");
        return new Summation<>() {
            @Override
            public T zero() {
                return zero;
            }

            @Override
            public T plus(T left, T right) {
                return plus.apply(left, right);
            }
        };
    }
}
