package dev.bykey.aggregation;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Map;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * The single-pass accumulation kernel shared by every by-key reduction.
 *
 * <p>For each element the key and value projections are invoked once, in that
 * order. The first occurrence of a key stores {@link Reduction#identity()} for
 * it; every occurrence then replaces the stored accumulator with
 * {@link Reduction#combine(Object, Object)}. When the reduction is a
 * {@link FinishingReduction}, the finisher builds a second map holding
 * {@link FinishingReduction#finish(Object)} of every accumulator and the raw
 * accumulators are dropped; otherwise the accumulator map itself is the result.
 *
 * <p>Example:
 * <pre>{@code
 * KeyedAggregator<Sale, String, Double, Double, Double> revenue = KeyedAggregator.reducing(
 *     Sale::region, Sale::amount, Summation.DOUBLE, 0);
 * Map<String, Double> byRegion = revenue.aggregate(sales);
 * }</pre>
 *
 * @param <E> the element type
 * @param <K> the key type
 * @param <V> the contributed value type
 * @param <A> the accumulator type
 * @param <R> the per-key result type
 */
public final class KeyedAggregator<E, K, V, A, R> implements Aggregator<E, Map<K, A>, Map<K, R>> {

    private static final Logger LOGGER = LogManager.getLogger(KeyedAggregator.class);

    private final Function<? super E, ? extends K> key;
    private final Function<? super E, ? extends V> value;
    private final Reduction<? super V, A> reduction;
    private final Function<Map<K, A>, Map<K, R>> finisher;
    private final int expectedUniqueCount;

    private KeyedAggregator(
            Function<? super E, ? extends K> key,
            Function<? super E, ? extends V> value,
            Reduction<? super V, A> reduction,
            Function<Map<K, A>, Map<K, R>> finisher,
            int expectedUniqueCount
    ) {
        KeyedMaps.checkHint(expectedUniqueCount);
        this.key = Objects.requireNonNull(key, "key projection must not be null");
        this.value = Objects.requireNonNull(value, "value projection must not be null");
        this.reduction = Objects.requireNonNull(reduction, "reduction must not be null");
        this.finisher = finisher;
        this.expectedUniqueCount = expectedUniqueCount;
    }

    /**
     * Creates a kernel that reports the raw accumulators.
     *
     * @param key the key projection
     * @param value the value projection
     * @param reduction identity and combine rule
     * @param expectedUniqueCount capacity hint, 0 when unknown
     */
    public static <E, K, V, A> KeyedAggregator<E, K, V, A, A> reducing(
            Function<? super E, ? extends K> key,
            Function<? super E, ? extends V> value,
            Reduction<? super V, A> reduction,
            int expectedUniqueCount
    ) {
        Function<Map<K, A>, Map<K, A>> handOver = accumulators -> {
            LOGGER.debug("Reduced input into {} keys", accumulators.size());
            return accumulators;
        };
        return new KeyedAggregator<>(key, value, reduction, handOver, expectedUniqueCount);
    }

    /**
     * Creates a kernel that reports the finished form of every accumulator.
     *
     * @param key the key projection
     * @param value the value projection
     * @param reduction identity, combine rule and finishing step
     * @param expectedUniqueCount capacity hint, 0 when unknown
     */
    public static <E, K, V, A, R> KeyedAggregator<E, K, V, A, R> finishing(
            Function<? super E, ? extends K> key,
            Function<? super E, ? extends V> value,
            FinishingReduction<? super V, A, ? extends R> reduction,
            int expectedUniqueCount
    ) {
        Objects.requireNonNull(reduction, "reduction must not be null");
        Function<Map<K, A>, Map<K, R>> finishEach = accumulators -> {
            Map<K, R> finished = KeyedMaps.newHashMap(accumulators.size());
            for (Map.Entry<K, A> entry : accumulators.entrySet()) {
                finished.put(entry.getKey(), reduction.finish(entry.getValue()));
            }
            LOGGER.debug("Reduced and finished input into {} keys", finished.size());
            return finished;
        };
        return new KeyedAggregator<>(key, value, reduction, finishEach, expectedUniqueCount);
    }

    @Override
    public Supplier<Map<K, A>> supplier() {
        return () -> KeyedMaps.newHashMap(expectedUniqueCount);
    }

    @Override
    public BiConsumer<Map<K, A>, E> accumulator() {
        return (accumulators, element) -> {
            K k = key.apply(element);
            V v = value.apply(element);
            A acc = accumulators.get(k);
            if (acc == null) {
                acc = Objects.requireNonNull(reduction.identity(), "identity must not be null");
            }
            A combined = reduction.combine(acc, v);
            if (combined == null) {
                throw new NullPointerException("combine returned null for key " + k);
            }
            accumulators.put(k, combined);
        };
    }

    @Override
    public Function<Map<K, A>, Map<K, R>> finisher() {
        return finisher;
    }
}
