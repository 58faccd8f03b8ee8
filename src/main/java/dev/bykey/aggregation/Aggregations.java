package dev.bykey.aggregation;

import dev.bykey.model.Extrema;
import dev.bykey.model.Partition;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Factories for reusable by-key aggregators.
 *
 * <p>Each factory returns an {@link Aggregator} that performs one by-key
 * operation when applied to an input. The same aggregator can be applied to
 * many inputs, composed with {@link Aggregator#andThen(Function)}, turned into a
 * {@link java.util.stream.Collector} or applied to a Reactor {@code Flux}.
 *
 * <pre>{@code
 * Aggregator<String, ?, Map<String, List<String>>> anagrams =
 *         Aggregations.grouping(Words::signature, Function.identity(), 0);
 *
 * Map<String, List<String>> groups = anagrams.aggregate(words);
 * }</pre>
 *
 * <p>The {@code expectedUniqueCount} arguments are capacity hints (0 when
 * unknown); they never change results.
 */
public final class Aggregations {

    private Aggregations() {
    }

    public static <E, K> Aggregator<E, ?, Map<K, Long>> counting(Function<? super E, ? extends K> key) {
        return counting(key, 0);
    }

    /**
     * Counts the elements of every key.
     */
    public static <E, K> Aggregator<E, ?, Map<K, Long>> counting(
            Function<? super E, ? extends K> key,
            int expectedUniqueCount
    ) {
        return KeyedAggregator.reducing(key, Function.identity(), Reduction.counting(), expectedUniqueCount);
    }

    /**
     * Maps every key to the value of its last element ({@code overwrite}) or
     * of its first element.
     */
    public static <E, K, V> Aggregator<E, ?, Map<K, V>> indexing(
            Function<? super E, ? extends K> key,
            Function<? super E, ? extends V> value,
            boolean overwrite,
            int expectedUniqueCount
    ) {
        KeyedMaps.checkHint(expectedUniqueCount);
        return Aggregations.<E, K, V, Map<K, V>>indexingInto(
                key, value, () -> KeyedMaps.newHashMap(expectedUniqueCount), overwrite);
    }

    /**
     * Index-by into maps created by {@code mapFactory}.
     *
     * <p>With {@code overwrite} disabled, a key already present in the map
     * (including one the factory pre-populated) keeps its value.
     */
    public static <E, K, V, M extends Map<K, V>> Aggregator<E, M, M> indexingInto(
            Function<? super E, ? extends K> key,
            Function<? super E, ? extends V> value,
            Supplier<M> mapFactory,
            boolean overwrite
    ) {
        Objects.requireNonNull(key, "key projection must not be null");
        Objects.requireNonNull(value, "value projection must not be null");
        Objects.requireNonNull(mapFactory, "mapFactory must not be null");
        return Aggregator.of(
                mapFactory,
                (map, element) -> {
                    K k = key.apply(element);
                    V v = value.apply(element);
                    if (overwrite || !map.containsKey(k)) {
                        map.put(k, v);
                    }
                },
                Function.identity()
        );
    }

    /**
     * Groups values into lists, one per key, in input order.
     */
    public static <E, K, V> Aggregator<E, ?, Map<K, List<V>>> grouping(
            Function<? super E, ? extends K> key,
            Function<? super E, ? extends V> value,
            int expectedUniqueCount
    ) {
        KeyedMaps.checkHint(expectedUniqueCount);
        return Aggregations.<E, K, V, List<V>, Map<K, List<V>>>groupingInto(
                key, value, () -> KeyedMaps.newHashMap(expectedUniqueCount), ArrayList::new);
    }

    /**
     * Groups values into buckets created by {@code bucketFactory}, inside maps
     * created by {@code mapFactory}. Existing buckets are appended to.
     */
    public static <E, K, V, B extends Collection<? super V>, M extends Map<K, B>> Aggregator<E, M, M> groupingInto(
            Function<? super E, ? extends K> key,
            Function<? super E, ? extends V> value,
            Supplier<M> mapFactory,
            Supplier<? extends B> bucketFactory
    ) {
        Objects.requireNonNull(key, "key projection must not be null");
        Objects.requireNonNull(value, "value projection must not be null");
        Objects.requireNonNull(mapFactory, "mapFactory must not be null");
        Objects.requireNonNull(bucketFactory, "bucketFactory must not be null");
        return Aggregator.of(
                mapFactory,
                (map, element) -> {
                    K k = key.apply(element);
                    V v = value.apply(element);
                    B bucket = map.get(k);
                    if (bucket == null) {
                        bucket = bucketFactory.get();
                        map.put(k, bucket);
                    }
                    bucket.add(v);
                },
                Function.identity()
        );
    }

    /**
     * Folds values into one fresh accumulator per key with a mutating combinator.
     */
    public static <E, K, V, A> Aggregator<E, ?, Map<K, A>> folding(
            Function<? super E, ? extends K> key,
            Function<? super E, ? extends V> value,
            Supplier<? extends A> initial,
            BiConsumer<? super A, ? super V> combine,
            int expectedUniqueCount
    ) {
        Objects.requireNonNull(combine, "combine must not be null");
        Reduction<V, A> reduction = Reduction.of(initial, (acc, v) -> {
            combine.accept(acc, v);
            return acc;
        });
        return KeyedAggregator.reducing(key, value, reduction, expectedUniqueCount);
    }

    /**
     * Reduces values per key and reports the raw accumulators.
     */
    public static <E, K, V, A> Aggregator<E, ?, Map<K, A>> reducing(
            Function<? super E, ? extends K> key,
            Function<? super E, ? extends V> value,
            Reduction<? super V, A> reduction,
            int expectedUniqueCount
    ) {
        return KeyedAggregator.reducing(key, value, reduction, expectedUniqueCount);
    }

    /**
     * Reduces values per key and reports the finished accumulators.
     */
    public static <E, K, V, A, R> Aggregator<E, ?, Map<K, R>> finishing(
            Function<? super E, ? extends K> key,
            Function<? super E, ? extends V> value,
            FinishingReduction<? super V, A, ? extends R> reduction,
            int expectedUniqueCount
    ) {
        return KeyedAggregator.finishing(key, value, reduction, expectedUniqueCount);
    }

    /**
     * Sums values per key, starting every total at {@code summation.zero()}.
     */
    public static <E, K, V> Aggregator<E, ?, Map<K, V>> summing(
            Function<? super E, ? extends K> key,
            Function<? super E, ? extends V> value,
            Summation<V> summation,
            int expectedUniqueCount
    ) {
        return KeyedAggregator.reducing(key, value, summation, expectedUniqueCount);
    }

    /**
     * Sums values per key, starting every total at {@code bias}.
     */
    public static <E, K, V> Aggregator<E, ?, Map<K, V>> summing(
            Function<? super E, ? extends K> key,
            Function<? super E, ? extends V> value,
            Summation<V> summation,
            V bias,
            int expectedUniqueCount
    ) {
        Objects.requireNonNull(summation, "summation must not be null");
        return KeyedAggregator.reducing(key, value, summation.startingAt(bias), expectedUniqueCount);
    }

    /**
     * Tracks per-key extrema ordered by {@code order} under {@code comparator}.
     */
    public static <E, K, O, V> Aggregator<E, ?, Map<K, Extrema<V>>> extrema(
            Function<? super E, ? extends K> key,
            Function<? super E, ? extends V> value,
            Function<? super E, ? extends O> order,
            Comparator<? super O> comparator,
            int expectedUniqueCount
    ) {
        return ExtremaAggregator.of(key, value, order, comparator, expectedUniqueCount);
    }

    /**
     * Tracks per-key extrema of the values themselves.
     */
    public static <E, K, V> Aggregator<E, ?, Map<K, Extrema<V>>> minMax(
            Function<? super E, ? extends K> key,
            Function<? super E, ? extends V> value,
            Comparator<? super V> comparator,
            int expectedUniqueCount
    ) {
        return ExtremaAggregator.ofValue(key, value, comparator, expectedUniqueCount);
    }

    /**
     * Splits values into two ordered buckets by a predicate on the element.
     */
    public static <E, V> Aggregator<E, ?, Partition<V>> partitioning(
            Predicate<? super E> predicate,
            Function<? super E, ? extends V> value
    ) {
        return new PartitionAggregator<>(predicate, value);
    }
}
