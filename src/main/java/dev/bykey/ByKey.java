package dev.bykey;

import dev.bykey.aggregation.Aggregations;
import dev.bykey.aggregation.FinishingReduction;
import dev.bykey.aggregation.KeyedMaps;
import dev.bykey.aggregation.Reduction;
import dev.bykey.aggregation.Summation;
import dev.bykey.model.Extrema;
import dev.bykey.model.Partition;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Single-pass key-based aggregation over an {@link Iterable}.
 *
 * <p>Every operation traverses its input exactly once, left to right. For each
 * element it invokes the key projection and then the value projection (the
 * ordering projection or predicate, where the operation has one, runs before
 * the value projection), each exactly once. The returned association is a new
 * {@link java.util.HashMap} owned by the caller; its key order is unspecified.
 *
 * <p>Example usage:
 * <pre>{@code
 * Map<Integer, Long> freq = ByKey.countBy(List.of(1, 1, 1, 2, 2, 3), x -> x);
 * // {1=3, 2=2, 3=1}
 *
 * Map<String, List<String>> anagrams = ByKey.groupBy(words, Puzzles::anagramSignature);
 *
 * Map<String, Integer> totals = ByKey.accumulateBy(
 *     scores, Score::team, Score::points, Summation.INTEGER);
 * }</pre>
 *
 * <p>A projection that throws aborts the pass: the exception reaches the caller
 * unchanged and no partial result is returned. Arguments named
 * {@code expectedUniqueCount} are capacity hints (0 when unknown) and never
 * change the result.
 *
 * @see dev.bykey.ranking.Ranking
 * @see Aggregations
 */
public final class ByKey {

    private ByKey() {
    }

    // ---- count ------------------------------------------------------------

    /**
     * Counts the elements of every key.
     *
     * @param source the elements
     * @param key the key projection
     * @return key to number of elements carrying it
     */
    public static <E, K> Map<K, Long> countBy(Iterable<? extends E> source, Function<? super E, ? extends K> key) {
        return countBy(source, key, 0);
    }

    public static <E, K> Map<K, Long> countBy(
            Iterable<? extends E> source,
            Function<? super E, ? extends K> key,
            int expectedUniqueCount
    ) {
        return Aggregations.<E, K>counting(key, KeyedMaps.sizeHint(source, expectedUniqueCount))
                .aggregate(source);
    }

    // ---- index ------------------------------------------------------------

    /**
     * Maps every key to the value of the last element carrying it.
     */
    public static <E, K, V> Map<K, V> indexBy(
            Iterable<? extends E> source,
            Function<? super E, ? extends K> key,
            Function<? super E, ? extends V> value
    ) {
        return indexBy(source, key, value, true);
    }

    /**
     * Maps every key to a single value.
     *
     * @param overwrite {@code true} keeps the last element's value, {@code false} the first
     */
    public static <E, K, V> Map<K, V> indexBy(
            Iterable<? extends E> source,
            Function<? super E, ? extends K> key,
            Function<? super E, ? extends V> value,
            boolean overwrite
    ) {
        return Aggregations.<E, K, V>indexing(key, value, overwrite, KeyedMaps.sizeHint(source, 0))
                .aggregate(source);
    }

    public static <E, K, V, M extends Map<K, V>> M indexByInto(
            Iterable<? extends E> source,
            Function<? super E, ? extends K> key,
            Function<? super E, ? extends V> value,
            M destination
    ) {
        return indexByInto(source, key, value, destination, true);
    }

    /**
     * Index-by into a caller-supplied map, which is mutated and returned.
     *
     * <p>With {@code overwrite} disabled, keys already present in
     * {@code destination} keep their value.
     */
    public static <E, K, V, M extends Map<K, V>> M indexByInto(
            Iterable<? extends E> source,
            Function<? super E, ? extends K> key,
            Function<? super E, ? extends V> value,
            M destination,
            boolean overwrite
    ) {
        Objects.requireNonNull(destination, "destination must not be null");
        return Aggregations.<E, K, V, M>indexingInto(key, value, () -> destination, overwrite)
                .aggregate(source);
    }

    // ---- group ------------------------------------------------------------

    /**
     * Groups the elements themselves by key.
     */
    public static <E, K> Map<K, List<E>> groupBy(Iterable<? extends E> source, Function<? super E, ? extends K> key) {
        return groupBy(source, key, Function.<E>identity());
    }

    public static <E, K, V> Map<K, List<V>> groupBy(
            Iterable<? extends E> source,
            Function<? super E, ? extends K> key,
            Function<? super E, ? extends V> value
    ) {
        return groupBy(source, key, value, 0);
    }

    /**
     * Groups values into one list per key. Within a list, values keep input order.
     */
    public static <E, K, V> Map<K, List<V>> groupBy(
            Iterable<? extends E> source,
            Function<? super E, ? extends K> key,
            Function<? super E, ? extends V> value,
            int expectedUniqueCount
    ) {
        return Aggregations.<E, K, V>grouping(key, value, KeyedMaps.sizeHint(source, expectedUniqueCount))
                .aggregate(source);
    }

    /**
     * Appends values to the lists of a caller-supplied map, creating an
     * {@link ArrayList} for keys it does not hold yet. The existing buckets
     * must be modifiable.
     */
    public static <E, K, V, M extends Map<K, List<V>>> M groupByInto(
            Iterable<? extends E> source,
            Function<? super E, ? extends K> key,
            Function<? super E, ? extends V> value,
            M destination
    ) {
        return ByKey.<E, K, V, List<V>, M>groupByInto(source, key, value, destination, ArrayList::new);
    }

    /**
     * Appends values to the buckets of a caller-supplied map, creating missing
     * buckets with {@code bucketFactory}.
     */
    public static <E, K, V, B extends Collection<? super V>, M extends Map<K, B>> M groupByInto(
            Iterable<? extends E> source,
            Function<? super E, ? extends K> key,
            Function<? super E, ? extends V> value,
            M destination,
            Supplier<? extends B> bucketFactory
    ) {
        Objects.requireNonNull(destination, "destination must not be null");
        return Aggregations.<E, K, V, B, M>groupingInto(key, value, () -> destination, bucketFactory)
                .aggregate(source);
    }

    // ---- fold -------------------------------------------------------------

    public static <E, K, V, A> Map<K, A> foldBy(
            Iterable<? extends E> source,
            Function<? super E, ? extends K> key,
            Function<? super E, ? extends V> value,
            Supplier<? extends A> initial,
            BiConsumer<? super A, ? super V> combine
    ) {
        return foldBy(source, key, value, initial, combine, 0);
    }

    /**
     * Folds values into a per-key accumulator with a mutating combinator.
     *
     * <p>{@code initial} is called once per distinct key, so every key owns its
     * accumulator.
     */
    public static <E, K, V, A> Map<K, A> foldBy(
            Iterable<? extends E> source,
            Function<? super E, ? extends K> key,
            Function<? super E, ? extends V> value,
            Supplier<? extends A> initial,
            BiConsumer<? super A, ? super V> combine,
            int expectedUniqueCount
    ) {
        return Aggregations.<E, K, V, A>folding(key, value, initial, combine,
                        KeyedMaps.sizeHint(source, expectedUniqueCount))
                .aggregate(source);
    }

    // ---- transform-reduce -------------------------------------------------

    public static <E, K, V, A> Map<K, A> transformReduceBy(
            Iterable<? extends E> source,
            Function<? super E, ? extends K> key,
            Function<? super E, ? extends V> value,
            Reduction<V, A> reduction
    ) {
        return transformReduceBy(source, key, value, reduction, 0);
    }

    /**
     * Reduces the values of every key and reports the raw accumulators.
     */
    public static <E, K, V, A> Map<K, A> transformReduceBy(
            Iterable<? extends E> source,
            Function<? super E, ? extends K> key,
            Function<? super E, ? extends V> value,
            Reduction<V, A> reduction,
            int expectedUniqueCount
    ) {
        return Aggregations.<E, K, V, A>reducing(key, value, reduction,
                        KeyedMaps.sizeHint(source, expectedUniqueCount))
                .aggregate(source);
    }

    public static <E, K, V, A, R> Map<K, R> transformReduceBy(
            Iterable<? extends E> source,
            Function<? super E, ? extends K> key,
            Function<? super E, ? extends V> value,
            FinishingReduction<V, A, R> reduction
    ) {
        return transformReduceBy(source, key, value, reduction, 0);
    }

    /**
     * Reduces the values of every key, then reports the finished form of each
     * accumulator.
     */
    public static <E, K, V, A, R> Map<K, R> transformReduceBy(
            Iterable<? extends E> source,
            Function<? super E, ? extends K> key,
            Function<? super E, ? extends V> value,
            FinishingReduction<V, A, R> reduction,
            int expectedUniqueCount
    ) {
        return Aggregations.<E, K, V, A, R>finishing(key, value, reduction,
                        KeyedMaps.sizeHint(source, expectedUniqueCount))
                .aggregate(source);
    }

    /**
     * Reduces the values of every key starting from {@code initial}.
     *
     * <p>{@code initial} is the starting accumulator of every key and is
     * shared between them, so it should be immutable.
     */
    public static <E, K, V, A> Map<K, A> transformReduceBy(
            Iterable<? extends E> source,
            Function<? super E, ? extends K> key,
            Function<? super E, ? extends V> value,
            A initial,
            BiFunction<? super A, ? super V, ? extends A> combine
    ) {
        return transformReduceBy(source, key, value, Reduction.<V, A>startingWith(initial, combine), 0);
    }

    // ---- accumulate -------------------------------------------------------

    /**
     * Sums the values of every key.
     *
     * <pre>{@code
     * Map<String, Integer> totals = ByKey.accumulateBy(scores, Score::team, Score::points, Summation.INTEGER);
     * }</pre>
     */
    public static <E, K, V> Map<K, V> accumulateBy(
            Iterable<? extends E> source,
            Function<? super E, ? extends K> key,
            Function<? super E, ? extends V> value,
            Summation<V> summation
    ) {
        return Aggregations.<E, K, V>summing(key, value, summation, KeyedMaps.sizeHint(source, 0))
                .aggregate(source);
    }

    /**
     * Sums the values of every key, starting each total at {@code bias}.
     */
    public static <E, K, V> Map<K, V> accumulateBy(
            Iterable<? extends E> source,
            Function<? super E, ? extends K> key,
            Function<? super E, ? extends V> value,
            Summation<V> summation,
            V bias
    ) {
        return accumulateBy(source, key, value, summation, bias, 0);
    }

    public static <E, K, V> Map<K, V> accumulateBy(
            Iterable<? extends E> source,
            Function<? super E, ? extends K> key,
            Function<? super E, ? extends V> value,
            Summation<V> summation,
            V bias,
            int expectedUniqueCount
    ) {
        return Aggregations.<E, K, V>summing(key, value, summation, bias,
                        KeyedMaps.sizeHint(source, expectedUniqueCount))
                .aggregate(source);
    }

    // ---- extrema ----------------------------------------------------------

    /**
     * Per key, reports the value of the element with the smallest
     * {@code order} and of the element with the largest, in natural order.
     *
     * <p>{@code order} is evaluated before {@code value}, so the value
     * projection may consume the element. Ties keep the earliest element.
     */
    public static <E, K, O extends Comparable<? super O>, V> Map<K, Extrema<V>> extremaBy(
            Iterable<? extends E> source,
            Function<? super E, ? extends K> key,
            Function<? super E, ? extends V> value,
            Function<? super E, ? extends O> order
    ) {
        return extremaBy(source, key, value, order, Comparator.<O>naturalOrder());
    }

    public static <E, K, O, V> Map<K, Extrema<V>> extremaBy(
            Iterable<? extends E> source,
            Function<? super E, ? extends K> key,
            Function<? super E, ? extends V> value,
            Function<? super E, ? extends O> order,
            Comparator<? super O> comparator
    ) {
        return extremaBy(source, key, value, order, comparator, 0);
    }

    public static <E, K, O, V> Map<K, Extrema<V>> extremaBy(
            Iterable<? extends E> source,
            Function<? super E, ? extends K> key,
            Function<? super E, ? extends V> value,
            Function<? super E, ? extends O> order,
            Comparator<? super O> comparator,
            int expectedUniqueCount
    ) {
        return Aggregations.<E, K, O, V>extrema(key, value, order, comparator,
                        KeyedMaps.sizeHint(source, expectedUniqueCount))
                .aggregate(source);
    }

    /**
     * Per key, reports the smallest and largest value in natural order.
     */
    public static <E, K, V extends Comparable<? super V>> Map<K, Extrema<V>> minMaxBy(
            Iterable<? extends E> source,
            Function<? super E, ? extends K> key,
            Function<? super E, ? extends V> value
    ) {
        return minMaxBy(source, key, value, Comparator.<V>naturalOrder());
    }

    /**
     * Per key, reports the smallest and largest value under {@code comparator}.
     * The value projection is invoked once per element.
     */
    public static <E, K, V> Map<K, Extrema<V>> minMaxBy(
            Iterable<? extends E> source,
            Function<? super E, ? extends K> key,
            Function<? super E, ? extends V> value,
            Comparator<? super V> comparator
    ) {
        return Aggregations.<E, K, V>minMax(key, value, comparator, KeyedMaps.sizeHint(source, 0))
                .aggregate(source);
    }

    // ---- partition --------------------------------------------------------

    public static <E> Partition<E> partitionBy(Iterable<? extends E> source, Predicate<? super E> predicate) {
        return partitionBy(source, predicate, Function.<E>identity());
    }

    /**
     * Splits values into the elements that pass {@code predicate} and those
     * that fail it. The predicate sees each element before {@code value} does.
     */
    public static <E, V> Partition<V> partitionBy(
            Iterable<? extends E> source,
            Predicate<? super E> predicate,
            Function<? super E, ? extends V> value
    ) {
        return Aggregations.<E, V>partitioning(predicate, value).aggregate(source);
    }

    // ---- lookup -----------------------------------------------------------

    /**
     * Looks up a key that must be present in a result.
     *
     * @throws MissingKeyException if {@code result} has no entry for {@code key}
     */
    public static <K, V> V at(Map<K, V> result, K key) {
        Objects.requireNonNull(result, "result must not be null");
        V found = result.get(key);
        if (found == null && !result.containsKey(key)) {
            throw new MissingKeyException(key);
        }
        return found;
    }
}
