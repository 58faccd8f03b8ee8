package dev.bykey.aggregation;

import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Aggregates the elements of an Iterable into a result in a single pass.
 *
 * <p>This is the Iterable-based counterpart of {@link java.util.stream.Collector}.
 * Every by-key operation is an Aggregator whose mutable state is the per-key
 * association under construction.
 *
 * <p>The aggregation process consists of three phases:
 * <ol>
 *   <li><b>Initialization:</b> Create a mutable accumulator via {@link #supplier()}</li>
 *   <li><b>Accumulation:</b> Process each element via {@link #accumulator()}, in encounter order</li>
 *   <li><b>Finishing:</b> Transform the accumulator to the result via {@link #finisher()}</li>
 * </ol>
 *
 * <p>Example usage:
 * <pre>{@code
 * Aggregator<String, ?, Map<Character, Long>> byInitial =
 *         Aggregations.counting(word -> word.charAt(0));
 * Map<Character, Long> counts = byInitial.aggregate(words);
 * }</pre>
 *
 * <p>Aggregators compose with {@link #andThen(Function)}:
 * <pre>{@code
 * Aggregator<Integer, ?, List<KeyValue<Integer, Long>>> mostFrequent =
 *         Aggregations.<Integer, Integer>counting(x -> x)
 *                 .andThen(counts -> Ranking.topKByValue(counts, 2));
 * }</pre>
 *
 * <p>Aggregators are sequential only: there is no combiner, and the state
 * created by {@link #supplier()} is never shared between passes.
 *
 * @param <T> the type of input elements
 * @param <A> the mutable accumulator type (internal state)
 * @param <R> the result type of the aggregation
 */
public interface Aggregator<T, A, R> {

    /**
     * Creates a new mutable accumulator instance.
     * Called once at the start of every aggregation.
     *
     * @return a supplier that creates a new accumulator
     */
    Supplier<A> supplier();

    /**
     * Incorporates a single element into the accumulator.
     * Called once per element, in encounter order.
     *
     * @return a function that adds an element to an accumulator
     */
    BiConsumer<A, T> accumulator();

    /**
     * Transforms the accumulator into the final result.
     * Called once after all elements are processed.
     *
     * @return a function that transforms the accumulator into the result
     */
    Function<A, R> finisher();

    /**
     * Aggregates all elements of the given Iterable into a single result.
     *
     * <p>The Iterable is traversed exactly once. If an element projection
     * throws, the exception propagates immediately and the partially built
     * accumulator is dropped.
     *
     * @param source the iterable to aggregate
     * @return the aggregation result
     */
    default R aggregate(Iterable<? extends T> source) {
        Objects.requireNonNull(source, "source must not be null");
        A acc = supplier().get();
        BiConsumer<A, T> accFn = accumulator();
        for (T item : source) {
            accFn.accept(acc, item);
        }
        return finisher().apply(acc);
    }

    /**
     * Aggregates the elements of the given Iterable that match the filter predicate.
     *
     * <p>Elements that do not match are skipped without invoking any projection.
     *
     * <p>Example:
     * <pre>{@code
     * Map<Integer, Long> longWordsByLength = Aggregations.<String, Integer>counting(String::length)
     *         .aggregateFiltered(words, word -> word.length() > 3);
     * }</pre>
     *
     * @param source the iterable to aggregate
     * @param filter predicate to select which elements to include
     * @return the aggregation result for filtered elements
     */
    default R aggregateFiltered(Iterable<? extends T> source, Predicate<? super T> filter) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(filter, "filter must not be null");
        A acc = supplier().get();
        BiConsumer<A, T> accFn = accumulator();
        for (T item : source) {
            if (filter.test(item)) {
                accFn.accept(acc, item);
            }
        }
        return finisher().apply(acc);
    }

    /**
     * Returns an Aggregator that applies {@code after} to the result of this one.
     *
     * <p>This is the composition point for pipelines: the traversal and the
     * accumulator stay the same, only the finishing step is extended.
     *
     * @param after the function applied to the finished result
     * @param <V> the type of the composed result
     * @return the composed aggregator
     */
    default <V> Aggregator<T, A, V> andThen(Function<? super R, ? extends V> after) {
        Objects.requireNonNull(after, "after must not be null");
        Function<A, R> finisher = finisher();
        return of(supplier(), accumulator(), acc -> after.apply(finisher.apply(acc)));
    }

    /**
     * Creates an Aggregator from functional components.
     *
     * <p>Example:
     * <pre>{@code
     * Aggregator<Integer, long[], Long> sum = Aggregator.of(
     *     () -> new long[1],
     *     (acc, val) -> acc[0] += val,
     *     acc -> acc[0]
     * );
     * }</pre>
     *
     * @param supplier creates a new accumulator
     * @param accumulator adds an element to the accumulator
     * @param finisher transforms the accumulator to the result
     * @param <T> the type of input elements
     * @param <A> the mutable accumulator type
     * @param <R> the result type
     * @return a new Aggregator
     */
    static <T, A, R> Aggregator<T, A, R> of(
            Supplier<A> supplier,
            BiConsumer<A, T> accumulator,
            Function<A, R> finisher) {
        Objects.requireNonNull(supplier, "supplier must not be null");
        Objects.requireNonNull(accumulator, "accumulator must not be null");
        Objects.requireNonNull(finisher, "finisher must not be null");
        return new Aggregator<>() {
            @Override
            public Supplier<A> supplier() {
                return supplier;
            }

            @Override
            public BiConsumer<A, T> accumulator() {
                return accumulator;
            }

            @Override
            public Function<A, R> finisher() {
                return finisher;
            }
        };
    }
}
