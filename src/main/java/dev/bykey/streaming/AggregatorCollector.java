package dev.bykey.streaming;

import dev.bykey.aggregation.Aggregator;

import java.util.Objects;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.function.BinaryOperator;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collector;

/**
 * A {@link Collector} that runs a by-key {@link Aggregator} over a Stream.
 *
 * <p>The stream is consumed one element at a time into the aggregator's
 * per-key state, exactly as {@link Aggregator#aggregate(Iterable)} would
 * consume an Iterable.
 *
 * <p>Example usage:
 * <pre>{@code
 * Map<Character, Long> byInitial = words.stream()
 *         .collect(AggregatorCollector.of(Aggregations.counting(word -> word.charAt(0))));
 * }</pre>
 *
 * <p>By-key aggregation is sequential: partial states of a parallel stream
 * cannot be merged without losing the per-bucket input order, so the combiner
 * rejects them with an {@link IllegalStateException}.
 *
 * @param <T> the type of stream elements
 * @param <A> the aggregator's accumulator type
 * @param <R> the result type
 */
public class AggregatorCollector<T, A, R> implements Collector<T, A, R> {

    private final Aggregator<T, A, R> aggregator;

    public AggregatorCollector(Aggregator<T, A, R> aggregator) {
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator must not be null");
    }

    /**
     * Returns a Collector for the given aggregator.
     * Convenience method for use with Stream.collect().
     */
    public static <T, A, R> AggregatorCollector<T, A, R> of(Aggregator<T, A, R> aggregator) {
        return new AggregatorCollector<>(aggregator);
    }

    @Override
    public Supplier<A> supplier() {
        return aggregator.supplier();
    }

    @Override
    public BiConsumer<A, T> accumulator() {
        return aggregator.accumulator();
    }

    @Override
    public BinaryOperator<A> combiner() {
        return (left, right) -> {
            throw new IllegalStateException("By-key aggregation does not support parallel streams");
        };
    }

    @Override
    public Function<A, R> finisher() {
        return aggregator.finisher();
    }

    @Override
    public Set<Characteristics> characteristics() {
        // Not UNORDERED: group and partition buckets follow encounter order
        return Set.of();
    }
}
