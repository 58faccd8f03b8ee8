package dev.bykey.reactor;

import dev.bykey.aggregation.Aggregator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Applies by-key {@link Aggregator}s to a Reactor {@link Flux}.
 *
 * <p>Uses {@link Flux#reduceWith} so that every subscription folds into its
 * own fresh per-key state, on whichever thread the Flux emits. No scheduler is
 * involved: a synchronous Flux is aggregated on the subscribing thread.
 *
 * <p>Example usage:
 * <pre>{@code
 * Flux<Reading> readings = ...;
 *
 * // Aggregate reactively
 * ReactorAggregation.aggregate(readings, Aggregations.counting(Reading::sensor))
 *     .subscribe(counts -> System.out.println(counts));
 *
 * // Or as an operator in a pipeline
 * Mono<Map<String, Long>> counts = readings
 *     .filter(reading -> reading.celsius() > 30.0)
 *     .as(ReactorAggregation.with(Aggregations.counting(Reading::sensor)));
 *
 * // Blocking for testing
 * Map<String, Long> result = counts.block();
 * }</pre>
 *
 * <p>An error signalled by the Flux, or thrown by a projection, terminates the
 * returned Mono with that error; the partial state is dropped.
 */
public final class ReactorAggregation {

    private ReactorAggregation() {
    }

    /**
     * Aggregates every element of {@code source}.
     *
     * @param source the elements
     * @param aggregator the by-key operation
     * @return Mono that emits the finished result once {@code source} completes
     */
    public static <T, A, R> Mono<R> aggregate(Flux<? extends T> source, Aggregator<T, A, R> aggregator) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(aggregator, "aggregator must not be null");
        BiConsumer<A, T> accumulator = aggregator.accumulator();
        Function<A, R> finisher = aggregator.finisher();
        return source
                .reduceWith(aggregator.supplier()::get, (A acc, T element) -> {
                    accumulator.accept(acc, element);
                    return acc;
                })
                .map(finisher);
    }

    /**
     * Returns the aggregation as a function usable with {@link Flux#as(Function)}.
     *
     * @param aggregator the by-key operation
     * @return a function from Flux to the Mono of the finished result
     */
    public static <T, A, R> Function<Flux<T>, Mono<R>> with(Aggregator<T, A, R> aggregator) {
        Objects.requireNonNull(aggregator, "aggregator must not be null");
        return flux -> aggregate(flux, aggregator);
    }
}
