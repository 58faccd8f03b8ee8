package dev.bykey.aggregation;

import dev.bykey.model.Partition;

import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Splits elements into two ordered buckets by a predicate.
 *
 * <p>The predicate is tested on the untouched element before the value
 * projection runs, so a destructive projection never affects the outcome.
 *
 * @param <E> the element type
 * @param <V> the bucketed value type
 */
public final class PartitionAggregator<E, V> implements Aggregator<E, Partition<V>, Partition<V>> {

    private final Predicate<? super E> predicate;
    private final Function<? super E, ? extends V> value;

    public PartitionAggregator(Predicate<? super E> predicate, Function<? super E, ? extends V> value) {
        this.predicate = Objects.requireNonNull(predicate, "predicate must not be null");
        this.value = Objects.requireNonNull(value, "value projection must not be null");
    }

    @Override
    public Supplier<Partition<V>> supplier() {
        return Partition::empty;
    }

    @Override
    public BiConsumer<Partition<V>, E> accumulator() {
        return (partition, element) -> {
            boolean held = predicate.test(element);
            V v = value.apply(element);
            partition.bucket(held).add(v);
        };
    }

    @Override
    public Function<Partition<V>, Partition<V>> finisher() {
        return Function.identity();
    }
}
