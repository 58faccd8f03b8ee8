package dev.bykey.aggregation;

import dev.bykey.model.Extrema;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Comparator;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Tracks, per key, the value of the element with the smallest ordering and the
 * value of the element with the largest ordering.
 *
 * <p>Per element the key projection runs first, then the ordering projection,
 * then the value projection. The value projection may be destructive: the
 * ordering has already been taken from the untouched element.
 *
 * <p>The first element of a key is both its min and its max. A later element
 * replaces the min only when its ordering is strictly smaller, and the max only
 * when strictly larger, so ties resolve to the earliest element.
 *
 * @param <E> the element type
 * @param <K> the key type
 * @param <O> the ordering type
 * @param <V> the reported value type
 */
public final class ExtremaAggregator<E, K, O, V>
        implements Aggregator<E, Map<K, ExtremaAggregator.State<O, V>>, Map<K, Extrema<V>>> {

    private static final Logger LOGGER = LogManager.getLogger(ExtremaAggregator.class);

    /**
     * Running extrema of one key.
     */
    public static final class State<O, V> {
        private O minOrder;
        private V minValue;
        private O maxOrder;
        private V maxValue;

        State(O order, V value) {
            this.minOrder = order;
            this.minValue = value;
            this.maxOrder = order;
            this.maxValue = value;
        }

        void observe(O order, V value, Comparator<? super O> comparator) {
            if (comparator.compare(order, minOrder) < 0) {
                minOrder = order;
                minValue = value;
            }
            if (comparator.compare(maxOrder, order) < 0) {
                maxOrder = order;
                maxValue = value;
            }
        }

        Extrema<V> toExtrema() {
            return new Extrema<>(minValue, maxValue);
        }
    }

    private final Function<? super E, ? extends K> key;
    private final Function<? super E, ? extends O> order;
    private final BiFunction<? super E, ? super O, ? extends V> value;
    private final Comparator<? super O> comparator;
    private final int expectedUniqueCount;

    private ExtremaAggregator(
            Function<? super E, ? extends K> key,
            Function<? super E, ? extends O> order,
            BiFunction<? super E, ? super O, ? extends V> value,
            Comparator<? super O> comparator,
            int expectedUniqueCount
    ) {
        KeyedMaps.checkHint(expectedUniqueCount);
        this.key = Objects.requireNonNull(key, "key projection must not be null");
        this.order = Objects.requireNonNull(order, "ordering projection must not be null");
        this.value = value;
        this.comparator = Objects.requireNonNull(comparator, "comparator must not be null");
        this.expectedUniqueCount = expectedUniqueCount;
    }

    /**
     * Orders elements by {@code order} and reports {@code value}.
     */
    public static <E, K, O, V> ExtremaAggregator<E, K, O, V> of(
            Function<? super E, ? extends K> key,
            Function<? super E, ? extends V> value,
            Function<? super E, ? extends O> order,
            Comparator<? super O> comparator,
            int expectedUniqueCount
    ) {
        Objects.requireNonNull(value, "value projection must not be null");
        return new ExtremaAggregator<>(key, order, (element, ignored) -> value.apply(element),
                comparator, expectedUniqueCount);
    }

    /**
     * Orders elements by the reported value itself. The value projection is
     * invoked once per element.
     */
    public static <E, K, V> ExtremaAggregator<E, K, V, V> ofValue(
            Function<? super E, ? extends K> key,
            Function<? super E, ? extends V> value,
            Comparator<? super V> comparator,
            int expectedUniqueCount
    ) {
        return new ExtremaAggregator<E, K, V, V>(key, value, (element, ordered) -> ordered,
                comparator, expectedUniqueCount);
    }

    @Override
    public Supplier<Map<K, State<O, V>>> supplier() {
        return () -> KeyedMaps.newHashMap(expectedUniqueCount);
    }

    @Override
    public BiConsumer<Map<K, State<O, V>>, E> accumulator() {
        return (states, element) -> {
            K k = key.apply(element);
            O o = order.apply(element);
            V v = value.apply(element, o);
            State<O, V> state = states.get(k);
            if (state == null) {
                states.put(k, new State<>(o, v));
            } else {
                state.observe(o, v, comparator);
            }
        };
    }

    @Override
    public Function<Map<K, State<O, V>>, Map<K, Extrema<V>>> finisher() {
        return states -> {
            Map<K, Extrema<V>> out = KeyedMaps.newHashMap(states.size());
            for (Map.Entry<K, State<O, V>> entry : states.entrySet()) {
                out.put(entry.getKey(), entry.getValue().toExtrema());
            }
            LOGGER.debug("Tracked extrema for {} keys", out.size());
            return out;
        };
    }
}
