package dev.bykey.ranking;

import dev.bykey.model.KeyValue;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Top-k and bottom-k selection over a finished key to aggregate association.
 *
 * <p>All selections copy the entries into {@link KeyValue} pairs, sort them
 * with a total order and keep the first {@code k}. When {@code k} is at least
 * the number of keys, the whole association comes back, sorted. The presets
 * break ties on the key so the result never depends on the map's iteration
 * order.
 *
 * <pre>{@code
 * Map<Integer, Long> freq = ByKey.countBy(List.of(1, 1, 1, 2, 2, 3), x -> x);
 * List<KeyValue<Integer, Long>> top = Ranking.topKByValue(freq, 2);
 * // [(1, 3), (2, 2)]
 * }</pre>
 */
public final class Ranking {

    private Ranking() {
    }

    /**
     * Descending value, then ascending key.
     */
    public static <K extends Comparable<? super K>, V extends Comparable<? super V>>
    Comparator<KeyValue<K, V>> byValueDescending() {
        return Comparator.comparing((KeyValue<K, V> pair) -> pair.value(), Comparator.<V>reverseOrder())
                .thenComparing(KeyValue::key, Comparator.<K>naturalOrder());
    }

    /**
     * Ascending value, then ascending key.
     */
    public static <K extends Comparable<? super K>, V extends Comparable<? super V>>
    Comparator<KeyValue<K, V>> byValueAscending() {
        return Comparator.comparing((KeyValue<K, V> pair) -> pair.value(), Comparator.<V>naturalOrder())
                .thenComparing(KeyValue::key, Comparator.<K>naturalOrder());
    }

    /**
     * Ascending key, then descending value. Keys of a map are unique, so the
     * second criterion only matters for pairs built elsewhere.
     */
    public static <K extends Comparable<? super K>, V extends Comparable<? super V>>
    Comparator<KeyValue<K, V>> byKeyAscending() {
        return Comparator.comparing((KeyValue<K, V> pair) -> pair.key(), Comparator.<K>naturalOrder())
                .thenComparing(KeyValue::value, Comparator.<V>reverseOrder());
    }

    /**
     * Returns the {@code k} pairs that come first under {@code order}.
     *
     * @param association the finished association
     * @param k the number of pairs to keep
     * @param order total order over the pairs, best first
     * @return at most {@code k} pairs, sorted by {@code order}
     * @throws IllegalArgumentException if {@code k} is negative
     */
    public static <K, V> List<KeyValue<K, V>> topK(
            Map<K, V> association,
            int k,
            Comparator<? super KeyValue<K, V>> order
    ) {
        Objects.requireNonNull(association, "association must not be null");
        Objects.requireNonNull(order, "order must not be null");
        if (k < 0) {
            throw new IllegalArgumentException("k must not be negative: " + k);
        }
        List<KeyValue<K, V>> pairs = new ArrayList<>(association.size());
        for (Map.Entry<K, V> entry : association.entrySet()) {
            pairs.add(KeyValue.of(entry));
        }
        pairs.sort(order);
        if (pairs.size() > k) {
            return new ArrayList<>(pairs.subList(0, k));
        }
        return pairs;
    }

    /**
     * The {@code k} keys with the largest values; ties go to the smaller key.
     */
    public static <K extends Comparable<? super K>, V extends Comparable<? super V>>
    List<KeyValue<K, V>> topKByValue(Map<K, V> association, int k) {
        return topK(association, k, Ranking.<K, V>byValueDescending());
    }

    /**
     * The {@code k} keys with the smallest values; ties go to the smaller key.
     */
    public static <K extends Comparable<? super K>, V extends Comparable<? super V>>
    List<KeyValue<K, V>> bottomKByValue(Map<K, V> association, int k) {
        return topK(association, k, Ranking.<K, V>byValueAscending());
    }

    /**
     * The {@code k} smallest keys.
     */
    public static <K extends Comparable<? super K>, V extends Comparable<? super V>>
    List<KeyValue<K, V>> topKByKey(Map<K, V> association, int k) {
        return topK(association, k, Ranking.<K, V>byKeyAscending());
    }
}
