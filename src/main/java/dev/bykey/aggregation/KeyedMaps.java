package dev.bykey.aggregation;

import java.util.Collection;
import java.util.HashMap;

/**
 * Sizing of the hash maps that hold per-key state.
 */
public final class KeyedMaps {

    private static final float LOAD_FACTOR = 0.75f;

    /**
     * Largest hint honoured up front. Bigger hints start at this size and the
     * map grows by rehashing as keys actually arrive.
     */
    static final int MAX_PRESIZED_KEYS = 1 << 20;

    private KeyedMaps() {
    }

    /**
     * Resolves the capacity hint for a pass over {@code source}.
     *
     * <p>An explicit hint wins; otherwise the size of a {@link Collection}
     * source is used; otherwise the hint stays 0 (unknown).
     *
     * @param source the input of the pass
     * @param expectedUniqueCount the caller's hint, 0 when unknown
     * @return the hint to pre-size the result with
     * @throws IllegalArgumentException if the hint is negative
     */
    public static int sizeHint(Iterable<?> source, int expectedUniqueCount) {
        checkHint(expectedUniqueCount);
        if (expectedUniqueCount > 0) {
            return expectedUniqueCount;
        }
        if (source instanceof Collection) {
            return ((Collection<?>) source).size();
        }
        return 0;
    }

    /**
     * Creates a HashMap able to hold {@code expected} entries without rehashing,
     * up to {@link #MAX_PRESIZED_KEYS} of them.
     *
     * @param expected the expected number of keys, 0 when unknown
     */
    public static <K, V> HashMap<K, V> newHashMap(int expected) {
        checkHint(expected);
        if (expected == 0) {
            return new HashMap<>();
        }
        int presized = Math.min(expected, MAX_PRESIZED_KEYS);
        return new HashMap<>((int) Math.ceil(presized / (double) LOAD_FACTOR), LOAD_FACTOR);
    }

    static void checkHint(int expectedUniqueCount) {
        if (expectedUniqueCount < 0) {
            throw new IllegalArgumentException("expectedUniqueCount must not be negative: " + expectedUniqueCount);
        }
    }
}
