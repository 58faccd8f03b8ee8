package dev.bykey.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-key extrema: the value reported for the element with the smallest
 * ordering and the value reported for the element with the largest ordering.
 *
 * <p>When the ordering projection differs from the value projection, these are
 * the values of those elements, not the ordering values themselves.
 *
 * @param <V> the reported value type
 */
public record Extrema<V>(
        V min,
        V max
) {
    @JsonCreator
    public Extrema(
            @JsonProperty("min") V min,
            @JsonProperty("max") V max
    ) {
        this.min = min;
        this.max = max;
    }

    /**
     * Creates the extrema of a key seen exactly once.
     */
    public static <V> Extrema<V> of(V only) {
        return new Extrema<>(only, only);
    }
}
