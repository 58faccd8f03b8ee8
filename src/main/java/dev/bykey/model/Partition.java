package dev.bykey.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of a boolean partition: the values whose element failed the predicate
 * and the values whose element passed it, each in input order.
 *
 * <p>The lists are owned by the caller and stay mutable.
 *
 * @param <V> the value type
 */
public record Partition<V>(
        List<V> falses,
        List<V> trues
) {
    @JsonCreator
    public Partition(
            @JsonProperty("falses") List<V> falses,
            @JsonProperty("trues") List<V> trues
    ) {
        this.falses = falses != null ? falses : new ArrayList<>();
        this.trues = trues != null ? trues : new ArrayList<>();
    }

    /**
     * Creates an empty partition with two fresh buckets.
     */
    public static <V> Partition<V> empty() {
        return new Partition<>(new ArrayList<>(), new ArrayList<>());
    }

    /**
     * Returns the bucket selected by a predicate outcome.
     */
    public List<V> bucket(boolean predicateHeld) {
        return predicateHeld ? trues : falses;
    }

    /**
     * Returns the total number of values in both buckets.
     */
    @JsonIgnore
    public int size() {
        return falses.size() + trues.size();
    }
}
