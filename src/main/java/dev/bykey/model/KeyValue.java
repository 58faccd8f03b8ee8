package dev.bykey.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * A key with its aggregate, as produced by the ranking step.
 *
 * @param <K> the key type
 * @param <V> the aggregate type
 */
public record KeyValue<K, V>(
        K key,
        V value
) {
    @JsonCreator
    public KeyValue(
            @JsonProperty("key") K key,
            @JsonProperty("value") V value
    ) {
        this.key = key;
        this.value = value;
    }

    /**
     * Copies a map entry.
     */
    public static <K, V> KeyValue<K, V> of(Map.Entry<? extends K, ? extends V> entry) {
        return new KeyValue<>(entry.getKey(), entry.getValue());
    }
}
