package dev.bykey.model;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests the JSON shape of the result types.
 */
class ModelJsonTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    @DisplayName("Extrema should serialize as min and max")
    void extremaShouldSerializeAsMinAndMax() throws Exception {
        // When
        JsonNode json = objectMapper.valueToTree(new Extrema<>(4, 15));

        // Then
        assertThat(json.get("min").asInt()).isEqualTo(4);
        assertThat(json.get("max").asInt()).isEqualTo(15);
        assertThat(objectMapper.readValue("{\"min\": \"a\", \"max\": \"z\"}",
                new TypeReference<Extrema<String>>() { })).isEqualTo(new Extrema<>("a", "z"));
    }

    @Test
    @DisplayName("Partition should serialize its buckets but not its size")
    void partitionShouldSerializeBuckets() throws Exception {
        // Given
        Partition<Integer> partition = new Partition<>(List.of(1, 3), List.of(2));

        // When
        JsonNode json = objectMapper.valueToTree(partition);

        // Then
        assertThat(json.has("size")).isFalse();
        assertThat(json.get("falses").size()).isEqualTo(2);
        assertThat(json.get("trues").get(0).asInt()).isEqualTo(2);
    }

    @Test
    @DisplayName("Partition should default missing buckets to empty lists")
    void partitionShouldDefaultMissingBuckets() throws Exception {
        // When
        Partition<String> partition = objectMapper.readValue("{\"trues\": [\"x\"]}",
                new TypeReference<Partition<String>>() { });

        // Then
        assertThat(partition.trues()).containsExactly("x");
        assertThat(partition.falses()).isEmpty();
        assertThat(partition.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("Empty partition buckets should be independent and mutable")
    void emptyPartitionShouldHaveFreshBuckets() {
        // Given
        Partition<String> partition = Partition.empty();

        // When
        partition.bucket(true).add("yes");

        // Then
        assertThat(partition.trues()).containsExactly("yes");
        assertThat(partition.falses()).isEmpty();
    }

    @Test
    @DisplayName("Key-value pairs should round-trip through JSON")
    void keyValueShouldRoundTrip() throws Exception {
        // Given
        KeyValue<String, Long> pair = new KeyValue<>("completed", 2L);

        // When
        String json = objectMapper.writeValueAsString(pair);

        // Then
        assertThat(json).isEqualTo("{\"key\":\"completed\",\"value\":2}");
        assertThat(objectMapper.readValue(json, new TypeReference<KeyValue<String, Long>>() { })).isEqualTo(pair);
    }
}
