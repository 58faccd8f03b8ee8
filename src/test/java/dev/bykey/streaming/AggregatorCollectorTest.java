package dev.bykey.streaming;

import dev.bykey.aggregation.Aggregations;
import dev.bykey.aggregation.KeyedAggregator;
import dev.bykey.aggregation.Reduction;
import dev.bykey.model.Partition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collector;
import java.util.stream.IntStream;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for AggregatorCollector, the bridge from by-key aggregators to
 * {@link java.util.stream.Stream#collect(Collector)}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * Map<Character, Long> byInitial = words.stream()
 *     .collect(AggregatorCollector.of(Aggregations.counting(word -> word.charAt(0))));
 * }</pre>
 *
 * <h2>Sequential Only</h2>
 * <p>Partial per-key states are never merged, so the collector refuses to
 * combine and declares no characteristics.</p>
 */
class AggregatorCollectorTest {

    // =========================================================================
    // SEQUENTIAL STREAMS
    // =========================================================================

    @Test
    @DisplayName("Should count a stream by key")
    void shouldCountStreamByKey() {
        // When
        Map<Integer, Long> byRemainder = IntStream.of(1, 1, 2, 3, 5, 8, 13).boxed()
                .collect(AggregatorCollector.of(Aggregations.<Integer, Integer>counting(x -> x % 3)));

        // Then
        assertThat(byRemainder).isEqualTo(Map.of(1, 3L, 2, 3L, 0, 1L));
    }

    @Test
    @DisplayName("Should keep encounter order in grouped buckets")
    void shouldKeepEncounterOrder() {
        // When
        Map<Boolean, List<Integer>> byParity = Stream.of(1, 1, 2, 3, 5, 8, 13)
                .collect(AggregatorCollector.of(Aggregations.<Integer, Boolean, Integer>grouping(x -> x % 2 == 0, x -> x, 2)));

        // Then
        assertThat(byParity.get(true)).containsExactly(2, 8);
        assertThat(byParity.get(false)).containsExactly(1, 1, 3, 5, 13);
    }

    @Test
    @DisplayName("Should only aggregate elements that survive upstream operators")
    void shouldAggregateAfterFilter() {
        // When
        Partition<Integer> small = Stream.of(1, 1, 2, 3, 5, 8, 13)
                .filter(x -> x > 1)
                .collect(AggregatorCollector.of(Aggregations.<Integer, Integer>partitioning(x -> x < 5, x -> x)));

        // Then
        assertThat(small.trues()).containsExactly(2, 3);
        assertThat(small.falses()).containsExactly(5, 8, 13);
    }

    // =========================================================================
    // PARALLEL STREAMS
    // =========================================================================

    @Test
    @DisplayName("Combiner should refuse to merge partial states")
    void combinerShouldRefuseToMerge() {
        // Given
        AggregatorCollector<Integer, Map<Integer, Long>, Map<Integer, Long>> collector =
                AggregatorCollector.of(KeyedAggregator.reducing((Integer x) -> x, x -> x, Reduction.counting(), 0));

        // When / Then
        assertThatThrownBy(() -> collector.combiner().apply(new HashMap<>(), new HashMap<>()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("parallel");
    }

    @Test
    @DisplayName("Should declare no characteristics")
    void shouldDeclareNoCharacteristics() {
        assertThat(AggregatorCollector.of(Aggregations.<String, String>counting(x -> x)).characteristics()).isEmpty();
    }
}
