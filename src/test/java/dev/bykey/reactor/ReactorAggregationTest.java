package dev.bykey.reactor;

import dev.bykey.aggregation.Aggregations;
import dev.bykey.aggregation.Aggregator;
import dev.bykey.aggregation.Summation;
import dev.bykey.model.Extrema;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Comparator;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for ReactorAggregation.
 *
 * <h2>Key Concepts</h2>
 * <ul>
 *   <li><b>reduceWith()</b>: every subscription folds into its own per-key state</li>
 *   <li><b>as()</b>: the aggregation plugs into a Flux pipeline as an operator</li>
 *   <li><b>Errors</b>: an upstream error or a failing projection terminates the Mono</li>
 * </ul>
 */
class ReactorAggregationTest {

    record Score(String team, int points) {
    }

    private static final List<Score> SCORES = List.of(
            new Score("red", 3), new Score("blue", 2), new Score("red", 5),
            new Score("blue", 4), new Score("red", -1));

    // =========================================================================
    // AGGREGATION
    // =========================================================================

    @Test
    @DisplayName("Should sum a Flux by key")
    void shouldSumFluxByKey() {
        // Given
        Aggregator<Score, ?, Map<String, Integer>> totals = Aggregations.summing(
                Score::team, Score::points, Summation.INTEGER, 0);

        // When
        Map<String, Integer> result = ReactorAggregation.aggregate(Flux.fromIterable(SCORES), totals).block();

        // Then
        assertThat(result).isEqualTo(Map.of("red", 7, "blue", 6));
    }

    @Test
    @DisplayName("Should plug into a pipeline with as()")
    void shouldPlugIntoPipeline() {
        // When
        Map<String, Extrema<Integer>> spans = Flux.fromIterable(SCORES)
                .filter(score -> score.points() > 0)
                .as(ReactorAggregation.with(Aggregations.<Score, String, Integer>minMax(
                        Score::team, Score::points, Comparator.naturalOrder(), 0)))
                .block();

        // Then
        assertThat(spans).containsEntry("red", new Extrema<>(3, 5)).containsEntry("blue", new Extrema<>(2, 4));
    }

    @Test
    @DisplayName("Should aggregate elements emitted on another thread")
    void shouldAggregateAsynchronousFlux() {
        // When
        Map<Boolean, Long> byParity = ReactorAggregation.aggregate(
                        Flux.range(1, 1_000).publishOn(Schedulers.parallel()),
                        Aggregations.<Integer, Boolean>counting(x -> x % 2 == 0))
                .block();

        // Then
        assertThat(byParity).isEqualTo(Map.of(true, 500L, false, 500L));
    }

    @Test
    @DisplayName("Should emit an empty association for an empty Flux")
    void shouldEmitEmptyAssociation() {
        Map<String, Long> counts = ReactorAggregation.aggregate(
                Flux.<String>empty(), Aggregations.<String, String>counting(s -> s)).block();

        assertThat(counts).isEmpty();
    }

    @Test
    @DisplayName("Every subscription should start from a fresh state")
    void everySubscriptionShouldStartFresh() {
        // Given
        Mono<Map<String, Long>> counts = ReactorAggregation.aggregate(
                Flux.just("a", "b", "a"), Aggregations.<String, String>counting(s -> s));

        // When
        Map<String, Long> first = counts.block();
        Map<String, Long> second = counts.block();

        // Then
        assertThat(first).isEqualTo(Map.of("a", 2L, "b", 1L));
        assertThat(second).isEqualTo(first).isNotSameAs(first);
    }

    // =========================================================================
    // ERRORS
    // =========================================================================

    @Test
    @DisplayName("Should propagate an upstream error")
    void shouldPropagateUpstreamError() {
        // Given
        Flux<String> failing = Flux.just("a", "b").concatWith(Flux.error(new IllegalStateException("source failed")));

        // When / Then
        assertThatThrownBy(() -> ReactorAggregation.aggregate(failing, Aggregations.<String, String>counting(s -> s)).block())
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("source failed");
    }

    @Test
    @DisplayName("Should propagate a failing projection")
    void shouldPropagateFailingProjection() {
        // Given
        Aggregator<String, ?, Map<Integer, Long>> byLength = Aggregations.counting(s -> {
            if (s.isEmpty()) {
                throw new IllegalArgumentException("empty word");
            }
            return s.length();
        });

        // When / Then
        assertThatThrownBy(() -> ReactorAggregation.aggregate(Flux.just("ok", ""), byLength).block())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("empty word");
    }
}
