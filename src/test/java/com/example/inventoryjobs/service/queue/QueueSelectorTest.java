package com.example.inventoryjobs.service.queue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("QueueSelector Tests")
class QueueSelectorTest {

    private static Map<String, Integer> defaultWeights() {
        var weights = new LinkedHashMap<String, Integer>();
        weights.put("critical", 6);
        weights.put("default", 3);
        weights.put("low", 1);
        return weights;
    }

    @Test
    @DisplayName("Should visit every queue exactly once per cycle")
    void shouldReturnPermutation() {
        var selector = new QueueSelector(defaultWeights(), new Random(7));

        for (var i = 0; i < 200; i++) {
            assertThat(selector.nextOrder()).containsExactlyInAnyOrder("critical", "default", "low");
        }
    }

    @Test
    @DisplayName("Should put queues first in proportion to their weight")
    void shouldFavourHeavierQueues() {
        // Given
        var selector = new QueueSelector(defaultWeights(), new Random(42));
        var firstCounts = new HashMap<String, Integer>();
        var cycles = 10_000;

        // When
        for (var i = 0; i < cycles; i++) {
            firstCounts.merge(selector.nextOrder().get(0), 1, Integer::sum);
        }

        // Then: expected shares are 60%, 30% and 10%
        assertThat(firstCounts.get("critical")).isBetween(5600, 6400);
        assertThat(firstCounts.get("default")).isBetween(2600, 3400);
        assertThat(firstCounts.get("low")).isBetween(700, 1300);
    }

    @Test
    @DisplayName("Should reject an empty or non-positive configuration")
    void shouldValidateWeights() {
        assertThatThrownBy(() -> new QueueSelector(Map.of(), new Random()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new QueueSelector(Map.of("low", 0), new Random()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("low");
    }

    @Test
    @DisplayName("Should know its configured queues")
    void shouldKnowQueues() {
        var selector = new QueueSelector(defaultWeights(), new Random());

        assertThat(selector.isKnown("critical")).isTrue();
        assertThat(selector.isKnown("bulk")).isFalse();
    }
}
