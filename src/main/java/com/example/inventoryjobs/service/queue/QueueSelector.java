package com.example.inventoryjobs.service.queue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Orders queues for one poll cycle by weighted random sampling without replacement.
 * <p>
 * The first queue is picked with probability proportional to its weight, the next one
 * among the remaining queues, and so on. Low-weight queues are never starved: they
 * come first in some cycles and are always polled when higher queues are empty.
 */
public class QueueSelector {

    private final List<Map.Entry<String, Integer>> weights;
    private final Random random;

    public QueueSelector(Map<String, Integer> weights, Random random) {
        if (weights.isEmpty()) {
            throw new IllegalArgumentException("At least one queue must be configured");
        }
        weights.forEach((queue, weight) -> {
            if (weight == null || weight <= 0) {
                throw new IllegalArgumentException("Queue " + queue + " must have a positive weight");
            }
        });
        this.weights = List.copyOf(weights.entrySet());
        this.random = random;
    }

    public List<String> nextOrder() {
        var remaining = new ArrayList<>(weights);
        var order = new ArrayList<String>(remaining.size());

        while (!remaining.isEmpty()) {
            var total = remaining.stream().mapToInt(Map.Entry::getValue).sum();
            var pick = random.nextInt(total);
            var iterator = remaining.iterator();
            while (iterator.hasNext()) {
                var entry = iterator.next();
                pick -= entry.getValue();
                if (pick < 0) {
                    order.add(entry.getKey());
                    iterator.remove();
                    break;
                }
            }
        }
        return order;
    }

    public boolean isKnown(String queue) {
        return weights.stream().anyMatch(e -> e.getKey().equals(queue));
    }
}
