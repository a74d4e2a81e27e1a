package com.starscape.imagepipeline.features.routing.domain;

import com.starscape.imagepipeline.features.delivery.domain.DeliveryQueue;

import java.util.Objects;

/**
 * A statically configured (consumer, filter, delivery mode) triple.
 * Direct-push subscriptions carry a consumer; buffered ones carry the queue to enqueue into.
 */
public record Subscription(
    String name,
    EventFilter filter,
    DeliveryMode mode,
    EventConsumer consumer,
    DeliveryQueue queue
) {

    public Subscription {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Subscription name cannot be blank");
        }
        Objects.requireNonNull(filter, "filter");
        Objects.requireNonNull(mode, "mode");
        if (mode == DeliveryMode.DIRECT_PUSH && consumer == null) {
            throw new IllegalArgumentException("Direct-push subscription " + name + " needs a consumer");
        }
        if (mode == DeliveryMode.BUFFERED_QUEUE && queue == null) {
            throw new IllegalArgumentException("Buffered subscription " + name + " needs a queue");
        }
    }

    public static Subscription direct(String name, EventFilter filter, EventConsumer consumer) {
        return new Subscription(name, filter, DeliveryMode.DIRECT_PUSH, consumer, null);
    }

    public static Subscription buffered(String name, EventFilter filter, DeliveryQueue queue) {
        return new Subscription(name, filter, DeliveryMode.BUFFERED_QUEUE, null, queue);
    }
}
