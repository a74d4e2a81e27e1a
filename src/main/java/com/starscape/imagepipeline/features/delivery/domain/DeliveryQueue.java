package com.starscape.imagepipeline.features.delivery.domain;

import java.time.Duration;
import java.util.List;

/**
 * At-least-once message queue with visibility-timeout semantics.
 * A received message stays invisible until it is deleted or its visibility timeout lapses,
 * after which it is delivered again with an incremented receive count.
 */
public interface DeliveryQueue {

    String name();

    void send(String body);

    /**
     * Receive a batch of messages.
     * Returns as soon as {@code maxMessages} are collected or {@code maxWait} has elapsed,
     * whichever comes first. The result may be empty.
     */
    List<DeliveryEnvelope> receive(int maxMessages, Duration maxWait);

    void delete(DeliveryEnvelope envelope);
}
