package com.starscape.imagepipeline.features.routing.domain;

/**
 * A subscriber reached by direct push. Exceptions thrown here mark the delivery as failed.
 */
@FunctionalInterface
public interface EventConsumer {

    void accept(NormalizedEvent event);
}
