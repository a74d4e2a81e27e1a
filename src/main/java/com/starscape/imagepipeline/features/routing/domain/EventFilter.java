package com.starscape.imagepipeline.features.routing.domain;

/**
 * Subscription filter evaluated in process by the topic router.
 */
public interface EventFilter {

    boolean matches(NormalizedEvent event);
}
