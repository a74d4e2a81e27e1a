package com.starscape.imagepipeline.features.notifications.domain;

/**
 * Sender card shown at the top of a notification email, followed by the message text.
 */
public record ContactDetails(String name, String email, String message) {}
