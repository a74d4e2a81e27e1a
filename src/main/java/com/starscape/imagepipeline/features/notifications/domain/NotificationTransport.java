package com.starscape.imagepipeline.features.notifications.domain;

/**
 * Outbound email transport.
 */
public interface NotificationTransport {

    /**
     * Send one HTML email.
     * @throws com.starscape.imagepipeline.common.exception.DependencyException if the provider rejects the message
     */
    void send(String from, String to, String subject, String htmlBody);
}
