package com.starscape.imagepipeline.features.notifications.app;

import com.starscape.imagepipeline.features.delivery.domain.DeliveryEnvelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Drains the rejection queue: one email per quarantined entry.
 * The email content is fixed; the rejected body is only logged.
 */
@Service
public class QuarantineNotifier {

    private static final Logger log = LoggerFactory.getLogger(QuarantineNotifier.class);

    static final String SUBJECT = "Image upload rejected";
    static final String MESSAGE = "One of your uploads could not be processed and has been rejected.";

    private final NotificationDispatcher dispatcher;

    public QuarantineNotifier(NotificationDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    public void handle(DeliveryEnvelope envelope) {
        log.warn("Rejected entry {}: {}", envelope.messageId(), envelope.body());
        dispatcher.dispatch(SUBJECT, dispatcher.fromAlbum(MESSAGE));
    }
}
