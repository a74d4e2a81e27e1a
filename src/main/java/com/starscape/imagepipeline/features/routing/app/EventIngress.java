package com.starscape.imagepipeline.features.routing.app;

import com.starscape.imagepipeline.common.exception.DeliveryException;
import com.starscape.imagepipeline.common.exception.EnvelopeParseException;
import com.starscape.imagepipeline.features.delivery.domain.DeliveryQueue;
import com.starscape.imagepipeline.features.routing.domain.DeliveryResult;
import com.starscape.imagepipeline.features.routing.domain.NormalizedEvent;
import com.starscape.imagepipeline.features.routing.domain.ParseFailure;
import com.starscape.imagepipeline.features.routing.domain.ParsedEnvelope;
import com.starscape.imagepipeline.features.routing.infra.EnvelopeParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Entry point for inbound envelopes from every transport.
 *
 * Unparseable input goes to the quarantine queue as-is and is never retried. After all events
 * have been fanned out, a failed direct-push delivery fails the whole batch so the upstream
 * transport redelivers it; consumers are idempotent, so the repeat is harmless.
 */
@Service
public class EventIngress {

    private static final Logger log = LoggerFactory.getLogger(EventIngress.class);

    private final EnvelopeParser parser;
    private final TopicRouter router;
    private final DeliveryQueue quarantine;

    public EventIngress(EnvelopeParser parser, TopicRouter router,
                        @Qualifier("rejectionQueue") DeliveryQueue quarantine) {
        this.parser = parser;
        this.router = router;
        this.quarantine = quarantine;
    }

    /**
     * @throws DeliveryException if any direct-push delivery failed
     */
    public IngressResult accept(String rawEnvelope) {
        ParsedEnvelope envelope;
        try {
            envelope = parser.parse(rawEnvelope);
        } catch (EnvelopeParseException e) {
            log.warn("Quarantining unparseable envelope: {}", e.getMessage());
            quarantine.send(rawEnvelope);
            return new IngressResult(0, 1, List.of());
        }

        for (ParseFailure failure : envelope.failures()) {
            log.warn("Quarantining unparseable record: {}", failure.reason());
            quarantine.send(failure.rawFragment());
        }

        List<DeliveryResult> deliveries = new ArrayList<>();
        for (NormalizedEvent event : envelope.events()) {
            log.info("Routing {} for {}", event.eventName(), event.objectKey());
            deliveries.addAll(router.publish(event));
        }

        IngressResult result = new IngressResult(envelope.events().size(), envelope.failures().size(), deliveries);
        List<DeliveryResult> failures = result.failures();
        if (!failures.isEmpty()) {
            throw new DeliveryException(
                    String.format("%d of %d deliveries failed", failures.size(), deliveries.size()), failures);
        }
        return result;
    }
}
