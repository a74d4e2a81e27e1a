package com.starscape.imagepipeline.features.routing.infra;

import com.starscape.imagepipeline.features.routing.app.EventIngress;
import com.starscape.imagepipeline.features.routing.app.IngressResult;
import io.awspring.cloud.sqs.annotation.SqsListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Listens on the ingress queue that receives object-store notifications, either directly
 * or wrapped by a pub/sub topic subscription.
 *
 * A thrown exception leaves the message on the queue for redelivery.
 * Only enabled when spring.cloud.aws.sqs.enabled=true.
 */
@Component
@ConditionalOnProperty(name = "spring.cloud.aws.sqs.enabled", havingValue = "true", matchIfMissing = false)
public class NotificationQueueListener {

    private static final Logger log = LoggerFactory.getLogger(NotificationQueueListener.class);

    private final EventIngress ingress;

    public NotificationQueueListener(EventIngress ingress) {
        this.ingress = ingress;
    }

    @SqsListener("${aws.sqs.ingress-queue-url}")
    public void onMessage(String message) {
        log.debug("Received ingress message: {}", message);
        IngressResult result = ingress.accept(message);
        log.info("Ingress message routed: events={}, quarantined={}, deliveries={}",
                result.events(), result.quarantined(), result.deliveries().size());
    }
}
