package com.starscape.imagepipeline.features.routing.app;

import com.starscape.imagepipeline.features.routing.domain.DeliveryResult;
import com.starscape.imagepipeline.features.routing.domain.NormalizedEvent;
import com.starscape.imagepipeline.features.routing.domain.Subscription;
import com.starscape.imagepipeline.features.routing.infra.EventCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Fans one event out to every subscription whose filter matches.
 *
 * Deliveries are independent: each matching subscription is attempted in registration order
 * and a failure is reported in that subscription's result only. Direct-push consumers run
 * synchronously on the caller's thread; buffered subscriptions only enqueue.
 */
public class TopicRouter {

    private static final Logger log = LoggerFactory.getLogger(TopicRouter.class);

    private final List<Subscription> subscriptions;
    private final EventCodec codec;

    public TopicRouter(List<Subscription> subscriptions, EventCodec codec) {
        Set<String> names = new HashSet<>();
        for (Subscription subscription : subscriptions) {
            if (!names.add(subscription.name())) {
                throw new IllegalArgumentException("Duplicate subscription name: " + subscription.name());
            }
        }
        this.subscriptions = List.copyOf(subscriptions);
        this.codec = codec;
    }

    public List<Subscription> subscriptions() {
        return subscriptions;
    }

    public List<DeliveryResult> publish(NormalizedEvent event) {
        List<DeliveryResult> results = new ArrayList<>();
        for (Subscription subscription : subscriptions) {
            if (subscription.filter().matches(event)) {
                results.add(deliver(subscription, event));
            }
        }
        if (results.isEmpty()) {
            log.debug("No subscription matched {} for {}", event.eventName(), event.objectKey());
        }
        return results;
    }

    private DeliveryResult deliver(Subscription subscription, NormalizedEvent event) {
        try {
            return switch (subscription.mode()) {
                case DIRECT_PUSH -> {
                    subscription.consumer().accept(event);
                    log.debug("Delivered {} {} to {}", event.eventName(), event.objectKey(), subscription.name());
                    yield DeliveryResult.delivered(subscription);
                }
                case BUFFERED_QUEUE -> {
                    subscription.queue().send(codec.encode(event));
                    log.debug("Enqueued {} {} for {}", event.eventName(), event.objectKey(), subscription.name());
                    yield DeliveryResult.enqueued(subscription);
                }
            };
        } catch (RuntimeException e) {
            log.error("Delivery of {} {} to {} failed", event.eventName(), event.objectKey(), subscription.name(), e);
            return DeliveryResult.failed(subscription, e);
        }
    }
}
