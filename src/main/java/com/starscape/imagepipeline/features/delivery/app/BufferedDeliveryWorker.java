package com.starscape.imagepipeline.features.delivery.app;

import com.starscape.imagepipeline.common.exception.EnvelopeParseException;
import com.starscape.imagepipeline.features.delivery.domain.DeliveryEnvelope;
import com.starscape.imagepipeline.features.delivery.domain.DeliveryQueue;
import com.starscape.imagepipeline.features.delivery.domain.EnvelopeHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;

/**
 * Drains a delivery queue in batches and applies the retry budget.
 *
 * For each envelope:
 * - success: the message is deleted from the source queue
 * - failure within budget: the message is left alone and reappears after the visibility timeout
 * - failure with receive count above the budget, or an undecodable body: the body is sent
 *   unmodified to the quarantine queue and the original is deleted
 *
 * A worker without a quarantine queue (the quarantine drainer itself) drops the message
 * once the budget is spent.
 */
public class BufferedDeliveryWorker {

    private static final Logger log = LoggerFactory.getLogger(BufferedDeliveryWorker.class);

    private final DeliveryQueue source;
    private final DeliveryQueue quarantine;
    private final EnvelopeHandler handler;
    private final int retryBudget;
    private final int batchSize;
    private final Duration maxBatchingWindow;

    public BufferedDeliveryWorker(
            DeliveryQueue source,
            DeliveryQueue quarantine,
            EnvelopeHandler handler,
            int retryBudget,
            int batchSize,
            Duration maxBatchingWindow) {
        if (retryBudget < 0) {
            throw new IllegalArgumentException("Retry budget cannot be negative");
        }
        if (batchSize < 1) {
            throw new IllegalArgumentException("Batch size must be at least 1");
        }
        this.source = source;
        this.quarantine = quarantine;
        this.handler = handler;
        this.retryBudget = retryBudget;
        this.batchSize = batchSize;
        this.maxBatchingWindow = maxBatchingWindow;
    }

    public String queueName() {
        return source.name();
    }

    /**
     * Receive one batch from the source queue and process it sequentially.
     */
    public DrainResult drainOnce() {
        List<DeliveryEnvelope> batch = source.receive(batchSize, maxBatchingWindow);
        if (batch.isEmpty()) {
            return DrainResult.empty();
        }

        log.debug("Processing batch of {} message(s) from {}", batch.size(), source.name());

        int acknowledged = 0;
        int retrying = 0;
        int quarantined = 0;
        int dropped = 0;
        for (DeliveryEnvelope envelope : batch) {
            switch (process(envelope)) {
                case ACKNOWLEDGED -> acknowledged++;
                case RETRYING -> retrying++;
                case QUARANTINED -> quarantined++;
                case DROPPED -> dropped++;
            }
        }
        return new DrainResult(batch.size(), acknowledged, retrying, quarantined, dropped);
    }

    private Outcome process(DeliveryEnvelope envelope) {
        try {
            handler.handle(envelope);
        } catch (EnvelopeParseException e) {
            log.error("Undecodable message {} on {}: {}", envelope.messageId(), source.name(), e.getMessage());
            return giveUp(envelope);
        } catch (RuntimeException e) {
            if (envelope.receiveCount() > retryBudget) {
                log.error("Message {} on {} failed on receive {} (budget {}), giving up",
                        envelope.messageId(), source.name(), envelope.receiveCount(), retryBudget, e);
                return giveUp(envelope);
            }
            log.warn("Message {} on {} failed on receive {}, will be redelivered: {}",
                    envelope.messageId(), source.name(), envelope.receiveCount(), e.getMessage());
            return Outcome.RETRYING;
        }

        source.delete(envelope);
        return Outcome.ACKNOWLEDGED;
    }

    private Outcome giveUp(DeliveryEnvelope envelope) {
        if (quarantine == null) {
            source.delete(envelope);
            log.error("Dropped message {} from {}", envelope.messageId(), source.name());
            return Outcome.DROPPED;
        }
        quarantine.send(envelope.body());
        source.delete(envelope);
        log.info("Moved message {} from {} to {}", envelope.messageId(), source.name(), quarantine.name());
        return Outcome.QUARANTINED;
    }

    private enum Outcome {
        ACKNOWLEDGED,
        RETRYING,
        QUARANTINED,
        DROPPED
    }
}
