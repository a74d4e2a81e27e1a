package com.starscape.imagepipeline.features.delivery.app;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Polls the image-process queue and the rejection (quarantine) queue on independent schedules.
 * Each poll blocks for at most the batching window while a batch fills.
 */
@Component
public class DeliveryPollingScheduler {

    private static final Logger log = LoggerFactory.getLogger(DeliveryPollingScheduler.class);

    private final BufferedDeliveryWorker imageProcessWorker;
    private final BufferedDeliveryWorker rejectionWorker;

    public DeliveryPollingScheduler(
            @Qualifier("imageProcessWorker") BufferedDeliveryWorker imageProcessWorker,
            @Qualifier("rejectionWorker") BufferedDeliveryWorker rejectionWorker) {
        this.imageProcessWorker = imageProcessWorker;
        this.rejectionWorker = rejectionWorker;
    }

    @Scheduled(fixedDelayString = "${app.pipeline.polling.queue-delay:1000}")
    public void pollImageProcessQueue() {
        drain(imageProcessWorker);
    }

    @Scheduled(fixedDelayString = "${app.pipeline.polling.queue-delay:1000}")
    public void pollRejectionQueue() {
        drain(rejectionWorker);
    }

    private void drain(BufferedDeliveryWorker worker) {
        try {
            DrainResult result = worker.drainOnce();
            if (result.received() > 0) {
                log.info("Drained {}: received={}, acknowledged={}, retrying={}, quarantined={}, dropped={}",
                        worker.queueName(), result.received(), result.acknowledged(),
                        result.retrying(), result.quarantined(), result.dropped());
            }
        } catch (Exception e) {
            // Transport failure; the next poll tries again
            log.error("Failed to drain {}", worker.queueName(), e);
        }
    }
}
