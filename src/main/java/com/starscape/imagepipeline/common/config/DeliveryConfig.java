package com.starscape.imagepipeline.common.config;

import com.starscape.imagepipeline.features.delivery.app.BufferedDeliveryWorker;
import com.starscape.imagepipeline.features.delivery.domain.DeliveryQueue;
import com.starscape.imagepipeline.features.delivery.infra.InMemoryDeliveryQueue;
import com.starscape.imagepipeline.features.delivery.infra.SqsDeliveryQueue;
import com.starscape.imagepipeline.features.notifications.app.QuarantineNotifier;
import com.starscape.imagepipeline.features.processimage.app.ImageCreateHandler;
import com.starscape.imagepipeline.features.routing.infra.EventCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.services.sqs.SqsClient;

/**
 * Buffered delivery queues and the workers that drain them.
 * The queue binding (in-process or SQS) is chosen by app.pipeline.queue.mode.
 */
@Configuration
public class DeliveryConfig {

    private static final Logger log = LoggerFactory.getLogger(DeliveryConfig.class);

    public static final String IMAGE_PROCESS_QUEUE = "image-process-queue";
    public static final String REJECTION_QUEUE = "rejection-queue";

    @Bean
    public DeliveryQueue imageProcessQueue(PipelineProperties properties, SqsClient sqsClient) {
        return queue(IMAGE_PROCESS_QUEUE, properties.getQueue().getImageProcessQueueUrl(), properties, sqsClient);
    }

    @Bean
    public DeliveryQueue rejectionQueue(PipelineProperties properties, SqsClient sqsClient) {
        return queue(REJECTION_QUEUE, properties.getQueue().getRejectionQueueUrl(), properties, sqsClient);
    }

    @Bean
    public BufferedDeliveryWorker imageProcessWorker(
            @Qualifier("imageProcessQueue") DeliveryQueue imageProcessQueue,
            @Qualifier("rejectionQueue") DeliveryQueue rejectionQueue,
            ImageCreateHandler imageCreateHandler,
            EventCodec codec,
            PipelineProperties properties) {
        PipelineProperties.Queue queue = properties.getQueue();
        return new BufferedDeliveryWorker(
                imageProcessQueue,
                rejectionQueue,
                envelope -> imageCreateHandler.accept(codec.decode(envelope.body())),
                queue.getRetryBudget(),
                queue.getBatchSize(),
                queue.getMaxBatchingWindow());
    }

    @Bean
    public BufferedDeliveryWorker rejectionWorker(
            @Qualifier("rejectionQueue") DeliveryQueue rejectionQueue,
            QuarantineNotifier quarantineNotifier,
            PipelineProperties properties) {
        PipelineProperties.Queue queue = properties.getQueue();
        return new BufferedDeliveryWorker(
                rejectionQueue,
                null,
                quarantineNotifier::handle,
                queue.getRetryBudget(),
                queue.getBatchSize(),
                queue.getMaxBatchingWindow());
    }

    private DeliveryQueue queue(String name, String url, PipelineProperties properties, SqsClient sqsClient) {
        return switch (properties.getQueue().getMode()) {
            case IN_MEMORY -> {
                log.info("Using in-memory queue for {}", name);
                yield new InMemoryDeliveryQueue(name, properties.getQueue().getVisibilityTimeout());
            }
            case SQS -> {
                log.info("Using SQS queue for {}: {}", name, url);
                yield new SqsDeliveryQueue(name, sqsClient, url);
            }
        };
    }
}
