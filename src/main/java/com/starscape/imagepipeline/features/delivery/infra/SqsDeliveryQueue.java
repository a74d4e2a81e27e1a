package com.starscape.imagepipeline.features.delivery.infra;

import com.starscape.imagepipeline.common.exception.DependencyException;
import com.starscape.imagepipeline.features.delivery.domain.DeliveryEnvelope;
import com.starscape.imagepipeline.features.delivery.domain.DeliveryQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.model.DeleteMessageRequest;
import software.amazon.awssdk.services.sqs.model.Message;
import software.amazon.awssdk.services.sqs.model.ReceiveMessageRequest;
import software.amazon.awssdk.services.sqs.model.SendMessageRequest;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * SQS-backed delivery queue.
 * Redelivery relies on the queue's own visibility timeout; no redrive policy is expected on the
 * queue, because the move to the quarantine queue is decided by the delivery worker.
 */
public class SqsDeliveryQueue implements DeliveryQueue {

    private static final Logger log = LoggerFactory.getLogger(SqsDeliveryQueue.class);

    private static final int SQS_MAX_MESSAGES_PER_RECEIVE = 10;
    private static final int SQS_MAX_WAIT_SECONDS = 20;
    private static final String RECEIVE_COUNT_ATTRIBUTE = "ApproximateReceiveCount";

    private final String name;
    private final SqsClient sqsClient;
    private final String queueUrl;

    public SqsDeliveryQueue(String name, SqsClient sqsClient, String queueUrl) {
        if (queueUrl == null || queueUrl.isBlank()) {
            throw new IllegalStateException("Queue URL not configured for " + name);
        }
        this.name = name;
        this.sqsClient = sqsClient;
        this.queueUrl = queueUrl;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public void send(String body) {
        try {
            SendMessageRequest request = SendMessageRequest.builder()
                    .queueUrl(queueUrl)
                    .messageBody(body)
                    .build();
            sqsClient.sendMessage(request);
        } catch (SdkException e) {
            throw new DependencyException("Failed to send message to " + name, e);
        }
    }

    @Override
    public List<DeliveryEnvelope> receive(int maxMessages, Duration maxWait) {
        long deadline = System.nanoTime() + maxWait.toNanos();
        List<DeliveryEnvelope> batch = new ArrayList<>();

        do {
            long remainingSeconds = Math.max(0, Duration.ofNanos(deadline - System.nanoTime()).getSeconds());
            ReceiveMessageRequest request = ReceiveMessageRequest.builder()
                    .queueUrl(queueUrl)
                    .maxNumberOfMessages(Math.min(SQS_MAX_MESSAGES_PER_RECEIVE, maxMessages - batch.size()))
                    .waitTimeSeconds((int) Math.min(SQS_MAX_WAIT_SECONDS, remainingSeconds))
                    .attributeNamesWithStrings(RECEIVE_COUNT_ATTRIBUTE)
                    .build();

            List<Message> messages;
            try {
                messages = sqsClient.receiveMessage(request).messages();
            } catch (SdkException e) {
                throw new DependencyException("Failed to receive messages from " + name, e);
            }

            for (Message message : messages) {
                batch.add(new DeliveryEnvelope(
                        message.messageId(),
                        message.receiptHandle(),
                        message.body(),
                        receiveCount(message)));
            }
        } while (batch.size() < maxMessages && System.nanoTime() < deadline);

        log.debug("Received {} message(s) from {}", batch.size(), name);
        return batch;
    }

    @Override
    public void delete(DeliveryEnvelope envelope) {
        try {
            DeleteMessageRequest request = DeleteMessageRequest.builder()
                    .queueUrl(queueUrl)
                    .receiptHandle(envelope.receiptHandle())
                    .build();
            sqsClient.deleteMessage(request);
        } catch (SdkException e) {
            throw new DependencyException("Failed to delete message " + envelope.messageId() + " from " + name, e);
        }
    }

    private int receiveCount(Message message) {
        String value = message.attributesAsStrings().get(RECEIVE_COUNT_ATTRIBUTE);
        if (value == null) {
            return 1;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            log.warn("Unparseable receive count '{}' on message {}", value, message.messageId());
            return 1;
        }
    }
}
