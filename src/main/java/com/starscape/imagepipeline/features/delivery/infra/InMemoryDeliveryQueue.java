package com.starscape.imagepipeline.features.delivery.infra;

import com.starscape.imagepipeline.features.delivery.domain.DeliveryEnvelope;
import com.starscape.imagepipeline.features.delivery.domain.DeliveryQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process queue with the same visibility-timeout contract as SQS.
 * Messages are kept in arrival order; a received message is hidden for the visibility timeout
 * and reappears with a higher receive count unless it is deleted first.
 */
public class InMemoryDeliveryQueue implements DeliveryQueue {

    private static final Logger log = LoggerFactory.getLogger(InMemoryDeliveryQueue.class);

    // Upper bound on a single wait, so messages whose visibility lapses are noticed.
    private static final long MAX_WAIT_SLICE_NANOS = TimeUnit.MILLISECONDS.toNanos(50);

    private final String name;
    private final Duration visibilityTimeout;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition messageArrived = lock.newCondition();
    private final Map<String, StoredMessage> messages = new LinkedHashMap<>();

    public InMemoryDeliveryQueue(String name, Duration visibilityTimeout) {
        this(name, visibilityTimeout, Clock.systemUTC());
    }

    public InMemoryDeliveryQueue(String name, Duration visibilityTimeout, Clock clock) {
        this.name = name;
        this.visibilityTimeout = visibilityTimeout;
        this.clock = clock;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public void send(String body) {
        String messageId = UUID.randomUUID().toString();
        lock.lock();
        try {
            messages.put(messageId, new StoredMessage(messageId, body, clock.instant()));
            messageArrived.signalAll();
        } finally {
            lock.unlock();
        }
        log.debug("Enqueued message {} on {}", messageId, name);
    }

    @Override
    public List<DeliveryEnvelope> receive(int maxMessages, Duration maxWait) {
        long deadline = System.nanoTime() + maxWait.toNanos();
        lock.lock();
        try {
            while (countVisible() < maxMessages) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    break;
                }
                messageArrived.awaitNanos(Math.min(remaining, MAX_WAIT_SLICE_NANOS));
            }
            return takeVisible(maxMessages);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return takeVisible(maxMessages);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void delete(DeliveryEnvelope envelope) {
        lock.lock();
        try {
            StoredMessage message = messages.get(envelope.messageId());
            if (message != null && envelope.receiptHandle().equals(message.receiptHandle)) {
                messages.remove(envelope.messageId());
            } else {
                log.debug("Ignoring delete with stale receipt for message {} on {}", envelope.messageId(), name);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Number of messages held, visible or in flight.
     */
    public int size() {
        lock.lock();
        try {
            return messages.size();
        } finally {
            lock.unlock();
        }
    }

    private int countVisible() {
        Instant now = clock.instant();
        int visible = 0;
        for (StoredMessage message : messages.values()) {
            if (message.isVisibleAt(now)) {
                visible++;
            }
        }
        return visible;
    }

    private List<DeliveryEnvelope> takeVisible(int maxMessages) {
        Instant now = clock.instant();
        List<DeliveryEnvelope> batch = new ArrayList<>();
        Iterator<StoredMessage> iterator = messages.values().iterator();
        while (iterator.hasNext() && batch.size() < maxMessages) {
            StoredMessage message = iterator.next();
            if (!message.isVisibleAt(now)) {
                continue;
            }
            message.receiveCount++;
            message.receiptHandle = UUID.randomUUID().toString();
            message.visibleAt = now.plus(visibilityTimeout);
            batch.add(new DeliveryEnvelope(message.messageId, message.receiptHandle, message.body, message.receiveCount));
        }
        return batch;
    }

    private static final class StoredMessage {
        private final String messageId;
        private final String body;
        private int receiveCount;
        private String receiptHandle;
        private Instant visibleAt;

        private StoredMessage(String messageId, String body, Instant visibleAt) {
            this.messageId = messageId;
            this.body = body;
            this.visibleAt = visibleAt;
        }

        private boolean isVisibleAt(Instant now) {
            return !visibleAt.isAfter(now);
        }
    }
}
