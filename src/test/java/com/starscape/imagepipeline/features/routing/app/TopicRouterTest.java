package com.starscape.imagepipeline.features.routing.app;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.starscape.imagepipeline.features.delivery.domain.DeliveryEnvelope;
import com.starscape.imagepipeline.features.delivery.infra.InMemoryDeliveryQueue;
import com.starscape.imagepipeline.features.routing.domain.AllowListMatch;
import com.starscape.imagepipeline.features.routing.domain.DeliveryResult;
import com.starscape.imagepipeline.features.routing.domain.EventConsumer;
import com.starscape.imagepipeline.features.routing.domain.EventField;
import com.starscape.imagepipeline.features.routing.domain.EventKind;
import com.starscape.imagepipeline.features.routing.domain.NormalizedEvent;
import com.starscape.imagepipeline.features.routing.domain.PrefixMatch;
import com.starscape.imagepipeline.features.routing.domain.Subscription;
import com.starscape.imagepipeline.features.routing.infra.EventCodec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class TopicRouterTest {

    private final EventCodec codec = new EventCodec(new ObjectMapper());

    private InMemoryDeliveryQueue imageProcessQueue;
    private EventConsumer deleteSync;
    private EventConsumer metadataUpdate;
    private EventConsumer creationMailer;
    private TopicRouter router;

    @BeforeEach
    void setUp() {
        imageProcessQueue = new InMemoryDeliveryQueue("image-process-queue", Duration.ofSeconds(30));
        deleteSync = mock(EventConsumer.class);
        metadataUpdate = mock(EventConsumer.class);
        creationMailer = mock(EventConsumer.class);

        router = new TopicRouter(List.of(
            Subscription.buffered("image-process-queue",
                new PrefixMatch(EventField.eventName(), List.of("ObjectCreated:Put")), imageProcessQueue),
            Subscription.direct("process-delete",
                new AllowListMatch(EventField.eventName(), Set.of("ObjectRemoved:Delete")), deleteSync),
            Subscription.direct("process-update",
                new AllowListMatch(EventField.attribute("comment_type"), Set.of("Description")), metadataUpdate),
            Subscription.direct("creation-mailer",
                new AllowListMatch(EventField.eventName(), Set.of("ObjectCreated:Put")), creationMailer)
        ), codec);
    }

    @Test
    void shouldFanOutCreatedObjectToQueueAndMailer() {
        NormalizedEvent event = NormalizedEvent.objectEvent(
            EventKind.OBJECT_CREATED, "ObjectCreated:Put", "photos", "cat photo.jpeg");

        List<DeliveryResult> results = router.publish(event);

        assertEquals(2, results.size());
        assertEquals("image-process-queue", results.get(0).subscription());
        assertEquals(DeliveryResult.Status.ENQUEUED, results.get(0).status());
        assertEquals("creation-mailer", results.get(1).subscription());
        assertEquals(DeliveryResult.Status.DELIVERED, results.get(1).status());

        verify(creationMailer).accept(event);
        verifyNoInteractions(deleteSync, metadataUpdate);

        List<DeliveryEnvelope> queued = imageProcessQueue.receive(10, Duration.ZERO);
        assertEquals(1, queued.size());
        assertEquals("cat photo.jpeg", codec.decode(queued.get(0).body()).objectKey());
    }

    @Test
    void shouldIsolateFailingDirectConsumer() {
        doThrow(new IllegalStateException("mail down")).when(creationMailer).accept(any());
        NormalizedEvent event = NormalizedEvent.objectEvent(
            EventKind.OBJECT_CREATED, "ObjectCreated:Put", "photos", "cat.jpeg");

        List<DeliveryResult> results = router.publish(event);

        assertEquals(DeliveryResult.Status.ENQUEUED, results.get(0).status());
        assertTrue(results.get(1).isFailed());
        assertEquals("mail down", results.get(1).error());
        assertEquals(1, imageProcessQueue.size());
    }

    @Test
    void shouldRouteDeleteOnlyToDeleteSync() {
        NormalizedEvent event = NormalizedEvent.objectEvent(
            EventKind.OBJECT_REMOVED, "ObjectRemoved:Delete", "photos", "cat.jpeg");

        List<DeliveryResult> results = router.publish(event);

        assertEquals(1, results.size());
        assertEquals("process-delete", results.get(0).subscription());
        verify(deleteSync).accept(event);
        assertEquals(0, imageProcessQueue.size());
    }

    @Test
    void shouldRouteAttributeChangesByAttributeValue() {
        NormalizedEvent description = NormalizedEvent.attributeChanged(
            "cat.jpeg", Map.of("comment_type", "Description"), Map.of("description", "A cat"));
        NormalizedEvent caption = NormalizedEvent.attributeChanged(
            "cat.jpeg", Map.of("comment_type", "Caption"), Map.of("caption", "Meow"));

        assertEquals(1, router.publish(description).size());
        assertTrue(router.publish(caption).isEmpty());
        verify(metadataUpdate, times(1)).accept(description);
    }

    @Test
    void shouldNotMatchOtherCreationSubtypes() {
        NormalizedEvent copy = NormalizedEvent.objectEvent(
            EventKind.OBJECT_CREATED, "ObjectCreated:Copy", "photos", "cat.jpeg");

        assertTrue(router.publish(copy).isEmpty());
    }

    @Test
    void shouldRejectDuplicateSubscriptionNames() {
        Subscription first = Subscription.direct("dup",
            new AllowListMatch(EventField.kind(), Set.of("ObjectCreated")), deleteSync);
        Subscription second = Subscription.direct("dup",
            new AllowListMatch(EventField.kind(), Set.of("ObjectRemoved")), deleteSync);

        assertThrows(IllegalArgumentException.class, () -> new TopicRouter(List.of(first, second), codec));
    }
}
