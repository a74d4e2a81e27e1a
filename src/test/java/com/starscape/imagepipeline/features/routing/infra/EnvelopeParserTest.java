package com.starscape.imagepipeline.features.routing.infra;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.starscape.imagepipeline.common.exception.EnvelopeParseException;
import com.starscape.imagepipeline.features.changestream.domain.ChangeOperation;
import com.starscape.imagepipeline.features.changestream.domain.ChangeRecord;
import com.starscape.imagepipeline.features.routing.domain.EventKind;
import com.starscape.imagepipeline.features.routing.domain.NormalizedEvent;
import com.starscape.imagepipeline.features.routing.domain.ParsedEnvelope;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EnvelopeParserTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final EnvelopeParser parser = new EnvelopeParser(objectMapper);

    @Test
    void shouldDecodeObjectStoreNotification() throws Exception {
        String raw = json(notification(objectRecord("ObjectCreated:Put", "photos", "cat%20photo.jpeg")));

        ParsedEnvelope envelope = parser.parse(raw);

        assertEquals(1, envelope.events().size());
        assertFalse(envelope.hasFailures());
        NormalizedEvent event = envelope.events().get(0);
        assertEquals(EventKind.OBJECT_CREATED, event.kind());
        assertEquals("ObjectCreated:Put", event.eventName());
        assertEquals("cat photo.jpeg", event.objectKey());
        assertEquals("photos", event.containerId());
    }

    @Test
    void shouldTreatPlusAsSpaceInObjectKeys() throws Exception {
        String raw = json(notification(objectRecord("ObjectRemoved:Delete", "photos", "my+dog%2B1.png")));

        NormalizedEvent event = parser.parse(raw).events().get(0);

        assertEquals(EventKind.OBJECT_REMOVED, event.kind());
        assertEquals("my dog+1.png", event.objectKey());
    }

    @Test
    void shouldUnwrapQueueBatchOfPubSubWrappers() throws Exception {
        String pubSub = json(Map.of(
            "Type", "Notification",
            "Message", json(notification(
                objectRecord("ObjectCreated:Put", "photos", "a.jpeg"),
                objectRecord("ObjectCreated:Put", "photos", "b.png")))));
        String raw = json(Map.of("Records", List.of(
            Map.of("messageId", "m1", "body", pubSub),
            Map.of("messageId", "m2", "body", json(notification(
                objectRecord("ObjectRemoved:Delete", "photos", "c.jpeg")))))));

        ParsedEnvelope envelope = parser.parse(raw);

        assertEquals(List.of("a.jpeg", "b.png", "c.jpeg"),
            envelope.events().stream().map(NormalizedEvent::objectKey).toList());
        assertFalse(envelope.hasFailures());
    }

    @Test
    void shouldUnwrapPubSubPushBatch() throws Exception {
        String raw = json(Map.of("Records", List.of(Map.of(
            "EventSource", "aws:sns",
            "Sns", Map.of("Message", json(notification(objectRecord("ObjectCreated:Put", "photos", "a.jpeg"))))))));

        ParsedEnvelope envelope = parser.parse(raw);

        assertEquals(1, envelope.events().size());
        assertEquals("a.jpeg", envelope.events().get(0).objectKey());
    }

    @Test
    void shouldIsolateBadRecordFromSiblings() throws Exception {
        String raw = json(notification(
            objectRecord("ObjectCreated:Put", "photos", "good.jpeg"),
            objectRecord("ObjectRestore:Completed", "photos", "odd.jpeg"),
            objectRecord("ObjectCreated:Put", "photos", "bad%zz.jpeg")));

        ParsedEnvelope envelope = parser.parse(raw);

        assertEquals(1, envelope.events().size());
        assertEquals("good.jpeg", envelope.events().get(0).objectKey());
        assertEquals(2, envelope.failures().size());
        assertTrue(envelope.failures().get(0).reason().contains("Unrecognized event type"));
        assertTrue(envelope.failures().get(0).rawFragment().contains("odd.jpeg"));
        assertTrue(envelope.failures().get(1).reason().contains("Malformed object key"));
    }

    @Test
    void shouldIsolateUnreadableQueueBody() throws Exception {
        String raw = json(Map.of("Records", List.of(
            Map.of("messageId", "m1", "body", "{not json"),
            Map.of("messageId", "m2", "body", json(notification(objectRecord("ObjectCreated:Put", "photos", "a.jpeg")))))));

        ParsedEnvelope envelope = parser.parse(raw);

        assertEquals(1, envelope.events().size());
        assertEquals(1, envelope.failures().size());
        assertEquals("{not json", envelope.failures().get(0).rawFragment());
    }

    @Test
    void shouldDecodeValidRecordsAfterUnrecognizedFirstEntry() throws Exception {
        String raw = "{\"Records\":[{}," + json(objectRecord("ObjectCreated:Put", "photos", "good.jpeg")) + "]}";

        ParsedEnvelope envelope = parser.parse(raw);

        assertEquals(1, envelope.events().size());
        assertEquals("good.jpeg", envelope.events().get(0).objectKey());
        assertEquals(1, envelope.failures().size());
        assertEquals("{}", envelope.failures().get(0).rawFragment());
    }

    @Test
    void shouldIsolateNullEntriesInEventList() throws Exception {
        String raw = "{\"Records\":[" + json(objectRecord("ObjectCreated:Put", "photos", "a.jpeg")) + ",null,42]}";

        ParsedEnvelope envelope = parser.parse(raw);

        assertEquals(1, envelope.events().size());
        assertEquals(2, envelope.failures().size());
        assertEquals("null", envelope.failures().get(0).rawFragment());
    }

    @Test
    void shouldIsolateNullEntryInsideQueueBody() throws Exception {
        String body = "{\"Records\":[null," + json(objectRecord("ObjectRemoved:Delete", "photos", "b.png")) + "]}";
        String raw = json(Map.of("Records", List.of(Map.of("messageId", "m1", "body", body))));

        ParsedEnvelope envelope = parser.parse(raw);

        assertEquals(List.of("b.png"), envelope.events().stream().map(NormalizedEvent::objectKey).toList());
        assertEquals(1, envelope.failures().size());
    }

    @Test
    void shouldRejectKeysThatAreNotValidUtf8() throws Exception {
        String raw = json(notification(
            objectRecord("ObjectCreated:Put", "photos", "caf%E9.jpeg"),
            objectRecord("ObjectCreated:Put", "photos", "caf%C3%A9.jpeg")));

        ParsedEnvelope envelope = parser.parse(raw);

        assertEquals(List.of("caf\u00e9.jpeg"), envelope.events().stream().map(NormalizedEvent::objectKey).toList());
        assertEquals(1, envelope.failures().size());
        assertTrue(envelope.failures().get(0).reason().contains("Malformed object key"));
    }

    @Test
    void shouldRejectTruncatedEscapeInKey() {
        assertThrows(EnvelopeParseException.class, () -> EnvelopeParser.decodeKey("photo%4"));
        assertEquals("\u732b photo.png", EnvelopeParser.decodeKey("\u732b+photo.png"));
    }

    @Test
    void shouldTurnAttributeMessageIntoAttributeChanged() throws Exception {
        String raw = json(Map.of(
            "Type", "Notification",
            "Message", json(Map.of("name", "cat.jpeg", "description", "A sleepy cat")),
            "MessageAttributes", Map.of("comment_type", Map.of("Type", "String", "Value", "Description"))));

        ParsedEnvelope envelope = parser.parse(raw);

        assertEquals(1, envelope.events().size());
        NormalizedEvent event = envelope.events().get(0);
        assertEquals(EventKind.ATTRIBUTE_CHANGED, event.kind());
        assertEquals("cat.jpeg", event.objectKey());
        assertEquals("Description", event.attribute("comment_type").orElseThrow());
        assertEquals("A sleepy cat", event.payloadValue("description").orElseThrow());
    }

    @Test
    void shouldRejectAttributeMessageWithoutName() throws Exception {
        String raw = json(Map.of(
            "Message", json(Map.of("description", "orphan")),
            "MessageAttributes", Map.of("comment_type", Map.of("Type", "String", "Value", "Description"))));

        assertThrows(EnvelopeParseException.class, () -> parser.parse(raw));
    }

    @Test
    void shouldReturnEmptyEnvelopeForProviderTestEvent() {
        ParsedEnvelope envelope = parser.parse("{\"Service\":\"Amazon S3\",\"Event\":\"s3:TestEvent\"}");

        assertTrue(envelope.events().isEmpty());
        assertFalse(envelope.hasFailures());
    }

    @Test
    void shouldRejectMalformedJson() {
        EnvelopeParseException e = assertThrows(EnvelopeParseException.class, () -> parser.parse("{\"Records\": ["));
        assertTrue(e.getMessage().contains("Malformed JSON"));
    }

    @Test
    void shouldRejectUnknownShape() {
        assertThrows(EnvelopeParseException.class, () -> parser.parse("{\"hello\":\"world\"}"));
        assertThrows(EnvelopeParseException.class, () -> parser.parse("[1,2,3]"));
        assertThrows(EnvelopeParseException.class, () -> parser.parse(""));
    }

    @Test
    void shouldDecodeChangeRecord() throws Exception {
        String payload = json(Map.of(
            "eventName", "REMOVE",
            "key", "cat.jpeg",
            "oldImage", Map.of("ImageName", "cat.jpeg", "BucketName", "photos")));

        ChangeRecord record = parser.parseChangeRecord(7L, payload);

        assertEquals(7L, record.sequence());
        assertEquals(ChangeOperation.REMOVE, record.operation());
        assertEquals("cat.jpeg", record.key());
        assertEquals("photos", record.oldImage().get("BucketName"));
        assertNull(record.newImage());
    }

    @Test
    void shouldRejectInconsistentChangeRecords() throws Exception {
        String unknownOperation = json(Map.of("eventName", "TRUNCATE", "key", "cat.jpeg"));
        String removeWithoutOldImage = json(Map.of("eventName", "REMOVE", "key", "cat.jpeg"));

        assertThrows(EnvelopeParseException.class, () -> parser.parseChangeRecord(1L, unknownOperation));
        assertThrows(EnvelopeParseException.class, () -> parser.parseChangeRecord(2L, removeWithoutOldImage));
        assertThrows(EnvelopeParseException.class, () -> parser.parseChangeRecord(3L, "garbage"));
    }

    private String json(Object value) throws Exception {
        return objectMapper.writeValueAsString(value);
    }

    private static Map<String, Object> notification(Map<?, ?>... records) {
        return Map.of("Records", List.of(records));
    }

    private static Map<String, Object> objectRecord(String eventName, String bucket, String key) {
        return Map.of(
            "eventSource", "aws:s3",
            "eventName", eventName,
            "s3", Map.of(
                "bucket", Map.of("name", bucket),
                "object", Map.of("key", key, "size", 1024)));
    }
}
