package com.starscape.imagepipeline.features.routing.infra;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.starscape.imagepipeline.common.exception.EnvelopeParseException;
import com.starscape.imagepipeline.features.changestream.domain.ChangeOperation;
import com.starscape.imagepipeline.features.changestream.domain.ChangeRecord;
import com.starscape.imagepipeline.features.changestream.domain.ChangeRecordPayload;
import com.starscape.imagepipeline.features.routing.domain.EventKind;
import com.starscape.imagepipeline.features.routing.domain.NormalizedEvent;
import com.starscape.imagepipeline.features.routing.domain.ParseFailure;
import com.starscape.imagepipeline.features.routing.domain.ParsedEnvelope;
import com.starscape.imagepipeline.features.routing.infra.envelope.MessageAttribute;
import com.starscape.imagepipeline.features.routing.infra.envelope.ObjectStoreEntity;
import com.starscape.imagepipeline.features.routing.infra.envelope.ObjectStoreRecord;
import com.starscape.imagepipeline.features.routing.infra.envelope.PubSubMessage;
import com.starscape.imagepipeline.features.routing.infra.envelope.PubSubRecord;
import com.starscape.imagepipeline.features.routing.infra.envelope.QueueMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Unwraps inbound envelopes into normalized events.
 *
 * Accepted shapes, outermost first:
 * - a queue batch whose record bodies are pub/sub wrappers or object-store notifications
 * - a pub/sub event batch (push delivery) whose messages carry object-store notifications
 * - a single pub/sub wrapper
 * - an object-store notification
 *
 * A pub/sub message with message attributes and no event list is an attribute change.
 * Within an event list each record is decoded on its own; a bad record becomes a
 * {@link ParseFailure} and its siblings are still returned.
 */
@Component
public class EnvelopeParser {

    private static final Logger log = LoggerFactory.getLogger(EnvelopeParser.class);

    private static final String RECORDS = "Records";
    private static final String TEST_EVENT = "s3:TestEvent";
    private static final String ATTRIBUTE_KEY_FIELD = "name";

    private final ObjectMapper objectMapper;

    public EnvelopeParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Parse one raw envelope.
     * @throws EnvelopeParseException if the envelope as a whole is malformed or unrecognized
     */
    public ParsedEnvelope parse(String rawEnvelope) {
        JsonNode root = readTree(rawEnvelope, "envelope");
        List<NormalizedEvent> events = new ArrayList<>();
        List<ParseFailure> failures = new ArrayList<>();

        JsonNode records = root.get(RECORDS);
        if (records != null && records.isArray()) {
            decodeRecordList(records, events, failures);
        } else if (root.hasNonNull("Message")) {
            decodePubSub(toValue(root, PubSubMessage.class), events, failures);
        } else if (!isTestEvent(root)) {
            throw new EnvelopeParseException("Unrecognized envelope shape");
        }

        log.debug("Parsed envelope: {} event(s), {} failure(s)", events.size(), failures.size());
        return new ParsedEnvelope(events, failures);
    }

    /**
     * Decode one flat change-log record.
     * @throws EnvelopeParseException if the payload is malformed or inconsistent with its operation
     */
    public ChangeRecord parseChangeRecord(long sequence, String payload) {
        ChangeRecordPayload record;
        try {
            record = objectMapper.readValue(payload, ChangeRecordPayload.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new EnvelopeParseException("Malformed change record " + sequence, e);
        }
        if (record == null || record.eventName() == null) {
            throw new EnvelopeParseException("Change record " + sequence + " has no event name");
        }

        ChangeOperation operation;
        try {
            operation = ChangeOperation.valueOf(record.eventName());
        } catch (IllegalArgumentException e) {
            throw new EnvelopeParseException("Unrecognized change operation: " + record.eventName(), e);
        }
        if (record.key() == null || record.key().isEmpty()) {
            throw new EnvelopeParseException("Change record " + sequence + " has no key");
        }

        boolean consistent = switch (operation) {
            case INSERT -> record.newImage() != null;
            case MODIFY -> record.oldImage() != null && record.newImage() != null;
            case REMOVE -> record.oldImage() != null;
        };
        if (!consistent) {
            throw new EnvelopeParseException("Change record " + sequence + " lacks the image required for " + operation);
        }
        return new ChangeRecord(sequence, operation, record.key(), record.oldImage(), record.newImage());
    }

    private void decodeRecordList(JsonNode records, List<NormalizedEvent> events, List<ParseFailure> failures) {
        for (JsonNode record : records) {
            isolate(record.toString(), failures, () -> decodeListRecord(record, events, failures));
        }
    }

    /**
     * Each entry of an event list is classified on its own, so one unrecognizable entry
     * does not decide how its siblings are read.
     */
    private void decodeListRecord(JsonNode record, List<NormalizedEvent> events, List<ParseFailure> failures) {
        if (!record.isObject()) {
            throw new EnvelopeParseException("Event list entry is not a JSON object");
        }
        if (record.has("body")) {
            decodeQueueMessage(record, events, failures);
        } else if (record.has("Sns")) {
            decodePubSub(requirePubSub(toValue(record, PubSubRecord.class)), events, failures);
        } else if (record.has("s3") || record.has("eventName")) {
            events.add(toObjectEvent(toValue(record, ObjectStoreRecord.class)));
        } else {
            throw new EnvelopeParseException("Unrecognized event list entry");
        }
    }

    private void decodeQueueMessage(JsonNode record, List<NormalizedEvent> events, List<ParseFailure> failures) {
        QueueMessage message = toValue(record, QueueMessage.class);
        if (message.body() == null) {
            throw new EnvelopeParseException("Queue record has no body");
        }

        isolate(message.body(), failures, () -> {
            JsonNode body = readTree(message.body(), "queue message body");
            JsonNode nested = body.get(RECORDS);
            if (body.hasNonNull("Message")) {
                decodePubSub(toValue(body, PubSubMessage.class), events, failures);
            } else if (nested != null && nested.isArray()) {
                decodeObjectStoreRecords(nested, events, failures);
            } else if (!isTestEvent(body)) {
                throw new EnvelopeParseException("Unrecognized queue message body");
            }
        });
    }

    private void decodePubSub(PubSubMessage message, List<NormalizedEvent> events, List<ParseFailure> failures) {
        if (message.message() == null) {
            throw new EnvelopeParseException("Pub/sub wrapper has no message");
        }
        JsonNode body = readTree(message.message(), "pub/sub message");
        JsonNode records = body.get(RECORDS);

        if (records != null && records.isArray()) {
            decodeObjectStoreRecords(records, events, failures);
        } else if (isTestEvent(body)) {
            log.debug("Ignoring provider test event");
        } else if (message.messageAttributes() != null && !message.messageAttributes().isEmpty()) {
            events.add(toAttributeChanged(body, message.messageAttributes()));
        } else {
            throw new EnvelopeParseException("Pub/sub message carries neither events nor attributes");
        }
    }

    private NormalizedEvent toAttributeChanged(JsonNode body, Map<String, MessageAttribute> messageAttributes) {
        JsonNode name = body.get(ATTRIBUTE_KEY_FIELD);
        if (name == null || !name.isTextual() || name.asText().isEmpty()) {
            throw new EnvelopeParseException("Attribute message has no '" + ATTRIBUTE_KEY_FIELD + "' field");
        }

        Map<String, String> attributes = new LinkedHashMap<>();
        messageAttributes.forEach((attributeName, attribute) -> {
            if (attribute != null && attribute.value() != null) {
                attributes.put(attributeName, attribute.value());
            }
        });

        Map<String, String> payload = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = body.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (field.getValue().isValueNode() && !field.getValue().isNull()) {
                payload.put(field.getKey(), field.getValue().asText());
            }
        }
        return NormalizedEvent.attributeChanged(name.asText(), attributes, payload);
    }

    private void decodeObjectStoreRecords(JsonNode records, List<NormalizedEvent> events, List<ParseFailure> failures) {
        for (JsonNode record : records) {
            isolate(record.toString(), failures, () ->
                    events.add(toObjectEvent(toValue(record, ObjectStoreRecord.class))));
        }
    }

    private NormalizedEvent toObjectEvent(ObjectStoreRecord record) {
        String eventName = record.eventName();
        EventKind kind = EventKind.fromObjectEventName(eventName)
                .orElseThrow(() -> new EnvelopeParseException("Unrecognized event type: " + eventName));

        ObjectStoreEntity entity = record.entity();
        if (entity == null || entity.bucket() == null || entity.object() == null) {
            throw new EnvelopeParseException("Object-store record lacks bucket or object");
        }
        String bucket = entity.bucket().name();
        String rawKey = entity.object().key();
        if (bucket == null || bucket.isBlank()) {
            throw new EnvelopeParseException("Object-store record has no bucket name");
        }
        if (rawKey == null || rawKey.isEmpty()) {
            throw new EnvelopeParseException("Object-store record has no object key");
        }
        return NormalizedEvent.objectEvent(kind, eventName, bucket, decodeKey(rawKey));
    }

    /**
     * Object keys arrive form-encoded: '+' stands for a space and reserved characters are %-escaped.
     * The escaped bytes must form valid UTF-8.
     */
    static String decodeKey(String rawKey) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream(rawKey.length());
        int i = 0;
        while (i < rawKey.length()) {
            char c = rawKey.charAt(i);
            if (c == '%') {
                int high = i + 1 < rawKey.length() ? Character.digit(rawKey.charAt(i + 1), 16) : -1;
                int low = i + 2 < rawKey.length() ? Character.digit(rawKey.charAt(i + 2), 16) : -1;
                if (high < 0 || low < 0) {
                    throw new EnvelopeParseException("Malformed object key: " + rawKey);
                }
                bytes.write((high << 4) | low);
                i += 3;
            } else {
                int next = rawKey.indexOf('%', i);
                int end = next < 0 ? rawKey.length() : next;
                bytes.writeBytes(rawKey.substring(i, end).replace('+', ' ').getBytes(StandardCharsets.UTF_8));
                i = end;
            }
        }

        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            return decoder.decode(ByteBuffer.wrap(bytes.toByteArray())).toString();
        } catch (CharacterCodingException e) {
            throw new EnvelopeParseException("Malformed object key: " + rawKey, e);
        }
    }

    private PubSubMessage requirePubSub(PubSubRecord record) {
        if (record.message() == null) {
            throw new EnvelopeParseException("Pub/sub record has no message");
        }
        return record.message();
    }

    private boolean isTestEvent(JsonNode node) {
        return TEST_EVENT.equals(node.path("Event").asText(null));
    }

    private void isolate(String rawFragment, List<ParseFailure> failures, Runnable decode) {
        try {
            decode.run();
        } catch (EnvelopeParseException | IllegalArgumentException e) {
            log.warn("Isolating unparseable record: {}", e.getMessage());
            failures.add(new ParseFailure(rawFragment, e.getMessage()));
        }
    }

    private JsonNode readTree(String json, String what) {
        if (json == null || json.isBlank()) {
            throw new EnvelopeParseException("Empty " + what);
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new EnvelopeParseException("Malformed JSON in " + what, e);
        }
        if (node == null || !node.isObject()) {
            throw new EnvelopeParseException("Expected a JSON object in " + what);
        }
        return node;
    }

    private <T> T toValue(JsonNode node, Class<T> type) {
        if (node == null || !node.isObject()) {
            throw new EnvelopeParseException("Expected a JSON object for " + type.getSimpleName());
        }
        T value;
        try {
            value = objectMapper.treeToValue(node, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new EnvelopeParseException("Cannot decode " + type.getSimpleName(), e);
        }
        if (value == null) {
            throw new EnvelopeParseException("Empty " + type.getSimpleName());
        }
        return value;
    }
}
