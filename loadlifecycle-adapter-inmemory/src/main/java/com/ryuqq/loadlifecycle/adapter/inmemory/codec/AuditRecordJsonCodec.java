package com.ryuqq.loadlifecycle.adapter.inmemory.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.loadlifecycle.core.model.ActorRole;
import com.ryuqq.loadlifecycle.core.model.TransitionAuditRecord;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Renders {@link TransitionAuditRecord} in the persisted row layout and back.
 *
 * <p><strong>Layout (field order fixed):</strong></p>
 * <pre>
 * {
 *   "entityId": "42",
 *   "fromState": "POSTED",
 *   "toState": "BIDDING",
 *   "transitionId": "POSTED_TO_BIDDING",
 *   "triggerType": "USER_ACTION",
 *   "triggerEvent": "first_bid_received",
 *   "actorId": "catalyst-9",
 *   "actorRole": "CATALYST",
 *   "guardsPassed": [],
 *   "effectsExecuted": ["notification:first_bid_received"],
 *   "metadata": {},
 *   "success": true,
 *   "errorMessage": null,
 *   "timestamp": "2024-05-01T10:15:30Z"
 * }
 * </pre>
 *
 * <p>Timestamps are ISO-8601 instants. Metadata values must be JSON-representable.</p>
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public class AuditRecordJsonCodec {

    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public AuditRecordJsonCodec() {
        this(new ObjectMapper());
    }

    public AuditRecordJsonCodec(ObjectMapper objectMapper) {
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper cannot be null");
        }
        this.objectMapper = objectMapper;
    }

    /**
     * Encodes one record.
     *
     * @param record the audit record
     * @return JSON text
     * @throws IllegalArgumentException if record is null or its metadata cannot be serialized
     */
    public String encode(TransitionAuditRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }

        ObjectNode root = objectMapper.createObjectNode();
        root.put("entityId", record.entityId());
        root.put("fromState", record.fromState());
        root.put("toState", record.toState());
        root.put("transitionId", record.transitionId());
        root.put("triggerType", record.triggerType());
        root.put("triggerEvent", record.triggerEvent());
        root.put("actorId", record.actorId());
        root.put("actorRole", record.actorRole().name());
        ArrayNode guards = root.putArray("guardsPassed");
        record.guardsPassed().forEach(guards::add);
        ArrayNode effects = root.putArray("effectsExecuted");
        record.effectsExecuted().forEach(effects::add);
        root.set("metadata", objectMapper.valueToTree(record.metadata()));
        root.put("success", record.success());
        root.put("errorMessage", record.errorMessage());
        root.put("timestamp", record.timestamp().toString());

        try {
            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot encode audit record for " + record.entityId(), e);
        }
    }

    /**
     * Decodes one record.
     *
     * @param json JSON text in the persisted layout
     * @return the audit record
     * @throws IllegalArgumentException if the text is not a valid audit record
     */
    public TransitionAuditRecord decode(String json) {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException("json cannot be null or blank");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed audit record JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Audit record JSON must be an object");
        }

        try {
            return new TransitionAuditRecord(
                text(root, "entityId"),
                text(root, "fromState"),
                text(root, "toState"),
                text(root, "transitionId"),
                text(root, "triggerType"),
                text(root, "triggerEvent"),
                text(root, "actorId"),
                ActorRole.valueOf(required(root, "actorRole").asText()),
                strings(root.path("guardsPassed")),
                strings(root.path("effectsExecuted")),
                root.hasNonNull("metadata") ? objectMapper.convertValue(root.get("metadata"), METADATA_TYPE) : Map.of(),
                required(root, "success").asBoolean(),
                text(root, "errorMessage"),
                Instant.parse(required(root, "timestamp").asText())
            );
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid audit record timestamp", e);
        }
    }

    private static JsonNode required(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            throw new IllegalArgumentException("Audit record JSON is missing " + field);
        }
        return node;
    }

    private static String text(JsonNode root, String field) {
        JsonNode node = root.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }

    private static List<String> strings(JsonNode array) {
        List<String> values = new ArrayList<>();
        if (array.isArray()) {
            array.forEach(node -> values.add(node.asText()));
        }
        return values;
    }
}
