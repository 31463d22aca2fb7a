package com.ryuqq.kindstore.core.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.kindstore.core.key.Key;
import com.ryuqq.kindstore.core.model.Model;
import com.ryuqq.kindstore.core.model.ModelRegistry;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON serialization step backed by Jackson.
 *
 * <p>Plain JSON values map to {@code Boolean}, {@code Long}, {@code Double}, {@code String},
 * {@code Map} and {@code List}. Values JSON cannot represent are written as tagged objects
 * {@code {"__type": <tag>, "value": ...}}:</p>
 * <ul>
 *   <li>{@code blob} - byte[] as Base64</li>
 *   <li>{@code datetime} - ZonedDateTime as an ISO-8601 instant, read back in UTC</li>
 *   <li>{@code key} - Key as namespace + flat path</li>
 *   <li>{@code model} - an entity as model name + key + flattened wire data</li>
 * </ul>
 *
 * @author Kindstore Team
 * @since 1.0.0
 */
public final class JsonCodec implements ValueCodec {

    /**
     * Field carrying the type tag of non-standard JSON values.
     */
    public static final String TYPE_FIELD = "__type";

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    @Override
    public Object encode(Object value) {
        try {
            return MAPPER.writeValueAsString(toNode(value));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value cannot be serialized to JSON.", e);
        }
    }

    @Override
    public Object decode(Object value) {
        String json;
        if (value instanceof String text) {
            json = text;
        } else if (value instanceof byte[] bytes) {
            json = new String(bytes, StandardCharsets.UTF_8);
        } else {
            throw new IllegalArgumentException(
                "Value of type " + value.getClass().getSimpleName() + " is not JSON data.");
        }

        try {
            return fromNode(MAPPER.readTree(json));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON data.", e);
        }
    }

    private static JsonNode toNode(Object value) {
        if (value == null) {
            return NODES.nullNode();
        }
        if (value instanceof Boolean b) {
            return NODES.booleanNode(b);
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return NODES.numberNode(((Number) value).longValue());
        }
        if (value instanceof Double || value instanceof Float) {
            return NODES.numberNode(((Number) value).doubleValue());
        }
        if (value instanceof String s) {
            return NODES.textNode(s);
        }
        if (value instanceof byte[] bytes) {
            return tagged("blob", NODES.textNode(Base64.getEncoder().encodeToString(bytes)));
        }
        if (value instanceof ZonedDateTime dt) {
            return tagged("datetime", NODES.textNode(DateTimeFormatter.ISO_INSTANT.format(dt)));
        }
        if (value instanceof Key key) {
            return tagged("key", keyNode(key));
        }
        if (value instanceof Model entity) {
            ObjectNode node = NODES.objectNode();
            node.put("kind", entity.schema().modelName());
            node.set("key", keyNode(entity.getKey()));
            ObjectNode data = NODES.objectNode();
            for (Map.Entry<String, Object> field : entity.toEntityData().entrySet()) {
                data.set(field.getKey(), toNode(field.getValue()));
            }
            node.set("data", data);
            return tagged("model", node);
        }
        if (value instanceof Map<?, ?> map) {
            ObjectNode node = NODES.objectNode();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                node.set(String.valueOf(entry.getKey()), toNode(entry.getValue()));
            }
            return node;
        }
        if (value instanceof Collection<?> collection) {
            ArrayNode node = NODES.arrayNode();
            for (Object element : collection) {
                node.add(toNode(element));
            }
            return node;
        }
        throw new IllegalArgumentException(
            "Value of type " + value.getClass().getSimpleName() + " cannot be serialized.");
    }

    private static ObjectNode tagged(String type, JsonNode value) {
        ObjectNode node = NODES.objectNode();
        node.put(TYPE_FIELD, type);
        node.set("value", value);
        return node;
    }

    private static ObjectNode keyNode(Key key) {
        ObjectNode node = NODES.objectNode();
        node.put("namespace", key.getNamespace());
        ArrayNode path = node.putArray("path");
        for (Object segment : key.path()) {
            path.add(toNode(segment));
        }
        return node;
    }

    private static Object fromNode(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isObject()) {
            JsonNode type = node.get(TYPE_FIELD);
            if (type != null) {
                return fromTagged(type.asText(), node.get("value"));
            }
            Map<String, Object> map = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                map.put(field.getKey(), fromNode(field.getValue()));
            }
            return map;
        }
        if (node.isArray()) {
            List<Object> list = new ArrayList<>(node.size());
            for (JsonNode element : node) {
                list.add(fromNode(element));
            }
            return list;
        }
        if (node.isIntegralNumber()) {
            return node.longValue();
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        return node.asText();
    }

    private static Object fromTagged(String type, JsonNode value) {
        switch (type) {
            case "blob":
                return Base64.getDecoder().decode(value.asText());
            case "datetime":
                return Instant.parse(value.asText()).atZone(ZoneOffset.UTC);
            case "key":
                return keyFromNode(value);
            case "model":
                Key key = keyFromNode(value.get("key"));
                Map<String, Object> data = new LinkedHashMap<>();
                Iterator<Map.Entry<String, JsonNode>> fields = value.get("data").fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> field = fields.next();
                    data.put(field.getKey(), fromNode(field.getValue()));
                }
                return ModelRegistry.lookup(value.get("kind").asText()).load(key, data);
            default:
                throw new IllegalArgumentException("Invalid kind '" + type + "'.");
        }
    }

    private static Key keyFromNode(JsonNode node) {
        List<Object> path = new ArrayList<>();
        for (JsonNode segment : node.get("path")) {
            path.add(fromNode(segment));
        }
        JsonNode namespace = node.get("namespace");
        return Key.fromPath(namespace == null || namespace.isNull() ? null : namespace.asText(), path);
    }
}
