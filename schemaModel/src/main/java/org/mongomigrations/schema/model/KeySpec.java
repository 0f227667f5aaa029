package org.mongomigrations.schema.model;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

/**
 * Ordered key specification shared by indexes and shard keys.
 * Serialized as a plain JSON object whose member order is the key order, e.g.
 * {@code {"tenant": 1, "createdAt": -1}}.
 */
@JsonSerialize(using = KeySpec.Serializer.class)
@JsonDeserialize(using = KeySpec.Deserializer.class)
public record KeySpec(List<KeyField> fields) {

    public KeySpec {
        if (fields == null || fields.isEmpty()) {
            throw new IllegalArgumentException("Key specification must contain at least one field");
        }
        var seen = new HashSet<String>();
        for (var field : fields) {
            if (!seen.add(field.path())) {
                throw new IllegalArgumentException("Duplicate key field: " + field.path());
            }
        }
        fields = List.copyOf(fields);
    }

    public static KeySpec of(KeyField... fields) {
        return new KeySpec(List.of(fields));
    }

    public boolean containsType(String type) {
        return fields.stream().anyMatch(f -> type.equals(f.type()));
    }

    static class Serializer extends JsonSerializer<KeySpec> {
        @Override
        public void serialize(KeySpec value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
            gen.writeStartObject();
            for (var field : value.fields()) {
                if (field.isDirectional()) {
                    gen.writeNumberField(field.path(), field.direction());
                } else {
                    gen.writeStringField(field.path(), field.type());
                }
            }
            gen.writeEndObject();
        }
    }

    static class Deserializer extends JsonDeserializer<KeySpec> {
        @Override
        public KeySpec deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            JsonNode node = p.readValueAsTree();
            if (node == null || !node.isObject()) {
                throw JsonMappingException.from(p, "Key specification must be a JSON object");
            }
            var fields = new ArrayList<KeyField>();
            Iterator<Map.Entry<String, JsonNode>> it = node.fields();
            while (it.hasNext()) {
                var entry = it.next();
                fields.add(toKeyField(p, entry.getKey(), entry.getValue()));
            }
            try {
                return new KeySpec(fields);
            } catch (IllegalArgumentException e) {
                throw JsonMappingException.from(p, e.getMessage(), e);
            }
        }

        private static KeyField toKeyField(JsonParser p, String path, JsonNode value) throws JsonMappingException {
            try {
                if (value.isNumber()) {
                    return new KeyField(path, toDirection(p, path, value), null);
                }
                if (value.isTextual()) {
                    return new KeyField(path, null, value.textValue());
                }
            } catch (IllegalArgumentException e) {
                throw JsonMappingException.from(p, e.getMessage(), e);
            }
            throw JsonMappingException.from(p,
                "Unsupported value for key field '" + path + "': " + value);
        }

        // mongosh prints some directions as 1.0
        private static int toDirection(JsonParser p, String path, JsonNode value) throws JsonMappingException {
            if (value.isIntegralNumber() && value.canConvertToInt()) {
                return value.intValue();
            }
            var number = value.doubleValue();
            if (!value.isIntegralNumber() && number == Math.rint(number)
                && number >= Integer.MIN_VALUE && number <= Integer.MAX_VALUE) {
                return (int) number;
            }
            throw JsonMappingException.from(p,
                "Direction of key field '" + path + "' must be a whole number in integer range: " + value);
        }
    }
}
