package org.mongomigrations.schema.io;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.mongomigrations.schema.model.SchemaSnapshot;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.exc.ValueInstantiationException;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads and writes the persisted JSON form of a {@link SchemaSnapshot}, and the other
 * JSON input files of the toolkit. Every structural problem is reported as a
 * {@link DeserializationException} naming the offending location.
 */
@Slf4j
public class SchemaSerializer {

    private final ObjectMapper objectMapper;

    public SchemaSerializer() {
        this(createObjectMapper());
    }

    public SchemaSerializer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public static ObjectMapper createObjectMapper() {
        return new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    public SchemaSnapshot read(Path schemaFile) throws IOException {
        log.debug("Reading schema from {}", schemaFile);
        return fromJson(Files.readString(schemaFile, StandardCharsets.UTF_8), schemaFile.toString());
    }

    public SchemaSnapshot fromJson(String json) throws DeserializationException {
        return fromJson(json, "<input>");
    }

    public void write(SchemaSnapshot snapshot, Path schemaFile) throws IOException {
        var parent = schemaFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(schemaFile, toJson(snapshot), StandardCharsets.UTF_8);
        log.debug("Wrote schema with {} databases to {}", snapshot.databases().size(), schemaFile);
    }

    public String toJson(SchemaSnapshot snapshot) {
        try {
            return objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            // Only reachable through a programming error in the model bindings
            throw new IllegalStateException("Unable to serialize schema snapshot", e);
        }
    }

    /**
     * Reads a JSON array of entries, such as the index or query input files.
     */
    public <T> List<T> readList(Path file, TypeReference<List<T>> type) throws IOException {
        var content = Files.readString(file, StandardCharsets.UTF_8);
        try {
            var entries = objectMapper.readValue(content, type);
            if (entries == null) {
                throw new DeserializationException(file + ": expected a JSON array but found null");
            }
            return entries;
        } catch (JsonProcessingException e) {
            throw toDeserializationException(file.toString(), e);
        }
    }

    private SchemaSnapshot fromJson(String json, String source) throws DeserializationException {
        try {
            var snapshot = objectMapper.readValue(json, SchemaSnapshot.class);
            if (snapshot == null) {
                throw new DeserializationException(source + ": schema document is empty");
            }
            return snapshot;
        } catch (JsonProcessingException e) {
            throw toDeserializationException(source, e);
        }
    }

    private static DeserializationException toDeserializationException(String source, JsonProcessingException e) {
        String detail;
        if (e instanceof ValueInstantiationException && e.getCause() != null) {
            detail = e.getCause().getMessage();
        } else {
            detail = e.getOriginalMessage();
        }
        var location = e instanceof JsonMappingException
            ? ((JsonMappingException) e).getPathReference()
            : null;
        var message = new StringBuilder(source).append(": ").append(detail);
        if (location != null && !location.isEmpty()) {
            message.append(" (at ").append(location).append(")");
        }
        return new DeserializationException(message.toString(), e);
    }
}
