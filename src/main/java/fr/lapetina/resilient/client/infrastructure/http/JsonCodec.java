package fr.lapetina.resilient.client.infrastructure.http;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.resilient.client.domain.model.ServiceResponse;

import java.io.UncheckedIOException;

/**
 * Shared Jackson configuration for request bodies and response payloads.
 */
public final class JsonCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private JsonCodec() {
        // Utility class
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * Serialises a request body. Strings are passed through untouched.
     */
    public static String encodeBody(Object body) {
        if (body instanceof String) {
            return (String) body;
        }
        try {
            return MAPPER.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialise request body", e);
        }
    }

    /**
     * Parses a response payload as a JSON tree.
     */
    public static JsonNode readTree(ServiceResponse response) {
        try {
            return MAPPER.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Response from " + response.uri() + " is not valid JSON", e);
        }
    }

    /**
     * Binds a response payload to a type.
     */
    public static <T> T read(ServiceResponse response, Class<T> type) {
        try {
            return MAPPER.readValue(response.body(), type);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Response from " + response.uri() + " cannot be read as " + type.getSimpleName(), e);
        }
    }
}
