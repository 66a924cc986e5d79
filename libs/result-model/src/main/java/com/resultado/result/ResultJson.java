package com.resultado.result;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.util.Optional;

/**
 * JSON rendering of {@link Result} and {@link ValidationError} values.
 *
 * <p>Kinds and severities are written by name. Absent message, detail, trace id, pointer,
 * severity and code are left out. The {@code errors} property of a failure is the computed view
 * from {@link Failure#errors()}.
 */
public final class ResultJson {

    private static final ObjectMapper MAPPER = createMapper();

    private ResultJson() {
        // utility class
    }

    private static ObjectMapper createMapper() {
        return new ObjectMapper().disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
    }

    /**
     * Serializes a result to a JSON string.
     *
     * @throws ResultSerializationException if the value cannot be serialized
     */
    public static String serialize(Result<?> result) {
        return write(result);
    }

    /**
     * Serializes a validation error to a JSON string.
     *
     * @throws ResultSerializationException if serialization fails
     */
    public static String serialize(ValidationError error) {
        return write(error);
    }

    /**
     * Reads a validation error back from JSON.
     *
     * @throws ResultSerializationException if the JSON is malformed or lacks a detail
     */
    public static ValidationError deserializeValidationError(String json) {
        try {
            return MAPPER.readValue(json, ValidationError.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ResultSerializationException("Failed to deserialize validation error", e);
        }
    }

    /** Safely reads a validation error, returning empty on failure. */
    public static Optional<ValidationError> tryDeserializeValidationError(String json) {
        try {
            return Optional.of(deserializeValidationError(json));
        } catch (ResultSerializationException e) {
            return Optional.empty();
        }
    }

    /** Returns the shared ObjectMapper (for advanced use). */
    public static ObjectMapper objectMapper() {
        return MAPPER;
    }

    private static String write(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new ResultSerializationException("Failed to serialize " + value, e);
        }
    }

    /** Thrown when a value cannot be converted to or from JSON. */
    public static class ResultSerializationException extends RuntimeException {
        public ResultSerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
