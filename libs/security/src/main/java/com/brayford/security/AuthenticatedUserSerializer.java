package com.brayford.security;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Base64;

/**
 * Encodes and decodes {@link AuthenticatedUser} for propagation in a request header.
 *
 * <p>The identity layer in front of the service serializes the caller to JSON and Base64-encodes
 * it so it survives as a single header value.
 */
public final class AuthenticatedUserSerializer {

    /** Header that carries the encoded caller. */
    public static final String HEADER = "X-Brayford-User";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private AuthenticatedUserSerializer() {
        // utility class
    }

    /**
     * @throws CallerSerializationException if serialization fails
     */
    public static String serialize(AuthenticatedUser user) {
        try {
            byte[] json = MAPPER.writeValueAsBytes(user);
            return Base64.getEncoder().encodeToString(json);
        } catch (JsonProcessingException e) {
            throw new CallerSerializationException("Failed to serialize caller", e);
        }
    }

    /**
     * @throws CallerSerializationException if the value is not Base64 JSON of a valid caller
     */
    public static AuthenticatedUser deserialize(String encoded) {
        try {
            byte[] json = Base64.getDecoder().decode(encoded);
            return MAPPER.readValue(json, AuthenticatedUser.class);
        } catch (Exception e) {
            throw new CallerSerializationException("Failed to deserialize caller", e);
        }
    }

    /**
     * Exception thrown when the caller header cannot be encoded or decoded.
     */
    public static class CallerSerializationException extends RuntimeException {
        public CallerSerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
