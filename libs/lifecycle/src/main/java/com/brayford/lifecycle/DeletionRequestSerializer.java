package com.brayford.lifecycle;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * JSON form of deletion requests and deleted-organization archives. Instants are written as
 * ISO-8601 strings, statuses by their canonical value.
 */
public final class DeletionRequestSerializer {

    private static final ObjectMapper MAPPER = createMapper();

    private DeletionRequestSerializer() {
        // utility class
    }

    private static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * @throws DeletionSerializationException if serialization fails
     */
    public static String serialize(DeletionRequest request) {
        try {
            return MAPPER.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new DeletionSerializationException("Failed to serialize deletion request: " + request.id(), e);
        }
    }

    /**
     * @throws DeletionSerializationException if the JSON is malformed or violates request invariants
     */
    public static DeletionRequest deserialize(String json) {
        try {
            return MAPPER.readValue(json, DeletionRequest.class);
        } catch (JsonProcessingException e) {
            throw new DeletionSerializationException("Failed to deserialize deletion request", e);
        }
    }

    public static String serializeArchive(DeletedOrganizationAudit audit) {
        try {
            return MAPPER.writeValueAsString(audit);
        } catch (JsonProcessingException e) {
            throw new DeletionSerializationException(
                    "Failed to serialize archive for organization: " + audit.organizationId(), e);
        }
    }

    /** Thrown when a deletion request or archive cannot be converted to or from JSON. */
    public static class DeletionSerializationException extends RuntimeException {
        public DeletionSerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
