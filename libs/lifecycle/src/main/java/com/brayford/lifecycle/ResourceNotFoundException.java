package com.brayford.lifecycle;

import com.brayford.security.BrayfordException;

/**
 * A referenced organization, member or deletion request does not exist.
 */
public class ResourceNotFoundException extends BrayfordException {

    public static final String CODE = "not-found";

    private final String resourceType;
    private final String resourceId;

    public ResourceNotFoundException(String resourceType, String resourceId) {
        super(resourceType + " not found: " + resourceId);
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }

    public String resourceType() {
        return resourceType;
    }

    public String resourceId() {
        return resourceId;
    }

    @Override
    public String errorCode() {
        return CODE;
    }
}
