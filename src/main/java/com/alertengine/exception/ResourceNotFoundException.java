package com.alertengine.exception;

import java.util.Map;

/**
 * Raised when a REST lookup names an alert, incident or rule the engine does not hold.
 */
public class ResourceNotFoundException extends BaseException {

    public ResourceNotFoundException(String resourceType, String identifier) {
        super(
                ErrorCode.NOT_FOUND,
                String.format("%s '%s' not found", resourceType, identifier),
                Map.of("resource", resourceType, "id", String.valueOf(identifier)));
    }
}
