package com.flagship.equipment_booking.exception;

import lombok.Getter;

/**
 * Raised when a booking, asset, kit, group or record id does not exist.
 * Kept distinct from {@link ResourceUnavailableException} so callers can tell
 * "doesn't exist" apart from "exists but busy".
 */
@Getter
public class ResourceNotFoundException extends RuntimeException {

    private final String resourceType;
    private final String resourceId;

    public ResourceNotFoundException(String resourceType, String resourceId) {
        super(String.format("%s %s not found", resourceType, resourceId));
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }
}
