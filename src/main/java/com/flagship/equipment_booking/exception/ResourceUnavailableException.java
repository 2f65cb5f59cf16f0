package com.flagship.equipment_booking.exception;

import lombok.Getter;

import java.util.List;

/**
 * Raised when an asset or kit exists but cannot be reserved for the
 * requested window.
 */
@Getter
public class ResourceUnavailableException extends RuntimeException {

    private final List<String> unavailableAssetIds;

    public ResourceUnavailableException(String message) {
        this(message, List.of());
    }

    public ResourceUnavailableException(String message, List<String> unavailableAssetIds) {
        super(message);
        this.unavailableAssetIds = unavailableAssetIds == null ? List.of() : List.copyOf(unavailableAssetIds);
    }
}
