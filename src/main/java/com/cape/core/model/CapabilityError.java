package com.cape.core.model;

import com.cape.core.error.CapeException;
import com.cape.core.error.ErrorKind;

/**
 * Error attached to a failed result.
 *
 * @param kind    failure category
 * @param message human-readable detail
 */
public record CapabilityError(ErrorKind kind, String message) {

    public CapabilityError {
        if (kind == null) {
            throw new IllegalArgumentException("Error kind is required");
        }
        message = message == null ? "" : message;
    }

    public static CapabilityError of(CapeException e) {
        return new CapabilityError(e.getKind(), e.getDetail());
    }
}
