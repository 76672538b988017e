package com.finops.advisor.adapters;

/**
 * Raised when a resource population cannot be listed at all.
 */
public class ResourceEnumerationException extends RuntimeException {

    public ResourceEnumerationException(String message) {
        super(message);
    }

    public ResourceEnumerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
