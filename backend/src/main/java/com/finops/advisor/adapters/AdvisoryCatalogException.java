package com.finops.advisor.adapters;

/**
 * Raised when the advisory catalog cannot be reached or listed.
 */
public class AdvisoryCatalogException extends RuntimeException {

    public AdvisoryCatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
