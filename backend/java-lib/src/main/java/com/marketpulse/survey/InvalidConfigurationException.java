package com.marketpulse.survey;

/**
 * Raised when a caller supplies a policy the pipeline cannot honor: an unknown strategy or
 * method name, a non-positive multiplier, an unknown column and the like
 * Always raised before any row is touched; the pipeline never substitutes a default.
 */
public class InvalidConfigurationException extends RuntimeException {

    public InvalidConfigurationException(String message) {
        super(message);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
