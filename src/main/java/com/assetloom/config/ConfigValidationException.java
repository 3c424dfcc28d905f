package com.assetloom.config;

/**
 * Exception thrown when a configuration value is missing, mistyped or out of range.
 */
public class ConfigValidationException extends Exception {

    public ConfigValidationException(String message) {
        super(message);
    }
}
