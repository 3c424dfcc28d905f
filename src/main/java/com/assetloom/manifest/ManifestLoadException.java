package com.assetloom.manifest;

/**
 * Exception thrown when an asset manifest cannot be read or has the wrong shape.
 */
public class ManifestLoadException extends Exception {

    public ManifestLoadException(String message) {
        super(message);
    }

    public ManifestLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
