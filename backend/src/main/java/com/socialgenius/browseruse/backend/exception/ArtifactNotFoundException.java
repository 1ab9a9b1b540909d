package com.socialgenius.browseruse.backend.exception;

/**
 * A screenshot directory or file that was asked for does not exist.
 */
public class ArtifactNotFoundException extends RuntimeException {

    public ArtifactNotFoundException(String message) {
        super(message);
    }
}
