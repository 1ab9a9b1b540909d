package com.socialgenius.browseruse.backend.agent;

/**
 * A browsing context operation failed.
 */
public class BrowserOperationException extends RuntimeException {

    public BrowserOperationException(String message) {
        super(message);
    }

    public BrowserOperationException(String message, Throwable cause) {
        super(message, cause);
    }
}
