package com.socialgenius.browseruse.backend.service;

import com.socialgenius.browseruse.backend.model.AuthErrorCode;

/**
 * Verdict of {@link OutcomeClassifier}. Successful outcomes carry no code.
 */
public record Outcome(boolean success, AuthErrorCode code, String message) {

    static final String SUCCESS_MESSAGE = "Successfully authenticated with Google";
    static final String GENERIC_FAILURE_MESSAGE = "Failed to log in to Google";

    public static Outcome succeeded() {
        return new Outcome(true, null, SUCCESS_MESSAGE);
    }

    public static Outcome failed(AuthErrorCode code) {
        return new Outcome(false, code, "Authentication failed: " + code.displayName());
    }

    public static Outcome unrecognizedFailure() {
        return new Outcome(false, AuthErrorCode.LOGIN_FAILED, GENERIC_FAILURE_MESSAGE);
    }
}
