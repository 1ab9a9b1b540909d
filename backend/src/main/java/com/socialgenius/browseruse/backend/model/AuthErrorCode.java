package com.socialgenius.browseruse.backend.model;

/**
 * Error codes reported inside a task's terminal result.
 */
public enum AuthErrorCode {
    WRONG_PASSWORD,
    EMAIL_NOT_FOUND,
    SUSPICIOUS_ACTIVITY,
    VERIFICATION_REQUIRED,
    TWO_FACTOR_REQUIRED,
    ACCOUNT_DISABLED,
    TOO_MANY_ATTEMPTS,
    CAPTCHA_CHALLENGE,
    // Login did not succeed and no specific cause was recognized
    LOGIN_FAILED,
    TIMEOUT,
    AUTH_ERROR,
    TERMINATED;

    /**
     * Human readable form, e.g. {@code TWO_FACTOR_REQUIRED} becomes "Two Factor Required".
     */
    public String displayName() {
        StringBuilder sb = new StringBuilder();
        for (String word : name().split("_")) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(word.charAt(0)).append(word.substring(1).toLowerCase());
        }
        return sb.toString();
    }
}
