package com.socialgenius.browseruse.backend.service;

import com.socialgenius.browseruse.backend.model.AuthErrorCode;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Phrase table that drives {@link OutcomeClassifier}. Failure rules are kept in priority
 * order: when agent output matches several rules, the earliest one wins.
 * <p>
 * All phrases are stored lower-cased; matching is a plain substring test.
 */
public final class OutcomeRuleTable {

    private final List<String> successPhrases;
    private final List<FailureRule> failureRules;
    private final List<String> sessionActivePhrases;

    private OutcomeRuleTable(Builder builder) {
        this.successPhrases = List.copyOf(builder.successPhrases);
        this.failureRules = List.copyOf(builder.failureRules);
        this.sessionActivePhrases = List.copyOf(builder.sessionActivePhrases);
    }

    /**
     * The table used for Google sign-in flows.
     */
    public static OutcomeRuleTable defaults() {
        return builder()
                .successPhrases(
                        "successfully logged in",
                        "login successful",
                        "logged in successfully",
                        "reached google account",
                        "reached a google account page",
                        "reached the google account dashboard",
                        "reached the account dashboard")
                .failureRule(AuthErrorCode.WRONG_PASSWORD,
                        "password is incorrect",
                        "wrong password",
                        "password was incorrect",
                        "your password was incorrect",
                        "check your password")
                .failureRule(AuthErrorCode.EMAIL_NOT_FOUND,
                        "couldn't find your google account",
                        "couldn't find account",
                        "email not found",
                        "no account found")
                .failureRule(AuthErrorCode.SUSPICIOUS_ACTIVITY,
                        "unusual activity",
                        "suspicious activity",
                        "unusual sign in",
                        "suspicious login attempt",
                        "security alert",
                        "security challenge")
                .failureRule(AuthErrorCode.VERIFICATION_REQUIRED,
                        "verification required",
                        "verify it's you",
                        "confirm your identity",
                        "additional verification",
                        "needs additional verification")
                .failureRule(AuthErrorCode.TWO_FACTOR_REQUIRED,
                        "2-step verification",
                        "two-factor",
                        "2fa",
                        "enter verification code",
                        "enter the code")
                .failureRule(AuthErrorCode.ACCOUNT_DISABLED,
                        "account disabled",
                        "account has been disabled",
                        "account suspended")
                .failureRule(AuthErrorCode.TOO_MANY_ATTEMPTS,
                        "too many failed attempts",
                        "try again later",
                        "temporary lock",
                        "account is locked")
                .failureRule(AuthErrorCode.CAPTCHA_CHALLENGE,
                        "captcha",
                        "security check",
                        "prove you're not a robot",
                        "recaptcha")
                .sessionActivePhrases(
                        "logged in",
                        "google account",
                        "personal info",
                        "you're signed in",
                        "welcome to your account")
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts a builder pre-filled with this table, for extending it.
     */
    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.successPhrases.addAll(successPhrases);
        builder.failureRules.addAll(failureRules);
        builder.sessionActivePhrases.addAll(sessionActivePhrases);
        return builder;
    }

    public List<String> successPhrases() {
        return successPhrases;
    }

    public List<FailureRule> failureRules() {
        return failureRules;
    }

    /**
     * Phrases showing that a restored session still lands on a signed-in page.
     */
    public List<String> sessionActivePhrases() {
        return sessionActivePhrases;
    }

    /**
     * One failure category and the phrases that identify it.
     */
    public record FailureRule(AuthErrorCode code, List<String> phrases) {

        public FailureRule {
            phrases = normalize(phrases);
        }
    }

    public static final class Builder {

        private final List<String> successPhrases = new ArrayList<>();
        private final List<FailureRule> failureRules = new ArrayList<>();
        private final List<String> sessionActivePhrases = new ArrayList<>();

        private Builder() {
        }

        public Builder successPhrases(String... phrases) {
            successPhrases.addAll(normalize(List.of(phrases)));
            return this;
        }

        /**
         * Appends a rule with lower priority than every rule added before it.
         */
        public Builder failureRule(AuthErrorCode code, String... phrases) {
            failureRules.add(new FailureRule(code, List.of(phrases)));
            return this;
        }

        /**
         * Inserts a rule ahead of all existing ones.
         */
        public Builder priorityFailureRule(AuthErrorCode code, String... phrases) {
            failureRules.add(0, new FailureRule(code, List.of(phrases)));
            return this;
        }

        public Builder sessionActivePhrases(String... phrases) {
            sessionActivePhrases.addAll(normalize(List.of(phrases)));
            return this;
        }

        public OutcomeRuleTable build() {
            return new OutcomeRuleTable(this);
        }
    }

    private static List<String> normalize(List<String> phrases) {
        return phrases.stream()
                .filter(phrase -> phrase != null && !phrase.isBlank())
                .map(phrase -> phrase.toLowerCase(Locale.ROOT))
                .toList();
    }
}
