package com.socialgenius.browseruse.backend.service;

import com.socialgenius.browseruse.backend.model.AuthErrorCode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class OutcomeClassifierTest {

    private final OutcomeClassifier classifier = new OutcomeClassifier(OutcomeRuleTable.defaults());

    @Test
    void shouldRecognizeSuccess() {
        Outcome outcome = classifier.classify("I have SUCCESSFULLY LOGGED IN and reached the account page.");

        assertTrue(outcome.success());
        assertNull(outcome.code());
        assertEquals("Successfully authenticated with Google", outcome.message());
    }

    @Test
    void shouldPreferSuccessOverFailureWords() {
        Outcome outcome = classifier.classify("Login successful. There was an error banner earlier but it went away.");

        assertTrue(outcome.success());
    }

    @Test
    void shouldUseEarliestMatchingFailureRule() {
        Outcome outcome = classifier.classify("A captcha appeared, then Google said the password is incorrect.");

        assertFalse(outcome.success());
        assertEquals(AuthErrorCode.WRONG_PASSWORD, outcome.code());
        assertEquals("Authentication failed: Wrong Password", outcome.message());
    }

    @Test
    void shouldRecognizeTwoFactor() {
        Outcome outcome = classifier.classify("Google is asking for 2-Step Verification on the phone.");

        assertEquals(AuthErrorCode.TWO_FACTOR_REQUIRED, outcome.code());
    }

    @Test
    void shouldFallBackToLoginFailed() {
        assertEquals(AuthErrorCode.LOGIN_FAILED, classifier.classify("").code());
        assertEquals(AuthErrorCode.LOGIN_FAILED, classifier.classify(null).code());
        Outcome unknown = classifier.classify("The page showed something unexpected.");
        assertEquals(AuthErrorCode.LOGIN_FAILED, unknown.code());
        assertEquals("Failed to log in to Google", unknown.message());
    }

    @Test
    void shouldHonorExtendedRules() {
        OutcomeRuleTable extended = OutcomeRuleTable.defaults().toBuilder()
                .priorityFailureRule(AuthErrorCode.ACCOUNT_DISABLED, "workspace admin blocked")
                .build();
        OutcomeClassifier custom = new OutcomeClassifier(extended);

        Outcome outcome = custom.classify("Workspace admin blocked sign-in; also wrong password.");

        assertEquals(AuthErrorCode.ACCOUNT_DISABLED, outcome.code());
    }

    @Test
    void shouldDetectActiveSession() {
        assertTrue(classifier.indicatesActiveSession("Welcome to your account, Personal info is visible"));
        assertFalse(classifier.indicatesActiveSession("The sign in page is shown"));
        assertFalse(classifier.indicatesActiveSession(null));
    }
}
