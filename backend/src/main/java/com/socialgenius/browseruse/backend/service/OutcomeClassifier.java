package com.socialgenius.browseruse.backend.service;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Maps the agent's final free-text report to a structured verdict using an
 * {@link OutcomeRuleTable}. Success phrases are checked before any failure rule.
 */
@Component
public class OutcomeClassifier {

    private final OutcomeRuleTable rules;

    public OutcomeClassifier(OutcomeRuleTable rules) {
        this.rules = rules;
    }

    public Outcome classify(String text) {
        if (text == null || text.isBlank()) {
            return Outcome.unrecognizedFailure();
        }
        String lower = text.toLowerCase(Locale.ROOT);

        if (containsAny(lower, rules.successPhrases())) {
            return Outcome.succeeded();
        }
        for (OutcomeRuleTable.FailureRule rule : rules.failureRules()) {
            if (containsAny(lower, rule.phrases())) {
                return Outcome.failed(rule.code());
            }
        }
        return Outcome.unrecognizedFailure();
    }

    /**
     * Whether a session check report indicates the browser is still signed in.
     */
    public boolean indicatesActiveSession(String text) {
        return text != null && containsAny(text.toLowerCase(Locale.ROOT), rules.sessionActivePhrases());
    }

    public OutcomeRuleTable rules() {
        return rules;
    }

    private static boolean containsAny(String text, List<String> phrases) {
        for (String phrase : phrases) {
            if (text.contains(phrase)) {
                return true;
            }
        }
        return false;
    }
}
