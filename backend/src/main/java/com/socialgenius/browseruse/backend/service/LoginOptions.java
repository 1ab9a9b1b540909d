package com.socialgenius.browseruse.backend.service;

import java.util.Map;

/**
 * Per-job knobs taken from a request's {@code advanced_options}.
 *
 * @param reuseSession       restore a stored session before the agent runs
 * @param persistSession     save the session after a successful login
 * @param humanDelayMin      lower bound of the pauses asked of the agent, seconds
 * @param humanDelayMax      upper bound of the pauses asked of the agent, seconds
 * @param maxCaptchaAttempts CAPTCHA attempts before the agent gives up
 */
public record LoginOptions(boolean reuseSession, boolean persistSession, int humanDelayMin, int humanDelayMax,
        int maxCaptchaAttempts) {

    public static LoginOptions from(Map<String, Object> advancedOptions, boolean reuseSessionDefault) {
        Map<String, Object> options = advancedOptions == null ? Map.of() : advancedOptions;
        int delayMin = intOption(options, "human_delay_min", 1);
        int delayMax = Math.max(delayMin, intOption(options, "human_delay_max", 3));
        return new LoginOptions(
                boolOption(options, "reuse_session", reuseSessionDefault),
                boolOption(options, "persist_session", true),
                delayMin,
                delayMax,
                intOption(options, "max_captcha_attempts", 2));
    }

    private static boolean boolOption(Map<String, Object> options, String key, boolean fallback) {
        Object value = options.get(key);
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof String s && !s.isBlank()) {
            return Boolean.parseBoolean(s.trim());
        }
        return fallback;
    }

    private static int intOption(Map<String, Object> options, String key, int fallback) {
        Object value = options.get(key);
        if (value instanceof Number n) {
            return n.intValue();
        }
        if (value instanceof String s) {
            try {
                return Integer.parseInt(s.trim());
            } catch (NumberFormatException e) {
                return fallback;
            }
        }
        return fallback;
    }
}
