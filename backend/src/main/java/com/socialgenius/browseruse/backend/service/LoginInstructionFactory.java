package com.socialgenius.browseruse.backend.service;

import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Renders the agent instruction for a Google sign-in from the
 * {@code instructions/google-login.txt} template.
 */
@Component
public class LoginInstructionFactory {

    static final String TEMPLATE_PATH = "instructions/google-login.txt";

    private final String template;

    public LoginInstructionFactory() {
        this(loadTemplate(TEMPLATE_PATH));
    }

    LoginInstructionFactory(String template) {
        this.template = template;
    }

    public String build(LoginJob job) {
        LoginOptions options = job.options();
        return template
                .replace("{{url}}", job.url())
                .replace("{{email}}", job.email())
                .replace("{{password}}", job.password())
                .replace("{{delayMin}}", String.valueOf(options.humanDelayMin()))
                .replace("{{delayMax}}", String.valueOf(options.humanDelayMax()))
                .replace("{{maxCaptchaAttempts}}", String.valueOf(options.maxCaptchaAttempts()));
    }

    /**
     * Instruction for checking whether a restored session is still signed in.
     */
    public String buildSessionCheck(String url) {
        return "Navigate to " + url + " and check if you're still logged in";
    }

    private static String loadTemplate(String path) {
        try (InputStream in = new ClassPathResource(path).getInputStream()) {
            return StreamUtils.copyToString(in, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read instruction template " + path, e);
        }
    }
}
