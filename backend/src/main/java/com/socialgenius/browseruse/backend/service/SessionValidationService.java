package com.socialgenius.browseruse.backend.service;

import com.socialgenius.browseruse.backend.agent.AgentInvoker;
import com.socialgenius.browseruse.backend.agent.AgentMessageListener;
import com.socialgenius.browseruse.backend.agent.AgentRequest;
import com.socialgenius.browseruse.backend.agent.AgentResult;
import com.socialgenius.browseruse.backend.agent.BrowserGate;
import com.socialgenius.browseruse.backend.agent.BrowserLease;
import com.socialgenius.browseruse.backend.agent.BrowsingContext;
import com.socialgenius.browseruse.backend.config.AutomationProperties;
import com.socialgenius.browseruse.backend.dto.SessionStatusResponse;
import com.socialgenius.browseruse.backend.dto.SessionValidationResponse;
import com.socialgenius.browseruse.backend.model.BrowserSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Read-side session endpoints: the stored-session summary and the live re-check.
 */
@Service
public class SessionValidationService {

    private static final Logger log = LoggerFactory.getLogger(SessionValidationService.class);

    static final String NO_SESSION = "No session found for this business";
    static final String APPLY_FAILED = "Failed to apply session to browser";
    static final String VALID = "Session is valid and working";
    static final String NOT_LOGGED_IN = "Session is not valid (not logged in)";
    static final String VALIDATION_ERROR = "Error validating session";

    private final SessionStore sessionStore;
    private final OutcomeClassifier classifier;
    private final AgentInvoker agentInvoker;
    private final BrowserGate browserGate;
    private final ScreenshotStorageService screenshots;
    private final LoginInstructionFactory instructions;
    private final AutomationProperties properties;

    public SessionValidationService(SessionStore sessionStore,
            OutcomeClassifier classifier,
            AgentInvoker agentInvoker,
            BrowserGate browserGate,
            ScreenshotStorageService screenshots,
            LoginInstructionFactory instructions,
            AutomationProperties properties) {
        this.sessionStore = sessionStore;
        this.classifier = classifier;
        this.agentInvoker = agentInvoker;
        this.browserGate = browserGate;
        this.screenshots = screenshots;
        this.instructions = instructions;
        this.properties = properties;
    }

    public SessionStatusResponse check(String businessId) {
        try {
            Optional<BrowserSession> stored = sessionStore.load(businessId);
            if (stored.isEmpty()) {
                return SessionStatusResponse.builder()
                        .hasSession(false)
                        .message(NO_SESSION)
                        .build();
            }
            BrowserSession session = stored.get();
            return SessionStatusResponse.builder()
                    .hasSession(true)
                    .cookiesCount(session.cookieCount())
                    .lastUpdated(session.getLastUpdated())
                    .expired(sessionStore.isExpired(session))
                    .message("Session exists")
                    .build();
        } catch (RuntimeException e) {
            log.error("[SESSION] Error checking session for business {}: {}", businessId, e.getMessage());
            return SessionStatusResponse.builder()
                    .hasSession(false)
                    .error(e.getMessage())
                    .message("Error checking session")
                    .build();
        }
    }

    /**
     * Applies the stored session to the shared browser and asks the agent whether it is
     * still signed in. A session that checks out is captured again and saved, tagged with
     * the caller's session id when one was supplied.
     *
     * @param callerSessionId value of the caller's X-Session-ID header or session cookie, may be null
     */
    public SessionValidationResponse validate(String businessId, String callerSessionId) {
        if (callerSessionId != null) {
            log.info("[VALIDATE] Session validation for business {} includes caller session id: {}...",
                    businessId, callerSessionId.substring(0, Math.min(8, callerSessionId.length())));
        }
        try {
            Optional<BrowserSession> stored = sessionStore.load(businessId);
            if (stored.isEmpty()) {
                return SessionValidationResponse.invalid(NO_SESSION);
            }
            return runCheck(businessId, stored.get(), callerSessionId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return validationError(businessId, e);
        } catch (Exception e) {
            return validationError(businessId, e);
        }
    }

    private SessionValidationResponse runCheck(String businessId, BrowserSession session, String callerSessionId)
            throws Exception {
        String traceId = "validate-" + UUID.randomUUID().toString().substring(0, 8);
        try (BrowserLease lease = browserGate.acquire(properties.getValidation().getTimeout())) {
            BrowsingContext context = lease.context();
            if (!sessionStore.apply(session, context)) {
                return SessionValidationResponse.invalid(APPLY_FAILED);
            }

            AgentResult result = agentInvoker.invoke(lease,
                    new AgentRequest(instructions.buildSessionCheck(properties.getValidation().getUrl()), traceId),
                    AgentMessageListener.NO_OP,
                    properties.getValidation().getTimeout());
            boolean loggedIn = classifier.indicatesActiveSession(result.finalResultOrEmpty());
            String screenshot = screenshots.captureValidationScreenshot(context, businessId).orElse(null);

            if (!loggedIn) {
                log.info("[VALIDATE] Session for business {} is no longer signed in", businessId);
                return SessionValidationResponse.builder()
                        .valid(false)
                        .message(NOT_LOGGED_IN)
                        .screenshot(screenshot)
                        .build();
            }

            BrowserSession refreshed = sessionStore.extract(businessId, context);
            if (refreshed.hasCookies()) {
                Map<String, String> metadata = callerSessionId == null
                        ? Map.of()
                        : Map.of("associated_session_id", callerSessionId);
                sessionStore.save(businessId, refreshed.getCookies(), refreshed.getLocalStorage(),
                        refreshed.getSessionStorage(), metadata);
            }
            return SessionValidationResponse.builder()
                    .valid(true)
                    .message(VALID)
                    .screenshot(screenshot)
                    .build();
        }
    }

    private SessionValidationResponse validationError(String businessId, Exception e) {
        log.error("[VALIDATE] Error validating session for business {}: {}", businessId, e.getMessage());
        return SessionValidationResponse.builder()
                .valid(false)
                .message(VALIDATION_ERROR)
                .error(String.valueOf(e.getMessage()))
                .build();
    }
}
