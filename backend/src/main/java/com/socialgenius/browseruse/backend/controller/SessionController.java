package com.socialgenius.browseruse.backend.controller;

import com.socialgenius.browseruse.backend.dto.SessionStatusResponse;
import com.socialgenius.browseruse.backend.dto.SessionValidationResponse;
import com.socialgenius.browseruse.backend.service.SessionValidationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/v1/session")
@Tag(name = "Sessions", description = "Stored browser sessions")
public class SessionController {

    private final SessionValidationService sessionValidationService;

    public SessionController(SessionValidationService sessionValidationService) {
        this.sessionValidationService = sessionValidationService;
    }

    @GetMapping("/{businessId}")
    @Operation(summary = "Check stored session", description = "Whether a session is stored for the business and how old it is")
    public ResponseEntity<SessionStatusResponse> checkSession(
            @Parameter(description = "Business ID") @PathVariable String businessId) {

        return ResponseEntity.ok(sessionValidationService.check(businessId));
    }

    @GetMapping("/{businessId}/validate")
    @Operation(summary = "Validate stored session", description = "Apply the stored session in the browser and check it is still signed in")
    public ResponseEntity<SessionValidationResponse> validateSession(
            @Parameter(description = "Business ID") @PathVariable String businessId,
            @RequestHeader(value = "X-Session-ID", required = false) String sessionIdHeader,
            @CookieValue(value = "session", required = false) String sessionCookie,
            @CookieValue(value = "sessionId", required = false) String sessionIdCookie) {

        String callerSessionId = sessionIdHeader != null ? sessionIdHeader
                : sessionCookie != null ? sessionCookie : sessionIdCookie;
        return ResponseEntity.ok(sessionValidationService.validate(businessId, callerSessionId));
    }
}
