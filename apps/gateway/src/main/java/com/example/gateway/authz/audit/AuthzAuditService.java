package com.example.gateway.authz.audit;

import com.example.gateway.authz.model.AuthorizationRequest;
import com.example.gateway.common.util.StringSanitizer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.List;

/**
 * Publishes field authorization audit events as JSON lines on the {@code AUTHZ_AUDIT} logger.
 * Allowed fields are logged at DEBUG to keep volume down; denials at WARN, failures at ERROR.
 */
@RequiredArgsConstructor
public class AuthzAuditService {

    private static final Logger AUDIT_LOG = LoggerFactory.getLogger("AUTHZ_AUDIT");

    private final ObjectMapper objectMapper;

    public void logDecision(
            @NonNull AuthorizationRequest request,
            boolean allowed,
            @NonNull List<Object> responsePath,
            @Nullable String operationName) {
        if (allowed && !AUDIT_LOG.isDebugEnabled()) {
            return;
        }
        logEvent(AuthzAuditEvent.decision(request, allowed, responsePath, operationName));
    }

    public void logError(
            @NonNull AuthorizationRequest request,
            @NonNull List<Object> responsePath,
            @Nullable String operationName,
            @NonNull String errorReason) {
        logEvent(AuthzAuditEvent.error(request, responsePath, operationName, errorReason));
    }

    private void logEvent(@NonNull AuthzAuditEvent event) {
        try {
            String json = objectMapper.writeValueAsString(event.toStructuredLog());
            logByOutcome(event.outcome(), json);
        } catch (JsonProcessingException e) {
            AUDIT_LOG.error("Failed to serialize audit event: {}", StringSanitizer.forLog(e.getMessage()));
            logFallback(event);
        }
    }

    private void logByOutcome(AuthzAuditEvent.Outcome outcome, String json) {
        switch (outcome) {
            case ALLOW -> AUDIT_LOG.debug(json);
            case DENY -> AUDIT_LOG.warn(json);
            case ERROR -> AUDIT_LOG.error(json);
        }
    }

    private void logFallback(@NonNull AuthzAuditEvent event) {
        AUDIT_LOG.warn("AuthZ {} - subject={}, resource={}, action={}, path={}",
                event.outcome(),
                StringSanitizer.forLog(event.subject()),
                StringSanitizer.forLog(event.resourcePath(), 256),
                event.action(),
                event.responsePath());
    }
}
