package com.example.gateway.authz.audit;

import com.example.gateway.authz.model.AuthorizationRequest;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structured audit event for a field authorization decision.
 */
public record AuthzAuditEvent(
        Instant timestamp,
        Outcome outcome,

        // Request
        String subject,
        String resourcePath,
        String action,

        // Field
        List<Object> responsePath,
        String operationName,
        String reason
) {
    public enum Outcome {
        ALLOW, DENY, ERROR
    }

    public static AuthzAuditEvent decision(
            AuthorizationRequest request,
            boolean allowed,
            List<Object> responsePath,
            String operationName) {
        return new AuthzAuditEvent(
                Instant.now(),
                allowed ? Outcome.ALLOW : Outcome.DENY,
                request.subject(),
                request.object(),
                request.action().value(),
                responsePath,
                operationName,
                null
        );
    }

    public static AuthzAuditEvent error(
            AuthorizationRequest request,
            List<Object> responsePath,
            String operationName,
            String reason) {
        return new AuthzAuditEvent(
                Instant.now(),
                Outcome.ERROR,
                request.subject(),
                request.object(),
                request.action().value(),
                responsePath,
                operationName,
                reason
        );
    }

    /**
     * Flat map for JSON logging.
     */
    public Map<String, Object> toStructuredLog() {
        Map<String, Object> log = new LinkedHashMap<>();
        log.put("type", "AUTHZ_FIELD_DECISION");
        log.put("timestamp", timestamp.toString());
        log.put("outcome", outcome.name());
        log.put("subject", subject);
        log.put("resourcePath", resourcePath);
        log.put("action", action);
        log.put("responsePath", responsePath);
        if (operationName != null) {
            log.put("operationName", operationName);
        }
        if (reason != null) {
            log.put("reason", reason);
        }
        return log;
    }
}
