package com.example.gateway.authz.model;

import java.util.Objects;

/**
 * The (subject, object, action) triple submitted to the decision policy.
 *
 * @param subject principal name, never null ("anonymous" when the request carries none)
 * @param object  static resource path of the field, e.g. {@code project.members.tickets.message}
 * @param action  action being performed
 */
public record AuthorizationRequest(
        String subject,
        String object,
        Action action
) {
    public AuthorizationRequest {
        Objects.requireNonNull(subject, "subject");
        Objects.requireNonNull(object, "object");
        Objects.requireNonNull(action, "action");
    }

    /**
     * Create a read request for a field.
     */
    public static AuthorizationRequest read(String subject, String resourcePath) {
        return new AuthorizationRequest(subject, resourcePath, Action.READ);
    }
}
