package com.example.gateway.authz.policy;

/**
 * Raised when the decision policy cannot produce a decision at all.
 * Distinct from a denial: the whole request is aborted.
 */
public class PolicyEvaluationException extends RuntimeException {

    public PolicyEvaluationException(String message) {
        super(message);
    }

    public PolicyEvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
