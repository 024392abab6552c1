package com.example.gateway.authz.policy;

/**
 * Answers allow/deny for a (subject, object, action) triple.
 *
 * <p>Implementations must be synchronous and side-effect free for a given rule set: the field
 * interceptor may call them from any executor thread and may memoize answers within a request.
 */
@FunctionalInterface
public interface DecisionPolicy {

    /**
     * @param subject principal name
     * @param object  static resource path
     * @param action  action value, e.g. "read"
     * @return true if the subject may perform the action on the object
     * @throws PolicyEvaluationException if no decision can be made (broken rule set, unreachable store)
     */
    boolean enforce(String subject, String object, String action);
}
