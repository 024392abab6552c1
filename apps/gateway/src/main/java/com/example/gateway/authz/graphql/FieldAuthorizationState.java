package com.example.gateway.authz.graphql;

import com.example.gateway.authz.context.RequestPrincipal;
import graphql.execution.instrumentation.InstrumentationState;
import org.springframework.lang.Nullable;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Per-request state of the field interceptor: the principal resolved once when execution starts,
 * decisions already made for this principal, and the first policy failure if one occurred.
 * Safe to share between fields resolved concurrently.
 */
class FieldAuthorizationState implements InstrumentationState {

    private final RequestPrincipal principal;
    @Nullable
    private final String operationName;
    private final Map<String, Boolean> decisions = new ConcurrentHashMap<>();
    private final AtomicReference<RuntimeException> failure = new AtomicReference<>();

    FieldAuthorizationState(RequestPrincipal principal, @Nullable String operationName) {
        this.principal = principal;
        this.operationName = operationName;
    }

    RequestPrincipal principal() {
        return principal;
    }

    @Nullable
    String operationName() {
        return operationName;
    }

    @Nullable
    Boolean cachedDecision(String resourcePath) {
        return decisions.get(resourcePath);
    }

    void rememberDecision(String resourcePath, boolean allowed) {
        decisions.putIfAbsent(resourcePath, allowed);
    }

    /**
     * Record a policy failure; only the first one is kept.
     */
    void fail(RuntimeException cause) {
        failure.compareAndSet(null, cause);
    }

    boolean hasFailed() {
        return failure.get() != null;
    }

    /**
     * The first recorded failure, or null if the policy never failed.
     */
    @Nullable
    RuntimeException failure() {
        return failure.get();
    }
}
