package com.example.gateway.observability.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.lang.NonNull;

/**
 * Counters for field authorization.
 * Tags are bounded (outcome, cache result) so resource paths never become metric labels.
 */
public class AuthzMetrics {

    public static final String DECISION_METRIC = "authz.field.decision";
    public static final String CACHE_METRIC = "authz.field.decision.cache";

    private final Counter allowed;
    private final Counter denied;
    private final Counter errors;
    private final Counter cacheHit;
    private final Counter cacheMiss;

    public AuthzMetrics(@NonNull MeterRegistry registry) {
        this.allowed = Counter.builder(DECISION_METRIC)
                .tag("outcome", "allowed")
                .description("Fields the principal was allowed to read")
                .register(registry);

        this.denied = Counter.builder(DECISION_METRIC)
                .tag("outcome", "denied")
                .description("Fields suppressed by the decision policy")
                .register(registry);

        this.errors = Counter.builder(DECISION_METRIC)
                .tag("outcome", "error")
                .description("Decision policy failures")
                .register(registry);

        this.cacheHit = Counter.builder(CACHE_METRIC)
                .tag("result", "hit")
                .description("Decisions answered from the per-request cache")
                .register(registry);

        this.cacheMiss = Counter.builder(CACHE_METRIC)
                .tag("result", "miss")
                .description("Decisions that required a policy evaluation")
                .register(registry);
    }

    public void recordDecision(boolean isAllowed) {
        if (isAllowed) {
            allowed.increment();
        } else {
            denied.increment();
        }
    }

    public void recordError() {
        errors.increment();
    }

    public void recordCacheHit() {
        cacheHit.increment();
    }

    public void recordCacheMiss() {
        cacheMiss.increment();
    }
}
