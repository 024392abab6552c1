package com.example.gateway.authz.config;

import com.example.gateway.authz.audit.AuthzAuditService;
import com.example.gateway.authz.graphql.FieldAuthorizationInstrumentation;
import com.example.gateway.authz.graphql.PrincipalContextInterceptor;
import com.example.gateway.authz.policy.DecisionPolicy;
import com.example.gateway.config.properties.AuthzProperties;
import com.example.gateway.observability.metrics.AuthzMetrics;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Installs field authorization into Spring for GraphQL.
 * Instrumentation and interceptor beans are picked up by the GraphQL auto-configuration.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(AuthzProperties.class)
@ConditionalOnProperty(name = "app.authz.enabled", havingValue = "true")
public class FieldAuthorizationConfig {

    @Bean
    @ConditionalOnProperty(name = "app.authz.audit.enabled", havingValue = "true", matchIfMissing = true)
    public AuthzAuditService authzAuditService(ObjectMapper objectMapper) {
        return new AuthzAuditService(objectMapper);
    }

    @Bean
    public AuthzMetrics authzMetrics(MeterRegistry meterRegistry) {
        return new AuthzMetrics(meterRegistry);
    }

    @Bean
    public FieldAuthorizationInstrumentation fieldAuthorizationInstrumentation(
            DecisionPolicy decisionPolicy,
            AuthzProperties properties,
            ObjectProvider<AuthzAuditService> auditService,
            AuthzMetrics metrics) {
        log.info("Field authorization enabled (principal header={}, decision cache={})",
                properties.graphql().principalHeader(), properties.graphql().cacheDecisions());
        return new FieldAuthorizationInstrumentation(
                decisionPolicy, properties.graphql(), auditService.getIfAvailable(), metrics);
    }

    @Bean
    public PrincipalContextInterceptor principalContextInterceptor(AuthzProperties properties) {
        return new PrincipalContextInterceptor(properties.graphql());
    }
}
