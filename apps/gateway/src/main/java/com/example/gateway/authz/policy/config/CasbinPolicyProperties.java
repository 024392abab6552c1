package com.example.gateway.authz.policy.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Locations of the Casbin model and policy, loaded from {@code app.authz.policy} in application.yml.
 * Any Spring resource location works ({@code classpath:}, {@code file:}).
 *
 * @param model  Casbin model definition (request, policy, effect and matcher sections)
 * @param policy CSV policy lines ({@code p, subject, object, action})
 */
@ConfigurationProperties(prefix = "app.authz.policy")
public record CasbinPolicyProperties(
        String model,
        String policy
) {
    public static final String DEFAULT_MODEL = "classpath:casbin/model.conf";
    public static final String DEFAULT_POLICY = "classpath:casbin/policy.csv";

    public CasbinPolicyProperties {
        if (model == null || model.isBlank()) {
            model = DEFAULT_MODEL;
        }
        if (policy == null || policy.isBlank()) {
            policy = DEFAULT_POLICY;
        }
    }
}
