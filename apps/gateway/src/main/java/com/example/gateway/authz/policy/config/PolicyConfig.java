package com.example.gateway.authz.policy.config;

import com.example.gateway.authz.policy.casbin.CasbinDecisionPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;

/**
 * Builds the Casbin decision policy from the configured model and policy files.
 * A missing or malformed file fails start-up.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(CasbinPolicyProperties.class)
public class PolicyConfig {

    @Bean
    public CasbinDecisionPolicy casbinDecisionPolicy(CasbinPolicyProperties properties,
                                                     ResourceLoader resourceLoader) {
        Resource model = resourceLoader.getResource(properties.model());
        Resource policy = resourceLoader.getResource(properties.policy());
        log.info("Loading Casbin model from {} and policy from {}", properties.model(), properties.policy());

        try (InputStream modelStream = model.getInputStream();
             InputStream policyStream = policy.getInputStream()) {
            return CasbinDecisionPolicy.load(modelStream, policyStream);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read Casbin files " + properties.model()
                    + ", " + properties.policy(), e);
        } catch (RuntimeException e) {
            throw new IllegalStateException("Invalid Casbin model or policy: " + e.getMessage(), e);
        }
    }
}
