package com.example.gateway.authz.policy.casbin;

import com.example.gateway.authz.policy.PolicyEvaluationException;
import org.casbin.jcasbin.main.Enforcer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static com.example.gateway.util.CasbinPolicyTestBuilder.aPolicy;
import static com.example.gateway.util.CasbinPolicyTestBuilder.referencePolicy;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("CasbinDecisionPolicy")
class CasbinDecisionPolicyTest {

    @Nested
    @DisplayName("reference policy")
    class ReferencePolicy {

        private final CasbinDecisionPolicy policy = referencePolicy();

        @Test
        @DisplayName("should grant user the member tree but not names or messages")
        void shouldApplyUserLines() {
            assertThat(policy.enforce("user", "project", "read")).isTrue();
            assertThat(policy.enforce("user", "project.id", "read")).isTrue();
            assertThat(policy.enforce("user", "project.name", "read")).isFalse();
            assertThat(policy.enforce("user", "project.members.name", "read")).isTrue();
            assertThat(policy.enforce("user", "project.members.tickets.id", "read")).isTrue();
            assertThat(policy.enforce("user", "project.members.tickets.message", "read")).isFalse();
        }

        @Test
        @DisplayName("should let anonymous read project ids only")
        void shouldLimitAnonymous() {
            assertThat(policy.enforce("anonymous", "project.id", "read")).isTrue();
            assertThat(policy.enforce("anonymous", "project.name", "read")).isFalse();
        }

        @Test
        @DisplayName("should restrict the project id for unauthorized_user")
        void shouldRestrictProjectId() {
            assertThat(policy.enforce("unauthorized_user", "project", "read")).isTrue();
            assertThat(policy.enforce("unauthorized_user", "project.name", "read")).isTrue();
            assertThat(policy.enforce("unauthorized_user", "project.id", "read")).isFalse();
        }

        @Test
        @DisplayName("should match keyMatch wildcards by prefix")
        void shouldMatchWildcards() {
            assertThat(policy.enforce("unauthorized_user", "project.members.tickets.message", "read")).isTrue();
            assertThat(policy.enforce("admin", "project.members.tickets.message", "read")).isTrue();
            assertThat(policy.enforce("admin", "projects", "read")).isTrue();
        }

        @Test
        @DisplayName("should deny unknown subjects and actions")
        void shouldDenyByDefault() {
            assertThat(policy.enforce("stranger", "project", "read")).isFalse();
            assertThat(policy.enforce("user", "project", "write")).isFalse();
        }
    }

    @Nested
    @DisplayName("loading")
    class Loading {

        @Test
        @DisplayName("should deny everything with an empty policy")
        void shouldDenyWithEmptyPolicy() {
            CasbinDecisionPolicy policy = aPolicy().build();

            assertThat(policy.enforce("user", "project", "read")).isFalse();
        }

        @Test
        @DisplayName("should evaluate only the given lines")
        void shouldEvaluateGivenLines() {
            CasbinDecisionPolicy policy = aPolicy()
                    .allowing("user", "project")
                    .allowing("user", "project.members*")
                    .build();

            assertThat(policy.enforce("user", "project", "read")).isTrue();
            assertThat(policy.enforce("user", "project.members.id", "read")).isTrue();
            assertThat(policy.enforce("user", "project.id", "read")).isFalse();
        }
    }

    @Nested
    @DisplayName("failures")
    class Failures {

        @Mock
        private Enforcer enforcer;

        @Test
        @DisplayName("should wrap enforcer failures")
        void shouldWrapEnforcerFailures() {
            when(enforcer.enforce("user", "project", "read")).thenThrow(new IllegalArgumentException("bad matcher"));

            CasbinDecisionPolicy policy = new CasbinDecisionPolicy(enforcer);

            assertThatThrownBy(() -> policy.enforce("user", "project", "read"))
                    .isInstanceOf(PolicyEvaluationException.class)
                    .hasMessageContaining("project")
                    .hasCauseInstanceOf(IllegalArgumentException.class);
        }
    }
}
