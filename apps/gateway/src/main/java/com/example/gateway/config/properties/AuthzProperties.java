package com.example.gateway.config.properties;

import com.example.gateway.authz.context.RequestPrincipal;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;
import java.util.Set;

@ConfigurationProperties(prefix = "app.authz")
public record AuthzProperties(
        boolean enabled,
        AuditProperties audit,
        GraphQlProperties graphql
) {
    public AuthzProperties {
        if (audit == null) {
            audit = new AuditProperties(true);
        }
        if (graphql == null) {
            graphql = GraphQlProperties.defaults();
        }
    }

    public record AuditProperties(
            boolean enabled
    ) {}

    /**
     * Field interceptor settings.
     *
     * @param principalHeader     HTTP header carrying the principal name
     * @param principalContextKey GraphQL context attribute read when no {@link RequestPrincipal} is stored
     * @param anonymousMarkers    principal values treated as anonymous
     * @param cacheDecisions      memoize decisions per (principal, resource path) within a request
     */
    public record GraphQlProperties(
            String principalHeader,
            String principalContextKey,
            List<String> anonymousMarkers,
            Boolean cacheDecisions
    ) {
        public GraphQlProperties {
            if (principalHeader == null || principalHeader.isBlank()) {
                principalHeader = "X-Role";
            }
            if (principalContextKey == null || principalContextKey.isBlank()) {
                principalContextKey = "role";
            }
            if (anonymousMarkers == null) {
                anonymousMarkers = List.copyOf(RequestPrincipal.DEFAULT_ANONYMOUS_MARKERS);
            }
            if (cacheDecisions == null) {
                cacheDecisions = Boolean.TRUE;
            }
        }

        public static GraphQlProperties defaults() {
            return new GraphQlProperties(null, null, null, null);
        }

        public Set<String> anonymousMarkerSet() {
            return Set.copyOf(anonymousMarkers);
        }
    }
}
