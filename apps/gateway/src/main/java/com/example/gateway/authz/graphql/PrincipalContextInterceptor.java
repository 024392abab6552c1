package com.example.gateway.authz.graphql;

import com.example.gateway.authz.context.RequestPrincipal;
import com.example.gateway.common.util.StringSanitizer;
import com.example.gateway.config.properties.AuthzProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.graphql.server.WebGraphQlInterceptor;
import org.springframework.graphql.server.WebGraphQlRequest;
import org.springframework.graphql.server.WebGraphQlResponse;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.Set;

/**
 * Resolves the request principal from an HTTP header and stores it in the GraphQL context,
 * where {@link FieldAuthorizationInstrumentation} picks it up.
 */
@Slf4j
public class PrincipalContextInterceptor implements WebGraphQlInterceptor {

    private final String principalHeader;
    private final Set<String> anonymousMarkers;

    public PrincipalContextInterceptor(AuthzProperties.GraphQlProperties properties) {
        this.principalHeader = properties.principalHeader();
        this.anonymousMarkers = properties.anonymousMarkerSet();
    }

    @Override
    public Mono<WebGraphQlResponse> intercept(WebGraphQlRequest request, Chain chain) {
        String supplied = StringSanitizer.headerValue(request.getHeaders().getFirst(principalHeader));
        RequestPrincipal principal = RequestPrincipal.of(supplied, anonymousMarkers);
        log.debug("GraphQL request {} runs as {}", request.getId(), StringSanitizer.forLog(principal.name()));

        request.configureExecutionInput((input, builder) ->
                builder.graphQLContext(Map.<Object, Object>of(RequestPrincipal.class, principal)).build());
        return chain.next(request);
    }
}
