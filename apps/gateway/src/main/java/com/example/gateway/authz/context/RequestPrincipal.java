package com.example.gateway.authz.context;

import graphql.GraphQLContext;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.Optional;
import java.util.Set;

/**
 * The identity a GraphQL request executes as.
 *
 * <p>Anonymous defaulting happens here, once per request: a missing or blank attribute, or one of the
 * configured anonymous markers, becomes {@link #ANONYMOUS}. Consumers never see a null name.
 *
 * @param name     subject name handed to the decision policy
 * @param supplied the raw attribute the request carried, if any
 */
public record RequestPrincipal(
        @NonNull String name,
        @NonNull Optional<String> supplied
) {
    public static final String ANONYMOUS = "anonymous";

    /**
     * Anonymous markers recognised when none are configured.
     */
    public static final Set<String> DEFAULT_ANONYMOUS_MARKERS = Set.of("*");

    /**
     * Build a principal from a raw request attribute using the default anonymous markers.
     */
    public static RequestPrincipal of(@Nullable String supplied) {
        return of(supplied, DEFAULT_ANONYMOUS_MARKERS);
    }

    /**
     * Build a principal from a raw request attribute.
     *
     * @param supplied         value of the principal attribute, may be null
     * @param anonymousMarkers values that explicitly mean "no identity"
     */
    public static RequestPrincipal of(@Nullable String supplied, @NonNull Set<String> anonymousMarkers) {
        Optional<String> raw = Optional.ofNullable(supplied).map(String::trim);
        String name = raw
                .filter(value -> !value.isEmpty())
                .filter(value -> !anonymousMarkers.contains(value))
                .orElse(ANONYMOUS);
        return new RequestPrincipal(name, raw);
    }

    public static RequestPrincipal anonymous() {
        return new RequestPrincipal(ANONYMOUS, Optional.empty());
    }

    /**
     * Resolve the principal of a GraphQL execution.
     *
     * <p>A {@code RequestPrincipal} stored under its class key wins. Otherwise the string attribute
     * under {@code attributeKey} is used, so plain maps like {@code {"role": "user"}} work as context.
     */
    public static RequestPrincipal from(@Nullable GraphQLContext context,
                                        @NonNull String attributeKey,
                                        @NonNull Set<String> anonymousMarkers) {
        if (context == null) {
            return anonymous();
        }
        RequestPrincipal stored = context.get(RequestPrincipal.class);
        if (stored != null) {
            return stored;
        }
        Object attribute = context.get(attributeKey);
        return of(attribute != null ? attribute.toString() : null, anonymousMarkers);
    }

    public boolean isAnonymous() {
        return ANONYMOUS.equals(name);
    }
}
