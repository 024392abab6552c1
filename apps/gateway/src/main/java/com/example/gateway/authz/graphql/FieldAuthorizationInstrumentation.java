package com.example.gateway.authz.graphql;

import com.example.gateway.authz.audit.AuthzAuditService;
import com.example.gateway.authz.context.RequestPrincipal;
import com.example.gateway.authz.model.AuthorizationRequest;
import com.example.gateway.authz.policy.DecisionPolicy;
import com.example.gateway.common.util.StringSanitizer;
import com.example.gateway.config.properties.AuthzProperties;
import com.example.gateway.observability.metrics.AuthzMetrics;
import graphql.ExecutionInput;
import graphql.ExecutionResult;
import graphql.ExecutionResultImpl;
import graphql.GraphQLError;
import graphql.GraphqlErrorBuilder;
import graphql.execution.DataFetcherResult;
import graphql.execution.instrumentation.InstrumentationState;
import graphql.execution.instrumentation.SimplePerformantInstrumentation;
import graphql.execution.instrumentation.parameters.InstrumentationCreateStateParameters;
import graphql.execution.instrumentation.parameters.InstrumentationExecutionParameters;
import graphql.execution.instrumentation.parameters.InstrumentationFieldFetchParameters;
import graphql.schema.DataFetcher;
import graphql.schema.DataFetchingEnvironment;
import graphql.schema.GraphQLNamedType;
import graphql.schema.GraphQLType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.graphql.execution.ErrorType;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Field-level read authorization for graphql-java.
 *
 * <p>Every field fetch is wrapped: the field's resource path is derived from its schema position, the
 * request principal is checked against the {@link DecisionPolicy} for {@code read}, and a denied field
 * resolves to {@code null} plus a {@link FieldAuthorizationError} without calling its data fetcher.
 * Denials are local to the field; the executor keeps resolving siblings and applies its own non-null
 * propagation.
 *
 * <p>A failing policy aborts the whole request: remaining fields short-circuit and the result is
 * replaced by a single internal error.
 */
@Slf4j
public class FieldAuthorizationInstrumentation extends SimplePerformantInstrumentation {

    static final String POLICY_FAILURE_MESSAGE = "Authorization policy evaluation failed";

    private final DecisionPolicy decisionPolicy;
    private final String principalContextKey;
    private final Set<String> anonymousMarkers;
    private final boolean cacheDecisions;

    @Nullable
    private final AuthzAuditService auditService;

    @Nullable
    private final AuthzMetrics metrics;

    public FieldAuthorizationInstrumentation(
            @NonNull DecisionPolicy decisionPolicy,
            @NonNull AuthzProperties.GraphQlProperties properties,
            @Nullable AuthzAuditService auditService,
            @Nullable AuthzMetrics metrics) {
        this.decisionPolicy = Objects.requireNonNull(decisionPolicy, "decisionPolicy");
        this.principalContextKey = properties.principalContextKey();
        this.anonymousMarkers = properties.anonymousMarkerSet();
        this.cacheDecisions = properties.cacheDecisions();
        this.auditService = auditService;
        this.metrics = metrics;
    }

    /**
     * Interceptor with default settings, ready to install into a {@code GraphQL} builder.
     */
    public static FieldAuthorizationInstrumentation forPolicy(@NonNull DecisionPolicy decisionPolicy) {
        return new FieldAuthorizationInstrumentation(
                decisionPolicy, AuthzProperties.GraphQlProperties.defaults(), null, null);
    }

    @Override
    public InstrumentationState createState(InstrumentationCreateStateParameters parameters) {
        ExecutionInput input = parameters.getExecutionInput();
        RequestPrincipal principal = RequestPrincipal.from(
                input.getGraphQLContext(), principalContextKey, anonymousMarkers);
        log.debug("Authorizing operation {} as {}", input.getOperationName(), principal.name());
        return new FieldAuthorizationState(principal, input.getOperationName());
    }

    @Override
    public DataFetcher<?> instrumentDataFetcher(DataFetcher<?> dataFetcher,
                                                InstrumentationFieldFetchParameters parameters,
                                                InstrumentationState state) {
        if (!(state instanceof FieldAuthorizationState authzState)) {
            return dataFetcher;
        }
        return environment -> authorize(dataFetcher, environment, authzState);
    }

    @Override
    public CompletableFuture<ExecutionResult> instrumentExecutionResult(ExecutionResult executionResult,
                                                                        InstrumentationExecutionParameters parameters,
                                                                        InstrumentationState state) {
        if (state instanceof FieldAuthorizationState authzState && authzState.hasFailed()) {
            RuntimeException cause = authzState.failure();
            log.error("Operation {} aborted for {}: policy evaluation failed: {}",
                    authzState.operationName(), StringSanitizer.forLog(authzState.principal().name()),
                    cause.getMessage(), cause);
            GraphQLError error = GraphqlErrorBuilder.newError()
                    .message(POLICY_FAILURE_MESSAGE)
                    .errorType(ErrorType.INTERNAL_ERROR)
                    .build();
            return CompletableFuture.completedFuture(ExecutionResultImpl.newExecutionResult()
                    .data(null)
                    .addError(error)
                    .build());
        }
        return CompletableFuture.completedFuture(executionResult);
    }

    private Object authorize(DataFetcher<?> delegate,
                             DataFetchingEnvironment environment,
                             FieldAuthorizationState state) throws Exception {
        if (state.hasFailed()) {
            return null;
        }
        if (isIntrospection(environment)) {
            return delegate.get(environment);
        }

        String resourcePath = ResourcePaths.of(environment.getExecutionStepInfo());
        String principal = state.principal().name();
        AuthorizationRequest request = AuthorizationRequest.read(principal, resourcePath);

        boolean allowed;
        try {
            allowed = decide(request, state);
        } catch (RuntimeException e) {
            state.fail(e);
            log.debug("Policy evaluation failed for subject={}, object={}",
                    StringSanitizer.forLog(principal), resourcePath);
            if (metrics != null) {
                metrics.recordError();
            }
            if (auditService != null) {
                auditService.logError(request, responsePath(environment), state.operationName(),
                        String.valueOf(e.getMessage()));
            }
            return null;
        }

        if (metrics != null) {
            metrics.recordDecision(allowed);
        }
        if (auditService != null) {
            auditService.logDecision(request, allowed, responsePath(environment), state.operationName());
        }

        if (allowed) {
            return delegate.get(environment);
        }

        log.debug("Field {} denied for {} at {}", resourcePath, StringSanitizer.forLog(principal),
                environment.getExecutionStepInfo().getPath());
        return DataFetcherResult.newResult()
                .data(null)
                .error(FieldAuthorizationError.forField(environment, principal, resourcePath))
                .build();
    }

    private boolean decide(AuthorizationRequest request, FieldAuthorizationState state) {
        if (!cacheDecisions) {
            return enforce(request);
        }
        Boolean cached = state.cachedDecision(request.object());
        if (cached != null) {
            if (metrics != null) {
                metrics.recordCacheHit();
            }
            return cached;
        }
        boolean allowed = enforce(request);
        state.rememberDecision(request.object(), allowed);
        if (metrics != null) {
            metrics.recordCacheMiss();
        }
        return allowed;
    }

    private boolean enforce(AuthorizationRequest request) {
        return decisionPolicy.enforce(request.subject(), request.object(), request.action().value());
    }

    private static List<Object> responsePath(DataFetchingEnvironment environment) {
        return environment.getExecutionStepInfo().getPath().toList();
    }

    /**
     * Schema meta fields ({@code __typename}, {@code __schema}, {@code __type}) and fields of the
     * introspection types describe the schema, not application data.
     */
    private static boolean isIntrospection(DataFetchingEnvironment environment) {
        if (environment.getFieldDefinition().getName().startsWith("__")) {
            return true;
        }
        GraphQLType parentType = environment.getParentType();
        return parentType instanceof GraphQLNamedType named && named.getName().startsWith("__");
    }
}
