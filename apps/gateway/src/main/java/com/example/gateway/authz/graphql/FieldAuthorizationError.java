package com.example.gateway.authz.graphql;

import graphql.GraphQLError;
import graphql.language.SourceLocation;
import graphql.schema.DataFetchingEnvironment;
import org.springframework.graphql.execution.ErrorType;

import java.util.List;

/**
 * Error reported in place of a field the principal may not read.
 * Carries the runtime response path (with list indices) and the field's location in the document.
 */
public class FieldAuthorizationError implements GraphQLError {

    private final String message;
    private final List<SourceLocation> locations;
    private final List<Object> path;

    public FieldAuthorizationError(String principal, String resourcePath,
                                   List<Object> path, List<SourceLocation> locations) {
        this.message = message(principal, resourcePath);
        this.path = List.copyOf(path);
        this.locations = List.copyOf(locations);
    }

    public static FieldAuthorizationError forField(DataFetchingEnvironment environment,
                                                   String principal, String resourcePath) {
        SourceLocation location = environment.getField().getSourceLocation();
        return new FieldAuthorizationError(
                principal,
                resourcePath,
                environment.getExecutionStepInfo().getPath().toList(),
                location != null ? List.of(location) : List.of());
    }

    static String message(String principal, String resourcePath) {
        return principal + " can not query " + resourcePath;
    }

    @Override
    public String getMessage() {
        return message;
    }

    @Override
    public List<SourceLocation> getLocations() {
        return locations;
    }

    @Override
    public List<Object> getPath() {
        return path;
    }

    @Override
    public ErrorType getErrorType() {
        return ErrorType.FORBIDDEN;
    }

    @Override
    public String toString() {
        return "FieldAuthorizationError{" +
                "message='" + message + '\'' +
                ", path=" + path +
                ", locations=" + locations +
                '}';
    }
}
