package com.example.gateway.authz.graphql;

import graphql.execution.ExecutionStepInfo;
import graphql.schema.GraphQLFieldDefinition;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Locale;

/**
 * Derives the static resource path of a field: the declared field names from the root field down,
 * joined with dots and lowercased. List indices and aliases never contribute, so every element of a
 * list field shares one path.
 */
public final class ResourcePaths {

    public static final char SEPARATOR = '.';

    private ResourcePaths() {}

    /**
     * Extend a parent path with a field name.
     *
     * @param parentPath path of the enclosing field, null or empty for root fields
     * @param fieldName  declared name of the field
     */
    @NonNull
    public static String child(@Nullable String parentPath, @NonNull String fieldName) {
        String segment = fieldName.toLowerCase(Locale.ROOT);
        if (parentPath == null || parentPath.isEmpty()) {
            return segment;
        }
        return parentPath + SEPARATOR + segment;
    }

    /**
     * Resource path of the field an execution step resolves.
     */
    @NonNull
    public static String of(@NonNull ExecutionStepInfo stepInfo) {
        Deque<String> fieldNames = new ArrayDeque<>();
        for (ExecutionStepInfo step = stepInfo; step != null; step = step.getParent()) {
            GraphQLFieldDefinition definition = step.getFieldDefinition();
            if (definition == null) {
                break; // operation root
            }
            if (step.getPath().isListSegment()) {
                continue; // list element, same field as its parent step
            }
            fieldNames.push(definition.getName());
        }

        String path = null;
        for (String fieldName : fieldNames) {
            path = child(path, fieldName);
        }
        return path != null ? path : "";
    }
}
