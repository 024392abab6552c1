package com.example.gateway.authz.model;

/**
 * Actions a subject can perform on a GraphQL resource path.
 */
public enum Action {
    /**
     * Read a field's value. The only action the field interceptor checks.
     */
    READ("read");

    private final String value;

    Action(String value) {
        this.value = value;
    }

    /**
     * Value handed to the decision policy and matched by policy rules.
     */
    public String value() {
        return value;
    }
}
