package io.mockdispatch.core.model;

/**
 * A query parameter documented on a custom API. Descriptive only; the dispatcher does not
 * enforce it.
 */
public record QueryParamSpec(String key, String value, boolean required) {}
