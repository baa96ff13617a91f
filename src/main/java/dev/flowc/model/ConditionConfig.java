package dev.flowc.model;

/**
 * A condition row of an {@code if} or {@code filter} node, still in editor string form.
 */
public record ConditionConfig(String field, String operator, String value) {}
