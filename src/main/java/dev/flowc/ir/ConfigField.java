package dev.flowc.ir;

/**
 * A user-supplied configuration field of the generated workflow.
 */
public record ConfigField(
    String name,
    Type type,
    String defaultValue, // nullable
    String description // nullable
) {

    public enum Type {
        STRING,
        NUMBER,
        BOOLEAN
    }
}
