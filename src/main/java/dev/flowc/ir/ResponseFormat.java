package dev.flowc.ir;

/**
 * How the body of an HTTP or AI response is interpreted.
 */
public enum ResponseFormat {
    JSON,
    TEXT,
    BINARY
}
