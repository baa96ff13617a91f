package dev.flowc.engine;

/**
 * Pipeline stage that produced a diagnostic.
 */
public enum Phase {
    PARSE,
    LOWER,
    IR_VALIDATE
}
