package dev.flowc.ir;

/**
 * A named expression: header, query parameter, code input, ABI argument or merge input.
 */
public record NamedValue(String name, ValueExpr value) {}
