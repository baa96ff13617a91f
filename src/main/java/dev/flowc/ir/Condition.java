package dev.flowc.ir;

/**
 * One comparison of a Branch or Filter.
 */
public record Condition(
    ValueExpr field,
    ComparisonOp operator,
    ValueExpr value // nullable, unary operators such as EXISTS take no right-hand side
) {}
