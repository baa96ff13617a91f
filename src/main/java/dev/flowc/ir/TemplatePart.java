package dev.flowc.ir;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * One segment of a {@link ValueExpr.Template}: either literal text or an interpolated expression.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "partType")
@JsonSubTypes({
    @JsonSubTypes.Type(value = TemplatePart.Lit.class, name = "lit"),
    @JsonSubTypes.Type(value = TemplatePart.Expr.class, name = "expr")
})
public sealed interface TemplatePart {

    record Lit(String value) implements TemplatePart {}

    record Expr(ValueExpr value) implements TemplatePart {}
}
