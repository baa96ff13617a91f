package dev.flowc.ir;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * A literal operand inside a {@link ValueExpr.Literal}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "literalType")
@JsonSubTypes({
    @JsonSubTypes.Type(value = LiteralValue.StringValue.class, name = "string"),
    @JsonSubTypes.Type(value = LiteralValue.NumberValue.class, name = "number"),
    @JsonSubTypes.Type(value = LiteralValue.IntegerValue.class, name = "integer"),
    @JsonSubTypes.Type(value = LiteralValue.BooleanValue.class, name = "boolean"),
    @JsonSubTypes.Type(value = LiteralValue.NullValue.class, name = "null"),
    @JsonSubTypes.Type(value = LiteralValue.JsonValue.class, name = "json")
})
public sealed interface LiteralValue {

    record StringValue(String value) implements LiteralValue {}

    record NumberValue(double value) implements LiteralValue {}

    record IntegerValue(long value) implements LiteralValue {}

    record BooleanValue(boolean value) implements LiteralValue {}

    record NullValue() implements LiteralValue {}

    /** JSON object or array kept as its source text. */
    record JsonValue(String value) implements LiteralValue {}
}
