package dev.flowc.ir;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.ArrayList;
import java.util.List;

/**
 * Any data reference in the IR. Replaces the {@code {{nodeId.field}}} strings of the visual graph.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
    @JsonSubTypes.Type(value = ValueExpr.Literal.class, name = "literal"),
    @JsonSubTypes.Type(value = ValueExpr.Binding.class, name = "binding"),
    @JsonSubTypes.Type(value = ValueExpr.ConfigRef.class, name = "configRef"),
    @JsonSubTypes.Type(value = ValueExpr.TriggerDataRef.class, name = "triggerDataRef"),
    @JsonSubTypes.Type(value = ValueExpr.Template.class, name = "template"),
    @JsonSubTypes.Type(value = ValueExpr.RawExpr.class, name = "rawExpr")
})
public sealed interface ValueExpr {

    /**
     * Step-output references contained in this expression, including those nested in template parts.
     */
    List<Binding> bindingRefs();

    record Literal(LiteralValue value) implements ValueExpr {
        @Override
        public List<Binding> bindingRefs() {
            return List.of();
        }
    }

    /**
     * Reference to the output of a prior step. An empty field path means the whole value.
     */
    record Binding(String stepId, String fieldPath) implements ValueExpr {
        @Override
        public List<Binding> bindingRefs() {
            return List.of(this);
        }
    }

    record ConfigRef(String field) implements ValueExpr {
        @Override
        public List<Binding> bindingRefs() {
            return List.of();
        }
    }

    record TriggerDataRef(String field) implements ValueExpr {
        @Override
        public List<Binding> bindingRefs() {
            return List.of();
        }
    }

    record Template(List<TemplatePart> parts) implements ValueExpr {
        @Override
        public List<Binding> bindingRefs() {
            var refs = new ArrayList<Binding>();
            for (TemplatePart part : parts) {
                if (part instanceof TemplatePart.Expr expr) {
                    refs.addAll(expr.value().bindingRefs());
                }
            }
            return refs;
        }
    }

    /** Target-language expression emitted verbatim. */
    record RawExpr(String expr) implements ValueExpr {
        @Override
        public List<Binding> bindingRefs() {
            return List.of();
        }
    }

    static ValueExpr string(String value) {
        return new Literal(new LiteralValue.StringValue(value));
    }

    static ValueExpr number(double value) {
        return new Literal(new LiteralValue.NumberValue(value));
    }

    static ValueExpr integer(long value) {
        return new Literal(new LiteralValue.IntegerValue(value));
    }

    static ValueExpr bool(boolean value) {
        return new Literal(new LiteralValue.BooleanValue(value));
    }

    static ValueExpr nullValue() {
        return new Literal(new LiteralValue.NullValue());
    }

    static ValueExpr binding(String stepId, String fieldPath) {
        return new Binding(stepId, fieldPath);
    }

    static ValueExpr config(String field) {
        return new ConfigRef(field);
    }

    static ValueExpr triggerData(String field) {
        return new TriggerDataRef(field);
    }

    static ValueExpr raw(String expr) {
        return new RawExpr(expr);
    }
}
