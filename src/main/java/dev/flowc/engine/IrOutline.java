package dev.flowc.engine;

import dev.flowc.ir.Block;
import dev.flowc.ir.LiteralValue;
import dev.flowc.ir.NamedValue;
import dev.flowc.ir.Operation;
import dev.flowc.ir.Step;
import dev.flowc.ir.TemplatePart;
import dev.flowc.ir.ValueExpr;
import dev.flowc.ir.WorkflowIR;

/**
 * Renders the block tree of a workflow IR as indented text for humans.
 */
public final class IrOutline {

    private static final String INDENT = "  ";

    private IrOutline() {}

    public static String render(WorkflowIR ir) {
        var sb = new StringBuilder();
        sb.append("workflow ").append(ir.metadata().id())
            .append(" (").append(ir.triggerParam()).append(")\n");
        appendBlock(sb, ir.handlerBody(), 1);
        return sb.toString();
    }

    private static void appendBlock(StringBuilder sb, Block block, int depth) {
        if (block.steps().isEmpty()) {
            sb.append(INDENT.repeat(depth)).append("(empty)\n");
            return;
        }
        for (Step step : block.steps()) {
            appendStep(sb, step, depth);
        }
    }

    private static void appendStep(StringBuilder sb, Step step, int depth) {
        String pad = INDENT.repeat(depth);
        sb.append(pad).append(step.id()).append(' ').append(step.operation().kind());
        if (step.output() != null) {
            sb.append(" -> ").append(step.output().variableName());
        }

        Operation operation = step.operation();
        if (operation instanceof Operation.Branch branch) {
            if (branch.reconvergeAt() != null) {
                sb.append(" (reconverges at ").append(branch.reconvergeAt()).append(')');
            }
            sb.append('\n');
            sb.append(pad).append(INDENT).append("true:\n");
            appendBlock(sb, branch.trueBranch(), depth + 2);
            sb.append(pad).append(INDENT).append("false:\n");
            appendBlock(sb, branch.falseBranch(), depth + 2);
            return;
        }
        if (operation instanceof Operation.Merge merge) {
            sb.append(" [");
            for (int i = 0; i < merge.inputs().size(); i++) {
                NamedValue input = merge.inputs().get(i);
                if (i > 0) {
                    sb.append(", ");
                }
                sb.append(input.name()).append('=').append(describe(input.value()));
            }
            sb.append(']');
        } else if (operation instanceof Operation.Return ret) {
            sb.append(' ').append(describe(ret.expression()));
        }
        sb.append('\n');
    }

    /** Compact source-like rendering of an expression. */
    static String describe(ValueExpr expr) {
        if (expr instanceof ValueExpr.Binding binding) {
            return binding.fieldPath().isEmpty() ? binding.stepId() : binding.stepId() + "." + binding.fieldPath();
        } else if (expr instanceof ValueExpr.ConfigRef ref) {
            return "config." + ref.field();
        } else if (expr instanceof ValueExpr.TriggerDataRef ref) {
            return "trigger." + ref.field();
        } else if (expr instanceof ValueExpr.RawExpr raw) {
            return raw.expr();
        } else if (expr instanceof ValueExpr.Template template) {
            var sb = new StringBuilder("`");
            for (TemplatePart part : template.parts()) {
                if (part instanceof TemplatePart.Lit lit) {
                    sb.append(lit.value());
                } else if (part instanceof TemplatePart.Expr nested) {
                    sb.append("${").append(describe(nested.value())).append('}');
                }
            }
            return sb.append('`').toString();
        } else if (expr instanceof ValueExpr.Literal literal) {
            return describe(literal.value());
        }
        return String.valueOf(expr);
    }

    private static String describe(LiteralValue value) {
        if (value instanceof LiteralValue.StringValue s) {
            return '"' + s.value() + '"';
        } else if (value instanceof LiteralValue.NumberValue n) {
            return String.valueOf(n.value());
        } else if (value instanceof LiteralValue.IntegerValue i) {
            return String.valueOf(i.value());
        } else if (value instanceof LiteralValue.BooleanValue b) {
            return String.valueOf(b.value());
        } else if (value instanceof LiteralValue.JsonValue j) {
            return j.value();
        }
        return "null";
    }
}
