package dev.flowc.validate;

import dev.flowc.ir.Block;
import dev.flowc.ir.NamedValue;
import dev.flowc.ir.Operation;
import dev.flowc.ir.Step;
import dev.flowc.ir.ValueExpr;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves every step reference in a block tree against the lexical scope at its point of use.
 *
 * <p>Scoping is forward-only and block-structured. A step's binding is visible to later steps of its
 * block and to blocks nested after it. Each branch arm starts from a copy of the scope at the branch.
 * A Merge that closes the Branch directly before it resolves its {@code "true"} and {@code "false"}
 * inputs against the exit scope of the matching arm; every other input sees the enclosing scope.
 */
public final class ScopeResolver {

    public enum Resolution {
        VISIBLE,
        UNKNOWN_STEP,
        NO_OUTPUT,
        NOT_VISIBLE
    }

    /** A binding read by {@code fromStepId} and how it resolved. */
    public record Reference(String fromStepId, ValueExpr.Binding binding, Resolution resolution) {}

    private final Map<String, Step> allSteps = new HashMap<>();
    private final List<Reference> references = new ArrayList<>();

    private ScopeResolver() {}

    public static List<Reference> resolve(Block body) {
        var resolver = new ScopeResolver();
        resolver.index(body);
        resolver.walk(body, LexicalScope.root());
        return resolver.references;
    }

    private void index(Block block) {
        for (Step step : block.steps()) {
            allSteps.putIfAbsent(step.id(), step);
            if (step.operation() instanceof Operation.Branch branch) {
                index(branch.trueBranch());
                index(branch.falseBranch());
            }
        }
    }

    private void walk(Block block, LexicalScope scope) {
        Step previous = null;
        LexicalScope trueExit = null;
        LexicalScope falseExit = null;

        for (Step step : block.steps()) {
            Operation operation = step.operation();

            if (operation instanceof Operation.Merge merge && closesPrevious(step, previous)) {
                for (NamedValue input : merge.inputs()) {
                    LexicalScope inputScope = switch (input.name()) {
                        case "true" -> trueExit;
                        case "false" -> falseExit;
                        default -> scope;
                    };
                    check(step, input.value(), inputScope);
                }
            } else {
                operation.expressions().forEach(e -> check(step, e, scope));
            }

            if (operation instanceof Operation.Branch branch) {
                trueExit = scope.fork();
                walk(branch.trueBranch(), trueExit);
                falseExit = scope.fork();
                walk(branch.falseBranch(), falseExit);
            }

            if (step.output() != null) {
                scope.define(step.id());
            }
            previous = step;
        }
    }

    /** True when {@code previous} is a Branch that reconverges at {@code step}. */
    private static boolean closesPrevious(Step step, Step previous) {
        return previous != null
            && previous.operation() instanceof Operation.Branch branch
            && step.id().equals(branch.reconvergeAt());
    }

    private void check(Step from, ValueExpr expr, LexicalScope scope) {
        for (ValueExpr.Binding binding : expr.bindingRefs()) {
            references.add(new Reference(from.id(), binding, classify(binding.stepId(), scope)));
        }
    }

    private Resolution classify(String stepId, LexicalScope scope) {
        Step target = allSteps.get(stepId);
        if (target == null) {
            return Resolution.UNKNOWN_STEP;
        }
        if (target.output() == null) {
            return Resolution.NO_OUTPUT;
        }
        return scope.contains(stepId) ? Resolution.VISIBLE : Resolution.NOT_VISIBLE;
    }
}
