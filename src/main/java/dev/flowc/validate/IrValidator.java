package dev.flowc.validate;

import dev.flowc.ir.Block;
import dev.flowc.ir.EvmChainUsage;
import dev.flowc.ir.Operation;
import dev.flowc.ir.SecretDeclaration;
import dev.flowc.ir.Step;
import dev.flowc.ir.WorkflowIR;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Checks a lowered {@link WorkflowIR} before code emission. Every rule runs; the result lists all
 * violations found, in rule order.
 */
public final class IrValidator {

    private IrValidator() {}

    public static List<Violation> validate(WorkflowIR ir) {
        return validate(ir, CapabilityBudget.defaults());
    }

    /**
     * Validate a workflow IR. Returns an empty list if valid. Never throws.
     */
    public static List<Violation> validate(WorkflowIR ir, CapabilityBudget budget) {
        var violations = new ArrayList<Violation>();
        Block body = ir.handlerBody();

        // E001
        if (body.steps().isEmpty()) {
            violations.add(new Violation("E001", "Handler body has no steps", null));
        }

        checkUniqueIds(body, new HashSet<>(), violations);
        checkScopes(body, violations);
        checkBranchAdjacency(body, violations);
        checkSecrets(ir, violations);
        checkEvmBindings(ir, violations);
        checkBudget(body, budget, violations);

        // E012
        if (!body.steps().isEmpty() && !terminates(body)) {
            violations.add(new Violation("E012",
                "Not every execution path ends in a Return or ErrorThrow step", null));
        }

        checkStrayMerges(body, violations);
        return violations;
    }

    // E002
    private static void checkUniqueIds(Block block, Set<String> seen, List<Violation> violations) {
        for (Step step : block.steps()) {
            if (!seen.add(step.id())) {
                violations.add(new Violation("E002", "Duplicate step id '%s'".formatted(step.id()), step.id()));
            }
            if (step.operation() instanceof Operation.Branch branch) {
                checkUniqueIds(branch.trueBranch(), seen, violations);
                checkUniqueIds(branch.falseBranch(), seen, violations);
            }
        }
    }

    // E003
    private static void checkScopes(Block body, List<Violation> violations) {
        for (ScopeResolver.Reference ref : ScopeResolver.resolve(body)) {
            String target = ref.binding().stepId();
            String message = switch (ref.resolution()) {
                case VISIBLE -> null;
                case UNKNOWN_STEP -> "Step '%s' references unknown step '%s'".formatted(ref.fromStepId(), target);
                case NO_OUTPUT -> "Step '%s' references step '%s', which produces no output"
                    .formatted(ref.fromStepId(), target);
                case NOT_VISIBLE -> "Step '%s' references step '%s', which is not in scope at this point"
                    .formatted(ref.fromStepId(), target);
            };
            if (message != null) {
                violations.add(new Violation("E003", message, ref.fromStepId()));
            }
        }
    }

    // E004, E005, E006
    private static void checkBranchAdjacency(Block block, List<Violation> violations) {
        List<Step> steps = block.steps();
        for (int i = 0; i < steps.size(); i++) {
            Step step = steps.get(i);
            if (!(step.operation() instanceof Operation.Branch branch)) {
                continue;
            }
            checkBranchAdjacency(branch.trueBranch(), violations);
            checkBranchAdjacency(branch.falseBranch(), violations);

            String reconvergeAt = branch.reconvergeAt();
            if (reconvergeAt == null) {
                continue;
            }
            if (i + 1 >= steps.size()) {
                violations.add(new Violation("E004",
                    "Branch '%s' reconverges at '%s' but no step follows it".formatted(step.id(), reconvergeAt),
                    step.id()));
                continue;
            }
            Step next = steps.get(i + 1);
            if (!next.id().equals(reconvergeAt)) {
                violations.add(new Violation("E004",
                    "Branch '%s' reconverges at '%s' but is followed by '%s'"
                        .formatted(step.id(), reconvergeAt, next.id()),
                    step.id()));
            }
            if (next.operation() instanceof Operation.Merge merge) {
                if (!step.id().equals(merge.branchStepId())) {
                    violations.add(new Violation("E005",
                        "Merge '%s' follows branch '%s' but names branch '%s'"
                            .formatted(next.id(), step.id(), merge.branchStepId()),
                        next.id()));
                }
            } else {
                violations.add(new Violation("E006",
                    "Step '%s' follows reconverging branch '%s' but is not a Merge".formatted(next.id(), step.id()),
                    next.id()));
            }
        }
    }

    // E007
    private static void checkSecrets(WorkflowIR ir, List<Violation> violations) {
        Set<String> declared = ir.requiredSecrets().stream()
            .map(SecretDeclaration::name)
            .collect(Collectors.toSet());
        forEachStep(ir.handlerBody(), step -> {
            for (String secret : step.operation().secretNames()) {
                if (!declared.contains(secret)) {
                    violations.add(new Violation("E007",
                        "Step '%s' uses undeclared secret '%s'".formatted(step.id(), secret), step.id()));
                }
            }
        });
    }

    // E008
    private static void checkEvmBindings(WorkflowIR ir, List<Violation> violations) {
        Set<String> declared = ir.evmChains().stream()
            .map(EvmChainUsage::bindingName)
            .collect(Collectors.toSet());

        String triggerBinding = ir.trigger() == null ? null : ir.trigger().chainBinding();
        if (triggerBinding != null && !declared.contains(triggerBinding)) {
            violations.add(new Violation("E008",
                "Trigger uses undeclared EVM client '%s'".formatted(triggerBinding), null));
        }

        forEachStep(ir.handlerBody(), step -> {
            String binding = null;
            if (step.operation() instanceof Operation.EvmRead read) {
                binding = read.evmClientBinding();
            } else if (step.operation() instanceof Operation.EvmWrite write) {
                binding = write.evmClientBinding();
            }
            if (binding != null && !declared.contains(binding)) {
                violations.add(new Violation("E008",
                    "Step '%s' uses undeclared EVM client '%s'".formatted(step.id(), binding), step.id()));
            }
        });
    }

    // E009, E010, E011
    private static void checkBudget(Block body, CapabilityBudget budget, List<Violation> violations) {
        CapabilityUsage usage = CapabilityUsage.worstCase(body);
        if (usage.httpCalls() > budget.maxHttpCalls()) {
            violations.add(new Violation("E009",
                "Up to %d HTTP/AI calls per execution exceeds the limit of %d"
                    .formatted(usage.httpCalls(), budget.maxHttpCalls()), null));
        }
        if (usage.evmReads() > budget.maxEvmReads()) {
            violations.add(new Violation("E010",
                "Up to %d EVM reads per execution exceeds the limit of %d"
                    .formatted(usage.evmReads(), budget.maxEvmReads()), null));
        }
        if (usage.evmWrites() > budget.maxEvmWrites()) {
            violations.add(new Violation("E011",
                "Up to %d EVM writes per execution exceeds the limit of %d"
                    .formatted(usage.evmWrites(), budget.maxEvmWrites()), null));
        }
    }

    /**
     * A block terminates when its last step does: a Return or ErrorThrow, or a Branch without
     * reconvergence whose arms both terminate. An empty block never terminates.
     */
    static boolean terminates(Block block) {
        if (block.steps().isEmpty()) {
            return false;
        }
        Operation last = block.steps().get(block.steps().size() - 1).operation();
        return switch (last.kind()) {
            case RETURN, ERROR_THROW -> true;
            case BRANCH -> {
                var branch = (Operation.Branch) last;
                yield branch.reconvergeAt() == null
                    && terminates(branch.trueBranch()) && terminates(branch.falseBranch());
            }
            default -> false;
        };
    }

    // E013
    private static void checkStrayMerges(Block block, List<Violation> violations) {
        Step previous = null;
        for (Step step : block.steps()) {
            if (step.operation() instanceof Operation.Branch branch) {
                checkStrayMerges(branch.trueBranch(), violations);
                checkStrayMerges(branch.falseBranch(), violations);
            }
            if (step.operation() instanceof Operation.Merge merge && merge.branchStepId() != null) {
                // A preceding branch that declares this merge is covered by E005.
                boolean declaredByPrevious = previous != null
                    && previous.operation() instanceof Operation.Branch prevBranch
                    && step.id().equals(prevBranch.reconvergeAt());
                if (!declaredByPrevious) {
                    violations.add(new Violation("E013",
                        "Merge '%s' names branch '%s' but is not that branch's reconvergence point"
                            .formatted(step.id(), merge.branchStepId()),
                        step.id()));
                }
            }
            previous = step;
        }
    }

    private static void forEachStep(Block block, Consumer<Step> action) {
        for (Step step : block.steps()) {
            action.accept(step);
            if (step.operation() instanceof Operation.Branch branch) {
                forEachStep(branch.trueBranch(), action);
                forEachStep(branch.falseBranch(), action);
            }
        }
    }

    /** Capability calls on the most expensive path through a block. */
    record CapabilityUsage(int httpCalls, int evmReads, int evmWrites) {

        static final CapabilityUsage NONE = new CapabilityUsage(0, 0, 0);

        static CapabilityUsage worstCase(Block block) {
            var total = NONE;
            for (Step step : block.steps()) {
                total = total.plus(of(step.operation()));
            }
            return total;
        }

        private static CapabilityUsage of(Operation operation) {
            return switch (operation.kind()) {
                case HTTP_REQUEST, AI_CALL -> new CapabilityUsage(1, 0, 0);
                case EVM_READ -> new CapabilityUsage(0, 1, 0);
                case EVM_WRITE -> new CapabilityUsage(0, 0, 1);
                case BRANCH -> {
                    var branch = (Operation.Branch) operation;
                    yield worstCase(branch.trueBranch()).max(worstCase(branch.falseBranch()));
                }
                case GET_SECRET, CODE_NODE, JSON_PARSE, ABI_ENCODE, ABI_DECODE, FILTER, MERGE, LOG,
                     ERROR_THROW, RETURN -> NONE;
            };
        }

        CapabilityUsage plus(CapabilityUsage other) {
            return new CapabilityUsage(httpCalls + other.httpCalls, evmReads + other.evmReads,
                evmWrites + other.evmWrites);
        }

        CapabilityUsage max(CapabilityUsage other) {
            return new CapabilityUsage(Math.max(httpCalls, other.httpCalls), Math.max(evmReads, other.evmReads),
                Math.max(evmWrites, other.evmWrites));
        }
    }
}
