package dev.flowc.lower;

import dev.flowc.engine.Diagnostic;
import dev.flowc.graph.WorkflowGraph;
import dev.flowc.ir.Block;
import dev.flowc.ir.LogLevel;
import dev.flowc.ir.LogicCombinator;
import dev.flowc.ir.MergeStrategy;
import dev.flowc.ir.NamedValue;
import dev.flowc.ir.Operation;
import dev.flowc.ir.Step;
import dev.flowc.ir.ValueExpr;
import dev.flowc.model.NodeConfig;
import dev.flowc.model.NodeKind;
import dev.flowc.model.NodeSettings;
import dev.flowc.model.WorkflowNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Turns a topologically ordered node list into a tree of blocks.
 *
 * <p>Every {@code if} node opens a diamond. Its arms are the not-yet-placed nodes reachable from one
 * outgoing edge and not from the other; nodes reachable from both arms stay in the enclosing walk and
 * are placed after the Merge step that closes the diamond. Arms are structured recursively.
 */
public final class ControlFlowStructurer {

    private static final Logger log = LoggerFactory.getLogger(ControlFlowStructurer.class);

    static final String TRUE_HANDLE = "true";
    static final String FALSE_HANDLE = "false";

    private final WorkflowGraph graph;
    private final ExpressionResolver resolver;
    private final ConvenienceExpander expander;
    private final PrimitiveLowering primitives;

    public ControlFlowStructurer(WorkflowGraph graph, ExpressionResolver resolver, ConvenienceExpander expander) {
        this.graph = graph;
        this.resolver = resolver;
        this.expander = expander;
        this.primitives = new PrimitiveLowering(graph, resolver);
    }

    /**
     * Build the handler body from the full topological order. Trigger nodes are skipped.
     *
     * @throws LoweringException with the diagnostics of every node that could not be lowered
     */
    public Block build(List<String> topologicalOrder) throws LoweringException {
        var state = new StructuringState();
        var steps = buildSteps(topologicalOrder, state);
        log.debug("Structured {} nodes into {} top-level steps ({} branches, {} synthesized steps)",
            state.consumedCount(), steps.size(), state.branchCount(), state.synthesizedCount());
        return new Block(steps);
    }

    private List<Step> buildSteps(List<String> nodeIds, StructuringState state) throws LoweringException {
        var steps = new ArrayList<Step>();
        var errors = new ArrayList<Diagnostic>();

        for (String id : nodeIds) {
            if (state.isConsumed(id)) {
                continue;
            }
            state.consume(id);
            WorkflowNode node = graph.node(id);
            if (node.isTrigger()) {
                continue;
            }
            try {
                if (node.kind() == NodeKind.IF) {
                    steps.addAll(buildBranch(node, nodeIds, state));
                } else {
                    steps.addAll(lowerNode(node, state));
                }
            } catch (LoweringException e) {
                errors.addAll(e.diagnostics());
            }
        }

        if (!errors.isEmpty()) {
            throw new LoweringException(errors);
        }
        return steps;
    }

    private List<Step> lowerNode(WorkflowNode node, StructuringState state) throws LoweringException {
        var steps = new ArrayList<Step>();
        if (expander.handles(node)) {
            steps.addAll(expander.expand(node, resolver));
        } else {
            steps.add(primitives.lower(node));
        }
        appendSettingsSteps(node, steps, state);
        return steps;
    }

    private List<Step> buildBranch(WorkflowNode node, List<String> nodeIds, StructuringState state)
            throws LoweringException {
        if (!(node.config() instanceof NodeConfig.If config)) {
            throw new LoweringException(PrimitiveLowering.UNSUPPORTED_NODE,
                "Conditional node carries no condition configuration", node.id());
        }
        state.recordBranch();

        String trueEntry = graph.successorVia(node.id(), TRUE_HANDLE);
        String falseEntry = graph.successorVia(node.id(), FALSE_HANDLE);
        Set<String> trueReach = graph.reachableFrom(trueEntry);
        Set<String> falseReach = graph.reachableFrom(falseEntry);

        String reconvergence = findReconvergence(nodeIds, trueReach, falseReach);
        List<String> trueIds = armNodes(nodeIds, trueReach, falseReach, state);
        List<String> falseIds = armNodes(nodeIds, falseReach, trueReach, state);
        log.debug("Branch '{}': true arm {}, false arm {}, reconverges at {}",
            node.id(), trueIds, falseIds, reconvergence);

        WorkflowNode mergeNode = null;
        String mergeId = null;
        if (reconvergence != null) {
            WorkflowNode candidate = graph.node(reconvergence);
            if (candidate.kind() == NodeKind.MERGE) {
                mergeNode = candidate;
                mergeId = candidate.id();
                state.consume(mergeId);
            } else {
                mergeId = node.id() + "___merge";
                state.recordSynthesized();
            }
        }

        var errors = new ArrayList<Diagnostic>();
        Block trueBlock = Block.empty();
        Block falseBlock = Block.empty();
        try {
            trueBlock = new Block(buildSteps(trueIds, state));
        } catch (LoweringException e) {
            errors.addAll(e.diagnostics());
        }
        try {
            falseBlock = new Block(buildSteps(falseIds, state));
        } catch (LoweringException e) {
            errors.addAll(e.diagnostics());
        }
        if (!errors.isEmpty()) {
            throw new LoweringException(errors);
        }

        var branch = new Operation.Branch(
            primitives.conditions(config.conditions()),
            LogicCombinator.fromEditorName(config.combineWith()),
            trueBlock,
            falseBlock,
            mergeId
        );

        var steps = new ArrayList<Step>();
        steps.add(new Step(node.id(), List.of(node.id()), node.label(), branch, null));

        if (mergeId != null) {
            var merge = new Operation.Merge(
                node.id(),
                mergeNode == null ? MergeStrategy.passThrough()
                    : PrimitiveLowering.mergeStrategy((NodeConfig.Merge) mergeNode.config()),
                List.of(
                    new NamedValue(TRUE_HANDLE, armResult(trueBlock)),
                    new NamedValue(FALSE_HANDLE, armResult(falseBlock))
                )
            );
            List<String> sources = mergeNode == null ? List.of(node.id()) : List.of(mergeNode.id());
            String label = mergeNode == null ? node.label() + " (merge)" : mergeNode.label();
            steps.add(new Step(mergeId, sources, label, merge, BindingNames.output(mergeId, BindingNames.ANY)));
        }

        appendSettingsSteps(node, steps, state);
        if (mergeNode != null) {
            appendSettingsSteps(mergeNode, steps, state);
        }
        return steps;
    }

    /**
     * First node of {@code nodeIds} reachable from both arms, or null when an arm is missing or the arms
     * never meet.
     */
    static String findReconvergence(List<String> nodeIds, Set<String> trueReach, Set<String> falseReach) {
        if (trueReach.isEmpty() || falseReach.isEmpty()) {
            return null;
        }
        for (String id : nodeIds) {
            if (trueReach.contains(id) && falseReach.contains(id)) {
                return id;
            }
        }
        return null;
    }

    /** Unplaced nodes of {@code nodeIds}, in order, reachable from this arm only. */
    private static List<String> armNodes(List<String> nodeIds, Set<String> ownReach, Set<String> otherReach,
                                         StructuringState state) {
        var arm = new ArrayList<String>();
        for (String id : nodeIds) {
            if (!state.isConsumed(id) && ownReach.contains(id) && !otherReach.contains(id)) {
                arm.add(id);
            }
        }
        return arm;
    }

    /** Whole-value reference to the last step of the arm that exports a binding, or null. */
    private static ValueExpr armResult(Block arm) {
        for (int i = arm.steps().size() - 1; i >= 0; i--) {
            Step step = arm.steps().get(i);
            if (step.output() != null) {
                return ValueExpr.binding(step.id(), "");
            }
        }
        return ValueExpr.nullValue();
    }

    /**
     * Log step from {@code settings.log}, placed before a terminal node's own step, then an auto-return when
     * the node ends a path implicitly.
     */
    private void appendSettingsSteps(WorkflowNode node, List<Step> steps, StructuringState state) {
        NodeSettings settings = node.settings();
        if (settings != null && settings.log() != null) {
            var logOp = new Operation.Log(
                LogLevel.fromEditorName(settings.log().level()),
                resolver.resolve(settings.log().messageTemplate()));
            var logStep = new Step(node.id() + "___log", List.of(node.id()), "Log (" + node.label() + ")",
                logOp, null);
            // a Return or ErrorThrow must stay last in its block
            if (node.isTerminal() && !steps.isEmpty()) {
                steps.add(steps.size() - 1, logStep);
            } else {
                steps.add(logStep);
            }
            state.recordSynthesized();
        }

        if (graph.outgoingCount(node.id()) == 0 && !node.isTerminal()) {
            ValueExpr value = settings != null && settings.returnExpression() != null
                ? resolver.resolve(settings.returnExpression())
                : ValueExpr.string("ok");
            steps.add(new Step(node.id() + "___auto_return", List.of(node.id()), "Auto return",
                new Operation.Return(value), null));
            state.recordSynthesized();
        }
    }
}
