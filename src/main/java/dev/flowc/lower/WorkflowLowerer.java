package dev.flowc.lower;

import dev.flowc.graph.CyclicGraphException;
import dev.flowc.graph.TopologicalSorter;
import dev.flowc.graph.WorkflowGraph;
import dev.flowc.ir.Block;
import dev.flowc.ir.WorkflowIR;
import dev.flowc.ir.WorkflowMetadata;
import dev.flowc.model.GlobalConfig;
import dev.flowc.model.Workflow;
import dev.flowc.model.WorkflowNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lowers a loaded workflow document into a {@link WorkflowIR}: graph, topological order, trigger,
 * handler body and global resources.
 */
public final class WorkflowLowerer {

    private static final Logger log = LoggerFactory.getLogger(WorkflowLowerer.class);

    private final ConvenienceExpander expander;

    public WorkflowLowerer() {
        this(new TokenNodeExpander());
    }

    public WorkflowLowerer(ConvenienceExpander expander) {
        this.expander = expander;
    }

    public WorkflowIR lower(Workflow workflow) throws LoweringException {
        WorkflowNode trigger = workflow.trigger();
        if (trigger == null) {
            throw new LoweringException(TriggerLowering.NOT_A_TRIGGER, "Workflow has no trigger node", null);
        }

        WorkflowGraph graph = WorkflowGraph.of(workflow);
        List<String> order;
        try {
            order = TopologicalSorter.sort(graph, trigger.id());
        } catch (CyclicGraphException e) {
            throw new CycleDetectedException(e);
        }
        log.debug("Topological order: {}", order);

        Map<String, String> idMap = new LinkedHashMap<>();
        for (WorkflowNode node : workflow.nodes()) {
            String outputStep = expander.outputStepId(node);
            if (outputStep != null) {
                idMap.put(node.id(), outputStep);
            }
        }
        var resolver = new TemplateExpressionResolver(idMap, trigger.id());

        TriggerLowering.Result lowered = TriggerLowering.lower(trigger, resolver);
        Block body = new ControlFlowStructurer(graph, resolver, expander).build(order);

        GlobalConfig global = workflow.globalConfig() == null ? GlobalConfig.empty() : workflow.globalConfig();
        var metadata = new WorkflowMetadata(
            workflow.id(),
            workflow.name(),
            workflow.description(),
            workflow.version(),
            global.testnet(),
            global.defaultChainSelector());

        var ir = new WorkflowIR(
            metadata,
            lowered.trigger(),
            lowered.param(),
            ResourceExtractor.configFields(lowered.configFields(), lowered.trigger(), body),
            ResourceExtractor.secrets(global),
            ResourceExtractor.evmChains(workflow, lowered.chain()),
            ResourceExtractor.rpcs(global),
            body);

        log.info("Lowered workflow '{}': {} nodes, {} top-level steps, {} chains, {} secrets",
            workflow.id(), graph.size(), body.steps().size(), ir.evmChains().size(), ir.requiredSecrets().size());
        return ir;
    }
}
