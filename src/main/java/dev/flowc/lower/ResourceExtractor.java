package dev.flowc.lower;

import dev.flowc.ir.Block;
import dev.flowc.ir.ConfigField;
import dev.flowc.ir.EvmChainUsage;
import dev.flowc.ir.Operation;
import dev.flowc.ir.RpcEntry;
import dev.flowc.ir.SecretDeclaration;
import dev.flowc.ir.Step;
import dev.flowc.ir.TemplatePart;
import dev.flowc.ir.TriggerDef;
import dev.flowc.ir.ValueExpr;
import dev.flowc.model.GlobalConfig;
import dev.flowc.model.NodeConfig;
import dev.flowc.model.Workflow;
import dev.flowc.model.WorkflowNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Collects the global resources of a workflow: secrets, chain clients, config fields and RPC endpoints.
 */
public final class ResourceExtractor {

    private ResourceExtractor() {}

    public static List<SecretDeclaration> secrets(GlobalConfig global) {
        return global.secrets().stream()
            .map(s -> new SecretDeclaration(s.name(), s.envVariable()))
            .toList();
    }

    public static List<RpcEntry> rpcs(GlobalConfig global) {
        return global.rpcs().stream()
            .map(r -> new RpcEntry(r.chainName(), r.url()))
            .toList();
    }

    /**
     * Distinct chains in node order. The trigger chain, when present, comes first and is flagged as
     * used for the trigger.
     */
    public static List<EvmChainUsage> evmChains(Workflow workflow, EvmChainUsage triggerChain) {
        var chains = new ArrayList<EvmChainUsage>();
        var seen = new LinkedHashSet<String>();
        if (triggerChain != null) {
            seen.add(triggerChain.chainSelectorName());
            chains.add(triggerChain);
        }
        for (WorkflowNode node : workflow.nodes()) {
            String selector = chainSelector(node.config());
            if (selector != null && seen.add(selector)) {
                chains.add(new EvmChainUsage(selector, BindingNames.evmClient(selector), false));
            }
        }
        return chains;
    }

    /**
     * Config schema: the trigger's own fields followed by one string field for every other config
     * reference found in the trigger or the handler body, in first-use order.
     */
    public static List<ConfigField> configFields(List<ConfigField> triggerFields, TriggerDef trigger, Block body) {
        Map<String, ConfigField> fields = new LinkedHashMap<>();
        triggerFields.forEach(f -> fields.put(f.name(), f));

        var referenced = new LinkedHashSet<String>();
        triggerExpressions(trigger).forEach(e -> collectConfigRefs(e, referenced));
        collectConfigRefs(body, referenced);

        for (String name : referenced) {
            fields.putIfAbsent(name, new ConfigField(name, ConfigField.Type.STRING, null, null));
        }
        return List.copyOf(fields.values());
    }

    private static String chainSelector(NodeConfig config) {
        if (config instanceof NodeConfig.EvmRead read) {
            return read.chainSelectorName();
        } else if (config instanceof NodeConfig.EvmWrite write) {
            return write.chainSelectorName();
        } else if (config instanceof NodeConfig.TokenOperation token) {
            return token.chainSelectorName();
        } else if (config instanceof NodeConfig.CheckBalance balance) {
            return balance.chainSelectorName();
        }
        return null;
    }

    private static List<ValueExpr> triggerExpressions(TriggerDef trigger) {
        var exprs = new ArrayList<ValueExpr>();
        if (trigger instanceof TriggerDef.Cron cron) {
            exprs.add(cron.schedule());
            if (cron.timezone() != null) {
                exprs.add(cron.timezone());
            }
        } else if (trigger instanceof TriggerDef.Http http) {
            exprs.add(http.path());
        } else if (trigger instanceof TriggerDef.EvmLog evmLog) {
            exprs.addAll(evmLog.contractAddresses());
        }
        return exprs;
    }

    private static void collectConfigRefs(Block block, LinkedHashSet<String> names) {
        for (Step step : block.steps()) {
            step.operation().expressions().forEach(e -> collectConfigRefs(e, names));
            if (step.operation() instanceof Operation.Branch branch) {
                collectConfigRefs(branch.trueBranch(), names);
                collectConfigRefs(branch.falseBranch(), names);
            }
        }
    }

    private static void collectConfigRefs(ValueExpr expr, LinkedHashSet<String> names) {
        if (expr instanceof ValueExpr.ConfigRef ref) {
            names.add(ref.field());
        } else if (expr instanceof ValueExpr.Template template) {
            for (TemplatePart part : template.parts()) {
                if (part instanceof TemplatePart.Expr nested) {
                    collectConfigRefs(nested.value(), names);
                }
            }
        }
    }
}
