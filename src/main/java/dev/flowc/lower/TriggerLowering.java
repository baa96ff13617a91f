package dev.flowc.lower;

import dev.flowc.ir.ConfigField;
import dev.flowc.ir.EvmChainUsage;
import dev.flowc.ir.TopicFilter;
import dev.flowc.ir.TriggerDef;
import dev.flowc.ir.TriggerParam;
import dev.flowc.ir.ValueExpr;
import dev.flowc.model.NodeConfig;
import dev.flowc.model.WorkflowNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Maps the trigger node to the workflow's entry point definition.
 */
public final class TriggerLowering {

    static final String NOT_A_TRIGGER = "L002";

    /**
     * Lowered trigger plus the resources it contributes.
     *
     * @param chain        chain the trigger listens on, or null
     * @param configFields config fields the trigger introduces (the cron schedule)
     */
    public record Result(
        TriggerDef trigger,
        TriggerParam param,
        EvmChainUsage chain,
        List<ConfigField> configFields
    ) {}

    private TriggerLowering() {}

    public static Result lower(WorkflowNode node, ExpressionResolver resolver) throws LoweringException {
        NodeConfig config = node.config();
        if (config instanceof NodeConfig.CronTrigger cron) {
            var schedule = new ConfigField("schedule", ConfigField.Type.STRING, cron.schedule(),
                "Cron schedule (min 30s interval)");
            var def = new TriggerDef.Cron(ValueExpr.config("schedule"),
                cron.timezone() == null ? null : ValueExpr.string(cron.timezone()));
            return new Result(def, TriggerParam.CRON_TRIGGER, null, List.of(schedule));
        }
        if (config instanceof NodeConfig.HttpTrigger http) {
            var def = new TriggerDef.Http(
                ValueExpr.string(http.path() == null ? "/" : http.path()),
                List.of(http.httpMethod() == null ? "POST" : http.httpMethod()),
                http.authorizedAddresses() == null ? List.of() : http.authorizedAddresses());
            return new Result(def, TriggerParam.HTTP_REQUEST, null, List.of());
        }
        if (config instanceof NodeConfig.EvmLogTrigger evmLog) {
            String binding = BindingNames.evmClient(evmLog.chainSelectorName());
            var contracts = new ArrayList<ValueExpr>();
            if (evmLog.contractAddresses() != null) {
                evmLog.contractAddresses().forEach(a -> contracts.add(resolver.resolve(a)));
            }
            var def = new TriggerDef.EvmLog(
                binding,
                contracts,
                evmLog.eventSignature(),
                evmLog.eventAbiJson(),
                topicFilters(evmLog.topicFilters()),
                evmLog.blockConfirmation() == null ? "finalized" : evmLog.blockConfirmation());
            var chain = new EvmChainUsage(evmLog.chainSelectorName(), binding, true);
            return new Result(def, TriggerParam.EVM_LOG, chain, List.of());
        }
        throw new LoweringException(NOT_A_TRIGGER,
            "Node type '%s' is not a trigger".formatted(node.kind().tag()), node.id());
    }

    private static List<TopicFilter> topicFilters(Map<Integer, List<String>> filters) {
        var result = new ArrayList<TopicFilter>();
        if (filters != null) {
            new TreeMap<>(filters).forEach((index, values) -> result.add(new TopicFilter(index, values)));
        }
        return result;
    }
}
