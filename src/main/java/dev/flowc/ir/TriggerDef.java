package dev.flowc.ir;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * The single entry point of a workflow.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = TriggerDef.Cron.class, name = "cron"),
    @JsonSubTypes.Type(value = TriggerDef.Http.class, name = "http"),
    @JsonSubTypes.Type(value = TriggerDef.EvmLog.class, name = "evmLog")
})
public sealed interface TriggerDef {

    /** Chain client binding the trigger listens on, or null when the trigger is not chain-bound. */
    default String chainBinding() {
        return null;
    }

    record Cron(ValueExpr schedule, ValueExpr timezone) implements TriggerDef {}

    record Http(ValueExpr path, List<String> methods, List<String> authorizedKeys) implements TriggerDef {}

    record EvmLog(
        String evmClientBinding,
        List<ValueExpr> contractAddresses,
        String eventSignature,
        String eventAbiJson,
        List<TopicFilter> topicFilters,
        String confidence
    ) implements TriggerDef {
        @Override
        public String chainBinding() {
            return evmClientBinding;
        }
    }
}
