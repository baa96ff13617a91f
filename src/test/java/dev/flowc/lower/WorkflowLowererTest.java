package dev.flowc.lower;

import dev.flowc.ir.ConfigField;
import dev.flowc.ir.EvmChainUsage;
import dev.flowc.ir.Operation;
import dev.flowc.ir.SecretDeclaration;
import dev.flowc.ir.Step;
import dev.flowc.ir.TriggerDef;
import dev.flowc.ir.TriggerParam;
import dev.flowc.ir.ValueExpr;
import dev.flowc.model.Workflow;
import org.junit.jupiter.api.Test;

import java.util.List;

import static dev.flowc.WorkflowFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class WorkflowLowererTest {

    private final WorkflowLowerer lowerer = new WorkflowLowerer();

    @Test
    void cronTriggerBecomesConfigDrivenSchedule() throws Exception {
        var ir = lowerer.lower(workflow(
            List.of(cron("t"), http("fetch", "https://api/{{config.asset}}"), ret("r", "{{fetch.body}}")),
            List.of(edge("t", "fetch"), edge("fetch", "r"))));

        assertThat(ir.triggerParam()).isEqualTo(TriggerParam.CRON_TRIGGER);
        assertThat(((TriggerDef.Cron) ir.trigger()).schedule()).isEqualTo(ValueExpr.config("schedule"));
        assertThat(ir.configSchema()).containsExactly(
            new ConfigField("schedule", ConfigField.Type.STRING, "0 */5 * * * *", "Cron schedule (min 30s interval)"),
            new ConfigField("asset", ConfigField.Type.STRING, null, null));
        assertThat(ir.metadata().id()).isEqualTo("wf-test");
        assertThat(ir.handlerBody().steps()).extracting(Step::id).containsExactly("fetch", "r");
    }

    @Test
    void evmLogTriggerChainComesFirst() throws Exception {
        var ir = lowerer.lower(workflow(
            List.of(evmLogTrigger("t", "ethereum-mainnet"), evmRead("read", CHAIN),
                evmRead("again", "ethereum-mainnet"), ret("r", "{{again}}")),
            List.of(edge("t", "read"), edge("read", "again"), edge("again", "r"))));

        assertThat(ir.triggerParam()).isEqualTo(TriggerParam.EVM_LOG);
        assertThat(ir.evmChains()).containsExactly(
            new EvmChainUsage("ethereum-mainnet", "evmClient_ethereum_mainnet", true),
            new EvmChainUsage(CHAIN, "evmClient_ethereum_testnet_sepolia", false));
        assertThat(ir.trigger().chainBinding()).isEqualTo("evmClient_ethereum_mainnet");
    }

    @Test
    void referencesToExpandedNodesFollowTheirOutputStep() throws Exception {
        var ir = lowerer.lower(workflow(
            List.of(httpTrigger("t"), mint("mint"), ret("r", "{{mint.txHash}}")),
            List.of(edge("t", "mint"), edge("mint", "r"))));

        assertThat(ir.handlerBody().steps()).extracting(Step::id)
            .containsExactly("mint___encode", "mint___write", "r");
        var ret = (Operation.Return) ir.handlerBody().steps().get(2).operation();
        assertThat(ret.expression()).isEqualTo(ValueExpr.binding("mint___write", "txHash"));
    }

    @Test
    void secretsComeFromGlobalConfig() throws Exception {
        var ir = lowerer.lower(workflow(
            List.of(cron("t"), getSecret("key", "API_KEY")),
            List.of(edge("t", "key")),
            List.of("API_KEY")));

        assertThat(ir.requiredSecrets()).containsExactly(new SecretDeclaration("API_KEY", "API_KEY_ENV"));
    }

    @Test
    void workflowWithoutTriggerIsRejected() {
        Workflow noTrigger = workflow(List.of(code("a")), List.of());

        var e = catchThrowableOfType(() -> lowerer.lower(noTrigger), LoweringException.class);

        assertThat(e.diagnostics()).singleElement().satisfies(d -> {
            assertThat(d.code()).isEqualTo("L002");
            assertThat(d.message()).isEqualTo("Workflow has no trigger node");
        });
    }

    @Test
    void cycleIsReportedWithANodeOnIt() {
        var cyclic = workflow(
            List.of(cron("t"), code("a"), code("b")),
            List.of(edge("t", "a"), edge("a", "b"), edge("b", "a")));

        var e = catchThrowableOfType(() -> lowerer.lower(cyclic), CycleDetectedException.class);

        assertThat(e.diagnostics().get(0).code()).isEqualTo("L001");
        assertThat(e.nodeId()).isIn("a", "b");
    }
}
