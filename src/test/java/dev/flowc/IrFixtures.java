package dev.flowc;

import dev.flowc.ir.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Hand-built IR steps and documents for validator and serialization tests.
 */
public final class IrFixtures {

    public static final String EVM_CLIENT = "evmClient_ethereum_testnet_sepolia";

    private IrFixtures() {}

    public static Step http(String id) {
        var op = new Operation.HttpRequest(HttpMethod.GET, ValueExpr.string("https://api.example.com"),
            List.of(), List.of(), null, null, null, null, List.of(200), ResponseFormat.JSON,
            ConsensusStrategy.identical());
        return step(id, op, output(id));
    }

    public static Step authenticatedHttp(String id, String secret) {
        var op = new Operation.HttpRequest(HttpMethod.GET, ValueExpr.string("https://api.example.com"),
            List.of(), List.of(), null, new HttpAuth.BearerToken(secret), null, null, List.of(200),
            ResponseFormat.JSON, ConsensusStrategy.identical());
        return step(id, op, output(id));
    }

    public static Step evmRead(String id, String client) {
        var op = new Operation.EvmRead(client, ValueExpr.string("0xcontract"), "balanceOf", "[]",
            List.of(), null, null);
        return step(id, op, output(id));
    }

    public static Step evmWrite(String id, String client) {
        var op = new Operation.EvmWrite(client, ValueExpr.string("0xreceiver"), ValueExpr.string("500000"),
            ValueExpr.string("0x"), null);
        return step(id, op, output(id));
    }

    public static Step secret(String id, String name) {
        return step(id, new Operation.GetSecret(name), output(id));
    }

    public static Step code(String id, ValueExpr... inputs) {
        var bindings = new ArrayList<NamedValue>();
        for (int i = 0; i < inputs.length; i++) {
            bindings.add(new NamedValue("in" + i, inputs[i]));
        }
        var op = new Operation.CodeNode("return {};", bindings, Operation.CodeNode.ExecutionMode.RUN_ONCE_FOR_ALL,
            null);
        return step(id, op, output(id));
    }

    public static Step log(String id, ValueExpr message) {
        return step(id, new Operation.Log(LogLevel.INFO, message), null);
    }

    public static Step ret(String id, ValueExpr value) {
        return step(id, new Operation.Return(value), null);
    }

    public static Step error(String id) {
        return step(id, new Operation.ErrorThrow(ValueExpr.string("failed")), null);
    }

    public static Step branch(String id, Block trueBranch, Block falseBranch, String reconvergeAt) {
        var condition = new Condition(ValueExpr.triggerData("flag"), ComparisonOp.EQUALS, ValueExpr.bool(true));
        var op = new Operation.Branch(List.of(condition), LogicCombinator.AND, trueBranch, falseBranch,
            reconvergeAt);
        return step(id, op, null);
    }

    public static Step merge(String id, String branchId, ValueExpr trueValue, ValueExpr falseValue) {
        var op = new Operation.Merge(branchId, MergeStrategy.passThrough(), List.of(
            new NamedValue("true", trueValue), new NamedValue("false", falseValue)));
        return step(id, op, output(id));
    }

    public static Step step(String id, Operation operation, OutputBinding output) {
        return new Step(id, List.of(id), id, operation, output);
    }

    public static OutputBinding output(String id) {
        return new OutputBinding("step_" + id, "any", null);
    }

    public static WorkflowIR ir(Block body) {
        return ir(body, List.of(), List.of(new EvmChainUsage("ethereum-testnet-sepolia", EVM_CLIENT, false)));
    }

    public static WorkflowIR ir(Block body, List<SecretDeclaration> secrets, List<EvmChainUsage> chains) {
        var metadata = new WorkflowMetadata("wf-test", "Test workflow", null, "1.0.0", true, null);
        var trigger = new TriggerDef.Cron(ValueExpr.config("schedule"), null);
        var schedule = new ConfigField("schedule", ConfigField.Type.STRING, "0 */5 * * * *", null);
        return new WorkflowIR(metadata, trigger, TriggerParam.CRON_TRIGGER, List.of(schedule), secrets, chains,
            List.of(), body);
    }
}
