package dev.flowc;

import dev.flowc.model.*;

import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Compact builders for in-memory workflow documents.
 */
public final class WorkflowFixtures {

    public static final String CHAIN = "ethereum-testnet-sepolia";

    private WorkflowFixtures() {}

    public static WorkflowNode cron(String id) {
        return node(id, new NodeConfig.CronTrigger("0 */5 * * * *", null));
    }

    public static WorkflowNode httpTrigger(String id) {
        return node(id, new NodeConfig.HttpTrigger("POST", "/hook", List.of()));
    }

    public static WorkflowNode evmLogTrigger(String id, String chain) {
        return node(id, new NodeConfig.EvmLogTrigger(chain, List.of("0xabc"), "Transfer(address,address,uint256)",
            "{}", Map.of(), null));
    }

    public static WorkflowNode http(String id, String url) {
        return node(id, new NodeConfig.HttpRequest("GET", url, null, Map.of(), Map.of(), null,
            null, null, null, null));
    }

    public static WorkflowNode code(String id, String... inputs) {
        return node(id, new NodeConfig.CodeNode("return {};", "runOnceForAll", List.of(inputs), null));
    }

    public static WorkflowNode jsonParse(String id) {
        return node(id, new NodeConfig.JsonParse("data", null));
    }

    public static WorkflowNode evmRead(String id, String chain) {
        return node(id, new NodeConfig.EvmRead(chain, "0xcontract", "balanceOf", "{}",
            List.of(new NodeConfig.Arg("address", "0xholder")), null, null));
    }

    public static WorkflowNode evmWrite(String id, String chain) {
        return node(id, new NodeConfig.EvmWrite(chain, "0xreceiver", "200000", "[]",
            List.of(new NodeConfig.Arg("bytes", "0x00")), null));
    }

    public static WorkflowNode getSecret(String id, String secret) {
        return node(id, new NodeConfig.GetSecret(secret));
    }

    public static WorkflowNode ifNode(String id, String field) {
        return node(id, new NodeConfig.If(List.of(new ConditionConfig(field, "equals", "true")), "and"));
    }

    public static WorkflowNode merge(String id) {
        return node(id, new NodeConfig.Merge("append", null));
    }

    public static WorkflowNode ret(String id, String expression) {
        return node(id, new NodeConfig.Return(expression));
    }

    public static WorkflowNode error(String id, String message) {
        return node(id, new NodeConfig.Error(message));
    }

    public static WorkflowNode log(String id, String message) {
        return node(id, new NodeConfig.Log("info", message));
    }

    public static WorkflowNode mint(String id) {
        return node(id, new NodeConfig.TokenOperation(NodeKind.MINT_TOKEN, CHAIN, "0xtoken", "{}",
            "{{trigger.wallet}}", "{{trigger.amount}}", "300000"));
    }

    public static WorkflowNode node(String id, NodeConfig config) {
        return new WorkflowNode(id, id, config, null);
    }

    public static WorkflowNode withSettings(WorkflowNode node, NodeSettings settings) {
        return new WorkflowNode(node.id(), node.label(), node.config(), settings);
    }

    public static WorkflowEdge edge(String source, String target) {
        return new WorkflowEdge(source + "->" + target, source, target, null, null);
    }

    public static WorkflowEdge edge(String source, String target, String sourceHandle) {
        return new WorkflowEdge(source + "->" + target, source, target, sourceHandle, null);
    }

    public static Workflow workflow(List<WorkflowNode> nodes, List<WorkflowEdge> edges) {
        return workflow(nodes, edges, List.of());
    }

    public static Workflow workflow(List<WorkflowNode> nodes, List<WorkflowEdge> edges, List<String> secrets) {
        var global = new GlobalConfig(true, null,
            secrets.stream().map(s -> new SecretReference(s, s + "_ENV")).toList(), List.of());
        return new Workflow("wf-test", "Test workflow", null, "1.0.0", nodes, edges, global);
    }

    /** Path of a workflow document under {@code src/test/resources/workflows}. */
    public static Path document(String name) {
        try {
            return Path.of(WorkflowFixtures.class.getResource("/workflows/" + name).toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }
}
