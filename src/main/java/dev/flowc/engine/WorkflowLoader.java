package dev.flowc.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.flowc.ir.HttpAuth;
import dev.flowc.model.*;

import java.io.IOException;
import java.nio.file.Path;
import java.util.*;

/**
 * Loads workflow documents exported by the visual editor.
 */
public final class WorkflowLoader {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private WorkflowLoader() {}

    /**
     * Load a workflow from a JSON file.
     *
     * @throws IOException              if the file cannot be read or is not JSON
     * @throws IllegalArgumentException if the document does not describe a workflow
     */
    public static Workflow loadFromFile(Path path) throws IOException {
        JsonNode root = MAPPER.readTree(path.toFile());
        return parseWorkflow(root);
    }

    /**
     * Load a workflow from a JSON string.
     */
    public static Workflow loadFromString(String json) throws IOException {
        JsonNode root = MAPPER.readTree(json);
        return parseWorkflow(root);
    }

    private static Workflow parseWorkflow(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Workflow document must be a JSON object");
        }
        String id = required(root, "id", "workflow").asText();
        String name = root.has("name") ? root.get("name").asText() : id;
        String description = optText(root, "description");
        String version = root.has("version") ? root.get("version").asText() : "1.0.0";

        var nodes = new ArrayList<WorkflowNode>();
        for (JsonNode node : required(root, "nodes", "workflow")) {
            nodes.add(parseNode(node));
        }
        var edges = new ArrayList<WorkflowEdge>();
        JsonNode edgesNode = root.get("edges");
        if (edgesNode != null) {
            for (JsonNode edge : edgesNode) {
                edges.add(parseEdge(edge));
            }
        }
        return new Workflow(id, name, description, version, nodes, edges, parseGlobalConfig(root.get("globalConfig")));
    }

    private static GlobalConfig parseGlobalConfig(JsonNode node) {
        if (node == null) {
            return GlobalConfig.empty();
        }
        boolean testnet = node.has("isTestnet") ? node.get("isTestnet").asBoolean()
            : !node.has("testnet") || node.get("testnet").asBoolean();

        var secrets = new ArrayList<SecretReference>();
        if (node.has("secrets")) {
            for (JsonNode s : node.get("secrets")) {
                secrets.add(new SecretReference(required(s, "name", "secret").asText(),
                    required(s, "envVariable", "secret").asText()));
            }
        }
        var rpcs = new ArrayList<RpcReference>();
        if (node.has("rpcs")) {
            for (JsonNode r : node.get("rpcs")) {
                rpcs.add(new RpcReference(required(r, "chainName", "rpc").asText(), required(r, "url", "rpc").asText()));
            }
        }
        return new GlobalConfig(testnet, optText(node, "defaultChainSelector"), secrets, rpcs);
    }

    private static WorkflowEdge parseEdge(JsonNode node) {
        String source = required(node, "source", "edge").asText();
        String target = required(node, "target", "edge").asText();
        String id = node.has("id") ? node.get("id").asText() : source + "->" + target;
        return new WorkflowEdge(id, source, target, optText(node, "sourceHandle"), optText(node, "targetHandle"));
    }

    private static WorkflowNode parseNode(JsonNode node) {
        String id = required(node, "id", "node").asText();
        NodeKind kind = NodeKind.fromTag(required(node, "type", "node '" + id + "'").asText());
        JsonNode data = node.get("data");
        String label = data != null && data.has("label") ? data.get("label").asText() : id;
        JsonNode config = data != null && data.has("config") ? data.get("config") : MAPPER.createObjectNode();
        String where = "node '" + id + "'";
        return new WorkflowNode(id, label, parseConfig(kind, config, where), parseSettings(node.get("settings")));
    }

    private static NodeSettings parseSettings(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        NodeSettings.LogSettings log = null;
        JsonNode logNode = node.get("log");
        if (logNode != null && logNode.isObject()) {
            log = new NodeSettings.LogSettings(optText(logNode, "level"), optText(logNode, "messageTemplate"));
        }
        return new NodeSettings(optText(node, "returnExpression"), log);
    }

    private static NodeConfig parseConfig(NodeKind kind, JsonNode c, String where) {
        return switch (kind) {
            case CRON_TRIGGER -> new NodeConfig.CronTrigger(text(c, "schedule", where), optText(c, "timezone"));
            case HTTP_TRIGGER -> new NodeConfig.HttpTrigger(
                c.has("httpMethod") ? c.get("httpMethod").asText() : "POST",
                optText(c, "path"),
                authorizedAddresses(c.get("authentication")));
            case EVM_LOG_TRIGGER -> new NodeConfig.EvmLogTrigger(
                text(c, "chainSelectorName", where),
                stringList(c.get("contractAddresses")),
                text(c, "eventSignature", where),
                json(c.get("eventAbi")),
                topicFilters(c.get("topicFilters")),
                optText(c, "blockConfirmation"));
            case HTTP_REQUEST -> new NodeConfig.HttpRequest(
                c.has("method") ? c.get("method").asText() : "GET",
                text(c, "url", where),
                httpAuth(c.get("authentication"), where),
                stringMap(c.get("headers")),
                stringMap(c.get("queryParameters")),
                c.has("body") && c.get("body").isObject()
                    ? new NodeConfig.HttpRequest.Body(optText(c.get("body"), "contentType"),
                        optText(c.get("body"), "data"))
                    : null,
                optInt(c, "cacheMaxAge"),
                optInt(c, "timeout"),
                c.has("expectedStatusCodes") ? intList(c.get("expectedStatusCodes")) : null,
                optText(c, "responseFormat"));
            case EVM_READ -> new NodeConfig.EvmRead(
                text(c, "chainSelectorName", where),
                text(c, "contractAddress", where),
                text(c, "functionName", where),
                json(c.get("abi")),
                args(c.get("args")),
                optText(c, "fromAddress"),
                optText(c, "blockNumber"));
            case EVM_WRITE -> new NodeConfig.EvmWrite(
                text(c, "chainSelectorName", where),
                text(c, "receiverAddress", where),
                optText(c, "gasLimit"),
                json(c.get("abiParams")),
                args(c.get("dataMapping")),
                optText(c, "value"));
            case GET_SECRET -> new NodeConfig.GetSecret(text(c, "secretName", where));
            case CODE_NODE -> new NodeConfig.CodeNode(
                text(c, "code", where),
                optText(c, "executionMode"),
                stringList(c.get("inputVariables")),
                optInt(c, "timeout"));
            case JSON_PARSE -> new NodeConfig.JsonParse(
                optText(c, "sourcePath"),
                c.has("strict") ? c.get("strict").asBoolean() : null);
            case ABI_ENCODE -> new NodeConfig.AbiEncode(json(c.get("abiParams")), mappings(c.get("dataMapping")));
            case ABI_DECODE -> new NodeConfig.AbiDecode(json(c.get("abiParams")), stringList(c.get("outputNames")));
            case MERGE -> {
                JsonNode strategy = c.get("strategy");
                yield strategy == null
                    ? new NodeConfig.Merge(null, null)
                    : new NodeConfig.Merge(optText(strategy, "mode"), optText(strategy, "code"));
            }
            case FILTER -> new NodeConfig.Filter(conditions(c.get("conditions")), optText(c, "combineWith"));
            case IF -> new NodeConfig.If(conditions(c.get("conditions")), optText(c, "combineWith"));
            case AI -> new NodeConfig.Ai(
                text(c, "provider", where),
                text(c, "baseUrl", where),
                text(c, "model", where),
                text(c, "apiKeySecret", where),
                c.has("systemPrompt") ? c.get("systemPrompt").asText() : "",
                text(c, "userPrompt", where),
                c.has("temperature") ? c.get("temperature").asDouble() : null,
                optInt(c, "maxTokens"),
                optText(c, "responseFormat"));
            case RETURN -> new NodeConfig.Return(text(c, "returnExpression", where));
            case LOG -> new NodeConfig.Log(optText(c, "level"), text(c, "messageTemplate", where));
            case ERROR -> new NodeConfig.Error(text(c, "errorMessage", where));
            case MINT_TOKEN -> token(kind, c, "recipientSource", where);
            case BURN_TOKEN -> token(kind, c, "fromSource", where);
            case TRANSFER_TOKEN -> token(kind, c, "toSource", where);
            case CHECK_KYC -> new NodeConfig.CheckKyc(
                text(c, "providerUrl", where),
                text(c, "apiKeySecretName", where),
                text(c, "walletAddressSource", where));
            case CHECK_BALANCE -> new NodeConfig.CheckBalance(
                text(c, "chainSelectorName", where),
                text(c, "tokenContractAddress", where),
                json(c.get("tokenAbi")),
                text(c, "addressSource", where));
        };
    }

    private static NodeConfig.TokenOperation token(NodeKind kind, JsonNode c, String accountField, String where) {
        return new NodeConfig.TokenOperation(
            kind,
            text(c, "chainSelectorName", where),
            text(c, "tokenContractAddress", where),
            json(c.get("tokenAbi")),
            text(c, accountField, where),
            text(c, "amountSource", where),
            optText(c, "gasLimit"));
    }

    private static HttpAuth httpAuth(JsonNode node, String where) {
        if (node == null || node.isNull()) {
            return null;
        }
        String type = node.has("type") ? node.get("type").asText() : "none";
        return switch (type) {
            case "none" -> null;
            case "bearerToken" -> new HttpAuth.BearerToken(text(node, "tokenSecret", where));
            case "headerAuth" -> new HttpAuth.HeaderAuth(text(node, "headerName", where),
                text(node, "valueSecret", where));
            case "basicAuth" -> new HttpAuth.BasicAuth(text(node, "usernameSecret", where),
                text(node, "passwordSecret", where));
            case "queryAuth" -> new HttpAuth.QueryAuth(text(node, "paramName", where),
                text(node, "valueSecret", where));
            default -> throw new IllegalArgumentException(
                "Unknown authentication type '%s' in %s".formatted(type, where));
        };
    }

    private static List<String> authorizedAddresses(JsonNode auth) {
        if (auth != null && "evmSignature".equals(optText(auth, "type"))) {
            return stringList(auth.get("authorizedAddresses"));
        }
        return List.of();
    }

    private static Map<Integer, List<String>> topicFilters(JsonNode node) {
        var filters = new LinkedHashMap<Integer, List<String>>();
        if (node != null) {
            for (int index = 1; index <= 3; index++) {
                JsonNode topic = node.get("topic" + index);
                if (topic != null && !topic.isNull()) {
                    filters.put(index, stringList(topic));
                }
            }
        }
        return filters;
    }

    private static List<ConditionConfig> conditions(JsonNode node) {
        var conditions = new ArrayList<ConditionConfig>();
        if (node != null) {
            for (JsonNode c : node) {
                conditions.add(new ConditionConfig(optText(c, "field"), optText(c, "operator"), optText(c, "value")));
            }
        }
        return conditions;
    }

    private static List<NodeConfig.Arg> args(JsonNode node) {
        var args = new ArrayList<NodeConfig.Arg>();
        if (node != null) {
            for (JsonNode a : node) {
                String abiType = a.has("abiType") ? a.get("abiType").asText() : optText(a, "type");
                args.add(new NodeConfig.Arg(abiType, optText(a, "value")));
            }
        }
        return args;
    }

    private static List<NodeConfig.Mapping> mappings(JsonNode node) {
        var mappings = new ArrayList<NodeConfig.Mapping>();
        if (node != null) {
            for (JsonNode m : node) {
                mappings.add(new NodeConfig.Mapping(optText(m, "paramName"), optText(m, "source")));
            }
        }
        return mappings;
    }

    private static JsonNode required(JsonNode node, String field, String where) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new IllegalArgumentException("Missing required field '%s' in %s".formatted(field, where));
        }
        return value;
    }

    private static String text(JsonNode node, String field, String where) {
        return required(node, field, where).asText();
    }

    private static String optText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static Integer optInt(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asInt();
    }

    /** A subtree kept as compact JSON text, or null when absent. */
    private static String json(JsonNode node) {
        return node == null || node.isNull() ? null : node.toString();
    }

    private static List<String> stringList(JsonNode node) {
        var values = new ArrayList<String>();
        if (node != null) {
            node.forEach(v -> values.add(v.asText()));
        }
        return values;
    }

    private static List<Integer> intList(JsonNode node) {
        var values = new ArrayList<Integer>();
        node.forEach(v -> values.add(v.asInt()));
        return values;
    }

    private static Map<String, String> stringMap(JsonNode node) {
        var values = new LinkedHashMap<String, String>();
        if (node != null) {
            for (var entry : node.properties()) {
                values.put(entry.getKey(), entry.getValue().asText());
            }
        }
        return values;
    }
}
