package dev.flowc.lower;

import dev.flowc.graph.WorkflowGraph;
import dev.flowc.ir.ComparisonOp;
import dev.flowc.ir.Condition;
import dev.flowc.ir.ConsensusStrategy;
import dev.flowc.ir.EvmArg;
import dev.flowc.ir.FilterNonMatch;
import dev.flowc.ir.HttpBody;
import dev.flowc.ir.HttpMethod;
import dev.flowc.ir.LogLevel;
import dev.flowc.ir.LogicCombinator;
import dev.flowc.ir.MergeStrategy;
import dev.flowc.ir.NamedValue;
import dev.flowc.ir.Operation;
import dev.flowc.ir.OutputBinding;
import dev.flowc.ir.ResponseFormat;
import dev.flowc.ir.Step;
import dev.flowc.ir.ValueExpr;
import dev.flowc.model.ConditionConfig;
import dev.flowc.model.NodeConfig;
import dev.flowc.model.NodeKind;
import dev.flowc.model.WorkflowNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * One node in, one step out. Control flow and convenience nodes are handled elsewhere.
 */
final class PrimitiveLowering {

    static final String UNSUPPORTED_NODE = "L003";
    static final String MISSING_INPUT = "L004";
    static final String FILTER_MESSAGE = "Filter condition not met";

    private final WorkflowGraph graph;
    private final ExpressionResolver resolver;

    PrimitiveLowering(WorkflowGraph graph, ExpressionResolver resolver) {
        this.graph = graph;
        this.resolver = resolver;
    }

    Step lower(WorkflowNode node) throws LoweringException {
        String id = node.id();
        NodeConfig config = node.config();

        if (config instanceof NodeConfig.HttpRequest http) {
            return step(node, httpRequest(http), BindingNames.output(id, BindingNames.HTTP_RESPONSE));
        } else if (config instanceof NodeConfig.EvmRead read) {
            return step(node, evmRead(read), BindingNames.output(id, BindingNames.ANY));
        } else if (config instanceof NodeConfig.EvmWrite write) {
            return step(node, evmWrite(write), BindingNames.output(id, BindingNames.EVM_WRITE_RESULT));
        } else if (config instanceof NodeConfig.GetSecret secret) {
            return step(node, new Operation.GetSecret(secret.secretName()),
                BindingNames.output(id, BindingNames.SECRET_VALUE));
        } else if (config instanceof NodeConfig.CodeNode code) {
            return step(node, codeNode(code), BindingNames.output(id, BindingNames.ANY));
        } else if (config instanceof NodeConfig.JsonParse parse) {
            var op = new Operation.JsonParse(predecessorInput(node, "body"),
                parse.sourcePath() == null ? "" : parse.sourcePath(),
                parse.strict() == null || parse.strict());
            return step(node, op, BindingNames.output(id, BindingNames.ANY));
        } else if (config instanceof NodeConfig.AbiEncode encode) {
            return step(node, abiEncode(encode), BindingNames.output(id, BindingNames.ENCODED_DATA));
        } else if (config instanceof NodeConfig.AbiDecode decode) {
            var op = new Operation.AbiDecode(predecessorInput(node, ""), decode.abiParamsJson(),
                nullToEmpty(decode.outputNames()));
            return step(node, op, BindingNames.output(id, BindingNames.ANY));
        } else if (config instanceof NodeConfig.Filter filter) {
            var op = new Operation.Filter(conditions(filter.conditions()),
                LogicCombinator.fromEditorName(filter.combineWith()),
                FilterNonMatch.earlyReturn(FILTER_MESSAGE));
            return step(node, op, null);
        } else if (config instanceof NodeConfig.Ai ai) {
            return step(node, aiCall(ai), BindingNames.output(id, BindingNames.ANY));
        } else if (config instanceof NodeConfig.Log logConfig) {
            var op = new Operation.Log(LogLevel.fromEditorName(logConfig.level()),
                resolver.resolve(logConfig.messageTemplate()));
            return step(node, op, null);
        } else if (config instanceof NodeConfig.Error error) {
            return step(node, new Operation.ErrorThrow(resolver.resolve(error.errorMessage())), null);
        } else if (config instanceof NodeConfig.Return ret) {
            return step(node, new Operation.Return(resolver.resolve(ret.returnExpression())), null);
        } else if (config instanceof NodeConfig.Merge merge) {
            return step(node, standaloneMerge(node, merge), BindingNames.output(id, BindingNames.ANY));
        }
        throw new LoweringException(UNSUPPORTED_NODE,
            "Unsupported node type '%s' for direct lowering".formatted(node.kind().tag()), id);
    }

    /** Strategy configured on a merge node. */
    static MergeStrategy mergeStrategy(NodeConfig.Merge config) {
        if (config.mode() == null) {
            return MergeStrategy.passThrough();
        }
        return switch (config.mode()) {
            case "append" -> new MergeStrategy(MergeStrategy.Mode.APPEND, null);
            case "custom" -> new MergeStrategy(MergeStrategy.Mode.CUSTOM, config.customCode());
            default -> MergeStrategy.passThrough();
        };
    }

    List<Condition> conditions(List<ConditionConfig> configs) {
        var conditions = new ArrayList<Condition>();
        for (ConditionConfig c : nullToEmpty(configs)) {
            conditions.add(new Condition(
                resolver.resolve(c.field()),
                ComparisonOp.fromEditorName(c.operator()),
                resolver.resolveOptional(c.value())));
        }
        return conditions;
    }

    private static Step step(WorkflowNode node, Operation operation, OutputBinding output) {
        return new Step(node.id(), List.of(node.id()), node.label(), operation, output);
    }

    private Operation.HttpRequest httpRequest(NodeConfig.HttpRequest config) {
        HttpBody body = null;
        if (config.body() != null) {
            body = new HttpBody(contentType(config.body().contentType()), resolver.resolve(config.body().data()));
        }
        return new Operation.HttpRequest(
            HttpMethod.fromEditorName(config.method()),
            resolver.resolve(config.url()),
            namedValues(config.headers()),
            namedValues(config.queryParameters()),
            body,
            config.authentication(),
            config.cacheMaxAge(),
            config.timeout(),
            config.expectedStatusCodes() == null ? List.of(200) : config.expectedStatusCodes(),
            responseFormat(config.responseFormat(), ResponseFormat.JSON),
            ConsensusStrategy.identical()
        );
    }

    private Operation.EvmRead evmRead(NodeConfig.EvmRead config) {
        var args = new ArrayList<EvmArg>();
        for (NodeConfig.Arg arg : nullToEmpty(config.args())) {
            args.add(new EvmArg(arg.abiType(), resolver.resolve(arg.value())));
        }
        return new Operation.EvmRead(
            BindingNames.evmClient(config.chainSelectorName()),
            resolver.resolve(config.contractAddress()),
            config.functionName(),
            config.abiJson(),
            args,
            resolver.resolveOptional(config.fromAddress()),
            resolver.resolveOptional(config.blockNumber())
        );
    }

    private Operation.EvmWrite evmWrite(NodeConfig.EvmWrite config) {
        // Calldata is expected pre-encoded by an upstream ABI encode step; the first mapping points at it.
        List<NodeConfig.Arg> mapping = nullToEmpty(config.dataMapping());
        ValueExpr encoded = mapping.isEmpty() ? ValueExpr.string("0x") : resolver.resolve(mapping.get(0).value());
        return new Operation.EvmWrite(
            BindingNames.evmClient(config.chainSelectorName()),
            resolver.resolve(config.receiverAddress()),
            ValueExpr.integer(TokenNodeExpander.parseGasLimit(config.gasLimit())),
            encoded,
            resolver.resolveOptional(config.value())
        );
    }

    private Operation.CodeNode codeNode(NodeConfig.CodeNode config) {
        var inputs = new ArrayList<NamedValue>();
        for (String variable : nullToEmpty(config.inputVariables())) {
            String name = BindingNames.sanitize(variable.replace("{{", "").replace("}}", "").trim());
            inputs.add(new NamedValue(name, resolver.resolve(variable)));
        }
        var mode = "runOnceForEach".equals(config.executionMode())
            ? Operation.CodeNode.ExecutionMode.RUN_ONCE_FOR_EACH
            : Operation.CodeNode.ExecutionMode.RUN_ONCE_FOR_ALL;
        return new Operation.CodeNode(config.code(), inputs, mode, config.timeout());
    }

    private Operation.AbiEncode abiEncode(NodeConfig.AbiEncode config) {
        var mappings = new ArrayList<NamedValue>();
        for (NodeConfig.Mapping m : nullToEmpty(config.dataMapping())) {
            mappings.add(new NamedValue(m.paramName(), resolver.resolve(m.source())));
        }
        return new Operation.AbiEncode(null, config.abiParamsJson(), mappings);
    }

    private Operation.AiCall aiCall(NodeConfig.Ai config) {
        return new Operation.AiCall(
            config.provider(),
            resolver.resolve(config.baseUrl()),
            resolver.resolve(config.model()),
            config.apiKeySecret(),
            resolver.resolve(config.systemPrompt()),
            resolver.resolve(config.userPrompt()),
            config.temperature(),
            config.maxTokens(),
            "json".equals(config.responseFormat()) ? ResponseFormat.JSON : ResponseFormat.TEXT,
            ConsensusStrategy.identical()
        );
    }

    /** Fan-in merge outside any diamond: one input per predecessor, named after it. */
    private Operation.Merge standaloneMerge(WorkflowNode node, NodeConfig.Merge config) {
        var inputs = new ArrayList<NamedValue>();
        for (String predecessor : graph.predecessors(node.id())) {
            inputs.add(new NamedValue(predecessor, resolver.reference(predecessor, "")));
        }
        return new Operation.Merge(null, mergeStrategy(config), inputs);
    }

    /**
     * Input of a node that implicitly reads its first predecessor. HTTP and AI predecessors are narrowed
     * to {@code httpField}; a trigger predecessor yields the trigger payload.
     */
    private ValueExpr predecessorInput(WorkflowNode node, String httpField) throws LoweringException {
        List<String> predecessors = graph.predecessors(node.id());
        if (predecessors.isEmpty()) {
            throw new LoweringException(MISSING_INPUT,
                "Node type '%s' reads its predecessor but has none".formatted(node.kind().tag()), node.id());
        }
        WorkflowNode predecessor = graph.node(predecessors.get(0));
        if (predecessor.isTrigger()) {
            return ValueExpr.triggerData("input");
        }
        boolean narrowed = predecessor.kind() == NodeKind.HTTP_REQUEST || predecessor.kind() == NodeKind.AI;
        return resolver.reference(predecessor.id(), narrowed ? httpField : "");
    }

    private List<NamedValue> namedValues(Map<String, String> values) {
        var result = new ArrayList<NamedValue>();
        if (values != null) {
            values.forEach((name, raw) -> result.add(new NamedValue(name, resolver.resolve(raw))));
        }
        return result;
    }

    private static HttpBody.ContentType contentType(String name) {
        if ("json".equals(name)) {
            return HttpBody.ContentType.JSON;
        }
        if ("formUrlEncoded".equals(name)) {
            return HttpBody.ContentType.FORM_URL_ENCODED;
        }
        return HttpBody.ContentType.RAW;
    }

    private static ResponseFormat responseFormat(String name, ResponseFormat fallback) {
        if (name == null) {
            return fallback;
        }
        return switch (name.toLowerCase(Locale.ROOT)) {
            case "text" -> ResponseFormat.TEXT;
            case "binary" -> ResponseFormat.BINARY;
            case "json" -> ResponseFormat.JSON;
            default -> fallback;
        };
    }

    private static <T> List<T> nullToEmpty(List<T> list) {
        return list == null ? List.of() : list;
    }
}
