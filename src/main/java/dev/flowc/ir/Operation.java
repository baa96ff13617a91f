package dev.flowc.ir;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.ArrayList;
import java.util.List;

/**
 * What a step does. One variant per code generation pattern of the target runtime.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = Operation.HttpRequest.class, name = "httpRequest"),
    @JsonSubTypes.Type(value = Operation.EvmRead.class, name = "evmRead"),
    @JsonSubTypes.Type(value = Operation.EvmWrite.class, name = "evmWrite"),
    @JsonSubTypes.Type(value = Operation.GetSecret.class, name = "getSecret"),
    @JsonSubTypes.Type(value = Operation.CodeNode.class, name = "codeNode"),
    @JsonSubTypes.Type(value = Operation.JsonParse.class, name = "jsonParse"),
    @JsonSubTypes.Type(value = Operation.AbiEncode.class, name = "abiEncode"),
    @JsonSubTypes.Type(value = Operation.AbiDecode.class, name = "abiDecode"),
    @JsonSubTypes.Type(value = Operation.Branch.class, name = "branch"),
    @JsonSubTypes.Type(value = Operation.Filter.class, name = "filter"),
    @JsonSubTypes.Type(value = Operation.Merge.class, name = "merge"),
    @JsonSubTypes.Type(value = Operation.AiCall.class, name = "aiCall"),
    @JsonSubTypes.Type(value = Operation.Log.class, name = "log"),
    @JsonSubTypes.Type(value = Operation.ErrorThrow.class, name = "errorThrow"),
    @JsonSubTypes.Type(value = Operation.Return.class, name = "return")
})
public sealed interface Operation {

    OperationKind kind();

    /**
     * Expressions this operation reads directly. Blocks nested in a Branch are not included.
     */
    List<ValueExpr> expressions();

    /** Secret names this operation reads, directly or through its authentication settings. */
    default List<String> secretNames() {
        return List.of();
    }

    /** {@code httpClient.sendRequest(...)} capability call. */
    record HttpRequest(
        HttpMethod method,
        ValueExpr url,
        List<NamedValue> headers,
        List<NamedValue> queryParams,
        HttpBody body, // nullable
        HttpAuth authentication, // nullable
        Integer cacheMaxAgeSeconds,
        Integer timeoutMs,
        List<Integer> expectedStatusCodes,
        ResponseFormat responseFormat,
        ConsensusStrategy consensus
    ) implements Operation {
        @Override
        public OperationKind kind() {
            return OperationKind.HTTP_REQUEST;
        }

        @Override
        public List<ValueExpr> expressions() {
            var exprs = new ArrayList<ValueExpr>();
            exprs.add(url);
            headers.forEach(h -> exprs.add(h.value()));
            queryParams.forEach(q -> exprs.add(q.value()));
            if (body != null) {
                exprs.add(body.data());
            }
            return exprs;
        }

        @Override
        public List<String> secretNames() {
            return authentication == null ? List.of() : authentication.secretNames();
        }
    }

    record EvmRead(
        String evmClientBinding,
        ValueExpr contractAddress,
        String functionName,
        String abiJson,
        List<EvmArg> args,
        ValueExpr fromAddress, // nullable
        ValueExpr blockNumber // nullable
    ) implements Operation {
        @Override
        public OperationKind kind() {
            return OperationKind.EVM_READ;
        }

        @Override
        public List<ValueExpr> expressions() {
            var exprs = new ArrayList<ValueExpr>();
            exprs.add(contractAddress);
            args.forEach(a -> exprs.add(a.value()));
            if (fromAddress != null) {
                exprs.add(fromAddress);
            }
            if (blockNumber != null) {
                exprs.add(blockNumber);
            }
            return exprs;
        }
    }

    record EvmWrite(
        String evmClientBinding,
        ValueExpr receiverAddress,
        ValueExpr gasLimit,
        ValueExpr encodedData,
        ValueExpr valueWei // nullable
    ) implements Operation {
        @Override
        public OperationKind kind() {
            return OperationKind.EVM_WRITE;
        }

        @Override
        public List<ValueExpr> expressions() {
            return present(receiverAddress, gasLimit, encodedData, valueWei);
        }
    }

    record GetSecret(String secretName) implements Operation {
        @Override
        public OperationKind kind() {
            return OperationKind.GET_SECRET;
        }

        @Override
        public List<ValueExpr> expressions() {
            return List.of();
        }

        @Override
        public List<String> secretNames() {
            return secretName == null ? List.of() : List.of(secretName);
        }
    }

    /** User code wrapped in an immediately invoked function; inputs are declared before it. */
    record CodeNode(
        String code,
        List<NamedValue> inputBindings,
        ExecutionMode executionMode,
        Integer timeoutMs
    ) implements Operation {

        public enum ExecutionMode {
            RUN_ONCE_FOR_ALL,
            RUN_ONCE_FOR_EACH
        }

        @Override
        public OperationKind kind() {
            return OperationKind.CODE_NODE;
        }

        @Override
        public List<ValueExpr> expressions() {
            return inputBindings.stream().map(NamedValue::value).toList();
        }
    }

    record JsonParse(ValueExpr input, String sourcePath, boolean strict) implements Operation {
        @Override
        public OperationKind kind() {
            return OperationKind.JSON_PARSE;
        }

        @Override
        public List<ValueExpr> expressions() {
            return present(input);
        }
    }

    record AbiEncode(
        String functionName, // nullable, standalone parameter encoding
        String abiJson,
        List<NamedValue> dataMappings
    ) implements Operation {
        @Override
        public OperationKind kind() {
            return OperationKind.ABI_ENCODE;
        }

        @Override
        public List<ValueExpr> expressions() {
            return dataMappings.stream().map(NamedValue::value).toList();
        }
    }

    record AbiDecode(ValueExpr input, String abiJson, List<String> outputNames) implements Operation {
        @Override
        public OperationKind kind() {
            return OperationKind.ABI_DECODE;
        }

        @Override
        public List<ValueExpr> expressions() {
            return present(input);
        }
    }

    /**
     * {@code if (conditions) { trueBranch } else { falseBranch }}. When {@code reconvergeAt} is set it names
     * the Merge step that immediately follows this step in the same block.
     */
    record Branch(
        List<Condition> conditions,
        LogicCombinator combineWith,
        Block trueBranch,
        Block falseBranch,
        String reconvergeAt // nullable, both arms terminate on their own
    ) implements Operation {
        @Override
        public OperationKind kind() {
            return OperationKind.BRANCH;
        }

        @Override
        public List<ValueExpr> expressions() {
            return conditionExpressions(conditions);
        }
    }

    /** Guard clause: continues or bails out, never forks. */
    record Filter(
        List<Condition> conditions,
        LogicCombinator combineWith,
        FilterNonMatch nonMatchBehavior
    ) implements Operation {
        @Override
        public OperationKind kind() {
            return OperationKind.FILTER;
        }

        @Override
        public List<ValueExpr> expressions() {
            return conditionExpressions(conditions);
        }
    }

    /**
     * Reconvergence point of a Branch, or a standalone fan-in when {@code branchStepId} is null.
     * Its output binding is the variable both arms assign.
     */
    record Merge(
        String branchStepId, // nullable
        MergeStrategy strategy,
        List<NamedValue> inputs
    ) implements Operation {
        @Override
        public OperationKind kind() {
            return OperationKind.MERGE;
        }

        @Override
        public List<ValueExpr> expressions() {
            return inputs.stream().map(NamedValue::value).toList();
        }
    }

    record AiCall(
        String provider,
        ValueExpr baseUrl,
        ValueExpr model,
        String apiKeySecret, // nullable
        ValueExpr systemPrompt, // nullable
        ValueExpr userPrompt,
        Double temperature,
        Integer maxTokens,
        ResponseFormat responseFormat,
        ConsensusStrategy consensus
    ) implements Operation {
        @Override
        public OperationKind kind() {
            return OperationKind.AI_CALL;
        }

        @Override
        public List<ValueExpr> expressions() {
            return present(baseUrl, model, systemPrompt, userPrompt);
        }

        @Override
        public List<String> secretNames() {
            return apiKeySecret == null ? List.of() : List.of(apiKeySecret);
        }
    }

    record Log(LogLevel level, ValueExpr message) implements Operation {
        @Override
        public OperationKind kind() {
            return OperationKind.LOG;
        }

        @Override
        public List<ValueExpr> expressions() {
            return present(message);
        }
    }

    /** Terminates execution with an error. */
    record ErrorThrow(ValueExpr message) implements Operation {
        @Override
        public OperationKind kind() {
            return OperationKind.ERROR_THROW;
        }

        @Override
        public List<ValueExpr> expressions() {
            return present(message);
        }
    }

    /** Terminates execution; the handler returns the expression. */
    record Return(ValueExpr expression) implements Operation {
        @Override
        public OperationKind kind() {
            return OperationKind.RETURN;
        }

        @Override
        public List<ValueExpr> expressions() {
            return present(expression);
        }
    }

    /** The non-null expressions among {@code exprs}, in order. */
    private static List<ValueExpr> present(ValueExpr... exprs) {
        var result = new ArrayList<ValueExpr>(exprs.length);
        for (ValueExpr expr : exprs) {
            if (expr != null) {
                result.add(expr);
            }
        }
        return result;
    }

    private static List<ValueExpr> conditionExpressions(List<Condition> conditions) {
        var exprs = new ArrayList<ValueExpr>();
        for (Condition condition : conditions) {
            if (condition.field() != null) {
                exprs.add(condition.field());
            }
            if (condition.value() != null) {
                exprs.add(condition.value());
            }
        }
        return exprs;
    }
}
