package dev.flowc.model;

import dev.flowc.ir.HttpAuth;

import java.util.List;
import java.util.Map;

/**
 * Kind-specific configuration of a node. String fields may hold {@code {{nodeId.field}}} references.
 */
public sealed interface NodeConfig {

    NodeKind kind();

    // --- Triggers ---

    record CronTrigger(String schedule, String timezone) implements NodeConfig {
        public NodeKind kind() { return NodeKind.CRON_TRIGGER; }
    }

    record HttpTrigger(
        String httpMethod,
        String path, // nullable
        List<String> authorizedAddresses
    ) implements NodeConfig {
        public NodeKind kind() { return NodeKind.HTTP_TRIGGER; }
    }

    record EvmLogTrigger(
        String chainSelectorName,
        List<String> contractAddresses,
        String eventSignature,
        String eventAbiJson,
        Map<Integer, List<String>> topicFilters,
        String blockConfirmation // nullable
    ) implements NodeConfig {
        public NodeKind kind() { return NodeKind.EVM_LOG_TRIGGER; }
    }

    // --- Actions ---

    record HttpRequest(
        String method,
        String url,
        HttpAuth authentication, // nullable
        Map<String, String> headers,
        Map<String, String> queryParameters,
        Body body, // nullable
        Integer cacheMaxAge,
        Integer timeout,
        List<Integer> expectedStatusCodes, // nullable
        String responseFormat // nullable
    ) implements NodeConfig {
        public NodeKind kind() { return NodeKind.HTTP_REQUEST; }

        public record Body(String contentType, String data) {}
    }

    record EvmRead(
        String chainSelectorName,
        String contractAddress,
        String functionName,
        String abiJson,
        List<Arg> args,
        String fromAddress, // nullable
        String blockNumber // nullable
    ) implements NodeConfig {
        public NodeKind kind() { return NodeKind.EVM_READ; }
    }

    record EvmWrite(
        String chainSelectorName,
        String receiverAddress,
        String gasLimit,
        String abiParamsJson,
        List<Arg> dataMapping,
        String value // nullable
    ) implements NodeConfig {
        public NodeKind kind() { return NodeKind.EVM_WRITE; }
    }

    record GetSecret(String secretName) implements NodeConfig {
        public NodeKind kind() { return NodeKind.GET_SECRET; }
    }

    // --- Transforms ---

    record CodeNode(
        String code,
        String executionMode,
        List<String> inputVariables,
        Integer timeout
    ) implements NodeConfig {
        public NodeKind kind() { return NodeKind.CODE_NODE; }
    }

    record JsonParse(String sourcePath, Boolean strict) implements NodeConfig {
        public NodeKind kind() { return NodeKind.JSON_PARSE; }
    }

    record AbiEncode(String abiParamsJson, List<Mapping> dataMapping) implements NodeConfig {
        public NodeKind kind() { return NodeKind.ABI_ENCODE; }
    }

    record AbiDecode(String abiParamsJson, List<String> outputNames) implements NodeConfig {
        public NodeKind kind() { return NodeKind.ABI_DECODE; }
    }

    record Merge(
        String mode, // append, passThrough, custom
        String customCode // nullable
    ) implements NodeConfig {
        public NodeKind kind() { return NodeKind.MERGE; }
    }

    // --- Control flow ---

    record Filter(List<ConditionConfig> conditions, String combineWith) implements NodeConfig {
        public NodeKind kind() { return NodeKind.FILTER; }
    }

    record If(List<ConditionConfig> conditions, String combineWith) implements NodeConfig {
        public NodeKind kind() { return NodeKind.IF; }
    }

    // --- AI ---

    record Ai(
        String provider,
        String baseUrl,
        String model,
        String apiKeySecret,
        String systemPrompt,
        String userPrompt,
        Double temperature,
        Integer maxTokens,
        String responseFormat // nullable
    ) implements NodeConfig {
        public NodeKind kind() { return NodeKind.AI; }
    }

    // --- Output ---

    record Return(String returnExpression) implements NodeConfig {
        public NodeKind kind() { return NodeKind.RETURN; }
    }

    record Log(String level, String messageTemplate) implements NodeConfig {
        public NodeKind kind() { return NodeKind.LOG; }
    }

    record Error(String errorMessage) implements NodeConfig {
        public NodeKind kind() { return NodeKind.ERROR; }
    }

    // --- Convenience nodes, expanded into primitive steps before lowering ---

    /**
     * Shared shape of the mint, burn and transfer nodes. {@code accountSource} is the recipient, the
     * burned-from account or the transfer destination respectively.
     */
    record TokenOperation(
        NodeKind tokenKind,
        String chainSelectorName,
        String tokenContractAddress,
        String tokenAbiJson,
        String accountSource,
        String amountSource,
        String gasLimit
    ) implements NodeConfig {
        public NodeKind kind() { return tokenKind; }
    }

    record CheckKyc(
        String providerUrl,
        String apiKeySecretName,
        String walletAddressSource
    ) implements NodeConfig {
        public NodeKind kind() { return NodeKind.CHECK_KYC; }
    }

    record CheckBalance(
        String chainSelectorName,
        String tokenContractAddress,
        String tokenAbiJson,
        String addressSource
    ) implements NodeConfig {
        public NodeKind kind() { return NodeKind.CHECK_BALANCE; }
    }

    /** ABI-typed argument of an EVM read or write. */
    record Arg(String abiType, String value) {}

    /** ABI parameter fed from a reference string. */
    record Mapping(String paramName, String source) {}
}
