package dev.flowc.lower;

import dev.flowc.ir.ConsensusStrategy;
import dev.flowc.ir.EvmArg;
import dev.flowc.ir.HttpAuth;
import dev.flowc.ir.HttpMethod;
import dev.flowc.ir.NamedValue;
import dev.flowc.ir.Operation;
import dev.flowc.ir.ResponseFormat;
import dev.flowc.ir.Step;
import dev.flowc.ir.ValueExpr;
import dev.flowc.model.NodeConfig;
import dev.flowc.model.NodeKind;
import dev.flowc.model.WorkflowNode;

import java.util.List;

/**
 * Expands the token and compliance nodes.
 *
 * <ul>
 *   <li>mint, burn, transfer: {@code ___encode} (ABI encode) then {@code ___write} (EVM write)</li>
 *   <li>check balance: {@code ___read} ({@code balanceOf} EVM read)</li>
 *   <li>check KYC: {@code ___secret}, {@code ___http} (bearer-authenticated GET) then {@code ___parse}</li>
 * </ul>
 */
public final class TokenNodeExpander implements ConvenienceExpander {

    static final long DEFAULT_GAS_LIMIT = 500_000L;

    @Override
    public List<Step> expand(WorkflowNode node, ExpressionResolver resolver) {
        NodeConfig config = node.config();
        if (config instanceof NodeConfig.TokenOperation token) {
            return expandToken(node, token, resolver);
        }
        if (config instanceof NodeConfig.CheckBalance balance) {
            return expandBalance(node, balance, resolver);
        }
        if (config instanceof NodeConfig.CheckKyc kyc) {
            return expandKyc(node, kyc, resolver);
        }
        return List.of();
    }

    @Override
    public String outputStepId(WorkflowNode node) {
        return switch (node.kind()) {
            case MINT_TOKEN, BURN_TOKEN, TRANSFER_TOKEN -> node.id() + "___write";
            case CHECK_BALANCE -> node.id() + "___read";
            case CHECK_KYC -> node.id() + "___parse";
            default -> null;
        };
    }

    private static List<Step> expandToken(WorkflowNode node, NodeConfig.TokenOperation config,
                                          ExpressionResolver resolver) {
        String encodeId = node.id() + "___encode";
        String writeId = node.id() + "___write";

        var encode = new Operation.AbiEncode(
            functionName(config.tokenKind()),
            config.tokenAbiJson(),
            List.of(
                new NamedValue(accountParam(config.tokenKind()), resolver.resolve(config.accountSource())),
                new NamedValue("amount", resolver.resolve(config.amountSource()))
            )
        );
        var write = new Operation.EvmWrite(
            BindingNames.evmClient(config.chainSelectorName()),
            resolver.resolve(config.tokenContractAddress()),
            ValueExpr.integer(parseGasLimit(config.gasLimit())),
            ValueExpr.binding(encodeId, "encoded"),
            null
        );

        return List.of(
            new Step(encodeId, List.of(node.id()), node.label() + " (encode)", encode,
                BindingNames.output(encodeId, BindingNames.ENCODED_DATA)),
            new Step(writeId, List.of(node.id()), node.label() + " (write)", write,
                BindingNames.output(writeId, BindingNames.EVM_WRITE_RESULT))
        );
    }

    private static List<Step> expandBalance(WorkflowNode node, NodeConfig.CheckBalance config,
                                            ExpressionResolver resolver) {
        String readId = node.id() + "___read";
        var read = new Operation.EvmRead(
            BindingNames.evmClient(config.chainSelectorName()),
            resolver.resolve(config.tokenContractAddress()),
            "balanceOf",
            config.tokenAbiJson(),
            List.of(new EvmArg("address", resolver.resolve(config.addressSource()))),
            null,
            null
        );
        return List.of(new Step(readId, List.of(node.id()), node.label() + " (read)", read,
            BindingNames.output(readId, BindingNames.ANY)));
    }

    private static List<Step> expandKyc(WorkflowNode node, NodeConfig.CheckKyc config,
                                        ExpressionResolver resolver) {
        String secretId = node.id() + "___secret";
        String httpId = node.id() + "___http";
        String parseId = node.id() + "___parse";

        var http = new Operation.HttpRequest(
            HttpMethod.GET,
            resolver.resolve(config.providerUrl()),
            List.of(),
            List.of(new NamedValue("address", resolver.resolve(config.walletAddressSource()))),
            null,
            new HttpAuth.BearerToken(config.apiKeySecretName()),
            null,
            null,
            List.of(200),
            ResponseFormat.JSON,
            ConsensusStrategy.identical()
        );

        return List.of(
            new Step(secretId, List.of(node.id()), node.label() + " (secret)",
                new Operation.GetSecret(config.apiKeySecretName()),
                BindingNames.output(secretId, BindingNames.SECRET_VALUE)),
            new Step(httpId, List.of(node.id()), node.label() + " (request)", http,
                BindingNames.output(httpId, BindingNames.HTTP_RESPONSE)),
            new Step(parseId, List.of(node.id()), node.label() + " (parse)",
                new Operation.JsonParse(ValueExpr.binding(httpId, "body"), "", true),
                BindingNames.output(parseId, BindingNames.ANY))
        );
    }

    private static String functionName(NodeKind kind) {
        return switch (kind) {
            case MINT_TOKEN -> "mint";
            case BURN_TOKEN -> "burn";
            default -> "transfer";
        };
    }

    private static String accountParam(NodeKind kind) {
        return kind == NodeKind.BURN_TOKEN ? "from" : "to";
    }

    static long parseGasLimit(String gasLimit) {
        if (gasLimit == null || gasLimit.isBlank()) {
            return DEFAULT_GAS_LIMIT;
        }
        try {
            return Long.parseLong(gasLimit.trim());
        } catch (NumberFormatException e) {
            return DEFAULT_GAS_LIMIT;
        }
    }
}
