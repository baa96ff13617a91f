package dev.flowc.ir;

import java.util.List;

/**
 * Complete intermediate representation of a compiled workflow. Built once by lowering, checked once by
 * the validator and handed unchanged to code emission.
 */
public record WorkflowIR(
    WorkflowMetadata metadata,
    TriggerDef trigger,
    TriggerParam triggerParam,
    List<ConfigField> configSchema,
    List<SecretDeclaration> requiredSecrets,
    List<EvmChainUsage> evmChains,
    List<RpcEntry> userRpcs,
    Block handlerBody
) {}
