package dev.flowc.ir;

/**
 * Discriminator of {@link Operation}. Consumers switch over it so that a new kind fails compilation
 * wherever it is not handled.
 */
public enum OperationKind {
    HTTP_REQUEST,
    EVM_READ,
    EVM_WRITE,
    GET_SECRET,
    CODE_NODE,
    JSON_PARSE,
    ABI_ENCODE,
    ABI_DECODE,
    BRANCH,
    FILTER,
    MERGE,
    AI_CALL,
    LOG,
    ERROR_THROW,
    RETURN
}
