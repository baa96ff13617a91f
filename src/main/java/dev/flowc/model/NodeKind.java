package dev.flowc.model;

/**
 * Node types the editor can place, keyed by the {@code type} tag of the document.
 */
public enum NodeKind {
    CRON_TRIGGER("cronTrigger"),
    HTTP_TRIGGER("httpTrigger"),
    EVM_LOG_TRIGGER("evmLogTrigger"),
    HTTP_REQUEST("httpRequest"),
    EVM_READ("evmRead"),
    EVM_WRITE("evmWrite"),
    GET_SECRET("getSecret"),
    CODE_NODE("codeNode"),
    JSON_PARSE("jsonParse"),
    ABI_ENCODE("abiEncode"),
    ABI_DECODE("abiDecode"),
    MERGE("merge"),
    FILTER("filter"),
    IF("if"),
    AI("ai"),
    RETURN("return"),
    LOG("log"),
    ERROR("error"),
    MINT_TOKEN("mintToken"),
    BURN_TOKEN("burnToken"),
    TRANSFER_TOKEN("transferToken"),
    CHECK_KYC("checkKyc"),
    CHECK_BALANCE("checkBalance");

    private final String tag;

    NodeKind(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    public boolean isTrigger() {
        return this == CRON_TRIGGER || this == HTTP_TRIGGER || this == EVM_LOG_TRIGGER;
    }

    /** Kinds that end an execution path on their own. */
    public boolean isTerminal() {
        return this == RETURN || this == ERROR;
    }

    public static NodeKind fromTag(String tag) {
        for (NodeKind kind : values()) {
            if (kind.tag.equals(tag)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown node type: " + tag);
    }
}
