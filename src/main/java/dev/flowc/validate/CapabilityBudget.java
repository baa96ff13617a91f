package dev.flowc.validate;

/**
 * Per-execution ceilings on capability calls imposed by the target runtime.
 */
public record CapabilityBudget(
    int maxHttpCalls,
    int maxEvmReads,
    int maxEvmWrites
) {
    public static final int DEFAULT_MAX_HTTP_CALLS = 5;
    public static final int DEFAULT_MAX_EVM_READS = 10;
    public static final int DEFAULT_MAX_EVM_WRITES = 5;

    public static CapabilityBudget defaults() {
        return new CapabilityBudget(DEFAULT_MAX_HTTP_CALLS, DEFAULT_MAX_EVM_READS, DEFAULT_MAX_EVM_WRITES);
    }

    /** Copy with the given ceilings replaced; null keeps the current value. */
    public CapabilityBudget withOverrides(Integer httpCalls, Integer evmReads, Integer evmWrites) {
        return new CapabilityBudget(
            httpCalls != null ? httpCalls : maxHttpCalls,
            evmReads != null ? evmReads : maxEvmReads,
            evmWrites != null ? evmWrites : maxEvmWrites);
    }
}
