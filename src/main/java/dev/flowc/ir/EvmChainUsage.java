package dev.flowc.ir;

/**
 * A distinct chain that needs its own client. Nodes on the same chain share one binding.
 */
public record EvmChainUsage(
    String chainSelectorName,
    String bindingName,
    boolean usedForTrigger
) {}
