package dev.flowc.model;

import java.util.List;

public record GlobalConfig(
    boolean testnet,
    String defaultChainSelector, // nullable
    List<SecretReference> secrets,
    List<RpcReference> rpcs
) {

    public static GlobalConfig empty() {
        return new GlobalConfig(true, null, List.of(), List.of());
    }
}
