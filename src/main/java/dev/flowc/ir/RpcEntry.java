package dev.flowc.ir;

public record RpcEntry(String chainName, String url) {}
