package dev.flowc.model;

public record RpcReference(String chainName, String url) {}
