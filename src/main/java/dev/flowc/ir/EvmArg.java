package dev.flowc.ir;

public record EvmArg(String abiType, ValueExpr value) {}
