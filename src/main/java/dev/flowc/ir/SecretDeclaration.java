package dev.flowc.ir;

/**
 * A secret the deployed workflow expects, with the environment variable that provides it.
 */
public record SecretDeclaration(String name, String envVariable) {}
