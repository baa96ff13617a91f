package dev.flowc.model;

public record SecretReference(String name, String envVariable) {}
