package dev.flowc.ir;

import java.util.List;

/**
 * The single named value a step exports into the enclosing lexical scope.
 */
public record OutputBinding(
    String variableName,
    String typeAnnotation,
    List<String> destructureFields // nullable, emit a plain binding when absent
) {}
