package dev.flowc.ir;

import java.util.List;

/**
 * A single unit of work in the execution plan. The id is unique across the whole block tree.
 */
public record Step(
    String id,
    List<String> sourceNodeIds,
    String label,
    Operation operation,
    OutputBinding output // nullable, steps such as Log, Branch and Return export nothing
) {}
