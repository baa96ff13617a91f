package dev.flowc.ir;

import java.util.List;

/**
 * How node results are aggregated across the runtime's replicas.
 */
public record ConsensusStrategy(
    Mode mode,
    List<String> fields, // MEDIAN_BY_FIELDS only
    String expr // CUSTOM only
) {

    public enum Mode {
        IDENTICAL,
        MEDIAN_BY_FIELDS,
        CUSTOM
    }

    public static ConsensusStrategy identical() {
        return new ConsensusStrategy(Mode.IDENTICAL, List.of(), null);
    }
}
