package dev.flowc.ir;

public record MergeStrategy(Mode mode, String customExpr) {

    public enum Mode {
        /** Whichever arm ran provides the value. */
        PASS_THROUGH,
        APPEND,
        CUSTOM
    }

    public static MergeStrategy passThrough() {
        return new MergeStrategy(Mode.PASS_THROUGH, null);
    }
}
