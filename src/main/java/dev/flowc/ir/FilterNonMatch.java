package dev.flowc.ir;

/**
 * What a Filter does when its conditions do not hold.
 */
public record FilterNonMatch(Mode mode, String message) {

    public enum Mode {
        /** Return {@code message} from the handler. */
        EARLY_RETURN,
        /** Skip the remaining steps of the enclosing block. */
        SKIP
    }

    public static FilterNonMatch earlyReturn(String message) {
        return new FilterNonMatch(Mode.EARLY_RETURN, message);
    }
}
