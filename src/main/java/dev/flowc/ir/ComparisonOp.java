package dev.flowc.ir;

public enum ComparisonOp {
    EQUALS,
    NOT_EQUALS,
    GT,
    GTE,
    LT,
    LTE,
    CONTAINS,
    NOT_CONTAINS,
    STARTS_WITH,
    ENDS_WITH,
    REGEX,
    NOT_REGEX,
    EXISTS,
    NOT_EXISTS,
    IS_EMPTY,
    IS_NOT_EMPTY;

    /**
     * Map an editor operator name ({@code "notEquals"}, {@code "isEmpty"}...) to its constant.
     * Unknown names fall back to {@link #EQUALS}.
     */
    public static ComparisonOp fromEditorName(String name) {
        if (name == null) {
            return EQUALS;
        }
        var sb = new StringBuilder();
        for (char c : name.toCharArray()) {
            if (Character.isUpperCase(c)) {
                sb.append('_');
            }
            sb.append(Character.toUpperCase(c));
        }
        for (ComparisonOp op : values()) {
            if (op.name().equals(sb.toString())) {
                return op;
            }
        }
        return EQUALS;
    }
}
