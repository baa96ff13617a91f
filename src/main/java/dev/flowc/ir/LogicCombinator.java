package dev.flowc.ir;

public enum LogicCombinator {
    AND,
    OR;

    public static LogicCombinator fromEditorName(String name) {
        return "or".equalsIgnoreCase(name) ? OR : AND;
    }
}
