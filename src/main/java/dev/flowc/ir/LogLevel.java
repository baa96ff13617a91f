package dev.flowc.ir;

import java.util.Locale;

public enum LogLevel {
    DEBUG,
    INFO,
    WARN,
    ERROR;

    public static LogLevel fromEditorName(String name) {
        if (name == null) {
            return INFO;
        }
        return switch (name.toLowerCase(Locale.ROOT)) {
            case "debug" -> DEBUG;
            case "warn" -> WARN;
            case "error" -> ERROR;
            default -> INFO;
        };
    }
}
