package dev.flowc.ir;

import java.util.Locale;

public enum HttpMethod {
    GET,
    POST,
    PUT,
    DELETE,
    PATCH,
    HEAD;

    public static HttpMethod fromEditorName(String name) {
        if (name == null) {
            return GET;
        }
        try {
            return valueOf(name.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return GET;
        }
    }
}
