package dev.flowc.ir;

public record HttpBody(ContentType contentType, ValueExpr data) {

    public enum ContentType {
        JSON,
        FORM_URL_ENCODED,
        RAW
    }
}
