package dev.flowc.lower;

import dev.flowc.ir.OutputBinding;

/**
 * Naming rules for generated identifiers.
 */
public final class BindingNames {

    public static final String ANY = "any";
    public static final String HTTP_RESPONSE = "{ statusCode: number; body: string; headers: Record<string, string> }";
    public static final String EVM_WRITE_RESULT = "{ txHash: string; status: string }";
    public static final String SECRET_VALUE = "{ value: string }";
    public static final String ENCODED_DATA = "{ encoded: string }";

    private BindingNames() {}

    /** {@code step_} followed by the step id with every non-identifier character replaced by {@code _}. */
    public static String variableName(String stepId) {
        return "step_" + sanitize(stepId);
    }

    public static OutputBinding output(String stepId, String typeAnnotation) {
        return new OutputBinding(variableName(stepId), typeAnnotation, null);
    }

    /** Name of the chain client shared by every step on {@code chainSelector}. */
    public static String evmClient(String chainSelector) {
        return "evmClient_" + chainSelector.replace('-', '_');
    }

    static String sanitize(String text) {
        var sb = new StringBuilder(text.length());
        for (char c : text.toCharArray()) {
            sb.append(Character.isLetterOrDigit(c) || c == '_' || c == '$' ? c : '_');
        }
        return sb.toString();
    }
}
