package dev.flowc.lower;

import dev.flowc.ir.TemplatePart;
import dev.flowc.ir.ValueExpr;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Parses {@code {{nodeId.field}}} references.
 *
 * <p>A string that is exactly one reference becomes that reference. A string without <code>{{</code> stays a
 * string literal. Anything else becomes a {@link ValueExpr.Template}; an unterminated <code>{{</code> turns the
 * rest of the string into literal text.
 *
 * <p>{@code config.x} resolves to a config field and {@code trigger.x} (or the trigger node's own id) to
 * trigger data. Node ids listed in the remapping table are replaced by the step id that stands for them,
 * which is how references to expanded convenience nodes reach the right primitive step.
 */
public final class TemplateExpressionResolver implements ExpressionResolver {

    private static final String OPEN = "{{";
    private static final String CLOSE = "}}";

    private final Map<String, String> idMap;
    private final String triggerNodeId; // nullable

    public TemplateExpressionResolver(Map<String, String> idMap, String triggerNodeId) {
        this.idMap = Map.copyOf(idMap);
        this.triggerNodeId = triggerNodeId;
    }

    /** Resolver without remapping or trigger alias. */
    public static TemplateExpressionResolver plain() {
        return new TemplateExpressionResolver(Map.of(), null);
    }

    @Override
    public ValueExpr resolve(String raw) {
        if (raw == null) {
            return ValueExpr.nullValue();
        }
        String trimmed = raw.trim();

        if (isSingleReference(trimmed)) {
            return parseReference(trimmed.substring(OPEN.length(), trimmed.length() - CLOSE.length()));
        }
        if (!trimmed.contains(OPEN)) {
            return ValueExpr.string(trimmed);
        }

        List<TemplatePart> parts = parseTemplate(trimmed);
        if (parts.size() == 1 && parts.get(0) instanceof TemplatePart.Lit lit) {
            return ValueExpr.string(lit.value());
        }
        return new ValueExpr.Template(parts);
    }

    @Override
    public ValueExpr reference(String nodeId, String fieldPath) {
        if ("config".equals(nodeId)) {
            return ValueExpr.config(fieldPath);
        }
        if ("trigger".equals(nodeId) || nodeId.equals(triggerNodeId)) {
            return ValueExpr.triggerData(fieldPath);
        }
        return ValueExpr.binding(idMap.getOrDefault(nodeId, nodeId), fieldPath);
    }

    private static boolean isSingleReference(String text) {
        if (!text.startsWith(OPEN) || !text.endsWith(CLOSE) || text.length() < OPEN.length() + CLOSE.length()) {
            return false;
        }
        String inner = text.substring(OPEN.length(), text.length() - CLOSE.length());
        return !inner.contains(OPEN) && !inner.contains(CLOSE);
    }

    private ValueExpr parseReference(String inner) {
        String ref = inner.trim();
        int dot = ref.indexOf('.');
        if (dot < 0) {
            return reference(ref, "");
        }
        return reference(ref.substring(0, dot), ref.substring(dot + 1));
    }

    private List<TemplatePart> parseTemplate(String text) {
        var parts = new ArrayList<TemplatePart>();
        String remaining = text;
        int start;
        while ((start = remaining.indexOf(OPEN)) >= 0) {
            if (start > 0) {
                parts.add(new TemplatePart.Lit(remaining.substring(0, start)));
            }
            String afterOpen = remaining.substring(start + OPEN.length());
            int end = afterOpen.indexOf(CLOSE);
            if (end < 0) {
                // Unterminated reference: keep the rest verbatim.
                parts.add(new TemplatePart.Lit(remaining.substring(start)));
                return parts;
            }
            parts.add(new TemplatePart.Expr(parseReference(afterOpen.substring(0, end))));
            remaining = afterOpen.substring(end + CLOSE.length());
        }
        if (!remaining.isEmpty()) {
            parts.add(new TemplatePart.Lit(remaining));
        }
        return parts;
    }
}
