package im.arun.jsonnav.tree;

import com.fasterxml.jackson.databind.JsonNode;
import im.arun.jsonnav.model.NodeKind;

/**
 * Display previews for tree rows. Pure and length-bounded.
 */
public final class ValueFormatter {
    private static final String ELLIPSIS = "...";

    private ValueFormatter() {}

    public static String displayValue(JsonNode element, int maxLength) {
        NodeKind kind = NodeKind.of(element);
        switch (kind) {
            case OBJECT:
                return element.size() > 0 ? "{ " + element.size() + " items }" : "{}";
            case ARRAY:
                return element.size() > 0 ? "[ " + element.size() + " items ]" : "[]";
            case STRING:
                return truncate(element.asText(), maxLength);
            case NUMBER:
                return element.asText();
            case BOOLEAN:
                return element.booleanValue() ? "true" : "false";
            case NULL:
            default:
                return "null";
        }
    }

    /**
     * Cuts {@code text} to {@code maxLength} chars plus an ellipsis, never splitting a surrogate pair.
     */
    public static String truncate(String text, int maxLength) {
        if (text.length() <= maxLength) {
            return text;
        }
        int end = maxLength;
        if (end > 0 && Character.isHighSurrogate(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(0, end) + ELLIPSIS;
    }
}
