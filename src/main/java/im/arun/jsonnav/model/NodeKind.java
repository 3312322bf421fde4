package im.arun.jsonnav.model;

import com.fasterxml.jackson.databind.JsonNode;

public enum NodeKind {
    OBJECT,
    ARRAY,
    STRING,
    NUMBER,
    BOOLEAN,
    NULL;

    public boolean isContainer() {
        return this == OBJECT || this == ARRAY;
    }

    public static NodeKind of(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return NULL;
        }
        if (node.isObject()) {
            return OBJECT;
        }
        if (node.isArray()) {
            return ARRAY;
        }
        if (node.isNumber()) {
            return NUMBER;
        }
        if (node.isBoolean()) {
            return BOOLEAN;
        }
        // textual, binary and POJO nodes all render as text
        return STRING;
    }
}
