package io.github.balazskreith.mailbox.document;

import com.fasterxml.jackson.databind.JsonNode;

public record DocumentOp(Type type, int index, JsonNode value) {

    public enum Type {
        APPEND,
        SET,
    }

    public static DocumentOp append(JsonNode value) {
        return new DocumentOp(Type.APPEND, -1, value);
    }

    public static DocumentOp set(int index, JsonNode value) {
        return new DocumentOp(Type.SET, index, value);
    }
}
