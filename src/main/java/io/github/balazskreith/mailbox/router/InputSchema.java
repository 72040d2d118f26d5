package io.github.balazskreith.mailbox.router;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.Map;

/**
 * Validates that the input is an object with typed fields.
 *
 * Failure messages start with the kind of the failure, e.g.:
 * {@code invalid_type: expected string, received number at "name"}.
 * Fields not declared by the schema are stripped from the validated input.
 */
public class InputSchema implements InputValidator {

    public static final String INVALID_TYPE = "invalid_type";

    public enum FieldType {
        STRING("string"),
        NUMBER("number"),
        BOOLEAN("boolean"),
        OBJECT("object"),
        ARRAY("array");

        private final String kind;

        FieldType(String kind) {
            this.kind = kind;
        }

        boolean matches(JsonNode node) {
            return kindOf(node).equals(this.kind);
        }
    }

    private record Field(FieldType type, boolean required) {

    }

    public static Builder object() {
        return new Builder();
    }

    private final Map<String, Field> fields;

    private InputSchema(Map<String, Field> fields) {
        this.fields = fields;
    }

    @Override
    public ValidationResult validate(JsonNode input) {
        if (!FieldType.OBJECT.matches(input)) {
            return ValidationResult.invalid(invalidType(FieldType.OBJECT, input, null));
        }
        var issues = new LinkedList<String>();
        var result = JsonNodeFactory.instance.objectNode();
        for (var entry : this.fields.entrySet()) {
            var name = entry.getKey();
            var field = entry.getValue();
            var value = input.get(name);
            if (value == null || (value.isNull() && !field.required())) {
                if (field.required()) {
                    issues.add(invalidType(field.type(), value, name));
                }
                continue;
            }
            if (!field.type().matches(value)) {
                issues.add(invalidType(field.type(), value, name));
                continue;
            }
            result.set(name, value);
        }
        if (!issues.isEmpty()) {
            return ValidationResult.invalid(String.join("; ", issues));
        }
        return ValidationResult.valid(result);
    }

    private static String invalidType(FieldType expected, JsonNode actual, String path) {
        var message = String.format("%s: expected %s, received %s", INVALID_TYPE, expected.kind, kindOf(actual));
        if (path == null) {
            return message;
        }
        return message + " at \"" + path + "\"";
    }

    private static String kindOf(JsonNode node) {
        if (node == null || node.isMissingNode()) return "undefined";
        if (node.isNull()) return "null";
        if (node.isTextual()) return "string";
        if (node.isNumber()) return "number";
        if (node.isBoolean()) return "boolean";
        if (node.isArray()) return "array";
        if (node.isObject()) return "object";
        return node.getNodeType().name().toLowerCase();
    }

    public static class Builder {
        private final Map<String, Field> fields = new LinkedHashMap<>();

        private Builder() {

        }

        public Builder required(String name, FieldType type) {
            this.fields.put(name, new Field(type, true));
            return this;
        }

        public Builder optional(String name, FieldType type) {
            this.fields.put(name, new Field(type, false));
            return this;
        }

        public InputSchema build() {
            return new InputSchema(new LinkedHashMap<>(this.fields));
        }
    }
}
