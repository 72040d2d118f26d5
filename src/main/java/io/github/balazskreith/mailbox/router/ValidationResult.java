package io.github.balazskreith.mailbox.router;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * @param input the validated input, null if the validation failed
 * @param message describes the failure, null if the input is valid
 */
public record ValidationResult(JsonNode input, String message) {

    public static ValidationResult valid(JsonNode input) {
        return new ValidationResult(input, null);
    }

    public static ValidationResult invalid(String message) {
        return new ValidationResult(null, message);
    }

    public boolean isValid() {
        return this.message == null;
    }
}
