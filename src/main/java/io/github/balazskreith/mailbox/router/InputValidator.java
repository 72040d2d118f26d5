package io.github.balazskreith.mailbox.router;

import com.fasterxml.jackson.databind.JsonNode;

@FunctionalInterface
public interface InputValidator {

    InputValidator ACCEPT_ALL = ValidationResult::valid;

    ValidationResult validate(JsonNode input);
}
