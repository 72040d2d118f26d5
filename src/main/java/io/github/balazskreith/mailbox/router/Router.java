package io.github.balazskreith.mailbox.router;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Resolves procedure names to procedures and validates call inputs.
 *
 * @param <S> the type of the state handlers receive through their call context
 */
public interface Router<S> {

    Optional<Procedure<S>> resolve(String procedureName);

    /**
     * Validates the input of a call. The procedure must be resolvable.
     *
     * @param procedureName the name of the called procedure
     * @param input the input of the call
     * @return the validated (possibly normalized) input or the validation failure
     */
    ValidationResult validate(String procedureName, JsonNode input);
}
