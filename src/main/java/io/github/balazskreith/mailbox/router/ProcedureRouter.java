package io.github.balazskreith.mailbox.router;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A router holding a fixed set of procedures keyed by their names
 */
public class ProcedureRouter<S> implements Router<S> {
    private static final Logger logger = LoggerFactory.getLogger(ProcedureRouter.class);

    public static <U> Builder<U> builder() {
        return new Builder<>();
    }

    private final Map<String, Procedure<S>> procedures;

    private ProcedureRouter(Map<String, Procedure<S>> procedures) {
        this.procedures = Collections.unmodifiableMap(procedures);
    }

    @Override
    public Optional<Procedure<S>> resolve(String procedureName) {
        return Optional.ofNullable(this.procedures.get(procedureName));
    }

    @Override
    public ValidationResult validate(String procedureName, JsonNode input) {
        var procedure = this.procedures.get(procedureName);
        if (procedure == null) {
            throw new IllegalArgumentException("No procedure is registered with name " + procedureName);
        }
        try {
            return procedure.validator().validate(input);
        } catch (RuntimeException ex) {
            logger.warn("Validator of procedure {} failed", procedureName, ex);
            return ValidationResult.invalid("validation_failed: " + ex.getMessage());
        }
    }

    public static class Builder<S> {
        private final Map<String, Procedure<S>> procedures = new HashMap<>();

        private Builder() {

        }

        public Builder<S> add(Procedure<S> procedure) {
            if (this.procedures.put(procedure.name(), procedure) != null) {
                throw new IllegalArgumentException("Procedure " + procedure.name() + " is registered twice");
            }
            return this;
        }

        public Builder<S> add(String name, InputValidator validator, ProcedureHandler<S> handler) {
            return this.add(Procedure.<S>builder(name).input(validator).handler(handler).build());
        }

        public ProcedureRouter<S> build() {
            return new ProcedureRouter<>(new HashMap<>(this.procedures));
        }
    }
}
