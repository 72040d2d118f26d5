package io.github.balazskreith.mailbox.router;

import java.util.Objects;

public record Procedure<S>(String name, InputValidator validator, ProcedureHandler<S> handler) {

    public static <U> Builder<U> builder(String name) {
        return new Builder<>(name);
    }

    public static class Builder<S> {
        private final String name;
        private InputValidator validator = InputValidator.ACCEPT_ALL;
        private ProcedureHandler<S> handler;

        private Builder(String name) {
            this.name = name;
        }

        public Builder<S> input(InputValidator validator) {
            this.validator = validator;
            return this;
        }

        public Builder<S> handler(ProcedureHandler<S> handler) {
            this.handler = handler;
            return this;
        }

        public Procedure<S> build() {
            Objects.requireNonNull(this.name, "Procedure must have a name");
            Objects.requireNonNull(this.validator, "Procedure must have an input validator");
            Objects.requireNonNull(this.handler, "Procedure " + this.name + " must have a handler");
            return new Procedure<>(this.name, this.validator, this.handler);
        }
    }
}
