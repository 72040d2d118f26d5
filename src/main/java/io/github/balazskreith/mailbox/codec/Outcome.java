package io.github.balazskreith.mailbox.codec;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * The outcome of a call: either a result or a failure with a machine matchable code
 */
public interface Outcome {

    enum Status {
        SUCCESS,
        FAILURE
    }

    static Outcome success(JsonNode result) {
        return new Success(result);
    }

    static Outcome failure(String code, String message) {
        return new Failure(code, message);
    }

    Status status();

    record Success(JsonNode result) implements Outcome {
        @Override
        public Status status() {
            return Status.SUCCESS;
        }
    }

    record Failure(String code, String message) implements Outcome {
        @Override
        public Status status() {
            return Status.FAILURE;
        }
    }
}
