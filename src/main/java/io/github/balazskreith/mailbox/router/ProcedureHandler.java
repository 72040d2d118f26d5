package io.github.balazskreith.mailbox.router;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.balazskreith.mailbox.server.CallContext;

@FunctionalInterface
public interface ProcedureHandler<S> {

    /**
     * Executes the procedure.
     *
     * @param input the validated input
     * @param context the context of the call
     * @return the result, which can be null if the handler writes its result to {@link CallContext#response()}
     * @throws Exception any exception is reported to the caller as an application error with its message
     */
    JsonNode handle(JsonNode input, CallContext<S> context) throws Exception;
}
