package io.github.balazskreith.mailbox.server;

import io.github.balazskreith.mailbox.codec.CallEntry;

/**
 * What a procedure handler receives besides its input.
 *
 * @param <S> the type of the application state given to the dispatcher
 */
public class CallContext<S> {

    private final CallEntry call;
    private final S state;
    private final Transactor transactor;
    private final ResponseSink response = new ResponseSink();

    CallContext(CallEntry call, S state, Transactor transactor) {
        this.call = call;
        this.state = state;
        this.transactor = transactor;
    }

    public String getCallId() {
        return this.call.id();
    }

    public String getProcedure() {
        return this.call.procedure();
    }

    /**
     * @return the id of the batch the call was committed in, or null
     */
    public String getBatchId() {
        return this.call.batchId();
    }

    public S state() {
        return this.state;
    }

    public ResponseSink response() {
        return this.response;
    }

    /**
     * Runs the action as one atomic change of the application data.
     * If the action throws, the fields it wrote to the response sink are discarded as well.
     *
     * @param action mutations of the application data and the response sink
     */
    public void transact(Runnable action) {
        var snapshot = this.response.snapshot();
        try {
            this.transactor.transact(action);
        } catch (RuntimeException ex) {
            this.response.restore(snapshot);
            throw ex;
        }
    }
}
