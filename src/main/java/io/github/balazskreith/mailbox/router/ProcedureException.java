package io.github.balazskreith.mailbox.router;

/**
 * Thrown by procedure handlers to refuse a call. The message travels back to the caller verbatim.
 */
public class ProcedureException extends RuntimeException {

    private final String reason;

    public ProcedureException(String message) {
        this(null, message);
    }

    /**
     * @param reason an application level reason code (e.g. CONFLICT), it is logged by the dispatcher
     * @param message the message the caller receives
     */
    public ProcedureException(String reason, String message) {
        super(message);
        this.reason = reason;
    }

    public String getReason() {
        return this.reason;
    }
}
