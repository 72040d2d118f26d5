package io.github.balazskreith.mailbox.client;

/**
 * A call settled with a failure response. The message is the one the dispatcher wrote.
 */
public class RemoteCallException extends RuntimeException {

    private final String callId;
    private final String code;

    public RemoteCallException(String callId, String code, String message) {
        super(message);
        this.callId = callId;
        this.code = code;
    }

    public String getCallId() {
        return this.callId;
    }

    /**
     * @return the machine matchable code of the failure, see {@link io.github.balazskreith.mailbox.codec.ErrorCodes}
     */
    public String getCode() {
        return this.code;
    }
}
