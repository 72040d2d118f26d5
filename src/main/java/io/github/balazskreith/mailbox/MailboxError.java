package io.github.balazskreith.mailbox;

/**
 * Indicates an abnormal condition a dispatcher or a correlator encountered while it
 * processed the queue document. These errors never stop the processing, they are
 * published so the application can observe them.
 */
public interface MailboxError {

    /**
     * An entry in the queue document could not be decoded and was skipped
     */
    int MALFORMED_ENTRY = 4001;

    /**
     * A response entry could not be appended to the queue document
     */
    int FAILED_RESPONSE = 5001;

    /**
     * A batch of call entries could not be appended to the queue document
     */
    int FAILED_BATCH = 5002;

    /**
     * The handler executor rejected a call, the call is answered with a failure
     */
    int REJECTED_CALL = 5003;

    static MailboxError create(int code, Throwable exception) {
        return new MailboxError() {
            @Override
            public int getCode() {
                return code;
            }

            @Override
            public Throwable getException() {
                return exception;
            }

            @Override
            public String toString() {
                return String.format("MailboxError code: %d, exception: %s", code, exception);
            }
        };
    }

    int getCode();
    Throwable getException();
}
