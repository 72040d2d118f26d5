package io.github.balazskreith.mailbox.codec;

/**
 * Codes of failed outcomes. Codes are plain strings, applications may use their own.
 */
public final class ErrorCodes {

    /**
     * No procedure is registered under the called name
     */
    public static final String NOT_FOUND = "NOT_FOUND";

    /**
     * The input of the call did not pass the validation of the procedure
     */
    public static final String BAD_INPUT = "BAD_INPUT";

    /**
     * The handler of the procedure threw an exception
     */
    public static final String APPLICATION_ERROR = "APPLICATION_ERROR";

    private ErrorCodes() {

    }
}
