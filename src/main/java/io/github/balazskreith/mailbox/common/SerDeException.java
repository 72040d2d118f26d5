package io.github.balazskreith.mailbox.common;

public class SerDeException extends RuntimeException {

    public SerDeException(String message, Throwable cause) {
        super(message, cause);
    }
}
