package io.github.balazskreith.mailbox.codec;

public class EntryDecodeException extends Exception {

    public EntryDecodeException(String message) {
        super(message);
    }
}
