package io.github.balazskreith.mailbox.codec;

public record ResponseEntry(String callId, Outcome outcome) implements QueueEntry {

    @Override
    public EntryType type() {
        return EntryType.RESPONSE;
    }
}
