package io.github.balazskreith.mailbox.codec;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * An entry written by a newer version of the protocol. The raw node is kept as it is.
 */
public record UnknownEntry(String typeName, JsonNode raw) implements QueueEntry {

    @Override
    public EntryType type() {
        return EntryType.UNKNOWN;
    }
}
