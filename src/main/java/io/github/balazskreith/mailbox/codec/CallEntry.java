package io.github.balazskreith.mailbox.codec;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A request to invoke a procedure
 *
 * @param id the correlation id, unique per call
 * @param procedure the name of the procedure
 * @param input the payload validated by the router
 * @param batchId the batch the call was committed in, or null
 */
public record CallEntry(String id, String procedure, JsonNode input, String batchId) implements QueueEntry {

    @Override
    public EntryType type() {
        return EntryType.CALL;
    }
}
