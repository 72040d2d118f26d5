package io.github.balazskreith.mailbox.server;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Tracks which calls of the queue document the dispatcher has claimed or seen answered.
 * A claimed call is never dispatched again, whatever its outcome was.
 *
 * Replicas may merge remote entries at any position, so the dispatcher scans the whole
 * document and relies on this seen-set keyed by call id, not on list positions.
 * Not thread safe, the dispatcher guards it.
 */
class ProcessingCursor {

    enum CallState {
        IN_FLIGHT,
        RESPONDED
    }

    private final Map<String, CallState> calls = new HashMap<>();
    private final Set<JsonNode> malformedEntries = new HashSet<>();

    /**
     * @return true if the call was never seen before and it is claimed now
     */
    boolean claim(String callId) {
        return this.calls.putIfAbsent(callId, CallState.IN_FLIGHT) == null;
    }

    void markResponded(String callId) {
        this.calls.put(callId, CallState.RESPONDED);
    }

    boolean isResponded(String callId) {
        return CallState.RESPONDED.equals(this.calls.get(callId));
    }

    /**
     * @return true if the entry is reported malformed for the first time
     */
    boolean markMalformed(JsonNode entry) {
        return this.malformedEntries.add(entry);
    }

    int countInFlight() {
        return (int) this.calls.values().stream().filter(CallState.IN_FLIGHT::equals).count();
    }
}
