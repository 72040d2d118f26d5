package io.github.balazskreith.mailbox.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Fields a handler attaches to the result of its call. The dispatcher merges them into the
 * result once the handler returns.
 */
public class ResponseSink {

    private ObjectNode fields = JsonNodeFactory.instance.objectNode();

    public synchronized ResponseSink set(String name, JsonNode value) {
        this.fields.set(name, value);
        return this;
    }

    public synchronized ResponseSink put(String name, String value) {
        this.fields.put(name, value);
        return this;
    }

    synchronized ObjectNode snapshot() {
        return this.fields.deepCopy();
    }

    synchronized void restore(ObjectNode snapshot) {
        this.fields = snapshot;
    }
}
