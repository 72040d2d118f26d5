package io.github.balazskreith.mailbox.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.UUID;

/**
 * Converts call and response entries to and from the JSON objects stored in the queue document.
 *
 * <pre>
 * {"type": "call", "id": ..., "procedure": ..., "input": ..., "batchId": ...}
 * {"type": "response", "callId": ..., "outcome": {"status": "success", "result": ...}}
 * {"type": "response", "callId": ..., "outcome": {"status": "failure", "code": ..., "message": ...}}
 * </pre>
 *
 * Fields the codec does not know are ignored, entries of unknown types are decoded to {@link UnknownEntry}.
 */
public class EntryCodec {

    static final String TYPE_FIELD = "type";
    static final String ID_FIELD = "id";
    static final String PROCEDURE_FIELD = "procedure";
    static final String INPUT_FIELD = "input";
    static final String BATCH_ID_FIELD = "batchId";
    static final String CALL_ID_FIELD = "callId";
    static final String OUTCOME_FIELD = "outcome";
    static final String STATUS_FIELD = "status";
    static final String RESULT_FIELD = "result";
    static final String CODE_FIELD = "code";
    static final String MESSAGE_FIELD = "message";

    private static final String SUCCESS_STATUS = "success";
    private static final String FAILURE_STATUS = "failure";

    private final JsonNodeFactory nodeFactory;

    public EntryCodec() {
        this(JsonNodeFactory.instance);
    }

    public EntryCodec(JsonNodeFactory nodeFactory) {
        this.nodeFactory = nodeFactory;
    }

    public CallEntry encodeCall(String procedure, JsonNode input, String id) {
        return this.encodeCall(procedure, input, id, null);
    }

    public CallEntry encodeCall(String procedure, JsonNode input, String id, String batchId) {
        if (procedure == null || procedure.isBlank()) {
            throw new IllegalArgumentException("Procedure name must be given for a call");
        }
        if (id != null && id.isBlank()) {
            throw new IllegalArgumentException("Call id cannot be blank");
        }
        var callId = id != null ? id : UUID.randomUUID().toString();
        return new CallEntry(callId, procedure, input != null ? input : NullNode.getInstance(), batchId);
    }

    public ResponseEntry encodeResponse(String callId, Outcome outcome) {
        if (callId == null) {
            throw new IllegalArgumentException("Response must refer to a call id");
        }
        return new ResponseEntry(callId, outcome);
    }

    public JsonNode toJson(CallEntry entry) {
        var result = this.nodeFactory.objectNode();
        result.put(TYPE_FIELD, EntryType.CALL.getWireName());
        result.put(ID_FIELD, entry.id());
        result.put(PROCEDURE_FIELD, entry.procedure());
        result.set(INPUT_FIELD, entry.input() != null ? entry.input() : NullNode.getInstance());
        if (entry.batchId() != null) {
            result.put(BATCH_ID_FIELD, entry.batchId());
        }
        return result;
    }

    public JsonNode toJson(ResponseEntry entry) {
        var outcome = this.nodeFactory.objectNode();
        switch (entry.outcome().status()) {
            case SUCCESS -> {
                var success = (Outcome.Success) entry.outcome();
                outcome.put(STATUS_FIELD, SUCCESS_STATUS);
                outcome.set(RESULT_FIELD, success.result() != null ? success.result() : NullNode.getInstance());
            }
            case FAILURE -> {
                var failure = (Outcome.Failure) entry.outcome();
                outcome.put(STATUS_FIELD, FAILURE_STATUS);
                outcome.put(CODE_FIELD, failure.code());
                outcome.put(MESSAGE_FIELD, failure.message());
            }
        }
        var result = this.nodeFactory.objectNode();
        result.put(TYPE_FIELD, EntryType.RESPONSE.getWireName());
        result.put(CALL_ID_FIELD, entry.callId());
        result.set(OUTCOME_FIELD, outcome);
        return result;
    }

    public QueueEntry decode(JsonNode raw) throws EntryDecodeException {
        if (raw == null || !raw.isObject()) {
            throw new EntryDecodeException("Entry is not an object: " + raw);
        }
        var typeName = requireText(raw, TYPE_FIELD);
        var type = EntryType.fromWireName(typeName);
        return switch (type) {
            case CALL -> this.decodeCall((ObjectNode) raw);
            case RESPONSE -> this.decodeResponse((ObjectNode) raw);
            case UNKNOWN -> new UnknownEntry(typeName, raw);
        };
    }

    private CallEntry decodeCall(ObjectNode raw) throws EntryDecodeException {
        var id = requireText(raw, ID_FIELD);
        var procedure = requireText(raw, PROCEDURE_FIELD);
        var input = raw.get(INPUT_FIELD);
        var batchId = optionalText(raw, BATCH_ID_FIELD);
        return new CallEntry(id, procedure, input != null ? input : NullNode.getInstance(), batchId);
    }

    private ResponseEntry decodeResponse(ObjectNode raw) throws EntryDecodeException {
        var callId = requireText(raw, CALL_ID_FIELD);
        var outcome = raw.get(OUTCOME_FIELD);
        if (outcome == null || !outcome.isObject()) {
            throw new EntryDecodeException("Response for call " + callId + " has no outcome object");
        }
        var status = requireText(outcome, STATUS_FIELD);
        return switch (status) {
            case SUCCESS_STATUS -> {
                var result = outcome.get(RESULT_FIELD);
                yield new ResponseEntry(callId, Outcome.success(result != null ? result : NullNode.getInstance()));
            }
            case FAILURE_STATUS -> {
                var code = requireText(outcome, CODE_FIELD);
                var message = optionalText(outcome, MESSAGE_FIELD);
                yield new ResponseEntry(callId, Outcome.failure(code, message != null ? message : ""));
            }
            default -> throw new EntryDecodeException("Response for call " + callId + " has unknown outcome status " + status);
        };
    }

    private static String requireText(JsonNode node, String field) throws EntryDecodeException {
        var value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().isEmpty()) {
            throw new EntryDecodeException("Entry has no textual field " + field + ": " + node);
        }
        return value.asText();
    }

    private static String optionalText(JsonNode node, String field) throws EntryDecodeException {
        var value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            throw new EntryDecodeException("Field " + field + " of entry is not textual: " + node);
        }
        return value.asText();
    }
}
