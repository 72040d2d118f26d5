package io.github.balazskreith.mailbox.document;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.balazskreith.mailbox.common.SerDe;
import io.github.balazskreith.mailbox.common.SerDeException;

import java.io.IOException;
import java.util.Objects;

public class DocumentChangeSerDe implements SerDe<DocumentChange> {

    private final ObjectMapper mapper;

    public DocumentChangeSerDe() {
        this(new ObjectMapper());
    }

    public DocumentChangeSerDe(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public byte[] serialize(DocumentChange change) {
        try {
            return this.mapper.writeValueAsBytes(change);
        } catch (IOException e) {
            throw new SerDeException("Cannot serialize document change " + change.changeId(), e);
        }
    }

    @Override
    public DocumentChange deserialize(byte[] data) {
        DocumentChange result;
        try {
            result = this.mapper.readValue(data, DocumentChange.class);
        } catch (IOException e) {
            throw new SerDeException("Cannot deserialize document change", e);
        }
        try {
            Objects.requireNonNull(result.changeId(), "changeId");
            Objects.requireNonNull(result.sourceId(), "sourceId");
            Objects.requireNonNull(result.ops(), "ops");
        } catch (NullPointerException e) {
            throw new SerDeException("Document change misses a required field", e);
        }
        return result;
    }
}
