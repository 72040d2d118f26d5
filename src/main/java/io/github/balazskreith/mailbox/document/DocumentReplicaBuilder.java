package io.github.balazskreith.mailbox.document;

import io.github.balazskreith.mailbox.common.SerDe;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.schedulers.Schedulers;

import java.util.Objects;
import java.util.UUID;

/**
 * Builder class for Document Replicas
 */
public class DocumentReplicaBuilder {

    private UUID replicaId = UUID.randomUUID();
    private String context = "No context is given";
    private SerDe<DocumentChange> serDe = new DocumentChangeSerDe();
    private Scheduler receivingScheduler = Schedulers.io();

    DocumentReplicaBuilder() {

    }

    /**
     * Sets the id of the replica
     *
     * @param replicaId the id
     * @return the builder object
     */
    public DocumentReplicaBuilder withReplicaId(UUID replicaId) {
        this.replicaId = replicaId;
        return this;
    }

    /**
     * Sets the context appears in the logs of the replica
     *
     * @param value the context
     * @return the builder object
     */
    public DocumentReplicaBuilder withContext(String value) {
        this.context = value;
        return this;
    }

    /**
     * Sets the serialization of the changes sent to remote replicas
     *
     * @param serDe the serde
     * @return the builder object
     */
    public DocumentReplicaBuilder withSerDe(SerDe<DocumentChange> serDe) {
        this.serDe = serDe;
        return this;
    }

    /**
     * Sets the scheduler remote changes are applied on
     *
     * @param scheduler the scheduler
     * @return the builder object
     */
    public DocumentReplicaBuilder withReceivingScheduler(Scheduler scheduler) {
        this.receivingScheduler = scheduler;
        return this;
    }

    public DocumentReplica build() {
        Objects.requireNonNull(this.replicaId, "Replica must have an id");
        Objects.requireNonNull(this.serDe, "Replica must have a serde for changes");
        Objects.requireNonNull(this.receivingScheduler, "Replica must have a scheduler to receive changes on");
        return new DocumentReplica(this.replicaId, this.context, this.serDe, this.receivingScheduler);
    }
}
