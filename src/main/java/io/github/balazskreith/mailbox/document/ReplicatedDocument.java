package io.github.balazskreith.mailbox.document;

import com.fasterxml.jackson.databind.JsonNode;
import io.reactivex.rxjava3.core.Observable;
import io.reactivex.rxjava3.disposables.Disposable;
import io.reactivex.rxjava3.functions.Consumer;

import java.util.List;
import java.util.UUID;

/**
 * An ordered list of JSON entries whose copies are merged across replicas.
 *
 * Every mutation is an atomic change: an observer reading the document through {@link #readAll()}
 * sees either all or none of the entries of a change. Merging concurrent changes of other replicas
 * may place their entries at any position, readers must not assume entries only arrive at the end.
 */
public interface ReplicatedDocument {

    /**
     * The identifier of this copy of the document
     */
    UUID getReplicaId();

    /**
     * Appends entries as one atomic change.
     *
     * @param entries the entries to append, nodes must not be mutated afterwards
     */
    void append(List<JsonNode> entries);

    default void append(JsonNode entry) {
        this.append(List.of(entry));
    }

    /**
     * Replaces the entry at the given position.
     *
     * @param index the position of the entry in the local copy
     * @param entry the new entry
     */
    void set(int index, JsonNode entry);

    /**
     * Runs the action and commits every mutation the calling thread issued on this document
     * inside it as one atomic change. Nothing is committed if the action throws.
     * Mutations issued inside the action are not visible to {@link #readAll()} until the action returns.
     *
     * @param action the action grouping the mutations
     */
    void transact(Runnable action);

    /**
     * @return a consistent snapshot of the local copy
     */
    List<JsonNode> readAll();

    int size();

    /**
     * Emits every change after it is applied to the local copy, local and remote ones alike.
     */
    Observable<DocumentChange> changes();

    default Disposable onChange(Consumer<DocumentChange> listener) {
        return this.changes().subscribe(listener);
    }
}
