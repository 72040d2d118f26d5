package io.github.balazskreith.mailbox.document;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.balazskreith.mailbox.common.Disposer;
import io.github.balazskreith.mailbox.common.RwLock;
import io.github.balazskreith.mailbox.common.SerDe;
import io.reactivex.rxjava3.core.Observable;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.disposables.Disposable;
import io.reactivex.rxjava3.subjects.PublishSubject;
import io.reactivex.rxjava3.subjects.Subject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * An in-memory copy of a replicated JSON list document.
 *
 * Local mutations are applied immediately and sent to every connected replica as serialized
 * {@link DocumentChange}s. Remote changes are applied in the order they arrive, every change
 * at most once. When two replicas are connected they exchange their full change history, so a
 * replica joining later converges to the same entries. Concurrent changes of different replicas
 * may be applied in different orders on different replicas.
 */
public class DocumentReplica implements ReplicatedDocument, Disposable {
    private static final Logger logger = LoggerFactory.getLogger(DocumentReplica.class);

    public static DocumentReplicaBuilder builder() {
        return new DocumentReplicaBuilder();
    }

    private final UUID id;
    private final String context;
    private final SerDe<DocumentChange> serDe;
    private final RwLock rwLock = new RwLock();
    private final List<JsonNode> entries = new ArrayList<>();
    private final List<DocumentChange> history = new ArrayList<>();
    private final Set<UUID> appliedChangeIds = new HashSet<>();
    private final ThreadLocal<List<DocumentOp>> pendingTransaction = new ThreadLocal<>();

    private final Subject<DocumentChange> changes = PublishSubject.<DocumentChange>create().toSerialized();
    private final Subject<byte[]> inbound = PublishSubject.<byte[]>create().toSerialized();
    private final Subject<byte[]> outbound = PublishSubject.<byte[]>create().toSerialized();
    private final DocumentTransport transport;
    private final Disposer disposer;

    DocumentReplica(UUID id, String context, SerDe<DocumentChange> serDe, Scheduler receivingScheduler) {
        this.id = id;
        this.context = context;
        this.serDe = serDe;
        this.transport = DocumentTransport.create(this.inbound, this.outbound);
        this.disposer = Disposer.builder()
                .addDisposable(this.inbound.observeOn(receivingScheduler).subscribe(this::receive))
                .addSubject(this.inbound)
                .addSubject(this.outbound)
                .addSubject(this.changes)
                .onDisposed(() -> {
                    logger.info("Replica {} ({}) is disposed", this.id, this.context);
                })
                .build();
        logger.info("Replica {} ({}) is created", this.id, this.context);
    }

    @Override
    public UUID getReplicaId() {
        return this.id;
    }

    public String getContext() {
        return this.context;
    }

    public DocumentTransport transport() {
        return this.transport;
    }

    /**
     * Connects this replica to another one and lets both send their change history to the other.
     *
     * @param peer the remote replica
     * @return disposing it disconnects the replicas
     */
    public Disposable connectTo(DocumentReplica peer) {
        var link = this.transport.connectTo(peer.transport);
        this.sendHistory();
        peer.sendHistory();
        logger.debug("Replica {} ({}) is connected to {} ({})", this.id, this.context, peer.id, peer.context);
        return link;
    }

    @Override
    public void append(List<JsonNode> newEntries) {
        var ops = new LinkedList<DocumentOp>();
        for (var entry : newEntries) {
            ops.add(DocumentOp.append(entry.deepCopy()));
        }
        this.submit(ops);
    }

    @Override
    public void set(int index, JsonNode entry) {
        if (index < 0) {
            throw new IndexOutOfBoundsException("Negative index: " + index);
        }
        this.submit(List.of(DocumentOp.set(index, entry.deepCopy())));
    }

    @Override
    public void transact(Runnable action) {
        if (this.pendingTransaction.get() != null) {
            // joins the outer transaction
            action.run();
            return;
        }
        var ops = new LinkedList<DocumentOp>();
        this.pendingTransaction.set(ops);
        try {
            action.run();
        } catch (RuntimeException ex) {
            logger.debug("Replica {} ({}) discards {} operations of a failed transaction", this.id, this.context, ops.size());
            throw ex;
        } finally {
            this.pendingTransaction.remove();
        }
        this.commit(ops);
    }

    @Override
    public List<JsonNode> readAll() {
        return this.rwLock.supplyInReadLock(() -> List.copyOf(this.entries));
    }

    @Override
    public int size() {
        return this.rwLock.supplyInReadLock(this.entries::size);
    }

    @Override
    public Observable<DocumentChange> changes() {
        return this.changes;
    }

    @Override
    public void dispose() {
        this.disposer.dispose();
    }

    @Override
    public boolean isDisposed() {
        return this.disposer.isDisposed();
    }

    private void submit(List<DocumentOp> ops) {
        var transaction = this.pendingTransaction.get();
        if (transaction != null) {
            transaction.addAll(ops);
            return;
        }
        this.commit(ops);
    }

    private void commit(List<DocumentOp> ops) {
        if (ops.isEmpty()) {
            return;
        }
        if (this.disposer.isDisposed()) {
            throw new IllegalStateException("Replica " + this.id + " (" + this.context + ") is disposed");
        }
        var change = new DocumentChange(UUID.randomUUID(), this.id, List.copyOf(ops));
        var bytes = this.serDe.serialize(change);
        var applied = this.rwLock.supplyInWriteLock(() -> {
            if (!this.apply(change)) {
                return false;
            }
            // sent in the same order as applied, so peers see the changes of this replica in order
            this.outbound.onNext(bytes);
            return true;
        });
        if (applied) {
            logger.trace("Replica {} ({}) committed change {}", this.id, this.context, change);
            this.changes.onNext(change);
        }
    }

    private void receive(byte[] bytes) {
        DocumentChange change;
        try {
            change = this.serDe.deserialize(bytes);
        } catch (Exception ex) {
            logger.warn("Replica {} ({}) received a change it cannot deserialize", this.id, this.context, ex);
            return;
        }
        var applied = this.rwLock.supplyInWriteLock(() -> this.apply(change));
        if (!applied) {
            return;
        }
        logger.trace("Replica {} ({}) applied remote change {}", this.id, this.context, change);
        this.changes.onNext(change);
    }

    // must be called in write lock
    private boolean apply(DocumentChange change) {
        if (!this.appliedChangeIds.add(change.changeId())) {
            return false;
        }
        for (var op : change.ops()) {
            switch (op.type()) {
                case APPEND -> this.entries.add(op.value());
                case SET -> {
                    if (op.index() < this.entries.size()) {
                        this.entries.set(op.index(), op.value());
                    } else {
                        logger.warn("Replica {} ({}) cannot set entry at {}, the document has {} entries", this.id, this.context, op.index(), this.entries.size());
                    }
                }
            }
        }
        this.history.add(change);
        return true;
    }

    private void sendHistory() {
        this.rwLock.runInReadLock(() -> {
            for (var change : this.history) {
                this.outbound.onNext(this.serDe.serialize(change));
            }
        });
    }

    @Override
    public String toString() {
        return String.format("DocumentReplica id: %s, context: %s, entries: %d", this.id, this.context, this.size());
    }
}
