package io.github.balazskreith.mailbox.client;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.balazskreith.mailbox.MailboxError;
import io.github.balazskreith.mailbox.codec.*;
import io.github.balazskreith.mailbox.common.Disposer;
import io.github.balazskreith.mailbox.document.ReplicatedDocument;
import io.reactivex.rxjava3.core.Observable;
import io.reactivex.rxjava3.disposables.Disposable;
import io.reactivex.rxjava3.subjects.PublishSubject;
import io.reactivex.rxjava3.subjects.Subject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

/**
 * The calling side of the mailbox: appends call entries to the queue document and settles the
 * returned futures when the matching response entries appear.
 *
 * Futures settle in the order the responses arrive. Responses of calls this correlator does not
 * wait for (issued by another client, cancelled, timed out) are ignored.
 *
 * Futures are settled on the settling executor, which runs them on the thread delivering the
 * changes of the queue unless the builder sets another one. With the default, a continuation
 * blocking on another call holds back every change the replica receives, so such continuations
 * need an executor of their own, e.g. a single threaded one that keeps the settlement order.
 */
public class Correlator implements Disposable, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(Correlator.class);

    public static CorrelatorBuilder builder() {
        return new CorrelatorBuilder();
    }

    private final ReplicatedDocument queue;
    private final EntryCodec codec;
    private final CorrelatorConfig config;
    private final String context;
    private final Map<String, PendingCall> pendingCalls = new ConcurrentHashMap<>();
    private final Subject<MailboxError> errors = PublishSubject.<MailboxError>create().toSerialized();
    private final TransactionGrouper grouper;
    private final Disposer disposer;
    private final Executor settlingExecutor;
    private final Object scanLock = new Object();
    // ids of calls issued by this correlator or seen in the queue, never reused
    private final Set<String> usedCallIds = ConcurrentHashMap.newKeySet();
    // call ids of the responses already processed, guarded by the scan lock
    private final Set<String> observedResponses = new HashSet<>();
    private final Set<JsonNode> malformedEntries = new HashSet<>();

    Correlator(ReplicatedDocument queue, EntryCodec codec, CorrelatorConfig config, Executor settlingExecutor, String context) {
        this.queue = queue;
        this.codec = codec;
        this.config = config;
        this.settlingExecutor = settlingExecutor;
        this.context = context;
        this.grouper = new TransactionGrouper(queue, ex -> this.errors.onNext(MailboxError.create(MailboxError.FAILED_BATCH, ex)));
        this.disposer = Disposer.builder()
                .addAction(() -> {
                    for (var pendingCall : this.pendingCalls.values()) {
                        pendingCall.cancel();
                    }
                })
                .addSubject(this.errors)
                .onDisposed(() -> {
                    logger.info("Correlator ({}) is disposed", this.context);
                })
                .build();
    }

    void init() {
        // responses already in the queue belong to calls issued before this correlator
        this.collectNewResponses();
        this.disposer.add(this.queue.changes().subscribe(change -> this.scan(), error -> {
            logger.warn("Correlator ({}) stopped receiving changes of the queue", this.context, error);
        }));
        logger.info("Correlator ({}) is started on replica {}", this.context, this.queue.getReplicaId());
    }

    public CompletableFuture<JsonNode> call(String procedure, JsonNode input) {
        return this.call(procedure, input, CallOptions.create());
    }

    /**
     * Calls a remote procedure.
     *
     * Inside {@link #withBatch(Runnable)} the call entry is committed together with the other calls
     * of the batch, otherwise it is appended to the queue immediately.
     *
     * @param procedure the name of the procedure
     * @param input the input of the procedure
     * @param options the id and the timeout of the call
     * @return settles with the result of the procedure, or fails with {@link RemoteCallException}
     * if the procedure failed, with {@link java.util.concurrent.TimeoutException} if the call timed out
     * @throws IllegalArgumentException if the id is blank, or it was already used by a call
     * issued through this correlator or appearing in the queue
     */
    public CompletableFuture<JsonNode> call(String procedure, JsonNode input, CallOptions options) {
        if (this.disposer.isDisposed()) {
            throw new IllegalStateException("Correlator (" + this.context + ") is disposed");
        }
        var batchId = this.grouper.getCurrentBatchId();
        var entry = this.codec.encodeCall(procedure, input, options.id(), batchId);
        if (!this.usedCallIds.add(entry.id())) {
            throw new IllegalArgumentException("Call id " + entry.id() + " is already used, the queue would never answer it again");
        }
        var timeoutInMs = options.timeoutInMs() != null ? options.timeoutInMs() : this.config.callTimeoutInMs();
        var pendingCall = PendingCall.builder()
                .withCallId(entry.id())
                .withProcedure(procedure)
                .withBatchId(batchId)
                .withTimeoutInMs(timeoutInMs)
                .build();
        this.pendingCalls.put(entry.id(), pendingCall);
        pendingCall.onSettled(() -> this.pendingCalls.remove(entry.id(), pendingCall));

        var raw = this.codec.toJson(entry);
        if (this.grouper.enlist(raw, pendingCall)) {
            logger.debug("Correlator ({}) enlisted call {} of {} in batch {}", this.context, entry.id(), procedure, batchId);
            return pendingCall.getFuture();
        }
        try {
            this.queue.append(raw);
        } catch (RuntimeException ex) {
            logger.warn("Correlator ({}) cannot append call {} of {}", this.context, entry.id(), procedure, ex);
            pendingCall.fail(ex);
            return pendingCall.getFuture();
        }
        logger.debug("Correlator ({}) issued call {} of {}", this.context, entry.id(), procedure);
        return pendingCall.getFuture();
    }

    /**
     * Runs the action and commits every call issued inside it by the calling thread as one atomic change.
     * A nested batch joins the outermost one.
     */
    public void withBatch(Runnable action) {
        this.grouper.withBatch(action);
    }

    public <T> T withBatch(Supplier<T> action) {
        return this.grouper.withBatch(action);
    }

    /**
     * Drops the pending call locally. The call entry stays in the queue, its response will be ignored.
     *
     * @return true if the call was pending and it is cancelled now
     */
    public boolean cancel(String callId) {
        var pendingCall = this.pendingCalls.get(callId);
        if (pendingCall == null) {
            return false;
        }
        logger.debug("Correlator ({}) cancels call {}", this.context, callId);
        return pendingCall.cancel();
    }

    public Set<String> getPendingCallIds() {
        return Set.copyOf(this.pendingCalls.keySet());
    }

    /**
     * Abnormal conditions observed while the queue is processed
     */
    public Observable<MailboxError> errors() {
        return this.errors;
    }

    @Override
    public void close() {
        this.dispose();
    }

    @Override
    public void dispose() {
        this.disposer.dispose();
    }

    @Override
    public boolean isDisposed() {
        return this.disposer.isDisposed();
    }

    private void scan() {
        if (this.disposer.isDisposed()) {
            return;
        }
        List<ResponseEntry> responses;
        try {
            responses = this.collectNewResponses();
        } catch (Exception ex) {
            logger.warn("Correlator ({}) failed to scan the queue", this.context, ex);
            return;
        }
        if (responses.isEmpty()) {
            return;
        }
        // settled outside of the scan so the continuations of the callers can issue new calls
        try {
            this.settlingExecutor.execute(() -> responses.forEach(this::settle));
        } catch (RejectedExecutionException ex) {
            logger.warn("Correlator ({}) settles {} response(s) on the scanning thread, the settling executor rejected them", this.context, responses.size(), ex);
            responses.forEach(this::settle);
        }
    }

    /**
     * Reads the whole queue, since replicas may merge remote entries at any position,
     * and returns the responses not processed before.
     */
    private List<ResponseEntry> collectNewResponses() {
        var result = new LinkedList<ResponseEntry>();
        synchronized (this.scanLock) {
            for (var raw : this.queue.readAll()) {
                QueueEntry entry;
                try {
                    entry = this.codec.decode(raw);
                } catch (EntryDecodeException ex) {
                    if (this.malformedEntries.add(raw)) {
                        logger.warn("Correlator ({}) skips entry: {}", this.context, ex.getMessage());
                        this.errors.onNext(MailboxError.create(MailboxError.MALFORMED_ENTRY, ex));
                    }
                    continue;
                }
                switch (entry.type()) {
                    case CALL -> this.usedCallIds.add(((CallEntry) entry).id());
                    case RESPONSE -> {
                        var response = (ResponseEntry) entry;
                        this.usedCallIds.add(response.callId());
                        if (this.observedResponses.add(response.callId())) {
                            result.add(response);
                        }
                    }
                    case UNKNOWN -> logger.trace("Correlator ({}) ignores entry of unknown type {}", this.context, ((UnknownEntry) entry).typeName());
                }
            }
        }
        return result;
    }

    private void settle(ResponseEntry response) {
        var pendingCall = this.pendingCalls.get(response.callId());
        if (pendingCall == null) {
            logger.debug("Correlator ({}) ignores response of call {}, it is not pending", this.context, response.callId());
            return;
        }
        try {
            switch (response.outcome().status()) {
                case SUCCESS -> pendingCall.resolve(((Outcome.Success) response.outcome()).result());
                case FAILURE -> {
                    var failure = (Outcome.Failure) response.outcome();
                    pendingCall.reject(failure.code(), failure.message());
                }
            }
        } catch (Exception ex) {
            logger.warn("Correlator ({}) failed to settle call {}", this.context, response.callId(), ex);
        }
        logger.debug("Correlator ({}) settled call {} with {}", this.context, response.callId(), response.outcome().status());
    }
}
