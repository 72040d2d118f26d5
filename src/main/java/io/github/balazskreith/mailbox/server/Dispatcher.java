package io.github.balazskreith.mailbox.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.balazskreith.mailbox.MailboxError;
import io.github.balazskreith.mailbox.codec.*;
import io.github.balazskreith.mailbox.common.Disposer;
import io.github.balazskreith.mailbox.document.ReplicatedDocument;
import io.github.balazskreith.mailbox.router.ProcedureException;
import io.github.balazskreith.mailbox.router.Router;
import io.github.balazskreith.mailbox.router.ValidationResult;
import io.reactivex.rxjava3.core.Observable;
import io.reactivex.rxjava3.disposables.Disposable;
import io.reactivex.rxjava3.subjects.PublishSubject;
import io.reactivex.rxjava3.subjects.Subject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedList;
import java.util.concurrent.RejectedExecutionException;

/**
 * The serving side of the mailbox: turns call entries of the queue document into response entries.
 *
 * Every call entry is processed at most once. On every change the whole document is scanned,
 * since replicas may merge remote entries at any position, and calls are tracked by their ids.
 * Calls already answered in the document when the dispatcher starts are skipped. Handlers run on
 * the handler executor, so a slow handler does not hold back the calls appended after it. A call
 * the executor rejects is answered with a failure. Only one dispatcher should serve a queue document.
 *
 * @param <S> the type of the application state handlers receive
 */
public class Dispatcher<S> implements Disposable, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(Dispatcher.class);

    static final String WRAPPED_RESULT_FIELD = "value";
    static final String REJECTED_CALL_MESSAGE = "The dispatcher has no capacity to execute the call";

    public static <U> DispatcherBuilder<U> builder() {
        return new DispatcherBuilder<>();
    }

    private final ReplicatedDocument queue;
    private final Router<S> router;
    private final S state;
    private final Transactor transactor;
    private final EntryCodec codec;
    private final DispatcherExecutors executors;
    private final String context;
    private final ProcessingCursor cursor = new ProcessingCursor();
    private final Subject<MailboxError> errors = PublishSubject.<MailboxError>create().toSerialized();
    private final Disposer disposer;

    Dispatcher(
            ReplicatedDocument queue,
            Router<S> router,
            S state,
            Transactor transactor,
            EntryCodec codec,
            DispatcherExecutors executors,
            boolean ownExecutors,
            String context
    ) {
        this.queue = queue;
        this.router = router;
        this.state = state;
        this.transactor = transactor;
        this.codec = codec;
        this.executors = executors;
        this.context = context;
        var builder = Disposer.builder()
                .addSubject(this.errors)
                .onDisposed(() -> {
                    logger.info("Dispatcher ({}) is disposed", this.context);
                });
        if (ownExecutors) {
            builder.addAction(() -> this.executors.getHandlerExecutor().shutdown());
        }
        this.disposer = builder.build();
    }

    void init() {
        this.disposer.add(this.queue.changes().subscribe(change -> this.scan(), error -> {
            logger.warn("Dispatcher ({}) stopped receiving changes of the queue", this.context, error);
        }));
        this.scan();
        logger.info("Dispatcher ({}) is started on replica {}", this.context, this.queue.getReplicaId());
    }

    /**
     * Abnormal conditions observed while the queue is processed
     */
    public Observable<MailboxError> errors() {
        return this.errors;
    }

    public int getNumberOfInFlightCalls() {
        synchronized (this.cursor) {
            return this.cursor.countInFlight();
        }
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
        var claimedCalls = new LinkedList<CallEntry>();
        try {
            synchronized (this.cursor) {
                var calls = new LinkedList<CallEntry>();
                for (var raw : this.queue.readAll()) {
                    QueueEntry entry;
                    try {
                        entry = this.codec.decode(raw);
                    } catch (EntryDecodeException ex) {
                        if (this.cursor.markMalformed(raw)) {
                            logger.warn("Dispatcher ({}) skips entry: {}", this.context, ex.getMessage());
                            this.errors.onNext(MailboxError.create(MailboxError.MALFORMED_ENTRY, ex));
                        }
                        continue;
                    }
                    switch (entry.type()) {
                        case CALL -> calls.add((CallEntry) entry);
                        case RESPONSE -> this.cursor.markResponded(((ResponseEntry) entry).callId());
                        case UNKNOWN -> logger.trace("Dispatcher ({}) ignores entry of unknown type {}", this.context, ((UnknownEntry) entry).typeName());
                    }
                }
                // claimed only after the whole snapshot is read, responses first,
                // so a call and its response new to a late dispatcher are both skipped
                for (var call : calls) {
                    if (!this.cursor.isResponded(call.id()) && this.cursor.claim(call.id())) {
                        claimedCalls.add(call);
                    }
                }
            }
        } catch (Exception ex) {
            logger.warn("Dispatcher ({}) failed to scan the queue", this.context, ex);
            return;
        }
        for (var call : claimedCalls) {
            this.dispatch(call);
        }
    }

    private void dispatch(CallEntry call) {
        logger.debug("Dispatcher ({}) dispatches call {} of procedure {}", this.context, call.id(), call.procedure());
        try {
            this.executors.getHandlerExecutor().execute(() -> {
                var outcome = this.execute(call);
                this.respond(call, outcome);
            });
        } catch (RejectedExecutionException ex) {
            logger.warn("Dispatcher ({}) cannot execute call {}, the handler executor rejected it", this.context, call.id(), ex);
            this.errors.onNext(MailboxError.create(MailboxError.REJECTED_CALL, ex));
            this.respond(call, Outcome.failure(ErrorCodes.APPLICATION_ERROR, REJECTED_CALL_MESSAGE));
        }
    }

    private Outcome execute(CallEntry call) {
        var resolved = this.router.resolve(call.procedure());
        if (resolved.isEmpty()) {
            logger.debug("Dispatcher ({}) has no procedure {} for call {}", this.context, call.procedure(), call.id());
            return Outcome.failure(ErrorCodes.NOT_FOUND, "No procedure is registered with name " + call.procedure());
        }
        ValidationResult validation;
        try {
            validation = this.router.validate(call.procedure(), call.input());
        } catch (RuntimeException ex) {
            logger.warn("Dispatcher ({}) failed to validate the input of call {}", this.context, call.id(), ex);
            validation = ValidationResult.invalid(messageOf(ex));
        }
        if (!validation.isValid()) {
            logger.debug("Dispatcher ({}) rejects the input of call {}: {}", this.context, call.id(), validation.message());
            return Outcome.failure(ErrorCodes.BAD_INPUT, validation.message());
        }
        var callContext = new CallContext<S>(call, this.state, this.transactor);
        JsonNode result;
        try {
            result = resolved.get().handler().handle(validation.input(), callContext);
        } catch (ProcedureException ex) {
            logger.debug("Procedure {} refused call {} (reason: {}): {}", call.procedure(), call.id(), ex.getReason(), ex.getMessage());
            return Outcome.failure(ErrorCodes.APPLICATION_ERROR, messageOf(ex));
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            logger.warn("Procedure {} is interrupted while it executed call {}", call.procedure(), call.id());
            return Outcome.failure(ErrorCodes.APPLICATION_ERROR, messageOf(ex));
        } catch (Throwable t) {
            logger.warn("Procedure {} failed to execute call {}", call.procedure(), call.id(), t);
            return Outcome.failure(ErrorCodes.APPLICATION_ERROR, messageOf(t));
        }
        return Outcome.success(merge(result, callContext.response()));
    }

    private void respond(CallEntry call, Outcome outcome) {
        var response = this.codec.encodeResponse(call.id(), outcome);
        try {
            this.queue.append(this.codec.toJson(response));
            logger.debug("Dispatcher ({}) responded to call {} with {}", this.context, call.id(), outcome.status());
        } catch (Exception ex) {
            logger.error("Dispatcher ({}) cannot append the response of call {}", this.context, call.id(), ex);
            this.errors.onNext(MailboxError.create(MailboxError.FAILED_RESPONSE, ex));
        } finally {
            synchronized (this.cursor) {
                this.cursor.markResponded(call.id());
            }
        }
    }

    static JsonNode merge(JsonNode result, ResponseSink response) {
        var fields = response.snapshot();
        if (result == null || result.isNull() || result.isMissingNode()) {
            return fields;
        }
        if (result.isObject()) {
            var merged = ((ObjectNode) result).deepCopy();
            merged.setAll(fields);
            return merged;
        }
        if (fields.isEmpty()) {
            return result;
        }
        var wrapped = JsonNodeFactory.instance.objectNode();
        wrapped.set(WRAPPED_RESULT_FIELD, result);
        wrapped.setAll(fields);
        return wrapped;
    }

    private static String messageOf(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }
}
