package io.github.balazskreith.mailbox.server;

import io.github.balazskreith.mailbox.codec.EntryCodec;
import io.github.balazskreith.mailbox.common.InvalidConfigurationException;
import io.github.balazskreith.mailbox.document.ReplicatedDocument;
import io.github.balazskreith.mailbox.router.Router;

import java.util.Objects;

/**
 * Builder class for Dispatchers
 */
public class DispatcherBuilder<S> {

    private ReplicatedDocument queue;
    private Router<S> router;
    private S state;
    private Transactor transactor = Transactor.DIRECT;
    private EntryCodec codec = new EntryCodec();
    private DispatcherConfig config = DispatcherConfig.create();
    private DispatcherExecutors executors;
    private String context = "Dispatcher";

    DispatcherBuilder() {

    }

    /**
     * Sets the queue document the dispatcher serves
     *
     * @param queue the replicated queue document
     * @return the builder object
     */
    public DispatcherBuilder<S> withQueue(ReplicatedDocument queue) {
        this.queue = queue;
        return this;
    }

    public DispatcherBuilder<S> withRouter(Router<S> router) {
        this.router = router;
        return this;
    }

    /**
     * Sets the application state handlers reach through {@link CallContext#state()}
     *
     * @param state the state
     * @return the builder object
     */
    public DispatcherBuilder<S> withState(S state) {
        this.state = state;
        return this;
    }

    /**
     * Sets how {@link CallContext#transact(Runnable)} makes the mutations of handlers atomic
     *
     * @param transactor the transactor, e.g. the transact method of the application data document
     * @return the builder object
     */
    public DispatcherBuilder<S> withTransactor(Transactor transactor) {
        this.transactor = transactor;
        return this;
    }

    public DispatcherBuilder<S> withCodec(EntryCodec codec) {
        this.codec = codec;
        return this;
    }

    public DispatcherBuilder<S> withContext(String value) {
        this.context = value;
        return this;
    }

    /**
     * Sets the maximum number of handlers running at once on the default executor
     *
     * @param value the maximum, 0 means unbounded
     * @return the builder object
     */
    public DispatcherBuilder<S> withMaxConcurrentHandlers(int value) {
        this.config = this.config.copyAndSetMaxConcurrentHandlers(value);
        return this;
    }

    /**
     * Sets the executors the handlers run on. Executors given here are not shut down by the dispatcher.
     *
     * @param executors the executors
     * @return the builder object
     */
    public DispatcherBuilder<S> withExecutors(DispatcherExecutors executors) {
        this.executors = executors;
        return this;
    }

    public Dispatcher<S> build() {
        Objects.requireNonNull(this.queue, "Dispatcher must have a queue document");
        Objects.requireNonNull(this.router, "Dispatcher must have a router");
        Objects.requireNonNull(this.transactor, "Dispatcher must have a transactor");
        Objects.requireNonNull(this.codec, "Dispatcher must have an entry codec");
        if (this.config.maxConcurrentHandlers() < 0) {
            throw new InvalidConfigurationException("Maximum number of concurrent handlers cannot be negative: " + this.config.maxConcurrentHandlers());
        }
        var ownExecutors = this.executors == null;
        var actualExecutors = ownExecutors ? DispatcherExecutors.createDefault(this.config) : this.executors;
        var result = new Dispatcher<S>(
                this.queue,
                this.router,
                this.state,
                this.transactor,
                this.codec,
                actualExecutors,
                ownExecutors,
                this.context
        );
        result.init();
        return result;
    }
}
