package io.github.balazskreith.mailbox.client;

import io.github.balazskreith.mailbox.codec.EntryCodec;
import io.github.balazskreith.mailbox.common.InvalidConfigurationException;
import io.github.balazskreith.mailbox.document.ReplicatedDocument;

import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Builder class for Correlators
 */
public class CorrelatorBuilder {

    private ReplicatedDocument queue;
    private EntryCodec codec = new EntryCodec();
    private CorrelatorConfig config = CorrelatorConfig.create();
    private Executor settlingExecutor = Runnable::run;
    private String context = "Correlator";

    CorrelatorBuilder() {

    }

    /**
     * Sets the queue document the calls are issued on
     *
     * @param queue the replicated queue document
     * @return the builder object
     */
    public CorrelatorBuilder withQueue(ReplicatedDocument queue) {
        this.queue = queue;
        return this;
    }

    public CorrelatorBuilder withCodec(EntryCodec codec) {
        this.codec = codec;
        return this;
    }

    public CorrelatorBuilder withContext(String value) {
        this.context = value;
        return this;
    }

    /**
     * Sets the time callers wait for a response unless the call sets its own timeout
     *
     * @param callTimeoutInMs timeout in milliseconds, 0 means unbounded
     * @return the builder object
     */
    public CorrelatorBuilder withCallTimeoutInMs(int callTimeoutInMs) {
        this.config = this.config.copyAndSetCallTimeoutInMs(callTimeoutInMs);
        return this;
    }

    /**
     * Sets the executor the futures of the calls are settled on. Executors given here are not shut down
     * by the correlator. By default futures are settled on the thread delivering the changes of the queue.
     *
     * @param executor the executor, a single threaded one keeps the order of the responses
     * @return the builder object
     */
    public CorrelatorBuilder withSettlingExecutor(Executor executor) {
        this.settlingExecutor = executor;
        return this;
    }

    public Correlator build() {
        Objects.requireNonNull(this.queue, "Correlator must have a queue document");
        Objects.requireNonNull(this.codec, "Correlator must have an entry codec");
        Objects.requireNonNull(this.settlingExecutor, "Correlator must have an executor to settle calls on");
        if (this.config.callTimeoutInMs() < 0) {
            throw new InvalidConfigurationException("Call timeout cannot be negative: " + this.config.callTimeoutInMs());
        }
        var result = new Correlator(this.queue, this.codec, this.config, this.settlingExecutor, this.context);
        result.init();
        return result;
    }
}
