package io.github.balazskreith.mailbox.client;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.balazskreith.mailbox.document.ReplicatedDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedList;
import java.util.List;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Groups the call entries issued by a thread inside {@link #withBatch(Supplier)} and appends
 * them to the queue document as one atomic change when the outermost batch action returns.
 *
 * A nested batch joins the outermost one: its calls get the outer batch id and they are
 * committed together with the outer calls.
 */
public class TransactionGrouper {
    private static final Logger logger = LoggerFactory.getLogger(TransactionGrouper.class);

    private static class Batch {
        private final String id = UUID.randomUUID().toString();
        private final List<JsonNode> entries = new LinkedList<>();
        private final List<PendingCall> calls = new LinkedList<>();
    }

    private final ReplicatedDocument queue;
    private final Consumer<Throwable> failedCommitListener;
    private final ThreadLocal<Batch> current = new ThreadLocal<>();

    TransactionGrouper(ReplicatedDocument queue, Consumer<Throwable> failedCommitListener) {
        this.queue = queue;
        this.failedCommitListener = failedCommitListener;
    }

    /**
     * @return the id of the batch the calling thread is in, or null
     */
    public String getCurrentBatchId() {
        var batch = this.current.get();
        return batch != null ? batch.id : null;
    }

    /**
     * Adds the call entry to the batch of the calling thread.
     *
     * @return false if the calling thread is not in a batch, the caller must append the entry itself
     */
    boolean enlist(JsonNode entry, PendingCall call) {
        var batch = this.current.get();
        if (batch == null) {
            return false;
        }
        batch.entries.add(entry);
        batch.calls.add(call);
        return true;
    }

    public void withBatch(Runnable action) {
        this.withBatch(() -> {
            action.run();
            return null;
        });
    }

    /**
     * Runs the action and commits every call it issued as one change.
     * If the action throws, nothing is committed and the calls it issued are cancelled.
     *
     * @param action issues the calls
     * @return the value the action returned
     */
    public <T> T withBatch(Supplier<T> action) {
        if (this.current.get() != null) {
            return action.get();
        }
        var batch = new Batch();
        this.current.set(batch);
        T result;
        try {
            result = action.get();
        } catch (RuntimeException | Error ex) {
            logger.debug("Batch {} is aborted, {} call(s) are cancelled", batch.id, batch.calls.size());
            batch.calls.forEach(PendingCall::cancel);
            throw ex;
        } finally {
            this.current.remove();
        }
        this.commit(batch);
        return result;
    }

    private void commit(Batch batch) {
        if (batch.entries.isEmpty()) {
            return;
        }
        try {
            this.queue.append(batch.entries);
        } catch (RuntimeException ex) {
            logger.warn("Batch {} with {} call(s) cannot be committed", batch.id, batch.calls.size(), ex);
            batch.calls.forEach(call -> call.fail(ex));
            this.failedCommitListener.accept(ex);
            throw ex;
        }
        logger.debug("Batch {} is committed with {} call(s)", batch.id, batch.entries.size());
    }
}
