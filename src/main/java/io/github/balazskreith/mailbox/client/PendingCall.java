package io.github.balazskreith.mailbox.client;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * A call issued by a correlator that has not been settled yet
 */
public class PendingCall {

    public static Builder builder() {
        return new Builder();
    }

    private String callId = null;
    private String procedure = null;
    private String batchId = null;
    private int timeoutInMs = 0;
    private final long createdInMs = Instant.now().toEpochMilli();
    private final CompletableFuture<JsonNode> future = new CompletableFuture<>();

    private PendingCall() {

    }

    public String getCallId() {
        return this.callId;
    }

    public String getProcedure() {
        return this.procedure;
    }

    public String getBatchId() {
        return this.batchId;
    }

    public CompletableFuture<JsonNode> getFuture() {
        return this.future;
    }

    public boolean resolve(JsonNode result) {
        return this.future.complete(result);
    }

    public boolean reject(String code, String message) {
        return this.future.completeExceptionally(new RemoteCallException(this.callId, code, message));
    }

    public boolean fail(Throwable cause) {
        return this.future.completeExceptionally(cause);
    }

    public boolean cancel() {
        return this.future.cancel(false);
    }

    public boolean isDone() {
        return this.future.isDone();
    }

    public boolean isCancelled() {
        return this.future.isCancelled();
    }

    /**
     * Runs the action once the call is settled in any way (response, cancellation, timeout)
     */
    public void onSettled(Runnable action) {
        this.future.whenComplete((result, error) -> action.run());
    }

    @Override
    public String toString() {
        return String.format("Pending call id: %s, procedure: %s, batch: %s, timeout: %d, elapsed: %d ms, done: %s",
                this.callId,
                this.procedure,
                this.batchId,
                this.timeoutInMs,
                Instant.now().toEpochMilli() - this.createdInMs,
                this.future.isDone()
        );
    }

    public static class Builder {
        private final PendingCall pendingCall = new PendingCall();

        Builder() {

        }

        public Builder withCallId(String callId) {
            this.pendingCall.callId = callId;
            return this;
        }

        public Builder withProcedure(String procedure) {
            this.pendingCall.procedure = procedure;
            return this;
        }

        public Builder withBatchId(String batchId) {
            this.pendingCall.batchId = batchId;
            return this;
        }

        public Builder withTimeoutInMs(int value) {
            this.pendingCall.timeoutInMs = value;
            return this;
        }

        public PendingCall build() {
            Objects.requireNonNull(this.pendingCall.callId, "Pending call must have an id");
            if (0 < this.pendingCall.timeoutInMs) {
                this.pendingCall.future.orTimeout(this.pendingCall.timeoutInMs, TimeUnit.MILLISECONDS);
            }
            return this.pendingCall;
        }
    }
}
