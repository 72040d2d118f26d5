package io.github.balazskreith.mailbox.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.IntNode;
import io.github.balazskreith.mailbox.MailboxError;
import io.github.balazskreith.mailbox.codec.*;
import io.github.balazskreith.mailbox.common.InvalidConfigurationException;
import io.github.balazskreith.mailbox.common.TestUtils;
import io.github.balazskreith.mailbox.document.DocumentReplica;
import io.github.balazskreith.mailbox.document.ReorderingDocument;
import io.reactivex.rxjava3.disposables.CompositeDisposable;
import io.reactivex.rxjava3.disposables.Disposable;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.*;

class CorrelatorTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final EntryCodec codec = new EntryCodec();
    private final CompositeDisposable disposables = new CompositeDisposable();
    private DocumentReplica queue;
    private Correlator correlator;

    @BeforeEach
    void setup() {
        this.queue = DocumentReplica.builder().withContext("queue").build();
        this.correlator = Correlator.builder().withQueue(this.queue).withContext("test").build();
        this.disposables.addAll(this.correlator, this.queue);
    }

    @AfterEach
    void teardown() {
        this.disposables.dispose();
    }

    private List<CallEntry> callEntries() {
        var result = new LinkedList<CallEntry>();
        for (var raw : this.queue.readAll()) {
            try {
                if (this.codec.decode(raw) instanceof CallEntry call) {
                    result.add(call);
                }
            } catch (EntryDecodeException ex) {
                Assertions.fail(ex);
            }
        }
        return result;
    }

    private void respond(String callId, Outcome outcome) {
        this.queue.append(this.codec.toJson(this.codec.encodeResponse(callId, outcome)));
    }

    private static Throwable causeOf(CompletableFuture<JsonNode> future) {
        var ex = Assertions.assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        return ex.getCause();
    }

    @Test
    void shouldAppendCallEntry() {
        var input = this.mapper.createObjectNode().put("name", "foo");

        this.correlator.call("userCreate", input);

        var calls = this.callEntries();
        Assertions.assertEquals(1, calls.size());
        Assertions.assertEquals("userCreate", calls.get(0).procedure());
        Assertions.assertEquals(input, calls.get(0).input());
        Assertions.assertNull(calls.get(0).batchId());
        Assertions.assertEquals(Set.of(calls.get(0).id()), this.correlator.getPendingCallIds());
    }

    @Test
    void shouldResolveWithTheResultOfTheResponse() throws Exception {
        var future = this.correlator.call("echo", IntNode.valueOf(1));
        var callId = this.callEntries().get(0).id();

        this.respond(callId, Outcome.success(IntNode.valueOf(2)));

        Assertions.assertEquals(IntNode.valueOf(2), future.get(5, TimeUnit.SECONDS));
        Assertions.assertTrue(this.correlator.getPendingCallIds().isEmpty());
    }

    @Test
    void shouldRejectWithTheFailureOfTheResponse() {
        var future = this.correlator.call("echo", null);
        var callId = this.callEntries().get(0).id();

        this.respond(callId, Outcome.failure(ErrorCodes.BAD_INPUT, "invalid_type: expected object, received null"));

        var cause = causeOf(future);
        Assertions.assertTrue(cause instanceof RemoteCallException);
        var remote = (RemoteCallException) cause;
        Assertions.assertEquals(callId, remote.getCallId());
        Assertions.assertEquals(ErrorCodes.BAD_INPUT, remote.getCode());
        Assertions.assertEquals("invalid_type: expected object, received null", remote.getMessage());
    }

    @Test
    void shouldSettleInTheOrderOfResponses() throws Exception {
        var first = this.correlator.call("echo", IntNode.valueOf(1), CallOptions.ofId("first"));
        var second = this.correlator.call("echo", IntNode.valueOf(2), CallOptions.ofId("second"));

        this.respond("second", Outcome.success(IntNode.valueOf(2)));

        Assertions.assertEquals(IntNode.valueOf(2), second.get(5, TimeUnit.SECONDS));
        Assertions.assertFalse(first.isDone());

        this.respond("first", Outcome.success(IntNode.valueOf(1)));

        Assertions.assertEquals(IntNode.valueOf(1), first.get(5, TimeUnit.SECONDS));
    }

    @Test
    void shouldIgnoreResponsesOfUnknownCalls() throws Exception {
        var errors = new LinkedBlockingQueue<MailboxError>();
        this.disposables.add(this.correlator.errors().subscribe(errors::add));
        var future = this.correlator.call("echo", null, CallOptions.ofId("mine"));

        this.respond("someone-else", Outcome.success(IntNode.valueOf(0)));
        this.respond("mine", Outcome.success(IntNode.valueOf(1)));

        Assertions.assertEquals(IntNode.valueOf(1), future.get(5, TimeUnit.SECONDS));
        Assertions.assertTrue(errors.isEmpty());
    }

    @Test
    void shouldSkipMalformedEntries() throws Exception {
        var errors = new LinkedBlockingQueue<MailboxError>();
        this.disposables.add(this.correlator.errors().subscribe(errors::add));
        var future = this.correlator.call("echo", null, CallOptions.ofId("mine"));

        this.queue.append(this.mapper.createObjectNode().put("type", "response").put("callId", "mine"));
        this.respond("mine", Outcome.success(IntNode.valueOf(1)));

        Assertions.assertEquals(IntNode.valueOf(1), future.get(5, TimeUnit.SECONDS));
        Assertions.assertEquals(MailboxError.MALFORMED_ENTRY, errors.poll(5, TimeUnit.SECONDS).getCode());
    }

    @Test
    void shouldNotUseCallIdAnsweredBeforeStart() throws Exception {
        this.respond("early", Outcome.success(IntNode.valueOf(0)));
        var correlator = Correlator.builder().withQueue(this.queue).build();
        this.disposables.add(correlator);

        Assertions.assertThrows(IllegalArgumentException.class, () -> correlator.call("echo", null, CallOptions.ofId("early")));
        var future = correlator.call("echo", null, CallOptions.ofId("late"));
        this.respond("late", Outcome.success(IntNode.valueOf(1)));

        Assertions.assertEquals(IntNode.valueOf(1), future.get(5, TimeUnit.SECONDS));
        Assertions.assertEquals(1, this.callEntries().size());
    }

    @Test
    void shouldNotReuseIdOfSettledCall() throws Exception {
        var future = this.correlator.call("echo", null, CallOptions.ofId("once"));
        this.respond("once", Outcome.success(IntNode.valueOf(1)));
        Assertions.assertEquals(IntNode.valueOf(1), future.get(5, TimeUnit.SECONDS));

        Assertions.assertThrows(IllegalArgumentException.class, () -> this.correlator.call("echo", null, CallOptions.ofId("once")));
        Assertions.assertEquals(1, this.callEntries().size());
        Assertions.assertTrue(this.correlator.getPendingCallIds().isEmpty());
    }

    @Test
    void shouldNotUseBlankCallId() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> this.correlator.call("echo", null, CallOptions.ofId("")));
        Assertions.assertThrows(IllegalArgumentException.class, () -> this.correlator.call("echo", null, CallOptions.ofId(" ")));

        Assertions.assertTrue(this.callEntries().isEmpty());
        Assertions.assertTrue(this.correlator.getPendingCallIds().isEmpty());
    }

    @Test
    void shouldSettleResponseMergedBeforeScannedEntries() throws Exception {
        var document = new ReorderingDocument();
        var correlator = Correlator.builder().withQueue(document).withContext("reordering").build();
        this.disposables.add(correlator);
        var first = correlator.call("echo", null, CallOptions.ofId("first"));
        var second = correlator.call("echo", null, CallOptions.ofId("second"));

        document.append(this.codec.toJson(this.codec.encodeResponse("first", Outcome.success(IntNode.valueOf(1)))));
        Assertions.assertEquals(IntNode.valueOf(1), first.get(5, TimeUnit.SECONDS));
        document.insertFirst(this.codec.toJson(this.codec.encodeResponse("second", Outcome.success(IntNode.valueOf(2)))));

        Assertions.assertEquals(IntNode.valueOf(2), second.get(5, TimeUnit.SECONDS));
        Assertions.assertTrue(correlator.getPendingCallIds().isEmpty());
    }

    @Test
    void shouldNotHoldTheQueueByBlockingContinuations() throws Exception {
        var settler = Executors.newSingleThreadExecutor(runnable -> new Thread(runnable, "settler"));
        this.disposables.add(Disposable.fromAction(settler::shutdownNow));
        var correlator = Correlator.builder().withQueue(this.queue).withSettlingExecutor(settler).build();
        this.disposables.add(correlator);
        var release = new CountDownLatch(1);
        var continuation = new CompletableFuture<String>();
        var blocking = correlator.call("echo", null, CallOptions.ofId("blocking"));
        var other = correlator.call("echo", null, CallOptions.ofId("other"));
        blocking.thenAccept(result -> {
            try {
                release.await(5, TimeUnit.SECONDS);
                continuation.complete(Thread.currentThread().getName());
            } catch (InterruptedException ex) {
                continuation.completeExceptionally(ex);
            }
        });

        this.respond("blocking", Outcome.success(IntNode.valueOf(1)));
        this.respond("other", Outcome.success(IntNode.valueOf(2)));

        Assertions.assertFalse(continuation.isDone());
        Assertions.assertEquals(2, this.queue.readAll().stream().filter(raw -> "response".equals(raw.path("type").asText())).count());
        release.countDown();
        Assertions.assertEquals("settler", continuation.get(5, TimeUnit.SECONDS));
        Assertions.assertEquals(IntNode.valueOf(2), other.get(5, TimeUnit.SECONDS));
    }

    @Test
    void shouldUseTheGivenCallId() {
        this.correlator.call("echo", null, CallOptions.ofId("testing"));

        Assertions.assertEquals("testing", this.callEntries().get(0).id());
        Assertions.assertThrows(IllegalArgumentException.class, () -> this.correlator.call("echo", null, CallOptions.ofId("testing")));
        Assertions.assertEquals(1, this.callEntries().size());
    }

    @Test
    void shouldCancelPendingCall() throws InterruptedException {
        var future = this.correlator.call("echo", null, CallOptions.ofId("cancelled"));

        Assertions.assertTrue(this.correlator.cancel("cancelled"));
        Assertions.assertFalse(this.correlator.cancel("cancelled"));
        this.respond("cancelled", Outcome.success(IntNode.valueOf(1)));

        Assertions.assertTrue(future.isCancelled());
        Assertions.assertTrue(this.correlator.getPendingCallIds().isEmpty());
    }

    @Test
    void shouldTimeoutCall() {
        var future = this.correlator.call("echo", null, CallOptions.ofId("late").withTimeoutInMs(100));

        Assertions.assertTrue(causeOf(future) instanceof TimeoutException);
        TestUtils.awaitUntil(() -> this.correlator.getPendingCallIds().isEmpty(), 5000);
        this.respond("late", Outcome.success(IntNode.valueOf(1)));
    }

    @Test
    void shouldUseDefaultTimeout() {
        var correlator = Correlator.builder().withQueue(this.queue).withCallTimeoutInMs(100).build();
        this.disposables.add(correlator);

        var future = correlator.call("echo", null);

        Assertions.assertTrue(causeOf(future) instanceof TimeoutException);
    }

    @Test
    void shouldCancelPendingCallsWhenDisposed() {
        var future = this.correlator.call("echo", null);

        this.correlator.dispose();

        Assertions.assertTrue(future.isCancelled());
        Assertions.assertThrows(IllegalStateException.class, () -> this.correlator.call("echo", null));
    }

    @Test
    void shouldNotBuildWithNegativeTimeout() {
        var builder = Correlator.builder().withQueue(this.queue).withCallTimeoutInMs(-1);

        Assertions.assertThrows(InvalidConfigurationException.class, builder::build);
    }
}
