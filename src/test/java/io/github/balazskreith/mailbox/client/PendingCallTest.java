package io.github.balazskreith.mailbox.client;

import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

class PendingCallTest {

    @Test
    void shouldSettleOnlyOnce() {
        var settled = new AtomicInteger(0);
        var pendingCall = PendingCall.builder().withCallId("c").withProcedure("echo").build();
        pendingCall.onSettled(settled::incrementAndGet);

        Assertions.assertTrue(pendingCall.resolve(TextNode.valueOf("first")));
        Assertions.assertFalse(pendingCall.reject("NOT_FOUND", "second"));
        Assertions.assertFalse(pendingCall.cancel());

        Assertions.assertEquals(TextNode.valueOf("first"), pendingCall.getFuture().join());
        Assertions.assertEquals(1, settled.get());
    }

    @Test
    void shouldRequireCallId() {
        Assertions.assertThrows(NullPointerException.class, () -> PendingCall.builder().build());
    }
}
