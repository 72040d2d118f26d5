package io.github.balazskreith.mailbox.server;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class ProcessingCursorTest {

    @Test
    void shouldClaimCallOnlyOnce() {
        var cursor = new ProcessingCursor();

        Assertions.assertTrue(cursor.claim("a"));
        Assertions.assertFalse(cursor.claim("a"));
        Assertions.assertEquals(1, cursor.countInFlight());
    }

    @Test
    void shouldNotClaimRespondedCall() {
        var cursor = new ProcessingCursor();

        cursor.markResponded("a");

        Assertions.assertFalse(cursor.claim("a"));
        Assertions.assertTrue(cursor.isResponded("a"));
        Assertions.assertEquals(0, cursor.countInFlight());
    }

    @Test
    void shouldReportMalformedEntryOnlyOnce() {
        var cursor = new ProcessingCursor();
        var entry = JsonNodeFactory.instance.objectNode().put("type", "call");

        Assertions.assertTrue(cursor.markMalformed(entry));
        Assertions.assertFalse(cursor.markMalformed(entry.deepCopy()));
    }
}
