package io.github.balazskreith.mailbox.codec;

/**
 * An entry of the queue document
 */
public interface QueueEntry {
    EntryType type();
}
