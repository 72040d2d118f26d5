package io.github.balazskreith.mailbox.common;

/**
 * Serializes objects to the bytes travelling between replicas and back.
 * Implementations throw {@link SerDeException} on malformed input.
 */
public interface SerDe<T> {
    byte[] serialize(T object);
    T deserialize(byte[] data);
}
