package io.github.balazskreith.mailbox.client;

/**
 * @param id the correlation id of the call, generated if null
 * @param timeoutInMs the time the caller waits for the response, the correlator default is used if null, 0 means unbounded
 */
public record CallOptions(String id, Integer timeoutInMs) {

    public static CallOptions create() {
        return new CallOptions(null, null);
    }

    public static CallOptions ofId(String id) {
        return new CallOptions(id, null);
    }

    public CallOptions withId(String value) {
        return new CallOptions(value, this.timeoutInMs);
    }

    public CallOptions withTimeoutInMs(int value) {
        return new CallOptions(this.id, value);
    }
}
