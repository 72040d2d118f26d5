package io.github.balazskreith.mailbox.client;

/**
 * @param callTimeoutInMs the default time callers wait for a response, 0 means unbounded
 */
public record CorrelatorConfig(
        int callTimeoutInMs
) {
    public static CorrelatorConfig create() {
        return new CorrelatorConfig(
                0
        );
    }

    public CorrelatorConfig copyAndSetCallTimeoutInMs(int callTimeoutInMs) {
        return new CorrelatorConfig(
                callTimeoutInMs
        );
    }
}
