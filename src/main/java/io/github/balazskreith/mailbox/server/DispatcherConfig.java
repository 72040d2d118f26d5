package io.github.balazskreith.mailbox.server;

/**
 * @param maxConcurrentHandlers the maximum number of handlers the default executor runs at once, 0 means unbounded
 */
public record DispatcherConfig(
        int maxConcurrentHandlers
) {
    public static DispatcherConfig create() {
        return new DispatcherConfig(
                0
        );
    }

    public DispatcherConfig copyAndSetMaxConcurrentHandlers(int maxConcurrentHandlers) {
        return new DispatcherConfig(
                maxConcurrentHandlers
        );
    }
}
