package io.github.balazskreith.mailbox.server;

/**
 * Runs an action so that the mutations it issues on the application data are committed atomically.
 */
@FunctionalInterface
public interface Transactor {

    Transactor DIRECT = Runnable::run;

    void transact(Runnable action);
}
