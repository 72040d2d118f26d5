package io.github.balazskreith.mailbox.server;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

public interface DispatcherExecutors {
    ExecutorService getHandlerExecutor();

    static DispatcherExecutors createDefault(DispatcherConfig config) {
        var counter = new AtomicInteger(0);
        ThreadFactory threadFactory = runnable -> {
            var thread = new Thread(runnable, "mailbox-handler-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        var handlerExecutor = 0 < config.maxConcurrentHandlers()
                ? Executors.newFixedThreadPool(config.maxConcurrentHandlers(), threadFactory)
                : Executors.newCachedThreadPool(threadFactory);
        return from(handlerExecutor);
    }

    static DispatcherExecutors from(ExecutorService handlerExecutor) {
        return () -> handlerExecutor;
    }
}
