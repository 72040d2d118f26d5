package io.github.balazskreith.mailbox.common;

import io.reactivex.rxjava3.disposables.CompositeDisposable;
import io.reactivex.rxjava3.disposables.Disposable;
import io.reactivex.rxjava3.subjects.Subject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects subscriptions, subjects and release actions of a component and disposes them exactly once.
 */
public class Disposer implements Disposable {

    private static final Logger logger = LoggerFactory.getLogger(Disposer.class);

    public static Builder builder() {
        return new Builder();
    }

    private final CompositeDisposable disposables = new CompositeDisposable();
    private volatile boolean disposed = false;
    private Runnable onDisposed = () -> {};

    private Disposer() {

    }

    public void add(Disposable disposable) {
        if (this.disposed) {
            logger.debug("Disposable is added after the disposer is disposed, it is disposed immediately");
            disposable.dispose();
            return;
        }
        this.disposables.add(disposable);
    }

    @Override
    public void dispose() {
        synchronized (this) {
            if (this.disposed) {
                return;
            }
            this.disposed = true;
        }
        this.disposables.dispose();
        this.onDisposed.run();
    }

    @Override
    public boolean isDisposed() {
        return this.disposed;
    }

    public static class Builder {
        private final Disposer result = new Disposer();

        private Builder() {

        }

        public Builder addSubject(Subject<?> subject) {
            this.result.disposables.add(Disposable.fromRunnable(() -> {
                if (!subject.hasComplete() && !subject.hasThrowable()) {
                    subject.onComplete();
                }
            }));
            return this;
        }

        public Builder addDisposable(Disposable disposable) {
            this.result.disposables.add(disposable);
            return this;
        }

        public Builder addAction(Runnable action) {
            this.result.disposables.add(Disposable.fromRunnable(action));
            return this;
        }

        public Builder onDisposed(Runnable action) {
            this.result.onDisposed = action;
            return this;
        }

        public Disposer build() {
            return this.result;
        }
    }
}
