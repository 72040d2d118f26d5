package io.github.balazskreith.mailbox.common;

import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

public class RwLock {

    private final ReadWriteLock rwLock = new ReentrantReadWriteLock();

    public void runInReadLock(Runnable action) {
        var readLock = this.rwLock.readLock();
        readLock.lock();
        try {
            action.run();
        } finally {
            readLock.unlock();
        }
    }

    public <U> U supplyInWriteLock(Supplier<U> supplier) {
        var writeLock = this.rwLock.writeLock();
        writeLock.lock();
        try {
            return supplier.get();
        } finally {
            writeLock.unlock();
        }
    }

    public <U> U supplyInReadLock(Supplier<U> supplier) {
        var readLock = this.rwLock.readLock();
        readLock.lock();
        try {
            return supplier.get();
        } finally {
            readLock.unlock();
        }
    }
}
