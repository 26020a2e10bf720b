package com.yumi.membership.filter;

import java.util.Objects;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Guards a {@link Filter} with one read-write lock: queries share the read lock,
 * anything that sets or clears bits takes the write lock.
 */
public class LockedFilter implements Filter {
    private final Filter delegate;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public LockedFilter(Filter delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    @Override
    public void add(byte[] key) {
        this.lock.writeLock().lock();
        try {
            this.delegate.add(key);
        } finally {
            this.lock.writeLock().unlock();
        }
    }

    @Override
    public boolean test(byte[] key) {
        this.lock.readLock().lock();
        try {
            return this.delegate.test(key);
        } finally {
            this.lock.readLock().unlock();
        }
    }

    @Override
    public boolean testAndAdd(byte[] key) {
        this.lock.writeLock().lock();
        try {
            return this.delegate.testAndAdd(key);
        } finally {
            this.lock.writeLock().unlock();
        }
    }

    @Override
    public boolean testLocations(long[] locations) {
        this.lock.readLock().lock();
        try {
            return this.delegate.testLocations(locations);
        } finally {
            this.lock.readLock().unlock();
        }
    }

    @Override
    public void clearAll() {
        this.lock.writeLock().lock();
        try {
            this.delegate.clearAll();
        } finally {
            this.lock.writeLock().unlock();
        }
    }

    @Override
    public int cap() {
        return this.delegate.cap();
    }

    @Override
    public int hashFunctionNum() {
        return this.delegate.hashFunctionNum();
    }
}
