package com.nodeproxy.common;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Guard backed by a fair {@link ReentrantLock}. Reentrant so an accessor holding the guard
 * may delegate to another accessor that acquires it again.
 */
public class ReentrantExclusiveAccessGuard implements ExclusiveAccessGuard {

    private final ReentrantLock lock = new ReentrantLock(true);

    @Override
    public void acquire() {
        lock.lock();
    }

    @Override
    public void release() {
        if (!lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("release() called by a thread that does not hold the guard");
        }
        lock.unlock();
    }

    public boolean isHeldByCurrentThread() {
        return lock.isHeldByCurrentThread();
    }
}
