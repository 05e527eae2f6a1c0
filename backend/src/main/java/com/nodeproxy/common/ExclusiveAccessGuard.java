package com.nodeproxy.common;

import java.util.function.Supplier;

/**
 * Serializes use of a shared resource (the daemon connection) across threads.
 * Scoped helpers release on every exit path, including exceptions.
 */
public interface ExclusiveAccessGuard {

    /**
     * Blocks until exclusive access is held by the calling thread.
     */
    void acquire();

    void release();

    default <T> T callExclusive(Supplier<T> action) {
        acquire();
        try {
            return action.get();
        } finally {
            release();
        }
    }

    default void runExclusive(Runnable action) {
        acquire();
        try {
            action.run();
        } finally {
            release();
        }
    }
}
