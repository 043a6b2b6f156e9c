package com.phillippitts.speechgate.service.inference;

import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Count of user-initiated recognition and synthesis requests currently in progress.
 *
 * <p>Foreground requests wrap their work in {@link #enter()}; background work calls
 * {@link #awaitIdle(Duration)} before each attempt and blocks on a condition (no polling) until
 * the count drops to zero or the timeout passes.
 *
 * <pre>{@code
 * try (ForegroundActivity.Scope ignored = foreground.enter()) {
 *     ... serve the request ...
 * }
 * }</pre>
 */
@Component
public class ForegroundActivity {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition idle = lock.newCondition();
    private int active;

    /**
     * Marks the start of a foreground request.
     *
     * @return scope that marks the end of the request when closed (exactly once)
     */
    public Scope enter() {
        lock.lock();
        try {
            active++;
        } finally {
            lock.unlock();
        }
        return new Scope();
    }

    private void exit() {
        lock.lock();
        try {
            if (active > 0) {
                active--;
            }
            if (active == 0) {
                idle.signalAll();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits until no foreground request is active.
     *
     * @param timeout longest time to wait
     * @return true if idle, false if foreground demand persisted past the timeout
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long remaining = timeout.toNanos();
        lock.lock();
        try {
            while (active > 0) {
                if (remaining <= 0) {
                    return false;
                }
                remaining = idle.awaitNanos(remaining);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    public int activeCount() {
        lock.lock();
        try {
            return active;
        } finally {
            lock.unlock();
        }
    }

    public boolean isIdle() {
        return activeCount() == 0;
    }

    /**
     * Handle for one foreground request.
     */
    public final class Scope implements AutoCloseable {
        private boolean closed;

        private Scope() {
        }

        @Override
        public void close() {
            if (!closed) {
                closed = true;
                exit();
            }
        }
    }
}
