package runbroker.coordinator.service;

import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Auto-reset event a long-polling thread parks on.
 * {@link #signal()} sets the flag and wakes waiters; {@link #await(long)}
 * returns as soon as the flag is set and consumes it.
 * A signal raised while nobody waits is kept until the next await or reset.
 */
public final class WakeSignal {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition signalled = lock.newCondition();
    private boolean set;

    public void signal() {
        lock.lock();
        try {
            set = true;
            signalled.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public void reset() {
        lock.lock();
        try {
            set = false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Wait until signalled or the timeout elapses.
     *
     * @return true if the signal fired
     */
    public boolean await(long timeoutNanos) throws InterruptedException {
        lock.lock();
        try {
            long remaining = timeoutNanos;
            while (!set) {
                if (remaining <= 0L) {
                    return false;
                }
                remaining = signalled.awaitNanos(remaining);
            }
            set = false;
            return true;
        } finally {
            lock.unlock();
        }
    }
}
