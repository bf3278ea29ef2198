package dev.macros.engine;

import java.time.Duration;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Cooperative pause/resume/stop signals between a worker's thread and its callers.
 *
 * <p>The worker blocks on a condition while paused and sleeps on the same condition
 * between Wait polls, so {@link #stop()} wakes it immediately. Interrupting the
 * worker thread counts as a stop.</p>
 */
final class RunControl {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private boolean paused;
    private boolean stopped;

    /** Clear both flags for a new run. */
    void reset() {
        lock.lock();
        try {
            paused = false;
            stopped = false;
        } finally {
            lock.unlock();
        }
    }

    /** @return false if already stopped */
    boolean pause() {
        lock.lock();
        try {
            if (stopped) {
                return false;
            }
            paused = true;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /** @return true if the run was paused */
    boolean resume() {
        lock.lock();
        try {
            boolean was = paused;
            paused = false;
            changed.signalAll();
            return was;
        } finally {
            lock.unlock();
        }
    }

    /** Idempotent; also releases a paused worker. */
    void stop() {
        lock.lock();
        try {
            stopped = true;
            paused = false;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    boolean isStopped() {
        lock.lock();
        try {
            return stopped;
        } finally {
            lock.unlock();
        }
    }

    boolean isPaused() {
        lock.lock();
        try {
            return paused;
        } finally {
            lock.unlock();
        }
    }

    /** Block while paused. Returns immediately when not paused or once stopped. */
    void awaitWhilePaused() {
        lock.lock();
        try {
            while (paused && !stopped) {
                changed.await();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stopped = true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Sleep for {@code duration} unless stopped first.
     *
     * @return false if the run was stopped
     */
    boolean sleep(Duration duration) {
        long remaining = duration.toNanos();
        lock.lock();
        try {
            while (!stopped && remaining > 0) {
                remaining = changed.awaitNanos(remaining);
            }
            return !stopped;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stopped = true;
            return false;
        } finally {
            lock.unlock();
        }
    }
}
