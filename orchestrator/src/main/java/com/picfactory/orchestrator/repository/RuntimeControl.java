package com.picfactory.orchestrator.repository;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;

/**
 * Scheduling signals of one job plus the lock that guards its task state.
 *
 * Every task mutation of the owning job happens while {@link #lock()} is held,
 * whether it comes from the job loop or from a control command. Control
 * commands call {@link #signalChange()} so a loop blocked in
 * {@link #awaitUnless} wakes up immediately instead of at its next poll.
 */
public class RuntimeControl {

    private final ReentrantLock lock    = new ReentrantLock();
    private final Condition     changed = lock.newCondition();

    private volatile boolean running   = false;
    private volatile boolean paused    = false;
    private volatile boolean cancelled = false;

    public boolean isRunning()   { return running; }
    public boolean isPaused()    { return paused; }
    public boolean isCancelled() { return cancelled; }

    public void setRunning(boolean running)     { this.running = running; }
    public void setPaused(boolean paused)       { this.paused = paused; }
    public void setCancelled(boolean cancelled) { this.cancelled = cancelled; }

    public void lock()   { lock.lock(); }
    public void unlock() { lock.unlock(); }

    /** Wake every thread blocked in {@link #awaitUnless}. */
    public void signalChange() {
        lock.lock();
        try {
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Block for at most {@code max} unless {@code ready} already holds.
     * The condition is evaluated under the lock, so a signal sent between the
     * caller's last check and this call is never lost.
     */
    public void awaitUnless(BooleanSupplier ready, Duration max) throws InterruptedException {
        lock.lock();
        try {
            if (!ready.getAsBoolean()) {
                changed.await(max.toNanos(), TimeUnit.NANOSECONDS);
            }
        } finally {
            lock.unlock();
        }
    }
}
