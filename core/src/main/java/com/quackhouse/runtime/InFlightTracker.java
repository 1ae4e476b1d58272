package com.quackhouse.runtime;

/**
 * Counts executions currently using the engine and lets shutdown wait for them.
 *
 * <p>Once {@link #close()} is called no new execution is admitted until
 * {@link #reopen()}. Thread-safe.
 */
public class InFlightTracker {

    private int inFlight = 0;
    private boolean admitting = true;

    /**
     * Registers an execution.
     *
     * @return false if the tracker is closed and the execution must not start
     */
    public synchronized boolean tryEnter() {
        if (!admitting) {
            return false;
        }
        inFlight++;
        return true;
    }

    /** Unregisters an execution admitted by {@link #tryEnter()}. */
    public synchronized void exit() {
        if (inFlight == 0) {
            throw new IllegalStateException("exit() without matching tryEnter()");
        }
        inFlight--;
        if (inFlight == 0) {
            notifyAll();
        }
    }

    /** Stops admitting new executions. */
    public synchronized void close() {
        admitting = false;
    }

    public synchronized void reopen() {
        admitting = true;
    }

    /**
     * Waits until no execution is in flight.
     *
     * @param timeoutMs maximum wait in milliseconds
     * @return true if drained, false if executions were still running at the deadline
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public synchronized boolean awaitDrained(long timeoutMs) throws InterruptedException {
        long deadline = System.currentTimeMillis() + timeoutMs;
        while (inFlight > 0) {
            long remaining = deadline - System.currentTimeMillis();
            if (remaining <= 0) {
                return false;
            }
            wait(remaining);
        }
        return true;
    }

    public synchronized int inFlight() {
        return inFlight;
    }

    public synchronized boolean isAdmitting() {
        return admitting;
    }
}
