package stressrunner;

import java.util.concurrent.TimeUnit;

/**
 * Shared stop flag of one scheduling cycle. Anything that waits, on the
 * backlog or on a child process, waits on this so it notices a stop
 * promptly.
 */
public class StopSignal {
    private boolean stopping;

    public synchronized void set() {
        stopping = true;
        notifyAll();
    }

    public synchronized void clear() {
        stopping = false;
    }

    public synchronized boolean isSet() {
        return stopping;
    }

    /**
     * Waits until the signal is set or the timeout elapses.
     * 
     * @return true if the signal is set
     */
    public synchronized boolean await(long timeout, TimeUnit unit) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        while (!stopping) {
            long left = deadline - System.nanoTime();
            if (left <= 0)
                break;
            TimeUnit.NANOSECONDS.timedWait(this, left);
        }
        return stopping;
    }
}
