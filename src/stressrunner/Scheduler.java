package stressrunner;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Owns the backlog of stress jobs and runs them on a pool of workers until
 * told to stop. One call to {@link #runCycle(String, long)} is one stretch
 * between two rebuilds of the code under test.
 */
public class Scheduler {
    private static final long LARGE_BACKOFF_MILLIS = 200;

    public static interface JobExecutor {
        Outcome execute(StressJob job, String revision, StopSignal stop) throws Exception;
    }

    private final int nworkers;
    private final int maxLarge;
    private final List<StressJob> jobs;
    private final JobExecutor executor;
    private final ResultLog resultLog;

    private final LinkedList<StressJob> backlog = new LinkedList<StressJob>();
    private final StopSignal stop = new StopSignal();
    private final AtomicInteger nlarge = new AtomicInteger();
    private final long startTime = System.currentTimeMillis();

    private volatile boolean shutdown;
    private volatile String revision;
    private volatile Throwable error;
    private int passed;
    private int failed;

    public Scheduler(int nworkers, int maxLarge, List<StressJob> jobs, JobExecutor executor, ResultLog resultLog) {
        Log.info("Initializing scheduler with " + nworkers + " jobs.");
        this.nworkers = nworkers;
        this.maxLarge = maxLarge;
        this.jobs = new ArrayList<StressJob>(jobs);
        this.executor = executor;
        this.resultLog = resultLog;
    }

    /**
     * Starts the workers against the full job list and returns once all of
     * them exited.
     *
     * @param timeoutSeconds
     *            stop automatically after this long, 0 runs until stopped
     * @throws WorkerFailedException
     *             a worker hit an error that is not a test outcome
     * @throws InterruptedException
     *             the calling thread was interrupted, the workers have been
     *             stopped and joined
     */
    public void runCycle(String revision, long timeoutSeconds) throws WorkerFailedException, InterruptedException {
        this.revision = revision;
        this.error = null;
        stop.clear();
        // a shutdown that raced with clear() must still stop this cycle
        if (shutdown)
            stop.set();
        reseed();

        Log.info("Starting workers.");
        ExecutorService pool = Executors.newFixedThreadPool(nworkers, namedThreads("worker"));
        for (int i = 0; i < nworkers; i++) {
            pool.execute(new Worker(this, i));
        }
        pool.shutdown();

        ScheduledExecutorService timer = null;
        if (timeoutSeconds > 0) {
            timer = Executors.newSingleThreadScheduledExecutor(namedThreads("rebuild-timer"));
            timer.schedule(new Runnable() {
                @Override
                public void run() {
                    Log.info("Rebuild period of " + timeoutSeconds + "s is over.");
                    requestStop();
                }
            }, timeoutSeconds, TimeUnit.SECONDS);
        }

        try {
            while (!pool.awaitTermination(1, TimeUnit.SECONDS)) {
            }
            Log.debug("Scheduler stopped by someone else.  Joined threads.");
        } catch (InterruptedException e) {
            Log.debug("Scheduler interrupted.  Stopping and joining threads.");
            requestStop();
            drain(pool);
            throw e;
        } finally {
            if (timer != null)
                timer.shutdownNow();
        }

        if (error != null)
            throw new WorkerFailedException("Worker failed: " + error, error);
    }

    private void drain(ExecutorService pool) {
        boolean interrupted = false;
        while (true) {
            try {
                if (pool.awaitTermination(1, TimeUnit.SECONDS))
                    break;
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted)
            Thread.currentThread().interrupt();
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger n = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + n.getAndIncrement());
            t.setDaemon(true);
            return t;
        };
    }

    private void reseed() {
        List<StressJob> shuffled = new ArrayList<StressJob>(jobs);
        Collections.shuffle(shuffled);
        synchronized (backlog) {
            backlog.clear();
            backlog.addAll(shuffled);
        }
    }

    public void enqueue(StressJob job) {
        synchronized (backlog) {
            backlog.addLast(job);
            backlog.notify();
        }
    }

    // null once the scheduler is stopping
    public StressJob dequeue() throws InterruptedException {
        synchronized (backlog) {
            while (backlog.isEmpty() && !stop.isSet()) {
                backlog.wait();
            }
            if (stop.isSet())
                return null;
            return backlog.removeFirst();
        }
    }

    public void requestStop() {
        if (!stop.isSet())
            Log.info("Stopping workers.");
        stop.set();
        synchronized (backlog) {
            backlog.notifyAll();
        }
    }

    // unlike requestStop, not reset by the next runCycle
    public void shutdown() {
        shutdown = true;
        requestStop();
    }

    public boolean isShutdown() {
        return shutdown;
    }

    public boolean isStopping() {
        return stop.isSet();
    }

    public StopSignal getStopSignal() {
        return stop;
    }

    public boolean tryReserveLarge() {
        while (true) {
            int current = nlarge.get();
            if (current + 1 > maxLarge)
                return false;
            if (nlarge.compareAndSet(current, current + 1))
                return true;
        }
    }

    public void releaseLarge() {
        nlarge.decrementAndGet();
    }

    void largeBackoff() throws InterruptedException {
        stop.await(LARGE_BACKOFF_MILLIS, TimeUnit.MILLISECONDS);
    }

    public Outcome execute(StressJob job, String revision) throws Exception {
        return executor.execute(job, revision, stop);
    }

    public synchronized void report(Outcome outcome) throws IOException {
        switch (outcome.getStatus()) {
        case PASSED:
            passed++;
            if (resultLog != null)
                resultLog.passed(outcome.getInfo());
            Log.info(reportString() + " PASSED " + outcome.getInfo());
            break;
        case FAILED:
            failed++;
            if (resultLog != null)
                resultLog.failed(outcome.getInfo());
            Log.warn(reportString() + " FAILED " + outcome.getInfo() + " (" + outcome.getReason() + ")");
            break;
        case KILLED:
            break;
        }
    }

    public void fail(Throwable t) {
        Log.error("Fatal error in worker thread.", t);
        Log.info("Killing all workers.");
        synchronized (this) {
            if (error == null)
                error = t;
        }
        requestStop();
    }

    public synchronized String reportString() {
        return "[PASS=" + passed + " FAIL=" + failed + "]";
    }

    public synchronized int getPassed() {
        return passed;
    }

    public synchronized int getFailed() {
        return failed;
    }

    public Throwable getError() {
        return error;
    }

    public String getRevision() {
        return revision;
    }

    public int getRunningLarge() {
        return nlarge.get();
    }

    public int getMaxLarge() {
        return maxLarge;
    }

    public int getWorkerCount() {
        return nworkers;
    }

    public long getStartTime() {
        return startTime;
    }

    public int backlogSize() {
        synchronized (backlog) {
            return backlog.size();
        }
    }

    public List<StressJob> getJobs() {
        return Collections.unmodifiableList(jobs);
    }
}
