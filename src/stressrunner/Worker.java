package stressrunner;

public class Worker implements Runnable {
    private final Scheduler scheduler;
    private final int id;

    public Worker(Scheduler scheduler, int id) {
        this.scheduler = scheduler;
        this.id = id;
    }

    @Override
    public void run() {
        Log.debug(this + " starting.");
        try {
            StressJob job;
            while ((job = scheduler.dequeue()) != null) {
                boolean large = job.isLarge();
                if (large && !scheduler.tryReserveLarge()) {
                    Log.debug(this + " pulled a large test, but there are already " + scheduler.getRunningLarge()
                            + " running.  Putting it back.");
                    scheduler.enqueue(job);
                    scheduler.largeBackoff();
                    continue;
                }
                try {
                    scheduler.report(scheduler.execute(job, scheduler.getRevision()));
                } catch (Throwable t) {
                    scheduler.fail(t);
                } finally {
                    if (large)
                        scheduler.releaseLarge();
                }
                if (!scheduler.isStopping())
                    scheduler.enqueue(job);
            }
        } catch (InterruptedException e) {
            Log.debug(this + " interrupted.");
            Thread.currentThread().interrupt();
        }
        Log.debug(this + " exiting.");
    }

    @Override
    public String toString() {
        return "Worker-" + id;
    }
}
