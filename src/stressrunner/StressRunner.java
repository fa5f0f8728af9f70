package stressrunner;

import java.io.File;
import java.util.LinkedList;
import java.util.List;

/**
 * Runs the stress tests repeatedly to see if any fail.
 *
 * Runs every test in parallel with different table sizes, cache sizes and
 * numbers of threads, reporting passes and collecting failure scenarios
 * until killed. Once per rebuild period everything stops, the tree is
 * updated and rebuilt, and the tests restart against the new revision.
 */
public class StressRunner {
    private final StressConfig config;
    private final Rebuilder rebuilder;
    private volatile Thread mainThread;

    public StressRunner(StressConfig config, Rebuilder rebuilder) {
        this.config = config;
        this.rebuilder = rebuilder;
    }

    public static void main(String[] args) throws Exception {
        StressConfig config;
        try {
            config = StressConfig.parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(StressConfig.USAGE);
            System.exit(2);
            return;
        }
        Log.setLevel(config.getLogLevel());

        try {
            new StressRunner(config, new SvnRebuilder(config)).run();
        } catch (BuildException e) {
            Log.error(e.getMessage(), e);
            System.exit(2);
        } catch (WorkerFailedException e) {
            Log.error("Scheduler reported an error.", e.getCause());
            System.exit(1);
        }
    }

    public void run() throws Exception {
        if (config.isBuild())
            rebuilder.rebuild();
        String rev = rebuilder.revision();

        File saveDir = config.getSaveDir();
        if (!saveDir.exists())
            saveDir.mkdirs();
        ResultLog resultLog = new ResultLog(config.getLogFile());
        Log.info("Saving pass/fail logs to " + config.getLogFile() + ".");
        Log.info("Saving failure environments to " + saveDir + ".");

        List<RunContext> runs = new LinkedList<RunContext>();
        JobRunner.Executor executor = new JobRunner.Executor(config, new Archiver(config), runs);
        List<StressJob> jobs = JobMatrix.generate(config);
        Log.info("Generated " + jobs.size() + " stress jobs.");
        Scheduler scheduler = new Scheduler(config.getJobs(), config.getMaxLarge(), jobs, executor, resultLog);

        StatusServer statusServer = null;
        if (config.getStatusPort() > 0) {
            statusServer = new StatusServer(scheduler, runs);
            statusServer.startServer(config.getStatusPort());
        }

        mainThread = Thread.currentThread();
        Runtime.getRuntime().addShutdownHook(new Thread(() -> shutdown(scheduler), "shutdown"));
        try {
            while (!scheduler.isShutdown()) {
                scheduler.runCycle(rev, config.getRebuildPeriod());
                if (scheduler.isShutdown())
                    break;
                rebuilder.rebuild();
                rev = rebuilder.revision();
            }
        } catch (InterruptedException e) {
            Log.info("Interrupted, all workers have been stopped.");
        } finally {
            mainThread = null;
            if (statusServer != null)
                statusServer.stopServer();
        }
    }

    private void shutdown(Scheduler scheduler) {
        scheduler.shutdown();
        Thread main = mainThread;
        if (main != null) {
            try {
                main.join(10000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
