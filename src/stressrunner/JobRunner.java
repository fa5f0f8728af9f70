package stressrunner;

import java.io.File;
import java.io.IOException;
import java.util.List;

/**
 * Drives one run of a {@link StressJob} through its {@link Lifecycle} in a
 * fresh scratch directory and turns what happened into an {@link Outcome}.
 *
 * Test failures are archived before the scratch directory goes away. Errors
 * that are not test failures are not handled here, they propagate to the
 * worker as fatal.
 */
public class JobRunner {
    private final StressJob job;
    private final String revision;
    private final File testsDir;
    private final Lifecycle lifecycle;
    private final ChildProcess child;
    private final Archiver archiver;
    private final List<RunContext> runs;

    public static class Executor implements Scheduler.JobExecutor {
        private final StressConfig config;
        private final Archiver archiver;
        private final List<RunContext> runs;

        public Executor(StressConfig config, Archiver archiver, List<RunContext> runs) {
            this.config = config;
            this.archiver = archiver;
            this.runs = runs;
        }

        @Override
        public Outcome execute(StressJob job, String revision, StopSignal stop) throws IOException {
            return new JobRunner(job, revision, config, stop, archiver, runs).run();
        }
    }

    public JobRunner(StressJob job, String revision, StressConfig config, StopSignal stop, Archiver archiver,
            List<RunContext> runs) {
        this.job = job;
        this.revision = revision;
        this.testsDir = config.getTestsDir();
        this.lifecycle = Lifecycle.forJob(job, config);
        this.child = new ChildProcess(config, stop);
        this.archiver = archiver;
        this.runs = runs;
    }

    public Outcome run() throws IOException {
        RunContext ctx = RunContext.open(job, revision, testsDir);
        synchronized (runs) {
            runs.add(ctx);
        }
        try {
            try {
                lifecycle.prepare(ctx, child);
                Log.debug(ctx + " testing.");
                ctx.markStarted();
                try {
                    lifecycle.execute(ctx, child);
                } finally {
                    ctx.markFinished();
                }
                Log.debug(ctx + " done.");
                ctx.updateState(RunContext.State.PASSED);
                return Outcome.passed(ctx.info());
            } catch (Killed e) {
                Log.debug(e.getMessage());
                ctx.updateState(RunContext.State.KILLED);
                return Outcome.killed(ctx.info());
            } catch (TestFailure e) {
                ctx.updateState(RunContext.State.FAILED);
                File savedir = archiver.save(ctx, e.getPhase());
                if (savedir != null)
                    Log.warn("Saved environment to " + savedir);
                return Outcome.failed(ctx.info(), e.getPhase(), e.getMessage(), savedir);
            }
        } finally {
            synchronized (runs) {
                runs.remove(ctx);
            }
            ctx.close();
        }
    }
}
