package stressrunner;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.util.concurrent.ThreadLocalRandom;

import org.apache.commons.io.FileUtils;

/**
 * State of a single run of a {@link StressJob}. Owned by one
 * {@link JobRunner} between dequeue and requeue, never shared.
 *
 * <pre>
 * rundir/
 *   envdir/        the database environment
 *   output.txt     stdout and stderr of every child
 *   commands.txt   every command line that was run
 * </pre>
 */
public class RunContext implements AutoCloseable {
    public static final int MAX_RANDOM_THREADS = 16;

    public static enum State {
        IDLE, PREPARING, EXECUTING, RECOVERING, PASSED, FAILED, KILLED
    }

    private final StressJob job;
    private final String revision;
    private final int runNumber;
    private final int numPtquery;
    private final int numUpdate;
    private final File rundir;
    private volatile State state;
    private volatile Phase phase;
    private long startTime;
    private long endTime;

    private RunContext(StressJob job, String revision, int runNumber, File rundir) {
        this.job = job;
        this.revision = revision;
        this.runNumber = runNumber;
        this.numPtquery = queryThreadsFor(runNumber);
        this.numUpdate = updateThreadsFor(runNumber);
        this.rundir = rundir;
        this.state = State.IDLE;
    }

    public static RunContext open(StressJob job, String revision, File parent) throws IOException {
        File rundir = Files.createTempDirectory(parent.toPath(), "run-").toFile();
        return new RunContext(job, revision, job.nextRunNumber(), rundir);
    }

    public static int queryThreadsFor(int runNumber) {
        if (runNumber % 2 < 1)
            return 1;
        return ThreadLocalRandom.current().nextInt(MAX_RANDOM_THREADS);
    }

    public static int updateThreadsFor(int runNumber) {
        if (runNumber % 4 < 2)
            return 1;
        return ThreadLocalRandom.current().nextInt(MAX_RANDOM_THREADS);
    }

    public StressJob getJob() {
        return job;
    }

    public String getRevision() {
        return revision;
    }

    public int getRunNumber() {
        return runNumber;
    }

    public int getNumPtquery() {
        return numPtquery;
    }

    public int getNumUpdate() {
        return numUpdate;
    }

    public File getRundir() {
        return rundir;
    }

    public File getEnvdir() {
        return new File(rundir, "envdir");
    }

    public File getOutputFile() {
        return new File(rundir, "output.txt");
    }

    public File getCommandsFile() {
        return new File(rundir, "commands.txt");
    }

    public State getState() {
        return state;
    }

    public void updateState(State state) {
        this.state = state;
    }

    public Phase getPhase() {
        return phase;
    }

    public void updatePhase(Phase phase) {
        this.phase = phase;
    }

    public void markStarted() {
        startTime = System.currentTimeMillis();
    }

    public void markFinished() {
        endTime = System.currentTimeMillis();
    }

    public long getElapsedSeconds() {
        if (startTime != 0 && endTime != 0)
            return (endTime - startTime) / 1000;
        return 0;
    }

    public RunInfo info() {
        return new RunInfo(job.getExecf(), revision, job.getTsize(), job.getCsize(), job.oldVersionString(),
                numPtquery, numUpdate, getElapsedSeconds());
    }

    @Override
    public void close() throws IOException {
        if (rundir.exists()) {
            FileUtils.deleteDirectory(rundir);
        }
    }

    @Override
    public String toString() {
        return job + "#" + runNumber;
    }
}
