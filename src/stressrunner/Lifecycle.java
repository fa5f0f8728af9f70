package stressrunner;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * The phases a job goes through on every run: one prepare step followed by
 * one execute step. Variants are expressed by picking and decorating the
 * steps, not by subclassing.
 */
public class Lifecycle {
    public static interface PrepareStep {
        void prepare(RunContext ctx, ChildProcess child) throws TestFailure, Killed, IOException;
    }

    public static interface ExecuteStep {
        void execute(RunContext ctx, ChildProcess child) throws TestFailure, Killed, IOException;
    }

    private final PrepareStep prepareStep;
    private final ExecuteStep executeStep;

    public Lifecycle(PrepareStep prepareStep, ExecuteStep executeStep) {
        this.prepareStep = prepareStep;
        this.executeStep = executeStep;
    }

    public static Lifecycle forJob(StressJob job, StressConfig config) {
        Variant variant = job.getVariant();
        PrepareStep prepare;
        if (variant.isUpgrade()) {
            prepare = new UpgradePrepare(config.getOldEnvironmentsDir());
        } else {
            prepare = new CreatePrepare(config.getTestsDir(), variant.isRecover());
        }
        ExecuteStep execute = variant.isRecover() ? new CrashRecoverExecute() : new StressExecute();
        if (variant.isDoubled()) {
            execute = new DoubleExecute(execute);
        }
        return new Lifecycle(prepare, execute);
    }

    public void prepare(RunContext ctx, ChildProcess child) throws TestFailure, Killed, IOException {
        ctx.updateState(RunContext.State.PREPARING);
        prepareStep.prepare(ctx, child);
    }

    public void execute(RunContext ctx, ChildProcess child) throws TestFailure, Killed, IOException {
        ctx.updateState(RunContext.State.EXECUTING);
        executeStep.execute(ctx, child);
    }

    public PrepareStep getPrepareStep() {
        return prepareStep;
    }

    public ExecuteStep getExecuteStep() {
        return executeStep;
    }

    public static List<String> prepareArgs(RunContext ctx) {
        StressJob job = ctx.getJob();
        List<String> args = new ArrayList<String>(Arrays.asList("-v", "--envdir", "envdir", "--num_elements",
                Long.toString(job.getTsize()), "--cachetable_size", Long.toString(job.getCsize())));
        // environments of old versions hold a single dictionary
        if (job.getVariant().isUpgrade()) {
            args.add("--num_DBs");
            args.add("1");
        }
        return args;
    }

    public static List<String> testArgs(RunContext ctx) {
        List<String> args = new ArrayList<String>(Arrays.asList("--num_seconds",
                Integer.toString(ctx.getJob().getTestTime()), "--no-crash_on_operation_failure",
                "--num_ptquery_threads", Integer.toString(ctx.getNumPtquery()), "--num_update_threads",
                Integer.toString(ctx.getNumUpdate())));
        args.addAll(prepareArgs(ctx));
        return args;
    }

    static List<String> withFlags(List<String> args, String... flags) {
        List<String> result = new ArrayList<String>(Arrays.asList(flags));
        result.addAll(args);
        return result;
    }
}
