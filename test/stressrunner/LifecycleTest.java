package stressrunner;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.io.IOException;
import java.util.Arrays;

import org.junit.Assume;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import stressrunner.StressJob.SeedKind;

public class LifecycleTest {
    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    @Test
    public void testStepsPerVariant() {
        StressConfig config = new StressConfig();
        Lifecycle plain = Lifecycle.forJob(new StressJob("a.tdb", 2000, 100000, 1, Variant.PLAIN), config);
        assertTrue(plain.getPrepareStep() instanceof CreatePrepare);
        assertTrue(plain.getExecuteStep() instanceof StressExecute);

        Lifecycle recover = Lifecycle.forJob(new StressJob("a.tdb", 2000, 100000, 1, Variant.RECOVER), config);
        assertTrue(recover.getPrepareStep() instanceof CreatePrepare);
        assertTrue(recover.getExecuteStep() instanceof CrashRecoverExecute);

        Lifecycle upgrade = Lifecycle.forJob(
                new StressJob("a.tdb", 2000, 100000, 1, Variant.UPGRADE_RECOVER, "4.2.0", SeedKind.STRESSED), config);
        assertTrue(upgrade.getPrepareStep() instanceof UpgradePrepare);
        assertTrue(upgrade.getExecuteStep() instanceof CrashRecoverExecute);

        Lifecycle doubled = Lifecycle.forJob(
                new StressJob("a.tdb", 2000, 100000, 1, Variant.DOUBLE_UPGRADE, "4.2.0", SeedKind.PRISTINE), config);
        assertTrue(doubled.getPrepareStep() instanceof UpgradePrepare);
        assertTrue(doubled.getExecuteStep() instanceof DoubleExecute);
        assertTrue(((DoubleExecute) doubled.getExecuteStep()).getInner() instanceof StressExecute);
    }

    @Test
    public void testStepsLeaveStateToLifecycle() throws Exception {
        StressJob job = new StressJob("a.tdb", 2000, 100000, 1, Variant.RECOVER);
        Lifecycle.ExecuteStep step = (ctx, child) -> ctx.updatePhase(Phase.STRESS);
        Lifecycle lifecycle = new Lifecycle((ctx, child) -> ctx.updatePhase(Phase.CREATE), step);
        try (RunContext ctx = RunContext.open(job, "r1", tmp.getRoot())) {
            lifecycle.prepare(ctx, null);
            assertEquals(RunContext.State.PREPARING, ctx.getState());
            lifecycle.execute(ctx, null);
            assertEquals(RunContext.State.EXECUTING, ctx.getState());
            assertEquals(Phase.STRESS, ctx.getPhase());
        }
    }

    @Test
    public void testCrashRecoverMovesToRecovering() throws Exception {
        Assume.assumeTrue(new File("/bin/bash").canExecute());
        StressConfig config = new StressConfig();
        config.setSourceDir(tmp.newFolder("src"));
        config.setNice(0);
        config.setPollMillis(50);
        config.getTestsDir().mkdirs();
        new StubExecutable(config.getTestsDir(), "a.tdb", new File(tmp.getRoot(), "calls.txt")).write();

        StressJob job = new StressJob("a.tdb", 2000, 100000, 1, Variant.RECOVER);
        Lifecycle lifecycle = Lifecycle.forJob(job, config);
        try (RunContext ctx = RunContext.open(job, "r1", config.getTestsDir())) {
            lifecycle.execute(ctx, new ChildProcess(config, new StopSignal()));
            assertEquals(RunContext.State.RECOVERING, ctx.getState());
            assertEquals(Phase.RECOVER, ctx.getPhase());
        }
    }

    @Test
    public void testArguments() throws IOException {
        StressJob job = new StressJob("a.tdb", 200000, 10000000, 60, Variant.PLAIN);
        try (RunContext ctx = RunContext.open(job, "r1", tmp.getRoot())) {
            assertEquals(Arrays.asList("-v", "--envdir", "envdir", "--num_elements", "200000", "--cachetable_size",
                    "10000000"), Lifecycle.prepareArgs(ctx));
            assertEquals(Arrays.asList("--only_create", "--test", "-v"),
                    Lifecycle.withFlags(Arrays.asList("-v"), "--only_create", "--test"));
            assertEquals(Arrays.asList("--num_seconds", "60", "--no-crash_on_operation_failure",
                    "--num_ptquery_threads", "1", "--num_update_threads", "1", "-v", "--envdir", "envdir",
                    "--num_elements", "200000", "--cachetable_size", "10000000"), Lifecycle.testArgs(ctx));
        }
    }

    @Test
    public void testUpgradeUsesSingleDictionary() throws IOException {
        StressJob job = new StressJob("a.tdb", 2000, 100000, 60, Variant.UPGRADE, "6.0.0", SeedKind.PRISTINE);
        try (RunContext ctx = RunContext.open(job, "r1", tmp.getRoot())) {
            assertEquals(Arrays.asList("-v", "--envdir", "envdir", "--num_elements", "2000", "--cachetable_size",
                    "100000", "--num_DBs", "1"), Lifecycle.prepareArgs(ctx));
        }
    }
}
