package stressrunner;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import org.apache.commons.io.FileUtils;

public class ChildProcess {
    private static final long TERMINATE_GRACE_SECONDS = 5;

    private final File testsDir;
    private final File libDir;
    private final String jemalloc;
    private final int nice;
    private final long pollMillis;
    private final StopSignal stop;

    public ChildProcess(StressConfig config, StopSignal stop) {
        this.testsDir = config.getTestsDir();
        this.libDir = config.getLibDir();
        this.jemalloc = config.getJemalloc();
        this.nice = config.getNice();
        this.pollMillis = config.getPollMillis();
        this.stop = stop;
    }

    /**
     * Runs <code>execf args...</code> with the run directory as working
     * directory.
     *
     * @return the exit code of the child
     * @throws Killed
     *             if the stop signal was raised before the child finished,
     *             the child was asked to terminate
     */
    public int run(RunContext ctx, List<String> args) throws IOException, Killed {
        String execf = ctx.getJob().getExecf();
        String commandLine = execf + " " + String.join(" ", args);
        Log.debug(ctx + " spawning " + commandLine);
        FileUtils.writeStringToFile(ctx.getCommandsFile(), commandLine + "\n", StandardCharsets.UTF_8, true);

        if (stop.isSet())
            throw new Killed(ctx + " stopped before spawning " + execf);

        List<String> command = new ArrayList<String>();
        if (nice > 0) {
            command.add("nice");
            command.add("-n");
            command.add(Integer.toString(nice));
        }
        command.add(new File(testsDir, execf).getAbsolutePath());
        command.addAll(args);

        ProcessBuilder pb = new ProcessBuilder(command).directory(ctx.getRundir()).redirectErrorStream(true)
                .redirectOutput(ProcessBuilder.Redirect.appendTo(ctx.getOutputFile()));
        augmentEnvironment(pb.environment(), libDir, jemalloc);

        Process proc = pb.start();
        return waitFor(ctx, proc);
    }

    private int waitFor(RunContext ctx, Process proc) throws Killed {
        try {
            while (!proc.waitFor(pollMillis, TimeUnit.MILLISECONDS)) {
                if (stop.isSet()) {
                    terminate(ctx, proc);
                    throw new Killed(ctx + " killed while running");
                }
            }
            return proc.exitValue();
        } catch (InterruptedException e) {
            terminate(ctx, proc);
            Thread.currentThread().interrupt();
            throw new Killed(ctx + " interrupted while running");
        }
    }

    private void terminate(RunContext ctx, Process proc) {
        Log.debug(ctx + " terminating child " + proc.pid());
        proc.destroy();
        try {
            if (!proc.waitFor(TERMINATE_GRACE_SECONDS, TimeUnit.SECONDS))
                Log.warn(ctx + " child " + proc.pid() + " is still running " + TERMINATE_GRACE_SECONDS
                        + "s after it was asked to terminate.");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public static void augmentEnvironment(Map<String, String> env, File libDir, String jemalloc) {
        prepend(env, "LD_LIBRARY_PATH", libDir.getPath());
        if (jemalloc != null && !jemalloc.isEmpty()) {
            prepend(env, "LD_PRELOAD", new File(jemalloc).toPath().normalize().toString());
        }
    }

    private static void prepend(Map<String, String> env, String key, String value) {
        String current = env.get(key);
        if (current == null || current.isEmpty()) {
            env.put(key, value);
        } else {
            env.put(key, value + File.pathSeparator + current);
        }
    }
}
