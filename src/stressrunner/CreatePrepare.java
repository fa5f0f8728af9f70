package stressrunner;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.UUID;

import org.apache.commons.io.FileUtils;

public class CreatePrepare implements Lifecycle.PrepareStep {
    private final File cacheDir;
    private final boolean crashMode;

    public CreatePrepare(File cacheDir, boolean crashMode) {
        this.cacheDir = cacheDir;
        this.crashMode = crashMode;
    }

    public File cacheLocation(StressJob job) {
        return new File(cacheDir, "dir." + job.getExecf() + "-" + job.getTsize() + "-" + job.getCsize());
    }

    @Override
    public void prepare(RunContext ctx, ChildProcess child) throws TestFailure, Killed, IOException {
        ctx.updatePhase(Phase.CREATE);
        File cached = cacheLocation(ctx.getJob());
        if (cached.isDirectory()) {
            Log.debug(ctx + " found existing environment.");
            FileUtils.copyDirectory(cached, ctx.getEnvdir());
            return;
        }

        Log.debug(ctx + " preparing an environment.");
        String execf = ctx.getJob().getExecf();
        String mode = crashMode ? "--only_create --test" : "--only_create";
        List<String> args = crashMode ? Lifecycle.withFlags(Lifecycle.prepareArgs(ctx), "--only_create", "--test")
                : Lifecycle.withFlags(Lifecycle.prepareArgs(ctx), "--only_create");
        if (child.run(ctx, args) != 0)
            throw new TestFailure(Phase.CREATE, execf + " crashed during " + mode + ".");
        if (!ctx.getEnvdir().isDirectory())
            throw new TestFailure(Phase.CREATE, execf + " did not create an environment during " + mode + ".");
        save(ctx, cached);
    }

    /**
     * Two runs may create the same environment at once. The copy goes to a
     * private directory first and is renamed into place; whoever renames
     * second drops its copy.
     */
    private void save(RunContext ctx, File cached) throws IOException {
        Log.debug(ctx + " copying environment to " + cached + ".");
        File tmp = new File(cacheDir, cached.getName() + ".tmp-" + UUID.randomUUID());
        FileUtils.copyDirectory(ctx.getEnvdir(), tmp);
        try {
            Files.move(tmp.toPath(), cached.toPath(), StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            FileUtils.deleteDirectory(tmp);
            if (!cached.isDirectory())
                throw e;
            Log.debug(ctx + " environment " + cached + " was saved by another run.");
        }
    }
}
