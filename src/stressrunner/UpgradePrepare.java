package stressrunner;

import java.io.File;
import java.io.IOException;

import org.apache.commons.io.FileUtils;

public class UpgradePrepare implements Lifecycle.PrepareStep {
    private final File oldEnvironmentsDir;

    public UpgradePrepare(File oldEnvironmentsDir) {
        this.oldEnvironmentsDir = oldEnvironmentsDir;
    }

    public File oldEnvdir(StressJob job) {
        String oldName = "saved" + job.getSeedKind().label() + "-" + job.getTsize() + "-dir";
        return new File(new File(oldEnvironmentsDir, job.getOldVersion()), oldName);
    }

    @Override
    public void prepare(RunContext ctx, ChildProcess child) throws IOException {
        ctx.updatePhase(Phase.CREATE);
        File source = oldEnvdir(ctx.getJob());
        Log.debug(ctx + " using old version environment " + source + ".");
        if (!source.isDirectory())
            throw new IOException("Old version environment " + source + " does not exist");
        FileUtils.copyDirectory(source, ctx.getEnvdir());
    }
}
