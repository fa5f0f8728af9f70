package stressrunner;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;

import org.apache.commons.io.FileUtils;

public class Archiver {
    private final File saveDir;
    private final File testsDir;
    private final File libDir;

    public Archiver(File saveDir, File testsDir, File libDir) {
        this.saveDir = saveDir;
        this.testsDir = testsDir;
        this.libDir = libDir;
    }

    public Archiver(StressConfig config) {
        this(config.getSaveDir(), config.getTestsDir(), config.getLibDir());
    }

    public static String prefixFor(RunContext ctx, Phase phase) {
        StressJob job = ctx.getJob();
        String prefix = job.getExecf() + "-" + ctx.getRevision() + "-" + job.getTsize() + "-" + job.getCsize() + "-"
                + ctx.getNumPtquery() + "-" + ctx.getNumUpdate() + "-" + phase.label() + "-";
        return prefix.replaceAll("[^a-zA-Z0-9_.+-]", "_");
    }

    public File save(RunContext ctx, Phase phase) {
        try {
            if (!saveDir.exists())
                saveDir.mkdirs();
            File savedir = Files.createTempDirectory(saveDir.toPath(), prefixFor(ctx, phase)).toFile();

            File[] runFiles = ctx.getRundir().listFiles();
            if (runFiles != null) {
                for (File f : runFiles) {
                    if (f.isDirectory()) {
                        FileUtils.copyDirectoryToDirectory(f, savedir);
                    } else {
                        FileUtils.copyFileToDirectory(f, savedir);
                    }
                }
            }
            File fullExecf = new File(testsDir, ctx.getJob().getExecf());
            if (fullExecf.isFile()) {
                FileUtils.copyFileToDirectory(fullExecf, savedir);
            } else {
                Log.warn(ctx + " could not find " + fullExecf + " to archive.");
            }
            File[] libs = libDir.listFiles((dir, name) -> name.endsWith(".so"));
            if (libs != null) {
                for (File lib : libs) {
                    FileUtils.copyFileToDirectory(lib, savedir);
                }
            }
            return savedir;
        } catch (IOException e) {
            Log.error(ctx + " could not be archived to " + saveDir + ".", e);
            return null;
        }
    }
}
