package stressrunner;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.commons.io.IOUtils;

public class SvnRebuilder implements Rebuilder {
    private final File sourceDir;
    private final File buildDir;
    private final File installDir;
    private final String cc;
    private final List<String> tests;

    public SvnRebuilder(StressConfig config) {
        this.sourceDir = config.getSourceDir();
        this.buildDir = config.getBuildDir();
        this.installDir = config.getInstallDir();
        this.cc = config.getCc();
        this.tests = config.getAllTestNames();
    }

    @Override
    public void rebuild() throws BuildException {
        Log.info("Updating from svn.");
        run(new ProcessBuilder("svn", "up").directory(sourceDir).redirectErrorStream(true)
                .redirectOutput(ProcessBuilder.Redirect.DISCARD));

        if (!compilerWorks()) {
            throw new BuildException("Cannot find working compiler named \"" + cc
                    + "\".  Try sourcing the icc env script or providing another compiler with --cc.");
        }

        Log.info("Building the stress tests.");
        if (!buildDir.exists())
            buildDir.mkdirs();
        int r = run(new ProcessBuilder("cmake", "-DCMAKE_BUILD_TYPE=Debug",
                "-DINTEL_CC=" + ("icc".equals(cc) ? "ON" : "OFF"), "-DCMAKE_INSTALL_DIR=" + installDir,
                sourceDir.getAbsolutePath()).directory(buildDir).inheritIO());
        if (r != 0)
            throw new BuildException("Configuring the build failed with exit code " + r + ".");

        List<String> make = new ArrayList<String>(Arrays.asList("make", "-s"));
        make.addAll(tests);
        r = run(new ProcessBuilder(make).directory(buildDir).inheritIO());
        if (r != 0)
            throw new BuildException("Building the tests failed with exit code " + r + ".");
    }

    private boolean compilerWorks() {
        try {
            return run(new ProcessBuilder(cc, "-v").redirectErrorStream(true)
                    .redirectOutput(ProcessBuilder.Redirect.DISCARD)) == 0;
        } catch (BuildException e) {
            Log.error("Error running " + cc + ".", e);
            return false;
        }
    }

    @Override
    public String revision() throws BuildException {
        try {
            Process proc = new ProcessBuilder("svn", "info").directory(sourceDir).redirectErrorStream(true).start();
            String out;
            try (InputStream is = proc.getInputStream()) {
                out = IOUtils.toString(is, StandardCharsets.UTF_8);
            }
            if (proc.waitFor() != 0)
                throw new BuildException("svn info failed: " + out.trim());
            String rev = parseRevision(out);
            if (rev == null)
                throw new BuildException("svn info did not report a revision");
            Log.info("Using the source tree at r" + rev + ".");
            return rev;
        } catch (IOException e) {
            throw new BuildException("Could not run svn info", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BuildException("Interrupted while running svn info", e);
        }
    }

    static String parseRevision(String svnInfo) {
        for (String line : svnInfo.split("\n")) {
            if (line.startsWith("Revision:"))
                return line.substring("Revision:".length()).trim();
        }
        return null;
    }

    private static int run(ProcessBuilder pb) throws BuildException {
        try {
            return pb.start().waitFor();
        } catch (IOException e) {
            throw new BuildException("Could not run " + pb.command(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BuildException("Interrupted while running " + pb.command(), e);
        }
    }
}
