package stressrunner;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.commons.io.FileUtils;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

public class StressConfig {
    public static final List<String> DEFAULT_TESTS = Arrays.asList("test_stress1.tdb", "test_stress5.tdb",
            "test_stress6.tdb");
    public static final List<String> DEFAULT_RECOVER_TESTS = Arrays.asList("recover-test_stress1.tdb",
            "recover-test_stress2.tdb", "recover-test_stress3.tdb");
    public static final List<String> KNOWN_OLD_VERSIONS = Arrays.asList("4.2.0", "5.0.8", "5.2.7", "6.0.0");

    public static final String USAGE = "Syntax: stressrunner [options]\n"
            + "  Runs the stress tests repeatedly, reporting passes and collecting failure\n"
            + "  scenarios until killed. Stops, updates, rebuilds and restarts once per rebuild period.\n\n"
            + "  -v, --verbose               show build status, passing tests, and other info\n"
            + "  -d, --debug                 show debugging info\n"
            + "  -l, --log <file>            where to save the pass/fail log [/tmp/run.stress-tests.log]\n"
            + "  -s, --savedir <dir>         where to save environments of failed tests [/tmp/run.stress-tests.failures]\n"
            + "  --source_dir <dir>          top of the source tree [current directory]\n"
            + "  --config <file>             JSON file with any of these options\n"
            + "  -t, --test_time <sec>       time to run each test [600]\n"
            + "  -j, --jobs <n>              how many concurrent tests to run [8]\n"
            + "  --maxlarge <n>              maximum number of large tests to run concurrently [2]\n"
            + "  --skip_build                skip the update and build before testing\n"
            + "  --rebuild_period <sec>      seconds between rebuilds, 0 means never [86400]\n"
            + "  --cc <compiler>             which compiler to use [icc]\n"
            + "  --jemalloc <lib>            a libjemalloc.so to put in LD_PRELOAD when running tests\n"
            + "  --add_test <name>           add a stress test to run\n"
            + "  --add_recover_test <name>   add a recover stress test to run\n"
            + "  --run_upgrade               also run the tests on environments of old versions\n"
            + "  --skip_non_upgrade          skip the tests that don't involve upgrade\n"
            + "  --double_upgrade            run the upgrade tests twice in a row\n"
            + "  --add_old_version <ver>     old version to upgrade from, one of " + KNOWN_OLD_VERSIONS + "\n"
            + "  --old_environments_dir <d>  directory containing old version environments\n"
            + "  --status_port <port>        serve a status page on this port, 0 means off [0]\n"
            + "  --nice <n>                  niceness of the test processes, 0 means unchanged [7]\n";

    private File sourceDir = new File(".").getAbsoluteFile();
    private File logFile = new File("/tmp/run.stress-tests.log");
    private File saveDir = new File("/tmp/run.stress-tests.failures");
    private int testTime = 600;
    private int jobs = 8;
    private int maxLarge = 2;
    private boolean build = true;
    private int rebuildPeriod = 60 * 60 * 24;
    private String cc = "icc";
    private String jemalloc;
    private List<String> testNames = new ArrayList<String>(DEFAULT_TESTS);
    private List<String> recoverTestNames = new ArrayList<String>(DEFAULT_RECOVER_TESTS);
    private boolean runUpgrade;
    private boolean runNonUpgrade = true;
    private boolean doubleUpgrade;
    private List<String> oldVersions = new ArrayList<String>();
    private File oldEnvironmentsDir = new File("../../tokudb.data/old-stress-test-envs");
    private int statusPort;
    private int nice = 7;
    private int logLevel = Log.WARN;
    private long pollMillis = 1000;

    public static StressConfig parse(String[] args) {
        List<String> a = new ArrayList<String>(Arrays.asList(args));
        StressConfig config = new StressConfig();

        String configFile = CmdUtils.getArgForKey(a, "--config");
        if (configFile != null) {
            config.applyJson(new File(configFile));
        }

        boolean debug = CmdUtils.hasKey(a, "-d", "--debug");
        boolean verbose = CmdUtils.hasKey(a, "-v", "--verbose");
        if (debug) {
            config.logLevel = Log.DEBUG;
        } else if (verbose) {
            config.logLevel = Log.INFO;
        }
        String val;
        if ((val = CmdUtils.getArgForKey(a, "-l", "--log")) != null)
            config.logFile = new File(val);
        if ((val = CmdUtils.getArgForKey(a, "-s", "--savedir")) != null)
            config.saveDir = new File(val);
        if ((val = CmdUtils.getArgForKey(a, "--source_dir")) != null)
            config.sourceDir = new File(val).getAbsoluteFile();
        Integer num;
        if ((num = CmdUtils.getIntArgForKey(a, "-t", "--test_time")) != null)
            config.testTime = num;
        if ((num = CmdUtils.getIntArgForKey(a, "-j", "--jobs")) != null)
            config.jobs = num;
        if ((num = CmdUtils.getIntArgForKey(a, "--maxlarge")) != null)
            config.maxLarge = num;
        if (CmdUtils.hasKey(a, "--skip_build"))
            config.build = false;
        if ((num = CmdUtils.getIntArgForKey(a, "--rebuild_period")) != null)
            config.rebuildPeriod = num;
        if ((val = CmdUtils.getArgForKey(a, "--cc")) != null)
            config.cc = val;
        if ((val = CmdUtils.getArgForKey(a, "--jemalloc")) != null)
            config.jemalloc = val;
        config.testNames.addAll(CmdUtils.getArgsForKey(a, "--add_test"));
        config.recoverTestNames.addAll(CmdUtils.getArgsForKey(a, "--add_recover_test"));
        if (CmdUtils.hasKey(a, "--run_upgrade"))
            config.runUpgrade = true;
        if (CmdUtils.hasKey(a, "--skip_non_upgrade"))
            config.runNonUpgrade = false;
        if (CmdUtils.hasKey(a, "--double_upgrade"))
            config.doubleUpgrade = true;
        config.oldVersions.addAll(CmdUtils.getArgsForKey(a, "--add_old_version"));
        if ((val = CmdUtils.getArgForKey(a, "--old_environments_dir")) != null)
            config.oldEnvironmentsDir = new File(val);
        if ((num = CmdUtils.getIntArgForKey(a, "--status_port")) != null)
            config.statusPort = num;
        if ((num = CmdUtils.getIntArgForKey(a, "--nice")) != null)
            config.nice = num;

        if (!a.isEmpty())
            throw new IllegalArgumentException("Invalid arguments: " + a);
        config.validate();
        return config;
    }

    private void applyJson(File file) {
        try {
            String str = FileUtils.readFileToString(file, StandardCharsets.UTF_8);
            str = str.replace("$HOME", System.getProperty("user.home"));
            applyJson(JsonParser.parseString(str).getAsJsonObject());
        } catch (IOException | JsonParseException | IllegalStateException | UnsupportedOperationException
                | NumberFormatException e) {
            throw new IllegalArgumentException("Invalid config file " + file + ": " + e.getMessage(), e);
        }
    }

    private void applyJson(JsonObject json) {

        JsonElement el;
        if ((el = json.get("verbose")) != null && el.getAsBoolean())
            logLevel = Log.INFO;
        if ((el = json.get("debug")) != null && el.getAsBoolean())
            logLevel = Log.DEBUG;
        if ((el = json.get("log")) != null)
            logFile = new File(el.getAsString());
        if ((el = json.get("savedir")) != null)
            saveDir = new File(el.getAsString());
        if ((el = json.get("source_dir")) != null)
            sourceDir = new File(el.getAsString()).getAbsoluteFile();
        if ((el = json.get("test_time")) != null)
            testTime = el.getAsInt();
        if ((el = json.get("jobs")) != null)
            jobs = el.getAsInt();
        if ((el = json.get("maxlarge")) != null)
            maxLarge = el.getAsInt();
        if ((el = json.get("skip_build")) != null)
            build = !el.getAsBoolean();
        if ((el = json.get("rebuild_period")) != null)
            rebuildPeriod = el.getAsInt();
        if ((el = json.get("cc")) != null)
            cc = el.getAsString();
        if ((el = json.get("jemalloc")) != null)
            jemalloc = el.getAsString();
        if ((el = json.get("add_test")) != null)
            testNames.addAll(parseArray(el.getAsJsonArray()));
        if ((el = json.get("add_recover_test")) != null)
            recoverTestNames.addAll(parseArray(el.getAsJsonArray()));
        if ((el = json.get("run_upgrade")) != null)
            runUpgrade = el.getAsBoolean();
        if ((el = json.get("skip_non_upgrade")) != null)
            runNonUpgrade = !el.getAsBoolean();
        if ((el = json.get("double_upgrade")) != null)
            doubleUpgrade = el.getAsBoolean();
        if ((el = json.get("add_old_version")) != null)
            oldVersions.addAll(parseArray(el.getAsJsonArray()));
        if ((el = json.get("old_environments_dir")) != null)
            oldEnvironmentsDir = new File(el.getAsString());
        if ((el = json.get("status_port")) != null)
            statusPort = el.getAsInt();
        if ((el = json.get("nice")) != null)
            nice = el.getAsInt();
    }

    private static List<String> parseArray(JsonArray array) {
        List<String> result = new ArrayList<String>();
        for (JsonElement jsonElement : array) {
            result.add(jsonElement.getAsString());
        }
        return result;
    }

    public void validate() {
        if (jobs < 1)
            throw new IllegalArgumentException("--jobs must be at least 1");
        if (maxLarge < 0)
            throw new IllegalArgumentException("--maxlarge can not be negative");
        if (testTime < 0 || rebuildPeriod < 0)
            throw new IllegalArgumentException("--test_time and --rebuild_period can not be negative");
        for (String version : oldVersions) {
            if (!KNOWN_OLD_VERSIONS.contains(version))
                throw new IllegalArgumentException(
                        "Unknown old version '" + version + "', choose from " + KNOWN_OLD_VERSIONS);
        }
        if (runUpgrade) {
            if (!oldEnvironmentsDir.isDirectory())
                throw new IllegalArgumentException(
                        "You specified --run_upgrade but did not specify an --old_environments_dir that exists.");
            if (oldVersions.isEmpty())
                throw new IllegalArgumentException(
                        "You specified --run_upgrade but gave no --add_old_version to run against.");
            for (String version : oldVersions) {
                File versionDir = new File(oldEnvironmentsDir, version);
                if (!versionDir.isDirectory())
                    throw new IllegalArgumentException(
                            "You specified --run_upgrade but " + versionDir + " is not a directory.");
            }
        }
    }

    public File getBuildDir() {
        return new File(sourceDir, "build");
    }

    public File getInstallDir() {
        return new File(sourceDir, "install");
    }

    public File getLibDir() {
        return new File(getInstallDir(), "lib");
    }

    public File getTestsDir() {
        return new File(new File(getBuildDir(), "src"), "tests");
    }

    public List<String> getAllTestNames() {
        List<String> result = new ArrayList<String>(testNames);
        result.addAll(recoverTestNames);
        return result;
    }

    public File getSourceDir() {
        return sourceDir;
    }

    public void setSourceDir(File sourceDir) {
        this.sourceDir = sourceDir;
    }

    public File getLogFile() {
        return logFile;
    }

    public void setLogFile(File logFile) {
        this.logFile = logFile;
    }

    public File getSaveDir() {
        return saveDir;
    }

    public void setSaveDir(File saveDir) {
        this.saveDir = saveDir;
    }

    public int getTestTime() {
        return testTime;
    }

    public void setTestTime(int testTime) {
        this.testTime = testTime;
    }

    public int getJobs() {
        return jobs;
    }

    public void setJobs(int jobs) {
        this.jobs = jobs;
    }

    public int getMaxLarge() {
        return maxLarge;
    }

    public void setMaxLarge(int maxLarge) {
        this.maxLarge = maxLarge;
    }

    public boolean isBuild() {
        return build;
    }

    public int getRebuildPeriod() {
        return rebuildPeriod;
    }

    public String getCc() {
        return cc;
    }

    public String getJemalloc() {
        return jemalloc;
    }

    public void setJemalloc(String jemalloc) {
        this.jemalloc = jemalloc;
    }

    public List<String> getTestNames() {
        return testNames;
    }

    public void setTestNames(List<String> testNames) {
        this.testNames = new ArrayList<String>(testNames);
    }

    public List<String> getRecoverTestNames() {
        return recoverTestNames;
    }

    public void setRecoverTestNames(List<String> recoverTestNames) {
        this.recoverTestNames = new ArrayList<String>(recoverTestNames);
    }

    public boolean isRunUpgrade() {
        return runUpgrade;
    }

    public void setRunUpgrade(boolean runUpgrade) {
        this.runUpgrade = runUpgrade;
    }

    public boolean isRunNonUpgrade() {
        return runNonUpgrade;
    }

    public void setRunNonUpgrade(boolean runNonUpgrade) {
        this.runNonUpgrade = runNonUpgrade;
    }

    public boolean isDoubleUpgrade() {
        return doubleUpgrade;
    }

    public void setDoubleUpgrade(boolean doubleUpgrade) {
        this.doubleUpgrade = doubleUpgrade;
    }

    public List<String> getOldVersions() {
        return oldVersions;
    }

    public void setOldVersions(List<String> oldVersions) {
        this.oldVersions = new ArrayList<String>(oldVersions);
    }

    public File getOldEnvironmentsDir() {
        return oldEnvironmentsDir;
    }

    public void setOldEnvironmentsDir(File oldEnvironmentsDir) {
        this.oldEnvironmentsDir = oldEnvironmentsDir;
    }

    public int getStatusPort() {
        return statusPort;
    }

    public int getNice() {
        return nice;
    }

    public void setNice(int nice) {
        this.nice = nice;
    }

    public int getLogLevel() {
        return logLevel;
    }

    public long getPollMillis() {
        return pollMillis;
    }

    public void setPollMillis(long pollMillis) {
        this.pollMillis = pollMillis;
    }
}
