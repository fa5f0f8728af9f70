package stressrunner;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import org.apache.commons.io.FileUtils;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class StressConfigTest {
    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private static void assertRejected(String... args) throws IOException {
        try {
            StressConfig.parse(args);
            fail("Expected " + Arrays.toString(args) + " to be rejected");
        } catch (IllegalArgumentException e) {
            // expected
        }
    }

    @Test
    public void testDefaults() throws IOException {
        StressConfig config = StressConfig.parse(new String[0]);
        assertEquals(600, config.getTestTime());
        assertEquals(8, config.getJobs());
        assertEquals(2, config.getMaxLarge());
        assertTrue(config.isBuild());
        assertEquals(86400, config.getRebuildPeriod());
        assertEquals("icc", config.getCc());
        assertNull(config.getJemalloc());
        assertEquals(StressConfig.DEFAULT_TESTS, config.getTestNames());
        assertEquals(StressConfig.DEFAULT_RECOVER_TESTS, config.getRecoverTestNames());
        assertFalse(config.isRunUpgrade());
        assertTrue(config.isRunNonUpgrade());
        assertEquals(0, config.getStatusPort());
        assertEquals(7, config.getNice());
        assertEquals(Log.WARN, config.getLogLevel());
        assertEquals(new File("/tmp/run.stress-tests.log"), config.getLogFile());
    }

    @Test
    public void testOptions() throws IOException {
        StressConfig config = StressConfig.parse(new String[] { "-v", "-j", "4", "--maxlarge", "1", "-t", "30",
                "--skip_build", "--add_test", "test_stress7.tdb", "--add_test", "test_stress4.tdb",
                "--add_recover_test", "recover-test_stress4.tdb", "-s", "/var/tmp/fails", "--log", "/var/tmp/log",
                "--cc", "gcc", "--jemalloc", "/opt/libjemalloc.so", "--rebuild_period", "0", "--status_port",
                "8080", "--nice", "0" });
        assertEquals(Log.INFO, config.getLogLevel());
        assertEquals(4, config.getJobs());
        assertEquals(1, config.getMaxLarge());
        assertEquals(30, config.getTestTime());
        assertFalse(config.isBuild());
        assertEquals(5, config.getTestNames().size());
        assertTrue(config.getTestNames().contains("test_stress4.tdb"));
        assertEquals(4, config.getRecoverTestNames().size());
        assertEquals(9, config.getAllTestNames().size());
        assertEquals(new File("/var/tmp/fails"), config.getSaveDir());
        assertEquals(new File("/var/tmp/log"), config.getLogFile());
        assertEquals("gcc", config.getCc());
        assertEquals("/opt/libjemalloc.so", config.getJemalloc());
        assertEquals(0, config.getRebuildPeriod());
        assertEquals(8080, config.getStatusPort());
        assertEquals(0, config.getNice());
    }

    @Test
    public void testDebugWinsOverVerbose() throws IOException {
        assertEquals(Log.DEBUG, StressConfig.parse(new String[] { "-v", "--debug" }).getLogLevel());
        assertEquals(Log.DEBUG, StressConfig.parse(new String[] { "-d", "--verbose" }).getLogLevel());
    }

    @Test
    public void testBadArguments() throws IOException {
        assertRejected("--no_such_option");
        assertRejected("-j");
        assertRejected("-j", "many");
        assertRejected("-j", "0");
        assertRejected("--maxlarge", "-1");
        assertRejected("--add_old_version", "3.1.0");
    }

    @Test
    public void testUpgradeNeedsEnvironments() throws IOException {
        File missing = new File(tmp.getRoot(), "missing");
        assertRejected("--run_upgrade", "--old_environments_dir", missing.getPath(), "--add_old_version", "5.0.8");

        File envs = tmp.newFolder("envs");
        assertRejected("--run_upgrade", "--old_environments_dir", envs.getPath());
        assertRejected("--run_upgrade", "--old_environments_dir", envs.getPath(), "--add_old_version", "5.0.8");

        new File(envs, "5.0.8").mkdirs();
        StressConfig config = StressConfig.parse(new String[] { "--run_upgrade", "--old_environments_dir",
                envs.getPath(), "--add_old_version", "5.0.8", "--double_upgrade", "--skip_non_upgrade" });
        assertTrue(config.isRunUpgrade());
        assertTrue(config.isDoubleUpgrade());
        assertFalse(config.isRunNonUpgrade());
        assertEquals(Arrays.asList("5.0.8"), config.getOldVersions());
    }

    @Test
    public void testJsonFileThenCommandLine() throws IOException {
        File json = tmp.newFile("stress.json");
        FileUtils.writeStringToFile(json, "{\n  \"jobs\": 3,\n  \"maxlarge\": 0,\n"
                + "  \"savedir\": \"$HOME/stress-failures\",\n  \"add_test\": [\"test_stress7.tdb\"],\n"
                + "  \"skip_build\": true\n}\n", StandardCharsets.UTF_8);

        StressConfig config = StressConfig.parse(new String[] { "--config", json.getPath(), "-j", "5" });
        assertEquals(5, config.getJobs());
        assertEquals(0, config.getMaxLarge());
        assertFalse(config.isBuild());
        assertEquals(new File(System.getProperty("user.home"), "stress-failures"), config.getSaveDir());
        assertTrue(config.getTestNames().contains("test_stress7.tdb"));
    }

    private void assertConfigFileRejected(String content) throws IOException {
        File json = tmp.newFile();
        FileUtils.writeStringToFile(json, content, StandardCharsets.UTF_8);
        try {
            StressConfig.parse(new String[] { "--config", json.getPath() });
            fail("Expected config " + content + " to be rejected");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage(), e.getMessage().startsWith("Invalid config file " + json));
        }
    }

    @Test
    public void testBadConfigFiles() throws IOException {
        assertConfigFileRejected("{ \"jobs\": ");
        assertConfigFileRejected("[1, 2]");
        assertConfigFileRejected("{\"add_test\": \"test_stress7.tdb\"}");
        assertConfigFileRejected("{\"jobs\": \"many\"}");
        assertConfigFileRejected("{\"savedir\": {}}");
    }

    @Test
    public void testMissingConfigFile() {
        File missing = new File(tmp.getRoot(), "missing.json");
        try {
            StressConfig.parse(new String[] { "--config", missing.getPath() });
            fail("Expected a missing config file to be rejected");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().startsWith("Invalid config file " + missing));
        }
    }

    @Test
    public void testDirectoryLayout() throws IOException {
        StressConfig config = StressConfig.parse(new String[] { "--source_dir", "/src/ft-index" });
        assertEquals(new File("/src/ft-index/build"), config.getBuildDir());
        assertEquals(new File("/src/ft-index/install/lib"), config.getLibDir());
        assertEquals(new File("/src/ft-index/build/src/tests"), config.getTestsDir());
    }
}
