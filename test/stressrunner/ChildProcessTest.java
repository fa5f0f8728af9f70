package stressrunner;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

import org.apache.commons.io.FileUtils;
import org.junit.Assume;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class ChildProcessTest {
    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private StressConfig config;
    private StopSignal stop;

    @Before
    public void setUp() throws IOException {
        config = new StressConfig();
        config.setSourceDir(tmp.newFolder("src"));
        config.setNice(0);
        config.setPollMillis(50);
        config.getTestsDir().mkdirs();
        stop = new StopSignal();
    }

    private void script(String name, String body) throws IOException {
        File f = new File(config.getTestsDir(), name);
        FileUtils.writeStringToFile(f, "#!/bin/bash\n" + body + "\n", StandardCharsets.UTF_8);
        f.setExecutable(true);
    }

    @Test
    public void testLibraryPathIsPrepended() {
        Map<String, String> env = new HashMap<String, String>();
        env.put("LD_LIBRARY_PATH", "/usr/local/lib");
        ChildProcess.augmentEnvironment(env, new File("/src/install/lib"), null);
        assertEquals("/src/install/lib" + File.pathSeparator + "/usr/local/lib", env.get("LD_LIBRARY_PATH"));
        assertEquals(null, env.get("LD_PRELOAD"));
    }

    @Test
    public void testJemallocIsPreloaded() {
        Map<String, String> env = new HashMap<String, String>();
        env.put("LD_PRELOAD", "libfoo.so");
        ChildProcess.augmentEnvironment(env, new File("/src/install/lib"), "/opt/jemalloc/./lib/libjemalloc.so");
        assertEquals("/src/install/lib", env.get("LD_LIBRARY_PATH"));
        assertEquals("/opt/jemalloc/lib/libjemalloc.so" + File.pathSeparator + "libfoo.so", env.get("LD_PRELOAD"));
    }

    @Test
    public void testRunRecordsCommandAndOutput() throws Exception {
        Assume.assumeTrue(new File("/bin/bash").canExecute());
        script("echo.tdb", "echo \"out $*\"; echo \"err $1\" >&2; echo \"$LD_LIBRARY_PATH\"; exit 7");
        StressJob job = new StressJob("echo.tdb", 2000, 100000, 1, Variant.PLAIN);

        try (RunContext ctx = RunContext.open(job, "r1", config.getTestsDir())) {
            ChildProcess child = new ChildProcess(config, stop);
            assertEquals(7, child.run(ctx, Arrays.asList("--only_stress", "-v")));
            assertEquals(7, child.run(ctx, Arrays.asList("--recover")));

            String commands = FileUtils.readFileToString(ctx.getCommandsFile(), StandardCharsets.UTF_8);
            assertEquals("echo.tdb --only_stress -v\necho.tdb --recover\n", commands);

            String output = FileUtils.readFileToString(ctx.getOutputFile(), StandardCharsets.UTF_8);
            assertTrue(output.contains("out --only_stress -v\n"));
            assertTrue(output.contains("err --only_stress\n"));
            assertTrue(output.contains("out --recover\n"));
            assertTrue(output.contains(config.getLibDir().getPath()));
        }
    }

    @Test(timeout = 20000)
    public void testStopKillsChild() throws Exception {
        Assume.assumeTrue(new File("/bin/bash").canExecute());
        script("hang.tdb", "exec sleep 30");
        StressJob job = new StressJob("hang.tdb", 2000, 100000, 1, Variant.PLAIN);

        try (RunContext ctx = RunContext.open(job, "r1", config.getTestsDir())) {
            Thread stopper = new Thread(() -> {
                try {
                    Thread.sleep(300);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                stop.set();
            });
            stopper.start();
            long start = System.currentTimeMillis();
            try {
                new ChildProcess(config, stop).run(ctx, Arrays.asList("--only_stress"));
                fail("Expected the child to be killed");
            } catch (Killed e) {
                assertTrue(System.currentTimeMillis() - start < 10000);
            }
            stopper.join();
        }
    }
}
