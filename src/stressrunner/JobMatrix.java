package stressrunner;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import stressrunner.StressJob.SeedKind;

public class JobMatrix {
    public static final List<Long> TABLE_SIZES = Arrays.asList(2000L, 200000L, 50000000L);
    public static final long LARGE_CACHE_SIZE = 1000L * 1000L * 1000L;

    // does not want an existing environment
    static final String OPENCLOSE_TEST = "test_stress_openclose.tdb";
    // assumes an environment that has not been stressed before
    static final String STRESS4_TEST = "test_stress4.tdb";

    public static List<Long> cacheSizesFor(long tsize) {
        return Arrays.asList(50 * tsize, LARGE_CACHE_SIZE);
    }

    public static List<StressJob> generate(StressConfig config) {
        List<StressJob> jobs = new ArrayList<StressJob>();
        int testTime = config.getTestTime();
        for (long tsize : TABLE_SIZES) {
            for (long csize : cacheSizesFor(tsize)) {
                for (String test : config.getTestNames()) {
                    if (config.isRunNonUpgrade())
                        jobs.add(new StressJob(test, tsize, csize, testTime, Variant.PLAIN));

                    if (config.isRunUpgrade() && !OPENCLOSE_TEST.equals(test)) {
                        for (String version : config.getOldVersions()) {
                            for (SeedKind kind : SeedKind.values()) {
                                if (config.isDoubleUpgrade() && !STRESS4_TEST.equals(test)) {
                                    jobs.add(new StressJob(test, tsize, csize, testTime, Variant.DOUBLE_UPGRADE,
                                            version, kind));
                                } else if (!(STRESS4_TEST.equals(test) && kind == SeedKind.STRESSED)) {
                                    jobs.add(new StressJob(test, tsize, csize, testTime, Variant.UPGRADE, version,
                                            kind));
                                }
                            }
                        }
                    }
                }

                for (String test : config.getRecoverTestNames()) {
                    if (config.isRunNonUpgrade())
                        jobs.add(new StressJob(test, tsize, csize, testTime, Variant.RECOVER));

                    if (config.isRunUpgrade()) {
                        for (String version : config.getOldVersions()) {
                            for (SeedKind kind : SeedKind.values()) {
                                Variant variant = config.isDoubleUpgrade() ? Variant.DOUBLE_UPGRADE_RECOVER
                                        : Variant.UPGRADE_RECOVER;
                                jobs.add(new StressJob(test, tsize, csize, testTime, variant, version, kind));
                            }
                        }
                    }
                }
            }
        }
        Collections.shuffle(jobs);
        return jobs;
    }
}
