package stressrunner;

import java.util.concurrent.atomic.AtomicInteger;

public class StressJob {
    public static final long LARGE_THRESHOLD = 10000000L;
    public static final String NO_UPGRADE = "noupgrade";

    public static enum SeedKind {
        PRISTINE, STRESSED;

        public String label() {
            return name().toLowerCase();
        }
    }

    private final String execf;
    private final long tsize;
    private final long csize;
    private final int testTime;
    private final Variant variant;
    private final String oldVersion;
    private final SeedKind seedKind;
    private final boolean large;
    private final AtomicInteger runs = new AtomicInteger();

    public StressJob(String execf, long tsize, long csize, int testTime, Variant variant) {
        this(execf, tsize, csize, testTime, variant, null, null);
    }

    public StressJob(String execf, long tsize, long csize, int testTime, Variant variant, String oldVersion,
            SeedKind seedKind) {
        if (variant.isUpgrade() && (oldVersion == null || seedKind == null))
            throw new IllegalArgumentException("Upgrade job " + execf + " needs an old version and a seed kind");
        if (!variant.isUpgrade() && (oldVersion != null || seedKind != null))
            throw new IllegalArgumentException("Job " + execf + " is not an upgrade job");
        this.execf = execf;
        this.tsize = tsize;
        this.csize = csize;
        this.testTime = testTime;
        this.variant = variant;
        this.oldVersion = oldVersion;
        this.seedKind = seedKind;
        this.large = tsize >= LARGE_THRESHOLD;
    }

    public String getExecf() {
        return execf;
    }

    public long getTsize() {
        return tsize;
    }

    public long getCsize() {
        return csize;
    }

    public int getTestTime() {
        return testTime;
    }

    public Variant getVariant() {
        return variant;
    }

    public String getOldVersion() {
        return oldVersion;
    }

    public SeedKind getSeedKind() {
        return seedKind;
    }

    public boolean isLarge() {
        return large;
    }

    public String oldVersionString() {
        if (!variant.isUpgrade())
            return NO_UPGRADE;
        return oldVersion + "-" + seedKind.label();
    }

    public int nextRunNumber() {
        return runs.getAndIncrement();
    }

    public int getRunCount() {
        return runs.get();
    }

    @Override
    public String toString() {
        return variant + "<" + execf + ", " + tsize + ", " + csize + ", " + oldVersionString() + ">";
    }
}
