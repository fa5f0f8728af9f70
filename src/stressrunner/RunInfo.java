package stressrunner;

public class RunInfo {
    private final String execf;
    private final String revision;
    private final long tsize;
    private final long csize;
    private final String oldVersion;
    private final int numPtquery;
    private final int numUpdate;
    private final long elapsedSeconds;

    public RunInfo(String execf, String revision, long tsize, long csize, String oldVersion, int numPtquery,
            int numUpdate, long elapsedSeconds) {
        this.execf = execf;
        this.revision = revision;
        this.tsize = tsize;
        this.csize = csize;
        this.oldVersion = oldVersion;
        this.numPtquery = numPtquery;
        this.numUpdate = numUpdate;
        this.elapsedSeconds = elapsedSeconds;
    }

    public String getExecf() {
        return execf;
    }

    public String getRevision() {
        return revision;
    }

    public long getTsize() {
        return tsize;
    }

    public long getCsize() {
        return csize;
    }

    public String getOldVersion() {
        return oldVersion;
    }

    public int getNumPtquery() {
        return numPtquery;
    }

    public int getNumUpdate() {
        return numUpdate;
    }

    public long getElapsedSeconds() {
        return elapsedSeconds;
    }

    public String toTabString() {
        return String.join("\t", execf, revision, Long.toString(tsize), Long.toString(csize), oldVersion,
                Integer.toString(numPtquery), Integer.toString(numUpdate), Long.toString(elapsedSeconds));
    }

    @Override
    public String toString() {
        return toTabString();
    }
}
