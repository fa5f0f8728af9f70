package stressrunner;

import java.io.File;

public class Outcome {
    public static enum Status {
        PASSED, FAILED, KILLED
    }

    private final Status status;
    private final RunInfo info;
    private final Phase phase;
    private final String reason;
    private final File archive;

    private Outcome(Status status, RunInfo info, Phase phase, String reason, File archive) {
        this.status = status;
        this.info = info;
        this.phase = phase;
        this.reason = reason;
        this.archive = archive;
    }

    public static Outcome passed(RunInfo info) {
        return new Outcome(Status.PASSED, info, null, null, null);
    }

    public static Outcome failed(RunInfo info, Phase phase, String reason, File archive) {
        return new Outcome(Status.FAILED, info, phase, reason, archive);
    }

    public static Outcome killed(RunInfo info) {
        return new Outcome(Status.KILLED, info, null, null, null);
    }

    public Status getStatus() {
        return status;
    }

    public RunInfo getInfo() {
        return info;
    }

    public Phase getPhase() {
        return phase;
    }

    public String getReason() {
        return reason;
    }

    public File getArchive() {
        return archive;
    }

    @Override
    public String toString() {
        if (status == Status.FAILED)
            return status + "(" + phase.label() + ", " + reason + ")";
        return status.toString();
    }
}
