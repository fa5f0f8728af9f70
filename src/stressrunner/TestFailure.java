package stressrunner;

public class TestFailure extends Exception {
    private static final long serialVersionUID = 1L;

    private final Phase phase;

    public TestFailure(Phase phase, String message) {
        super(message);
        this.phase = phase;
    }

    public Phase getPhase() {
        return phase;
    }
}
