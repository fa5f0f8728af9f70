package stressrunner;

import java.io.IOException;

public class DoubleExecute implements Lifecycle.ExecuteStep {
    private final Lifecycle.ExecuteStep inner;

    public DoubleExecute(Lifecycle.ExecuteStep inner) {
        this.inner = inner;
    }

    public Lifecycle.ExecuteStep getInner() {
        return inner;
    }

    @Override
    public void execute(RunContext ctx, ChildProcess child) throws TestFailure, Killed, IOException {
        inner.execute(ctx, child);
        Log.debug(ctx + " running the test a second time.");
        inner.execute(ctx, child);
    }
}
