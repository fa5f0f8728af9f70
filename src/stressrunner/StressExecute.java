package stressrunner;

import java.io.IOException;

public class StressExecute implements Lifecycle.ExecuteStep {

    @Override
    public void execute(RunContext ctx, ChildProcess child) throws TestFailure, Killed, IOException {
        ctx.updatePhase(Phase.STRESS);
        if (child.run(ctx, Lifecycle.withFlags(Lifecycle.testArgs(ctx), "--only_stress")) != 0)
            throw new TestFailure(Phase.STRESS, ctx.getJob().getExecf() + " crashed during --only_stress.");
    }
}
