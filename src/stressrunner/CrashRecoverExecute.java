package stressrunner;

import java.io.IOException;

public class CrashRecoverExecute implements Lifecycle.ExecuteStep {

    @Override
    public void execute(RunContext ctx, ChildProcess child) throws TestFailure, Killed, IOException {
        String execf = ctx.getJob().getExecf();
        ctx.updatePhase(Phase.TEST);
        if (child.run(ctx, Lifecycle.withFlags(Lifecycle.testArgs(ctx), "--only_stress", "--test")) == 0)
            throw new TestFailure(Phase.TEST, execf + " did not crash during --only_stress --test.");

        ctx.updateState(RunContext.State.RECOVERING);
        ctx.updatePhase(Phase.RECOVER);
        if (child.run(ctx, Lifecycle.withFlags(Lifecycle.prepareArgs(ctx), "--recover")) != 0)
            throw new TestFailure(Phase.RECOVER, execf + " crashed during --recover.");
    }
}
