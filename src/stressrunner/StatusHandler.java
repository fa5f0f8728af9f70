package stressrunner;

import java.io.IOException;
import java.util.List;

import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

public class StatusHandler implements StatusServer.Handler {
    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    private final Scheduler scheduler;
    private final List<RunContext> runs;

    public StatusHandler(Scheduler scheduler, List<RunContext> runs) {
        this.scheduler = scheduler;
        this.runs = runs;
    }

    @Override
    public void handle(HttpServletRequest request, HttpServletResponse response) throws IOException {
        response.setContentType("application/json;charset=utf-8");
        response.setStatus(HttpServletResponse.SC_OK);
        response.getWriter().println(GSON.toJson(toJson(scheduler, runs)));
    }

    public static JsonObject toJson(Scheduler scheduler, List<RunContext> runs) {
        JsonObject status = new JsonObject();
        status.addProperty("revision", scheduler.getRevision());
        status.addProperty("startTime", Util.formatTime(scheduler.getStartTime()));
        status.addProperty("passed", scheduler.getPassed());
        status.addProperty("failed", scheduler.getFailed());
        status.addProperty("backlog", scheduler.backlogSize());
        status.addProperty("runningLarge", scheduler.getRunningLarge());
        status.addProperty("maxLarge", scheduler.getMaxLarge());
        status.addProperty("stopping", scheduler.isStopping());

        JsonArray array = new JsonArray();
        for (RunContext ctx : Util.safeCopy(runs)) {
            JsonObject run = new JsonObject();
            run.addProperty("job", ctx.getJob().toString());
            run.addProperty("run", ctx.getRunNumber());
            run.addProperty("state", ctx.getState().toString());
            run.addProperty("phase", ctx.getPhase() == null ? null : ctx.getPhase().label());
            run.addProperty("ptqueryThreads", ctx.getNumPtquery());
            run.addProperty("updateThreads", ctx.getNumUpdate());
            array.add(run);
        }
        status.add("runs", array);
        return status;
    }
}
