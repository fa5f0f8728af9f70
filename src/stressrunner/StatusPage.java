package stressrunner;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;

import org.thymeleaf.context.Context;

public class StatusPage implements StatusServer.Handler {
    private final Scheduler scheduler;
    private final List<RunContext> runs;

    public StatusPage(Scheduler scheduler, List<RunContext> runs) {
        this.scheduler = scheduler;
        this.runs = runs;
    }

    @Override
    public void handle(HttpServletRequest request, HttpServletResponse response) throws IOException {
        response.setContentType("text/html;charset=utf-8");
        response.setStatus(HttpServletResponse.SC_OK);

        Context context = new Context();
        context.setVariable("startTime", Util.formatTime(scheduler.getStartTime()));
        context.setVariable("revision", scheduler.getRevision());
        context.setVariable("passed", scheduler.getPassed());
        context.setVariable("failed", scheduler.getFailed());
        context.setVariable("backlog", scheduler.backlogSize());
        context.setVariable("runningLarge", scheduler.getRunningLarge());
        context.setVariable("maxLarge", scheduler.getMaxLarge());

        List<Object> result = new ArrayList<Object>();
        for (RunContext ctx : Util.safeCopy(runs)) {
            Map<String, Object> map = new HashMap<String, Object>();
            map.put("job", ctx.getJob().toString());
            map.put("run", ctx.getRunNumber());
            map.put("state", ctx.getState());
            map.put("phase", ctx.getPhase() == null ? "" : ctx.getPhase().label());
            map.put("threads", ctx.getNumPtquery() + "/" + ctx.getNumUpdate());
            result.add(map);
        }
        context.setVariable("runs", result);

        Util.processTemplate(response, context, "stressrunner/status.html");
    }
}
