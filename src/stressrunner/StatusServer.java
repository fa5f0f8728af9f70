package stressrunner;

import java.io.IOException;
import java.util.List;

import javax.servlet.ServletException;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;

import org.eclipse.jetty.server.Request;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.handler.AbstractHandler;

public class StatusServer extends AbstractHandler {
    public static interface Handler {
        void handle(HttpServletRequest request, HttpServletResponse response) throws IOException, ServletException;
    }

    private final Handler statusHandler;
    private final Handler statusPage;
    private Server server;

    public StatusServer(Scheduler scheduler, List<RunContext> runs) {
        this.statusHandler = new StatusHandler(scheduler, runs);
        this.statusPage = new StatusPage(scheduler, runs);
    }

    @Override
    public void handle(String target, Request baseRequest, HttpServletRequest request, HttpServletResponse response)
            throws IOException, ServletException {
        if ("/status".equals(target)) {
            statusHandler.handle(request, response);
        } else {
            statusPage.handle(request, response);
        }
        baseRequest.setHandled(true);
    }

    public void startServer(int port) throws Exception {
        server = new Server(port);
        server.setHandler(this);
        server.start();
        Log.info("Serving status page on port " + port + ".");
    }

    public void stopServer() {
        if (server == null)
            return;
        try {
            server.stop();
        } catch (Exception e) {
            Log.warn("Could not stop the status server.", e);
        }
    }
}
