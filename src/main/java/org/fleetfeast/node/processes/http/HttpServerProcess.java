package org.fleetfeast.node.processes.http;

import org.fleetfeast.node.processes.http.api.FleetController;
import org.fleetfeast.node.spi.IProcess;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

import io.javalin.Javalin;

/**
 * Runs the Javalin server that exposes the fleet endpoints.
 * <pre>
 * http {
 *   host = "0.0.0.0"
 *   port = 8000          # 0 picks a free port
 *   basePath = "/"
 * }
 * </pre>
 */
public class HttpServerProcess implements IProcess {

    private static final Logger log = LoggerFactory.getLogger(HttpServerProcess.class);

    private final String host;
    private final int port;
    private final String basePath;
    private final FleetController controller;
    private Javalin app;

    public HttpServerProcess(Config options, FleetController controller) {
        this.host = options.hasPath("host") ? options.getString("host") : "0.0.0.0";
        this.port = options.hasPath("port") ? options.getInt("port") : 8000;
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("http.port must be between 0 and 65535, got " + port);
        }
        String configuredBase = options.hasPath("basePath") ? options.getString("basePath") : "";
        this.basePath = configuredBase.endsWith("/") ? configuredBase.substring(0, configuredBase.length() - 1) : configuredBase;
        this.controller = controller;
    }

    @Override
    public synchronized void start() {
        if (app != null) {
            log.warn("HTTP server already running on port {}", app.port());
            return;
        }
        app = Javalin.create(config -> {
            config.showJavalinBanner = false;
            config.bundledPlugins.enableCors(cors -> cors.addRule(rule -> rule.anyHost()));
        });
        controller.registerRoutes(app, basePath);
        app.start(host, port);
        log.info("HTTP server listening on {}:{}", host, app.port());
    }

    @Override
    public synchronized void stop() {
        if (app == null) {
            return;
        }
        controller.close();
        app.stop();
        app = null;
        log.info("HTTP server stopped");
    }

    /**
     * @return the bound port, or -1 when not running
     */
    public synchronized int getPort() {
        return app != null ? app.port() : -1;
    }
}
