package io.perfdash.web.environment;

import io.perfdash.api.config.DashboardConfig;
import io.perfdash.core.service.DashboardQueryService;
import io.perfdash.web.server.DashboardWebServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Web environment around the query service.
 * Builds the service from the configuration and starts an embedded Tomcat
 * server that serves the dashboard page and its JSON API.
 */
public class DashboardEnvironment {

    private static final Logger log = LoggerFactory.getLogger(DashboardEnvironment.class);

    private final DashboardConfig config;
    private final DashboardQueryService service;
    private DashboardWebServer webServer;

    public DashboardEnvironment(DashboardConfig config) {
        this(config, new DashboardQueryService(config));
    }

    public DashboardEnvironment(DashboardConfig config, DashboardQueryService service) {
        this.config = config;
        this.service = service;
    }

    /**
     * Start the web server on the configured port.
     */
    public void startServer() {
        if (webServer != null) {
            throw new IllegalStateException("Server already started");
        }
        webServer = new DashboardWebServer(service, config.port());
        webServer.start();
        log.info("PerfDash dashboard available at http://localhost:{} (artifacts: {})",
                webServer.getPort(), config.artifactRoot().toAbsolutePath());
    }

    public void shutdown() {
        if (webServer != null) {
            webServer.stop();
            webServer = null;
        }
        log.info("Dashboard environment shut down");
    }

    /**
     * @return the bound port once started, otherwise the configured one
     */
    public int port() {
        return webServer != null ? webServer.getPort() : config.port();
    }

    public DashboardConfig config() {
        return config;
    }

    public DashboardQueryService service() {
        return service;
    }
}
