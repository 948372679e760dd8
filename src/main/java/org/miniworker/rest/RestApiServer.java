package org.miniworker.rest;

import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.UndertowOptions;
import io.undertow.server.handlers.PathHandler;
import org.miniworker.config.XmlConfiguration;
import org.miniworker.manager.WorkerManager;
import org.miniworker.rest.base.CORSHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

/**
 * Undertow server exposing the worker manager.
 */
public class RestApiServer {
    private static final Logger logger = LoggerFactory.getLogger(RestApiServer.class);

    private final XmlConfiguration.Server cfg;
    private final WorkerManager manager;
    private final Path configPath;
    private Undertow server;

    public RestApiServer(XmlConfiguration.Server cfg, WorkerManager manager, Path configPath) {
        if (cfg == null) {
            logger.error("Invalid configuration: missing server configuration.");
            throw new IllegalArgumentException("Invalid configuration: missing server section.");
        }
        this.cfg = cfg;
        this.manager = manager;
        this.configPath = configPath;
    }

    public synchronized void start() {
        String basePath = normalizeBasePath(cfg.basePath);
        String host = cfg.host == null || cfg.host.isBlank() ? "0.0.0.0" : cfg.host;

        PathHandler pathHandler = Handlers.path()
                .addPrefixPath(basePath, Routes.api(manager, configPath));

        Undertow.Builder builder = Undertow.builder()
                .setServerOption(UndertowOptions.DECODE_URL, true)
                .setServerOption(UndertowOptions.URL_CHARSET, StandardCharsets.UTF_8.name())
                .addHttpListener(cfg.port, host)
                .setHandler(new CORSHandler(pathHandler, CORSHandler.parseOrigins(cfg.allowedOrigins)));
        if (cfg.ioThreads > 0) {
            builder.setIoThreads(cfg.ioThreads);
        }
        if (cfg.workerThreads > 0) {
            builder.setWorkerThreads(cfg.workerThreads);
        }

        server = builder.build();
        try {
            server.start();
        } catch (RuntimeException e) {
            logger.error("Error starting server: {}", e.getMessage());
            server = null;
            throw new IllegalStateException("Cannot start REST API on " + host + ":" + cfg.port, e);
        }
        logger.info("""
                        MINI-WORKER MANAGER REST API
                        --------------------------------------
                        Undertow server started successfully!
                        Host   : http://{}:{}{}
                        """,
                host, port(), basePath.equals("/") ? "" : basePath);
    }

    /**
     * Port actually bound, useful when the configured port is 0.
     */
    public synchronized int port() {
        if (server == null) {
            return cfg.port;
        }
        return ((InetSocketAddress) server.getListenerInfo().get(0).getAddress()).getPort();
    }

    public synchronized void stop() {
        if (server != null) {
            server.stop();
            server = null;
            logger.info("REST API stopped");
        }
    }

    static String normalizeBasePath(String basePath) {
        if (basePath == null || basePath.isBlank() || basePath.equals("/")) {
            return "/";
        }
        String path = basePath.trim();
        if (!path.startsWith("/")) {
            path = "/" + path;
        }
        return path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
    }
}
