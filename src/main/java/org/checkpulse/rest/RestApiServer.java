package org.checkpulse.rest;

import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.UndertowOptions;
import io.undertow.server.handlers.PathHandler;
import org.checkpulse.config.XmlConfiguration;
import org.checkpulse.handlers.sse.SseCheckStatusHandler;
import org.checkpulse.rest.base.Dispatcher;
import org.checkpulse.rest.base.FallBack;
import org.checkpulse.services.CheckOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;

/**
 * Read-only status API for the UI collaborator.
 */
public class RestApiServer {
    private static final Logger logger = LoggerFactory.getLogger(RestApiServer.class);

    private final Undertow server;
    private final SseCheckStatusHandler sseHandler;

    private RestApiServer(Undertow server, SseCheckStatusHandler sseHandler) {
        this.server = server;
        this.sseHandler = sseHandler;
    }

    public static RestApiServer start(XmlConfiguration.Server cfg, CheckOrchestrator orchestrator) {
        if (cfg == null) {
            throw new IllegalArgumentException("Invalid configuration: missing server section.");
        }
        String base = cfg.basePath == null ? "" : cfg.basePath;

        SseCheckStatusHandler sseHandler = new SseCheckStatusHandler(orchestrator, cfg.ssePushInterval);

        PathHandler pathHandler = Handlers.path(new Dispatcher(new FallBack()))
                .addPrefixPath(base + "/system", Routes.system(orchestrator))
                .addPrefixPath(base + "/checks", Routes.checks(orchestrator))
                .addPrefixPath(base + "/stream/checks", sseHandler.getHandler());

        Undertow server = Undertow.builder()
                .setServerOption(UndertowOptions.DECODE_URL, true)
                .setServerOption(UndertowOptions.URL_CHARSET, StandardCharsets.UTF_8.name())
                .setIoThreads(Math.max(1, cfg.ioThreads))
                .setWorkerThreads(Math.max(1, cfg.workerThreads))
                .addHttpListener(cfg.port, cfg.host)
                .setHandler(pathHandler)
                .build();

        server.start();
        RestApiServer api = new RestApiServer(server, sseHandler);
        logger.info("""
                        CHECKPULSE STATUS API
                        --------------------------------------
                        Undertow server started successfully!
                        Host   : http://{}:{}{}""",
                cfg.host, api.port(), base);
        return api;
    }

    /**
     * Bound port, useful when configured with port 0.
     */
    public int port() {
        return ((InetSocketAddress) server.getListenerInfo().get(0).getAddress()).getPort();
    }

    public void stop() {
        sseHandler.shutdown();
        server.stop();
        logger.info("Status API stopped");
    }
}
