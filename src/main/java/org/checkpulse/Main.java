package org.checkpulse;

import org.checkpulse.config.ConfigLoader;
import org.checkpulse.config.XmlConfiguration;
import org.checkpulse.config.utils.EnvironmentProvider;
import org.checkpulse.config.utils.LogContext;
import org.checkpulse.rest.RestApiServer;
import org.checkpulse.services.CheckOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point
 * Load Configuration from Xml
 * Load checkfiles and schedule checks
 * Start the status API when enabled
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        EnvironmentProvider.init();
        LogContext.start("Main");

        try {
            logger.info("[------------ Starting CheckPulse ------------]");

            String configPath = (args.length > 0) ? args[0] : "config.xml";
            XmlConfiguration cfg = ConfigLoader.loadConfig(configPath);
            logger.debug("Configuration loaded from {}", configPath);
            logger.info("Checks config: dir={}, interval={}s, timeout={}s, workers={}",
                    cfg.checks.checkfilesDir,
                    cfg.checks.checkRunInterval,
                    cfg.checks.commandTimeoutSeconds,
                    cfg.checks.workerThreads == 0 ? "unbounded" : cfg.checks.workerThreads);

            CheckOrchestrator orchestrator = new CheckOrchestrator(cfg.checks);
            orchestrator.start();

            RestApiServer api = null;
            if (cfg.server.enabled) {
                logger.info("[------------ Starting Undertow server ------------]");
                api = RestApiServer.start(cfg.server, orchestrator);
            }

            RestApiServer startedApi = api;
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                logger.info("[------------ Shutdown initiated ------------]");
                if (startedApi != null) startedApi.stop();
                orchestrator.shutdown();
                logger.info("[------------ CheckPulse shutdown complete ------------]");
            }));

        } catch (Exception e) {
            logger.error("[------------ Startup failed: {} ------------]", e.getMessage(), e);
            System.exit(1);
        } finally {
            LogContext.clear();
        }
    }
}
