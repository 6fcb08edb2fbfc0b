package org.checkpulse.config;

import org.checkpulse.config.utils.EnvironmentProvider;
import org.checkpulse.config.utils.XmlUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.function.UnaryOperator;

public class ConfigLoader {

    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String ENV_CHECKFILES_DIR = "CHECKPULSE_CHECKFILES_DIR";
    public static final String ENV_RUN_INTERVAL = "CHECKPULSE_RUN_INTERVAL";

    private ConfigLoader() {}

    /**
     * Loads {@code xmlPath}, falling back to the bundled classpath config.xml, then applies
     * environment overrides and validates the result.
     */
    public static XmlConfiguration loadConfig(String xmlPath) {
        return loadConfig(xmlPath, EnvironmentProvider::get);
    }

    static XmlConfiguration loadConfig(String xmlPath, UnaryOperator<String> env) {
        try {
            XmlConfiguration cfg = read(xmlPath);
            applyOverrides(cfg, env);
            validate(cfg);
            return cfg;
        } catch (IllegalStateException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Failed to load config file! " + e.getMessage(), e);
        }
    }

    /**
     * Expands a leading {@code ~} to the user's home directory.
     */
    public static Path resolvePath(String path) {
        if (path.equals("~")) {
            return Paths.get(System.getProperty("user.home"));
        }
        if (path.startsWith("~/")) {
            return Paths.get(System.getProperty("user.home"), path.substring(2));
        }
        return Paths.get(path);
    }

    private static XmlConfiguration read(String xmlPath) throws Exception {
        if (xmlPath != null) {
            Path path = Paths.get(xmlPath);
            if (Files.isRegularFile(path)) {
                try (InputStream in = Files.newInputStream(path)) {
                    logger.debug("Reading configuration from {}", path);
                    return unmarshal(in);
                }
            }
        }
        try (InputStream in = ConfigLoader.class.getClassLoader().getResourceAsStream("config.xml")) {
            if (in != null) {
                logger.info("Configuration file {} not found, using bundled defaults", xmlPath);
                return unmarshal(in);
            }
        }
        logger.warn("No configuration found, using built-in defaults");
        return new XmlConfiguration();
    }

    private static XmlConfiguration unmarshal(InputStream in) throws Exception {
        Document doc = XmlUtil.readXml(in);
        XmlConfiguration cfg = XmlUtil.unmarshal(doc, XmlConfiguration.class);
        if (cfg.checks == null) cfg.checks = new XmlConfiguration.Checks();
        if (cfg.server == null) cfg.server = new XmlConfiguration.Server();
        return cfg;
    }

    private static void applyOverrides(XmlConfiguration cfg, UnaryOperator<String> env) {
        String dir = env.apply(ENV_CHECKFILES_DIR);
        if (dir != null) {
            logger.info("Checkfiles directory overridden by {}: {}", ENV_CHECKFILES_DIR, dir);
            cfg.checks.checkfilesDir = dir;
        }
        String interval = env.apply(ENV_RUN_INTERVAL);
        if (interval != null) {
            try {
                cfg.checks.checkRunInterval = Integer.parseInt(interval);
            } catch (NumberFormatException e) {
                throw new IllegalStateException(ENV_RUN_INTERVAL + " must be an integer, got '" + interval + "'", e);
            }
        }
    }

    private static void validate(XmlConfiguration cfg) {
        if (cfg.checks.checkfilesDir == null || cfg.checks.checkfilesDir.isBlank()) {
            throw new IllegalStateException("checks.checkfilesDir must be set");
        }
        if (cfg.checks.checkRunInterval <= 0) {
            throw new IllegalStateException("checks.checkRunInterval must be positive, got " + cfg.checks.checkRunInterval);
        }
        if (cfg.checks.commandTimeoutSeconds < 0 || cfg.checks.workerThreads < 0 || cfg.checks.historySize < 0) {
            throw new IllegalStateException("checks.commandTimeoutSeconds, workerThreads and historySize must not be negative");
        }
    }
}
