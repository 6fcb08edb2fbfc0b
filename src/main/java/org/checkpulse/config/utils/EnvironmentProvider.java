package org.checkpulse.config.utils;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.util.StatusPrinter;
import io.github.cdimascio.dotenv.Dotenv;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;

/**
 * EnvironmentProvider acts as the universal environment bootstrap.
 *
 * Responsibilities:
 *  1. Loads environment variables (.env or system)
 *  2. Initializes the Logback config matching APP_ENV (dev/prod)
 *  3. Resolves configuration overrides by name
 */
public class EnvironmentProvider {

    private static final Logger logger = LoggerFactory.getLogger(EnvironmentProvider.class);

    private static final String ENV_ENVIRONMENT = "APP_ENV";
    private static boolean initialized = false;
    private static String activeEnv = "PRODUCTION";
    private static Dotenv dotenv;

    private EnvironmentProvider() {}

    /** Initialize environment and logger config */
    public static synchronized void init() {
        if (initialized) return;

        dotenv = Dotenv.configure().ignoreIfMissing().load();

        String env = System.getenv(ENV_ENVIRONMENT);
        if (env == null || env.isBlank()) {
            env = dotenv.get(ENV_ENVIRONMENT, "PRODUCTION");
        }
        activeEnv = env.toUpperCase();
        System.setProperty(ENV_ENVIRONMENT, activeEnv);

        if ("DEVELOPMENT".equalsIgnoreCase(activeEnv)) {
            loadLogbackFromClasspath("logback-dev.xml");
            logger.info("Environment set to DEVELOPMENT, using logback-dev.xml");
        } else {
            loadLogbackFromClasspath("logback.xml");
            logger.info("Environment set to PRODUCTION, using logback.xml");
        }
        initialized = true;
    }

    /**
     * Looks a variable up in the process environment first, then in .env.
     *
     * @return the trimmed value, or null when unset or blank
     */
    public static String get(String name) {
        String value = System.getenv(name);
        if (value == null || value.isBlank()) {
            value = dotenv().get(name);
        }
        return value == null || value.isBlank() ? null : value.trim();
    }

    public static boolean isDev() {
        if (!initialized) init();
        return "DEVELOPMENT".equalsIgnoreCase(activeEnv);
    }

    public static String getEnvironment() {
        if (!initialized) init();
        return activeEnv;
    }

    private static synchronized Dotenv dotenv() {
        if (dotenv == null) {
            dotenv = Dotenv.configure().ignoreIfMissing().load();
        }
        return dotenv;
    }

    private static void loadLogbackFromClasspath(String resourceName) {
        try (InputStream in = EnvironmentProvider.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (in == null) {
                logger.warn("Logback config {} not found on classpath, keeping defaults", resourceName);
                return;
            }
            LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
            context.reset();
            JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(context);
            configurator.doConfigure(in);
            StatusPrinter.printInCaseOfErrorsOrWarnings(context);
        } catch (Exception e) {
            System.err.println("Failed to load logback config: " + resourceName + " (" + e.getMessage() + ")");
        }
    }
}
