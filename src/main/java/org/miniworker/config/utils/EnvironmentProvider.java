package org.miniworker.config.utils;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.util.StatusPrinter;
import io.github.cdimascio.dotenv.Dotenv;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.util.Optional;

/**
 * EnvironmentProvider acts as the universal environment bootstrap.
 *
 * Responsibilities:
 *  1 Loads environment variables (system first, then .env)
 *  2 Switches Logback to logback-dev.xml when APP_ENV=DEVELOPMENT
 *  3 Lets worker processes swap in a config without the shared log file
 */
public class EnvironmentProvider {

    private static final Logger logger = LoggerFactory.getLogger(EnvironmentProvider.class);

    private static final String ENV_ENVIRONMENT = "APP_ENV";
    private static boolean initialized = false;
    private static String activeEnv = "PRODUCTION";
    private static Dotenv dotenv;

    /** Initialize environment and logger config */
    public static synchronized void init() {
        if (initialized) return;

        try {
            dotenv = Dotenv.configure().ignoreIfMissing().load();

            // --- Determine environment ---
            String env = System.getenv(ENV_ENVIRONMENT);
            if (env == null || env.isBlank()) {
                env = dotenv.get(ENV_ENVIRONMENT, "PRODUCTION");
            }
            activeEnv = env.toUpperCase();
            System.setProperty(ENV_ENVIRONMENT, activeEnv);

            // logback.xml is picked up automatically, only development needs a switch
            if ("DEVELOPMENT".equalsIgnoreCase(activeEnv)) {
                loadLogbackFromClasspath("logback-dev.xml");
                logger.info("Environment set to DEVELOPMENT, using logback-dev.xml");
            }

            logger.debug("Environment initialized: {}", activeEnv);
            initialized = true;

        } catch (Exception e) {
            logger.error("Failed to initialize environment: {}", e.getMessage(), e);
            throw new IllegalStateException("Environment initialization failed.", e);
        }
    }

    /**
     * Value of {@code key} from the system environment, else from {@code .env}.
     */
    public static Optional<String> get(String key) {
        String value = System.getenv(key);
        if (value == null || value.isBlank()) {
            value = dotenv().get(key);
        }
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
    }

    /** Convenience helpers */
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

    /**
     * Replaces the whole Logback configuration with {@code resourceName} from the
     * class path. A missing resource leaves the current configuration in place.
     */
    public static void useLogbackConfig(String resourceName) {
        loadLogbackFromClasspath(resourceName);
    }

    private static void loadLogbackFromClasspath(String resourceName) {
        try (InputStream config = EnvironmentProvider.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (config == null) {
                logger.warn("Logback config {} not found on classpath", resourceName);
                return;
            }
            LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
            context.reset();
            JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(context);
            configurator.doConfigure(config);
            StatusPrinter.printInCaseOfErrorsOrWarnings(context);
        } catch (Exception e) {
            System.err.println("Failed to load logback config: " + resourceName + " (" + e.getMessage() + ")");
        }
    }
}
