package org.miniworker.config;

import org.miniworker.config.utils.EnvironmentProvider;
import org.miniworker.config.utils.XmlUtil;
import org.miniworker.manager.ManagerSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String LOG_DIR_ENV = "MINI_WORKER_LOG_DIR";
    public static final String STATS_DIR_ENV = "MINI_WORKER_STATS_DIR";
    public static final String JAVA_ENV = "MINI_WORKER_JAVA";

    /**
     * Loads the XML configuration and returns a fully-typed XmlConfiguration object.
     */
    public static XmlConfiguration loadConfig(Path xmlPath) {
        if (!Files.isRegularFile(xmlPath)) {
            throw new IllegalStateException("Config file not found: " + xmlPath.toAbsolutePath());
        }
        try {
            XmlConfiguration cfg = XmlUtil.unmarshal(xmlPath, XmlConfiguration.class);
            logger.info("Loaded configuration from {} ({} workers)", xmlPath, cfg.workers.size());
            return cfg;
        } catch (Exception e) {
            throw new IllegalStateException("Failed to load config file! " + e.getMessage(), e);
        }
    }

    /**
     * Manager section merged with the environment overrides. Missing directories
     * default to {@code logs} and the log directory.
     */
    public static ManagerSettings managerSettings(XmlConfiguration cfg) {
        XmlConfiguration.Manager m = cfg.manager != null ? cfg.manager : new XmlConfiguration.Manager();

        String logDir = EnvironmentProvider.get(LOG_DIR_ENV).orElse(blankToNull(m.logDir));
        if (logDir == null) {
            logDir = "logs";
        }
        String statsDir = EnvironmentProvider.get(STATS_DIR_ENV).orElse(blankToNull(m.statsDir));
        if (statsDir == null) {
            statsDir = logDir;
        }
        String java = EnvironmentProvider.get(JAVA_ENV).orElse(blankToNull(m.javaExecutable));
        Duration grace = m.stopGraceSeconds > 0
                ? Duration.ofSeconds(m.stopGraceSeconds)
                : ManagerSettings.DEFAULT_STOP_GRACE;

        return new ManagerSettings(Path.of(logDir), Path.of(statsDir), java, blankToNull(m.classpath), grace);
    }

    /**
     * Worker name to class name, in file order.
     */
    public static Map<String, String> registrations(XmlConfiguration cfg) {
        Map<String, String> workers = new LinkedHashMap<>();
        for (XmlConfiguration.WorkerEntry entry : cfg.workers) {
            if (entry.name == null || entry.workerClass == null) {
                throw new IllegalStateException("Worker entries need both <name> and <workerClass>");
            }
            workers.put(entry.name.trim(), entry.workerClass.trim());
        }
        return workers;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
