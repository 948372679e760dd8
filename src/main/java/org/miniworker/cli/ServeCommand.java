package org.miniworker.cli;

import org.miniworker.config.ConfigLoader;
import org.miniworker.config.XmlConfiguration;
import org.miniworker.config.utils.EnvironmentProvider;
import org.miniworker.config.utils.LogContext;
import org.miniworker.manager.ManagerSettings;
import org.miniworker.manager.WorkerManager;
import org.miniworker.manager.exceptions.RegistrationException;
import org.miniworker.rest.RestApiServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

/**
 * Load Configuration from Xml
 * Register workers
 * Start the management REST API and block until the JVM is shut down
 */
@Command(name = "serve", description = "Run the worker management REST API", mixinStandardHelpOptions = true)
public class ServeCommand implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(ServeCommand.class);

    @Option(names = {"-c", "--config"}, defaultValue = "config.xml",
            description = "XML configuration file (default: ${DEFAULT-VALUE})")
    Path configPath;

    @Override
    public Integer call() throws InterruptedException {
        LogContext.start("ServeCommand");
        EnvironmentProvider.init();
        logger.info("[------------ Starting Mini-Worker Manager ({}) ------------]", EnvironmentProvider.getEnvironment());

        RestApiServer server;
        try {
            XmlConfiguration cfg = ConfigLoader.loadConfig(configPath);
            ManagerSettings settings = ConfigLoader.managerSettings(cfg);
            logger.info("Workers log to {}, stats in {}", settings.logDir(), settings.statsDir());

            WorkerManager manager = new WorkerManager(settings);
            manager.reload(ConfigLoader.registrations(cfg));

            server = new RestApiServer(cfg.server, manager, configPath);
            server.start();
        } catch (IllegalStateException | IllegalArgumentException | RegistrationException e) {
            logger.error("[------------ Startup failed: {} ------------]", e.getMessage(), e);
            return 1;
        }

        CountDownLatch stopped = new CountDownLatch(1);
        RestApiServer running = server;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("[------------ Shutdown initiated ------------]");
            running.stop();
            stopped.countDown();
        }, "mini-worker-serve-shutdown"));

        stopped.await();
        return 0;
    }
}
