package metalcc;

import metalcc.coordinator.config.CoordinatorConfig;
import metalcc.coordinator.config.Dependencies;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.concurrent.CountDownLatch;

/**
 * Control plane entry point.
 *
 * Reads {@code metalcc.ini} from the working directory (or the path given as the
 * first argument) when present, otherwise the environment.
 */
public class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    private static final String DEFAULT_CONFIG = "metalcc.ini";

    public static void main(String[] args) throws Exception {
        File configFile = new File(args.length > 0 ? args[0] : DEFAULT_CONFIG);
        CoordinatorConfig config;
        if (configFile.isFile()) {
            log.info("Loading configuration from {}", configFile.getAbsolutePath());
            config = CoordinatorConfig.fromIni(configFile);
        } else {
            config = CoordinatorConfig.fromEnv();
        }

        Dependencies deps = Dependencies.create(config);
        CountDownLatch shutdown = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down...");
            deps.close();
            shutdown.countDown();
        }, "metalcc-shutdown"));

        deps.server().start();
        deps.startScheduler();

        shutdown.await();
    }
}
