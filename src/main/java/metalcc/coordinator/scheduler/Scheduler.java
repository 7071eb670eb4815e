package metalcc.coordinator.scheduler;

import metalcc.coordinator.config.CoordinatorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Timer for periodic background work. Currently runs only metering.
 *
 * Uses a single-threaded executor so two metering periods never overlap.
 */
public class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final ScheduledExecutorService executor;
    private final MeteringTask meteringTask;
    private final CoordinatorConfig config;

    private volatile boolean running = false;

    public Scheduler(MeteringTask meteringTask, CoordinatorConfig config) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "metalcc-scheduler");
            t.setDaemon(true);
            return t;
        });
        this.meteringTask = meteringTask;
        this.config = config;
    }

    /**
     * Start the scheduler.
     */
    public void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }

        running = true;

        if (config.meteringEnabled()) {
            long intervalMs = config.meteringInterval().toMillis();
            executor.scheduleAtFixedRate(
                    meteringTask,
                    intervalMs, // initial delay
                    intervalMs, // interval
                    TimeUnit.MILLISECONDS);
            log.info("Metering scheduled every {}ms", intervalMs);
        } else {
            log.warn("Metering disabled, workloads will run free of charge");
        }

        log.info("Scheduler started");
    }

    /**
     * Stop the scheduler gracefully.
     */
    public void stop() {
        if (!running) {
            return;
        }

        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Scheduler forcefully stopped");
            } else {
                log.info("Scheduler stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Get the metering task for direct access (e.g., manual trigger).
     */
    public MeteringTask meteringTask() {
        return meteringTask;
    }
}
