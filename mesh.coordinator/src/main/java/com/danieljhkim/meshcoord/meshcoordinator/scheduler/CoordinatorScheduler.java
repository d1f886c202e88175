package com.danieljhkim.meshcoord.meshcoordinator.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs the coordinator's periodic tasks. Each task gets its own single-threaded daemon executor, so a slow tick of one
 * task never delays another. A tick that throws is logged and the task keeps its schedule.
 */
public class CoordinatorScheduler {

    private static final Logger logger = LoggerFactory.getLogger(CoordinatorScheduler.class);
    private static final long TERMINATION_TIMEOUT_SECONDS = 5;

    private final List<PeriodicTask> tasks = new ArrayList<>();
    private final List<ScheduledExecutorService> executors = new ArrayList<>();
    private boolean started;

    record PeriodicTask(String name, Duration interval, Runnable tick) {}

    /**
     * Adds a task. Must be called before {@link #start()}.
     */
    public synchronized CoordinatorScheduler register(String name, Duration interval, Runnable tick) {
        if (started) {
            throw new IllegalStateException("scheduler already started");
        }
        tasks.add(new PeriodicTask(name, interval, tick));
        return this;
    }

    public synchronized void start() {
        if (started) {
            return;
        }
        started = true;
        for (PeriodicTask task : tasks) {
            ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "mesh-" + task.name());
                t.setDaemon(true);
                return t;
            });
            long intervalMs = task.interval().toMillis();
            executor.scheduleAtFixedRate(() -> runTick(task), intervalMs, intervalMs, TimeUnit.MILLISECONDS);
            executors.add(executor);
            logger.info("Scheduled {} every {} ms", task.name(), intervalMs);
        }
    }

    /**
     * Stops every task, letting a running tick finish first.
     */
    public synchronized void shutdown() throws InterruptedException {
        logger.info("Shutting down coordinator scheduler...");
        for (ScheduledExecutorService executor : executors) {
            executor.shutdown();
        }
        for (ScheduledExecutorService executor : executors) {
            if (!executor.awaitTermination(TERMINATION_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                logger.warn("Scheduler task did not terminate in time; forcing shutdown");
                executor.shutdownNow();
            }
        }
        executors.clear();
    }

    public synchronized boolean isStarted() {
        return started && !executors.isEmpty();
    }

    public synchronized List<String> getTaskNames() {
        return tasks.stream().map(PeriodicTask::name).toList();
    }

    static void runTick(PeriodicTask task) {
        try {
            logger.debug("Running {}", task.name());
            task.tick().run();
        } catch (Exception e) {
            logger.warn("Error during scheduled {}", task.name(), e);
        }
    }
}
