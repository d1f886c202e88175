package com.danieljhkim.meshcoord.meshcoordinator.event;

import com.danieljhkim.meshcoord.meshcommon.exception.NetworkException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Single consumer of the unbounded event channel.
 *
 * <p>
 * For every event, in publish order: update {@link MeshMetrics} (this class is their only writer), append to the
 * journal when one is configured, run the coordinator's reactions, then notify subscribers. Failures in any of the
 * last three steps are logged and never stop the consumer.
 */
@Slf4j
public class EventProcessor implements EventPublisher {

    private static final long POLL_INTERVAL_MS = 100;

    private final BlockingQueue<MeshEvent> queue = new LinkedBlockingQueue<>();
    private final MeshMetrics metrics = new MeshMetrics();
    private final EventJournal journal;
    private final List<Consumer<MeshEvent>> reactions = new CopyOnWriteArrayList<>();
    private final List<Consumer<MeshEvent>> subscribers = new CopyOnWriteArrayList<>();

    private final AtomicLong published = new AtomicLong();
    private final AtomicLong processed = new AtomicLong();
    private final Object progressMonitor = new Object();

    private volatile boolean accepting = true;
    private volatile Thread consumer;

    /**
     * @param journal optional journal; {@code null} disables journaling
     */
    public EventProcessor(EventJournal journal) {
        this.journal = journal;
    }

    public EventProcessor() {
        this(null);
    }

    // ============================
    // Lifecycle
    // ============================

    public synchronized void start() {
        if (consumer != null) {
            return;
        }
        Thread thread = new Thread(this::runLoop, "mesh-event-processor");
        thread.setDaemon(true);
        consumer = thread;
        thread.start();
        log.info("Event processor started");
    }

    public boolean isRunning() {
        Thread thread = consumer;
        return thread != null && thread.isAlive();
    }

    /**
     * Stops accepting events, lets the consumer drain what is queued, then closes the journal.
     */
    public void shutdown(Duration timeout) {
        accepting = false;
        Thread thread;
        synchronized (this) {
            thread = consumer;
        }
        if (thread != null) {
            try {
                thread.join(timeout.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (thread.isAlive()) {
                log.warn("Event processor did not drain within {}, {} events dropped", timeout, queue.size());
                thread.interrupt();
            }
        }
        if (journal != null) {
            try {
                journal.close();
            } catch (IOException e) {
                log.warn("Failed to close event journal", e);
            }
        }
        log.info("Event processor stopped after {} events", processed.get());
    }

    // ============================
    // Publishing
    // ============================

    @Override
    public void publish(MeshEvent event) {
        if (!accepting) {
            throw new NetworkException("Event channel closed, cannot send " + event.describe());
        }
        published.incrementAndGet();
        queue.add(event);
        log.debug("Queued {}", event.describe());
    }

    /**
     * Registers a coordinator reaction. Reactions run before subscribers.
     */
    public void addReaction(Consumer<MeshEvent> reaction) {
        reactions.add(reaction);
    }

    public void subscribe(Consumer<MeshEvent> subscriber) {
        if (subscriber != null) {
            subscribers.add(subscriber);
            log.debug("Added subscriber, total subscribers: {}", subscribers.size());
        }
    }

    public boolean unsubscribe(Consumer<MeshEvent> subscriber) {
        return subscribers.remove(subscriber);
    }

    // ============================
    // Consumption
    // ============================

    private void runLoop() {
        try {
            while (accepting || !queue.isEmpty()) {
                MeshEvent event = queue.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
                if (event != null) {
                    process(event);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Processes queued events on the calling thread until the queue is empty, including events published by
     * reactions along the way. Only valid while the consumer thread is not running.
     *
     * @return number of events processed
     */
    public int processPending() {
        if (isRunning()) {
            throw new IllegalStateException("consumer thread is running");
        }
        int count = 0;
        MeshEvent event;
        while ((event = queue.poll()) != null) {
            process(event);
            count++;
        }
        return count;
    }

    /**
     * Blocks until every published event, including those published while waiting, has been processed.
     *
     * @return false on timeout
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (progressMonitor) {
            while (processed.get() < published.get()) {
                long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                if (remainingMs <= 0) {
                    return false;
                }
                progressMonitor.wait(remainingMs);
            }
        }
        return true;
    }

    private void process(MeshEvent event) {
        try {
            metrics.apply(event);
            if (journal != null) {
                try {
                    journal.append(event);
                } catch (IOException e) {
                    log.warn("Failed to journal {}", event.describe(), e);
                }
            }
            for (Consumer<MeshEvent> reaction : reactions) {
                try {
                    reaction.accept(event);
                } catch (RuntimeException e) {
                    log.warn("Reaction to {} failed: {}", event.describe(), e.getMessage(), e);
                }
            }
            for (Consumer<MeshEvent> subscriber : subscribers) {
                try {
                    subscriber.accept(event);
                } catch (RuntimeException e) {
                    log.warn("Subscriber threw exception on {}", event.describe(), e);
                }
            }
        } finally {
            processed.incrementAndGet();
            synchronized (progressMonitor) {
                progressMonitor.notifyAll();
            }
        }
    }

    public MeshMetricsSnapshot getMetrics() {
        return metrics.snapshot();
    }

    public int getQueueSize() {
        return queue.size();
    }

    public int getSubscriberCount() {
        return subscribers.size();
    }
}
