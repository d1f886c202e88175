package com.danieljhkim.meshcoord.meshcoordinator.scheduler;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class CoordinatorSchedulerTest {

    private final CoordinatorScheduler scheduler = new CoordinatorScheduler();

    @AfterEach
    void tearDown() throws InterruptedException {
        scheduler.shutdown();
    }

    @Test
    void testTasksRunPeriodically() throws InterruptedException {
        CountDownLatch ticks = new CountDownLatch(3);
        scheduler.register("ticker", Duration.ofMillis(20), ticks::countDown);

        scheduler.start();

        assertTrue(scheduler.isStarted());
        assertTrue(ticks.await(5, TimeUnit.SECONDS));
    }

    @Test
    void testFailingTickKeepsSchedule() throws InterruptedException {
        AtomicInteger attempts = new AtomicInteger();
        CountDownLatch survived = new CountDownLatch(2);
        scheduler.register("flaky", Duration.ofMillis(20), () -> {
            attempts.incrementAndGet();
            survived.countDown();
            throw new IllegalStateException("tick failed");
        });

        scheduler.start();

        assertTrue(survived.await(5, TimeUnit.SECONDS));
        assertTrue(attempts.get() >= 2);
    }

    @Test
    void testRegisterAfterStartRejected() {
        scheduler.register("a", Duration.ofSeconds(10), () -> {}).register("b", Duration.ofSeconds(10), () -> {});
        scheduler.start();

        assertEquals(List.of("a", "b"), scheduler.getTaskNames());
        assertThrows(
                IllegalStateException.class, () -> scheduler.register("c", Duration.ofSeconds(10), () -> {}));
    }

    @Test
    void testShutdownStopsTasks() throws InterruptedException {
        AtomicInteger ticks = new AtomicInteger();
        scheduler.register("counter", Duration.ofMillis(10), ticks::incrementAndGet);
        scheduler.start();
        Thread.sleep(50);

        scheduler.shutdown();
        int afterShutdown = ticks.get();
        Thread.sleep(50);

        assertEquals(afterShutdown, ticks.get());
        assertFalse(scheduler.isStarted());
    }
}
