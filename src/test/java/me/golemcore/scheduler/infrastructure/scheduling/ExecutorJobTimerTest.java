package me.golemcore.scheduler.infrastructure.scheduling;

import me.golemcore.scheduler.domain.component.JobTimer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExecutorJobTimerTest {

    private ExecutorJobTimer timer;

    @BeforeEach
    void setUp() {
        timer = new ExecutorJobTimer(Clock.systemUTC());
    }

    @AfterEach
    void tearDown() {
        timer.shutdown();
    }

    @Test
    void shouldRunTaskOnTimerThread() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);
        AtomicReference<String> threadName = new AtomicReference<>();

        timer.schedule(() -> {
            threadName.set(Thread.currentThread().getName());
            latch.countDown();
        }, Instant.now().plusMillis(20));

        assertTrue(latch.await(5, TimeUnit.SECONDS));
        assertEquals("job-timer", threadName.get());
    }

    @Test
    void shouldRunOverdueTaskImmediately() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);

        timer.schedule(latch::countDown, Instant.now().minusSeconds(60));

        assertTrue(latch.await(5, TimeUnit.SECONDS));
    }

    @Test
    void shouldNotRunCanceledTask() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);
        Instant at = Instant.now().plusMillis(200);

        JobTimer.TimerHandle handle = timer.schedule(latch::countDown, at);
        handle.cancel();

        assertEquals(at, handle.getFireAt());
        assertFalse(latch.await(500, TimeUnit.MILLISECONDS));
    }

    @Test
    void shouldDropCanceledTaskFromQueue() {
        JobTimer.TimerHandle handle = timer.schedule(() -> {
        }, Instant.now().plus(Duration.ofDays(30)));
        assertEquals(1, timer.queuedTasks());

        handle.cancel();

        assertEquals(0, timer.queuedTasks());
    }

    @Test
    void shouldKeepRunningAfterFailingTask() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);

        timer.schedule(() -> {
            throw new IllegalStateException("boom");
        }, Instant.now());
        timer.schedule(latch::countDown, Instant.now().plusMillis(20));

        assertTrue(latch.await(5, TimeUnit.SECONDS));
    }
}
