package viewchange.timer;

import org.junit.After;
import org.junit.Test;
import viewchange.common.TestUtils;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class ScheduledCountdownTimerTest {
    private final ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor();
    private final AtomicInteger firings = new AtomicInteger();
    private final ScheduledCountdownTimer timer = new ScheduledCountdownTimer("test", executor, firings::incrementAndGet);

    @After
    public void tearDown() {
        executor.shutdownNow();
    }

    @Test
    public void firesOncePerArming() throws InterruptedException {
        timer.reset(Duration.ofMillis(20));
        assertTrue(timer.isRunning());

        TestUtils.waitUntilTrue(() -> firings.get() == 1, "timer did not fire", Duration.ofSeconds(2));
        Thread.sleep(100);
        assertEquals(1, firings.get());
        assertFalse(timer.isRunning());
    }

    @Test
    public void stopCancelsPendingFiring() throws InterruptedException {
        timer.reset(Duration.ofMillis(50));
        timer.stop();

        Thread.sleep(200);
        assertEquals(0, firings.get());
        assertFalse(timer.isRunning());
    }

    @Test
    public void resetPostponesFiring() throws InterruptedException {
        timer.reset(Duration.ofMillis(100));
        Thread.sleep(50);
        timer.reset(Duration.ofMillis(400));
        Thread.sleep(150);
        assertEquals(0, firings.get());

        TestUtils.waitUntilTrue(() -> firings.get() == 1, "timer did not fire", Duration.ofSeconds(2));
    }

    @Test
    public void firingQueuedBehindResetIsIgnored() throws InterruptedException {
        //hold the scheduler thread so the firing is queued when the timer is stopped.
        executor.execute(() -> sleep(150));
        timer.reset(Duration.ofMillis(10));
        Thread.sleep(50);
        timer.stop();

        Thread.sleep(250);
        assertEquals(0, firings.get());
    }

    @Test
    public void failingActionDoesNotKillTimer() {
        AtomicInteger attempts = new AtomicInteger();
        ScheduledCountdownTimer failing = new ScheduledCountdownTimer("failing", executor, () -> {
            attempts.incrementAndGet();
            throw new IllegalStateException("boom");
        });
        failing.reset(Duration.ofMillis(10));
        TestUtils.waitUntilTrue(() -> attempts.get() == 1, "timer did not fire", Duration.ofSeconds(2));

        failing.reset(Duration.ofMillis(10));
        TestUtils.waitUntilTrue(() -> attempts.get() == 2, "timer did not fire again", Duration.ofSeconds(2));
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
