package viewchange.timer;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * {@link CountdownTimer} that runs its action on the given scheduler. When the
 * scheduler is a node's single update thread, firings are serialised with
 * message handling.
 *
 * A firing can already be queued when the timer is re-armed. Every arming
 * gets a new generation and a firing from an older generation is ignored.
 */
public class ScheduledCountdownTimer implements CountdownTimer {
    private static final Logger logger = LogManager.getLogger(ScheduledCountdownTimer.class);

    private final String name;
    private final ScheduledExecutorService executor;
    private final Runnable action;

    private ScheduledFuture<?> scheduledTask;
    private long generation;

    public ScheduledCountdownTimer(String name, ScheduledExecutorService executor, Runnable action) {
        this.name = name;
        this.executor = executor;
        this.action = action;
    }

    @Override
    public synchronized void reset(Duration duration) {
        stop();
        long armedGeneration = generation;
        try {
            scheduledTask = executor.schedule(() -> fire(armedGeneration), duration.toMillis(), TimeUnit.MILLISECONDS);
            logger.trace(name + " armed for " + duration.toMillis() + "ms");
        } catch (RejectedExecutionException e) {
            logger.debug(name + " not armed, scheduler is shut down");
        }
    }

    @Override
    public synchronized void stop() {
        generation++;
        if (scheduledTask != null) {
            scheduledTask.cancel(false);
            scheduledTask = null;
        }
    }

    @Override
    public synchronized boolean isRunning() {
        return scheduledTask != null;
    }

    private synchronized void fire(long armedGeneration) {
        if (armedGeneration != generation) {
            return;
        }
        scheduledTask = null;
        logger.debug(name + " fired");
        try {
            action.run();
        } catch (RuntimeException e) {
            logger.error(name + " action failed", e);
        }
    }
}
