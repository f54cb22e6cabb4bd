package viewchange.timer;

import java.time.Duration;

/**
 * A one-shot timer that can be re-armed. Each arming fires at most once;
 * re-arming or stopping cancels a firing that has not happened yet.
 */
public interface CountdownTimer {
    void reset(Duration duration);

    void stop();

    boolean isRunning();
}
