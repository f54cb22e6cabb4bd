package viewchange.vc;

import viewchange.timer.CountdownTimer;

import java.time.Duration;

//Fires only when a test calls fire(), or when a simulated cluster reaches its deadline.
class ManualTimer implements CountdownTimer {
    private final VirtualClock clock;
    private Runnable action = () -> {};
    private boolean running;
    private long deadline;
    private Duration lastDuration;
    private int resets;

    ManualTimer() {
        this(new VirtualClock());
    }

    ManualTimer(VirtualClock clock) {
        this.clock = clock;
    }

    void onFire(Runnable action) {
        this.action = action;
    }

    @Override
    public void reset(Duration duration) {
        running = true;
        lastDuration = duration;
        deadline = clock.nowMillis() + duration.toMillis();
        resets++;
    }

    @Override
    public void stop() {
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    void fire() {
        running = false;
        action.run();
    }

    long deadline() {
        return deadline;
    }

    Duration lastDuration() {
        return lastDuration;
    }

    int resets() {
        return resets;
    }
}
