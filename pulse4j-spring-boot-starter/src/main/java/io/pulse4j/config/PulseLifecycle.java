package io.pulse4j.config;

import io.pulse4j.Pulse;
import org.springframework.context.SmartLifecycle;

/**
 * Starts the scheduler once the context is refreshed and stops it on shutdown.
 */
public class PulseLifecycle implements SmartLifecycle {
    private final Pulse pulse;
    private volatile boolean running = false;

    public PulseLifecycle(Pulse pulse) {
        this.pulse = pulse;
    }

    @Override
    public void start() {
        pulse.start();
        running = true;
    }

    @Override
    public void stop() {
        pulse.stop();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    // last to start, first to stop
    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }
}
