package com.social.automation.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * A background loop on its own single daemon thread, ticking at a fixed delay.
 * <p>
 * {@link #tick()} is the unit of work and can be driven directly in tests. {@link #stop()}
 * interrupts the running tick, so waits inside it end early, and returns once the tick
 * has unwound or the grace period has passed.
 */
public abstract class PeriodicTask implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(PeriodicTask.class);
    private static final long STOP_GRACE_SECONDS = 10;

    private final String name;
    private final Duration interval;
    private final Duration initialDelay;
    private final boolean autoStart;
    private ScheduledExecutorService scheduler;

    protected PeriodicTask(String name, Duration interval, Duration initialDelay, boolean autoStart) {
        this.name = name;
        this.interval = interval;
        this.initialDelay = initialDelay;
        this.autoStart = autoStart;
    }

    /**
     * One pass of the loop. Exceptions abort this tick only.
     */
    public abstract void tick();

    @Override
    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleWithFixedDelay(this::safeTick,
                initialDelay.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("{} started, interval {}s", name, interval.toSeconds());
    }

    @Override
    public void stop() {
        ScheduledExecutorService running;
        synchronized (this) {
            running = scheduler;
            scheduler = null;
        }
        if (running == null) {
            return;
        }
        onStop();
        running.shutdownNow();
        try {
            if (!running.awaitTermination(STOP_GRACE_SECONDS, TimeUnit.SECONDS)) {
                log.warn("{} did not finish its tick within {}s of stop", name, STOP_GRACE_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("{} stopped", name);
    }

    /**
     * Hook for releasing resources owned by the subclass before the loop thread is interrupted.
     */
    protected void onStop() {
    }

    @Override
    public synchronized boolean isRunning() {
        return scheduler != null;
    }

    @Override
    public boolean isAutoStartup() {
        return autoStart;
    }

    public String getName() {
        return name;
    }

    private void safeTick() {
        try {
            tick();
        } catch (Exception e) {
            log.error("{} tick failed, retrying next interval: {}", name, e.getMessage(), e);
        }
    }
}
