package com.social.automation.engine;

import com.social.automation.config.AutomationConfig;
import com.social.automation.model.action.ActionType;
import org.springframework.stereotype.Component;

import java.util.Random;

/**
 * Human-like pause before dispatching an action, drawn uniformly from the action type's range.
 * Runs on the calling scope worker's thread and holds no locks.
 */
@Component
public class PacingDelay {

    private final AutomationConfig.Pacing pacing;
    private final Random random;
    private final Sleeper sleeper;

    public PacingDelay(AutomationConfig automationConfig, Random random, Sleeper sleeper) {
        this.pacing = automationConfig.getPacing();
        this.random = random;
        this.sleeper = sleeper;
    }

    /**
     * @return the delay slept, in milliseconds
     * @throws InterruptedException if the worker is stopped while waiting
     */
    public long pause(ActionType type) throws InterruptedException {
        if (!pacing.isEnabled()) {
            return 0;
        }
        long min = pacing.minFor(type);
        long max = Math.max(min, pacing.maxFor(type));
        long delay = min + (long) (random.nextDouble() * (max - min));
        if (delay > 0) {
            sleeper.sleep(delay);
        }
        return delay;
    }
}
