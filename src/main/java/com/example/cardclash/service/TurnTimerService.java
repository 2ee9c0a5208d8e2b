package com.example.cardclash.service;

import com.example.cardclash.config.SchedulerConfig;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import java.util.function.LongFunction;

@Service
public class TurnTimerService {

    private final TaskScheduler taskScheduler;
    private final Clock clock;

    public TurnTimerService(@Qualifier(SchedulerConfig.MATCH_CLOCK_SCHEDULER) TaskScheduler taskScheduler, Clock clock) {
        this.taskScheduler = taskScheduler;
        this.clock = clock;
    }

    /**
     * Replaces the running turn timer of {@code turnClock}.
     *
     * @param onTimeout builds the timeout task for the generation the clock was armed with
     * @return that generation
     */
    public long scheduleTurnTimer(TurnClock turnClock, String playerId, int seconds, LongFunction<Runnable> onTimeout) {
        // Cancel the old timer first so at most one is ever pending
        cancelTurnTimer(turnClock);

        Instant deadline = clock.instant().plusSeconds(seconds);
        long generation = turnClock.arm(playerId, deadline);
        turnClock.setTimer(taskScheduler.schedule(onTimeout.apply(generation), deadline));
        return generation;
    }

    public void cancelTurnTimer(TurnClock turnClock) {
        // Disarm first, so a callback already waiting for the room lock sees a stale generation
        turnClock.disarm();
        cancel(turnClock.getTimer());
        turnClock.setTimer(null);
    }

    public long remainingSeconds(TurnClock turnClock) {
        return turnClock.remainingSeconds(clock.instant());
    }

    /**
     * One-shot timer for grace and join windows.
     */
    public ScheduledFuture<?> schedule(int seconds, Runnable task) {
        return taskScheduler.schedule(task, clock.instant().plusSeconds(seconds));
    }

    public void cancel(ScheduledFuture<?> timer) {
        if (timer != null && !timer.isDone()) {
            timer.cancel(false);
        }
    }
}
