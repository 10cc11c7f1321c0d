package com.tally.service.core.scheduler;

import com.tally.service.core.support.CallbackException;
import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.util.ErrorHandler;

/**
 * Handle of one registered schedule.
 *
 * <p>Lifecycle: {@code IDLE -> SCHEDULED -> FIRING -> SCHEDULED ...}; {@code STOPPED} is reachable
 * from any state and left only through {@link #start()}. At most one timer is armed and at most one
 * callback runs at a time; the next timer is armed after the callback returns. However many
 * occurrences were missed while the callback ran or the timer was late, they collapse into a single
 * catch-up firing.
 */
@Slf4j
public final class CronJob {

    private final String name;
    private final CronSpec spec;
    private final CronCallback callback;
    private final Object[] args;
    private final TaskScheduler taskScheduler;
    private final Clock clock;
    private final ErrorHandler errorHandler;

    private final Object monitor = new Object();
    private CronState state = CronState.IDLE;
    private boolean inFlight;
    private long generation;
    private Instant lastFire;
    private Instant nextFireTime;
    private boolean catchUpPending;
    private ScheduledFuture<?> pending;
    private long fireCount;

    CronJob(
            String name,
            CronSpec spec,
            CronCallback callback,
            Object[] args,
            TaskScheduler taskScheduler,
            Clock clock,
            ErrorHandler errorHandler) {
        this.name = name;
        this.spec = spec;
        this.callback = callback;
        this.args = args != null ? args.clone() : new Object[0];
        this.taskScheduler = taskScheduler;
        this.clock = clock;
        this.errorHandler = errorHandler;
    }

    /** Arms the schedule from the current time. No-op when already scheduled or firing. */
    public void start() {
        synchronized (monitor) {
            if (state == CronState.SCHEDULED || state == CronState.FIRING) {
                return;
            }
            generation++;
            initialize();
            if (inFlight) {
                // the running callback arms the timer when it returns
                state = CronState.FIRING;
            } else {
                callNext();
            }
        }
    }

    /** Cancels future firings. A callback already running is not interrupted or awaited. */
    public void stop() {
        synchronized (monitor) {
            if (state == CronState.STOPPED) {
                return;
            }
            generation++;
            if (pending != null) {
                pending.cancel(false);
                pending = null;
            }
            catchUpPending = false;
            state = CronState.STOPPED;
        }
        log.info("Stopped schedule '{}'", name);
    }

    private void initialize() {
        lastFire = null;
        catchUpPending = false;
        nextFireTime = getNext();
    }

    /**
     * Next occurrence strictly after the last firing, or after now before the first one. When that
     * occurrence has already passed, recomputes from now and flags one catch-up firing.
     */
    private Instant getNext() {
        Instant now = clock.instant();
        if (lastFire == null) {
            return spec.nextAfter(now);
        }
        Instant following = spec.nextAfter(lastFire);
        if (following.isAfter(now)) {
            return following;
        }
        catchUpPending = true;
        log.warn("Schedule '{}' missed occurrence {}; firing once to catch up", name, following);
        return spec.nextAfter(now);
    }

    private void callNext() {
        Instant at = catchUpPending ? clock.instant() : nextFireTime;
        long armedGeneration = generation;
        state = CronState.SCHEDULED;
        pending = taskScheduler.schedule(() -> fire(armedGeneration, at), at);
        log.debug("Schedule '{}' armed for {}", name, at);
    }

    private void fire(long armedGeneration, Instant planned) {
        synchronized (monitor) {
            if (armedGeneration != generation || state != CronState.SCHEDULED) {
                return;
            }
            Instant now = clock.instant();
            state = CronState.FIRING;
            inFlight = true;
            pending = null;
            catchUpPending = false;
            lastFire = planned.isAfter(now) ? planned : now;
            fireCount++;
        }
        try {
            callFunc();
        } finally {
            synchronized (monitor) {
                inFlight = false;
                if (state == CronState.FIRING) {
                    nextFireTime = getNext();
                    callNext();
                }
            }
        }
    }

    private void callFunc() {
        log.debug("Schedule '{}' firing", name);
        try {
            callback.invoke(args.clone());
        } catch (Exception ex) {
            CallbackException failure = new CallbackException(name, ex);
            try {
                errorHandler.handleError(failure);
            } catch (RuntimeException handlerFailure) {
                log.error("Error handler failed for schedule '{}'", name, handlerFailure);
            }
        }
    }

    public String name() {
        return name;
    }

    public CronSpec spec() {
        return spec;
    }

    public CronState state() {
        synchronized (monitor) {
            return state;
        }
    }

    /** Planned next occurrence; {@code null} before the first start. */
    public Instant nextFireTime() {
        synchronized (monitor) {
            return nextFireTime;
        }
    }

    public Instant lastFire() {
        synchronized (monitor) {
            return lastFire;
        }
    }

    public long fireCount() {
        synchronized (monitor) {
            return fireCount;
        }
    }

    public boolean isCallbackInFlight() {
        synchronized (monitor) {
            return inFlight;
        }
    }

    @Override
    public String toString() {
        synchronized (monitor) {
            return "CronJob{name='" + name + "', spec=" + spec + ", state=" + state + ", nextFireTime="
                    + nextFireTime + ", lastFire=" + lastFire + ", fireCount=" + fireCount
                    + (catchUpPending ? ", catchUpPending" : "") + (inFlight ? ", inFlight" : "") + "}";
        }
    }
}
