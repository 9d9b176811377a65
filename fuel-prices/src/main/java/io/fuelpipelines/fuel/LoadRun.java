package io.fuelpipelines.fuel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;

/** One execution of the load, moving through {@link RunState}s in the only order they allow. */
public final class LoadRun {
    private static final Logger log = LoggerFactory.getLogger(LoadRun.class);

    private final Instant startedAt;
    private RunState state = RunState.START;

    public LoadRun() {
        this.startedAt = Instant.now();
    }

    public RunState state() { return state; }

    public Duration elapsed() { return Duration.between(startedAt, Instant.now()); }

    /** @throws IllegalStateException when {@code next} is not reachable from the current state */
    public void moveTo(RunState next) {
        if (!state.next().contains(next)) {
            throw new IllegalStateException("Illegal run transition " + state + " -> " + next);
        }
        log.info("Run {} -> {}", state, next);
        state = next;
    }

    public void require(RunState expected) {
        if (state != expected) {
            throw new IllegalStateException("Run is " + state + ", expected " + expected);
        }
    }
}
