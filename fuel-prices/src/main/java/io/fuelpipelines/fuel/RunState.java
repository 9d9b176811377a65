package io.fuelpipelines.fuel;

import java.util.EnumSet;
import java.util.Set;

/**
 * Phases of a load run. The table is replaced in {@link #REPLACING} before anything is loaded in
 * {@link #STREAMING}; a fatal failure in either, or in opening the input, ends in {@link #ABORTED}.
 */
public enum RunState {
    START,
    REPLACING,
    STREAMING,
    REPORTING,
    DONE,
    ABORTED;

    public Set<RunState> next() {
        return switch (this) {
            case START -> EnumSet.of(REPLACING, ABORTED);
            case REPLACING -> EnumSet.of(STREAMING, ABORTED);
            case STREAMING -> EnumSet.of(REPORTING, ABORTED);
            case REPORTING -> EnumSet.of(DONE);
            case DONE, ABORTED -> EnumSet.noneOf(RunState.class);
        };
    }

    public boolean isTerminal() {
        return this == DONE || this == ABORTED;
    }
}
