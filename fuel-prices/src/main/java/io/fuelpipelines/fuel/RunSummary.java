package io.fuelpipelines.fuel;

import java.time.Duration;
import java.util.Map;

/**
 * Final account of a run.
 *
 * @param cause the fatal error when {@code state} is {@link RunState#ABORTED}, else null
 */
public record RunSummary(RunState state, RunCounters counters, Duration elapsed, double meanBatchMillis, Exception cause) {

    public boolean succeeded() {
        return state == RunState.DONE;
    }

    /** Process exit code for this outcome. */
    public int exitCode() {
        return succeeded() ? 0 : 1;
    }

    public String describe() {
        StringBuilder sb = new StringBuilder();
        sb.append("Run ").append(state)
                .append(": read=").append(counters.rowsRead())
                .append(" loaded=").append(counters.rowsLoaded())
                .append(" rejected=").append(counters.rowsRejected());
        if (!counters.rejectedByKind().isEmpty()) {
            sb.append(" {");
            boolean first = true;
            for (Map.Entry<RejectionKind, Long> e : counters.rejectedByKind().entrySet()) {
                if (!first) sb.append(", ");
                sb.append(e.getKey()).append('=').append(e.getValue());
                first = false;
            }
            sb.append('}');
        }
        sb.append(" batches=").append(counters.batches())
                .append(" elapsed=").append(elapsed)
                .append(String.format(" meanBatchMs=%.2f", meanBatchMillis));
        if (cause != null) sb.append(" cause=").append(cause.getMessage());
        return sb.toString();
    }
}
