package io.github.riemr.roster.solver;

import io.github.riemr.roster.engine.model.ModelVariable;

import java.time.Duration;

/**
 * Outcome of one solving call. {@code values} is indexed by {@link ModelVariable#getIndex()}
 * and is present only when {@link SolveStatus#hasAssignment()}.
 */
public record SolverResult(SolveStatus status, long[] values, Long objectiveValue, Duration wallTime) {

    public static SolverResult withoutAssignment(SolveStatus status, Duration wallTime) {
        if (status.hasAssignment()) {
            throw new IllegalArgumentException(status + " requires an assignment");
        }
        return new SolverResult(status, null, null, wallTime);
    }

    public long value(ModelVariable variable) {
        if (values == null) {
            throw new IllegalStateException("no assignment for status " + status);
        }
        return values[variable.getIndex()];
    }

    public boolean isTrue(ModelVariable variable) {
        return value(variable) == 1L;
    }
}
