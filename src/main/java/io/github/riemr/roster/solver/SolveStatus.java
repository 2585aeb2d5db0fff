package io.github.riemr.roster.solver;

public enum SolveStatus {
    OPTIMAL,
    FEASIBLE,
    INFEASIBLE,
    TIMEOUT_NO_SOLUTION;

    public boolean hasAssignment() {
        return this == OPTIMAL || this == FEASIBLE;
    }
}
