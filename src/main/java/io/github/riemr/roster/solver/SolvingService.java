package io.github.riemr.roster.solver;

import io.github.riemr.roster.engine.RosterModel;

import java.time.Duration;

/**
 * Exact or heuristic backend that solves a finished roster model within a wall-clock budget.
 * Blocking; one call per solve invocation, no retries.
 */
public interface SolvingService {

    SolverResult solve(RosterModel model, Duration budget);

    String name();
}
