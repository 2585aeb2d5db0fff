package io.github.riemr.roster.config;

import io.github.riemr.roster.domain.model.ShiftScheme;
import io.github.riemr.roster.engine.PointWeights;

import java.time.Duration;

/**
 * Resolved {@code roster.*} settings.
 */
public record RosterSettings(
        ShiftScheme scheme,
        boolean weekdayMorningCovered,
        int immunityYears,
        Duration timeBudget,
        String backend,
        PointWeights weights,
        int cpSatWorkers,
        Integer cpSatRandomSeed,
        Duration localSearchUnimprovedLimit
) {
}
