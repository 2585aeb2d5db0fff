package io.github.riemr.roster.engine.result;

/**
 * Points in display units (solver points divided by the weight scale).
 */
public record SummaryRow(String employee, int startingPoints, double pointsEarned, double totalPoints) {
}
