package io.github.riemr.roster.engine;

import io.github.riemr.roster.domain.model.Shift;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * A required slot that no employee is eligible for.
 */
public record Infeasibility(LocalDate date, Shift shift, String message) {

    public static Infeasibility noEligibleEmployee(LocalDate date, Shift shift) {
        String msg = "Impossible to fill: " + date.format(DateTimeFormatter.ISO_LOCAL_DATE)
                + " (" + shift.name() + "). Reason: no eligible employee under current restrictions.";
        return new Infeasibility(date, shift, msg);
    }
}
