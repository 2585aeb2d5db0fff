package io.github.riemr.roster.domain.model;

import java.time.LocalDate;

/**
 * (employee, date, shift) key of one assignment decision.
 */
public record AssignmentKey(String employeeName, LocalDate date, Shift shift) {

    @Override
    public String toString() {
        return employeeName + "_" + date + "_" + shift.name();
    }
}
