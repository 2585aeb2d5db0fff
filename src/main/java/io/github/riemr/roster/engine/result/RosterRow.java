package io.github.riemr.roster.engine.result;

import io.github.riemr.roster.domain.model.Shift;

import java.time.LocalDate;

public record RosterRow(LocalDate date, String day, String employee, Shift shift) {
}
