package io.github.riemr.roster.engine;

import io.github.riemr.roster.domain.model.Employee;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;

/**
 * Inputs of one solve invocation. The date list may be unordered or contain gaps.
 */
public record RosterProblem(List<Employee> employees, Set<LocalDate> holidays, List<LocalDate> dates) {

    public RosterProblem {
        employees = employees == null ? List.of() : List.copyOf(employees);
        holidays = holidays == null ? Set.of() : Set.copyOf(holidays);
        dates = dates == null ? List.of() : List.copyOf(dates);
    }
}
