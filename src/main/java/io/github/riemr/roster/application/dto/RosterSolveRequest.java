package io.github.riemr.roster.application.dto;

import io.github.riemr.roster.domain.model.Employee;
import io.github.riemr.roster.engine.RosterProblem;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 求解リクエスト。対象日は dates の明示指定、または from/to の期間指定（両端含む）。
 */
@Data
public class RosterSolveRequest {

    @NotEmpty(message = "employees is required")
    @Valid
    private List<EmployeeInput> employees = new ArrayList<>();

    private List<LocalDate> holidays = new ArrayList<>();

    private List<LocalDate> dates;
    private LocalDate from;
    private LocalDate to;

    // SPLIT / FULL_DAY; 未指定なら設定値
    private String scheme;

    public RosterProblem toProblem() {
        return new RosterProblem(toEmployees(employees),
                holidays == null ? Set.of() : new HashSet<>(holidays),
                resolveDates());
    }

    List<LocalDate> resolveDates() {
        if (dates != null && !dates.isEmpty()) {
            return new ArrayList<>(new LinkedHashSet<>(dates));
        }
        if (from == null || to == null) {
            throw new IllegalArgumentException("dates or from/to is required");
        }
        if (from.isAfter(to)) {
            throw new IllegalArgumentException("from must not be after to: " + from + " > " + to);
        }
        List<LocalDate> out = new ArrayList<>();
        for (LocalDate d = from; !d.isAfter(to); d = d.plusDays(1)) {
            out.add(d);
        }
        return out;
    }

    static List<Employee> toEmployees(List<EmployeeInput> inputs) {
        Set<String> seen = new HashSet<>();
        List<Employee> out = new ArrayList<>(inputs.size());
        for (EmployeeInput in : inputs) {
            Employee e = in.toDomain();
            if (!seen.add(e.getName())) {
                throw new IllegalArgumentException("duplicate employee name: " + e.getName());
            }
            out.add(e);
        }
        return out;
    }
}
