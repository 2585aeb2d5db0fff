package io.github.riemr.roster.application.dto;

import io.github.riemr.roster.domain.model.Employee;
import io.github.riemr.roster.engine.result.RosterOutcome;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

@Data
public class CarryForwardRequest {

    @NotEmpty(message = "employees is required")
    @Valid
    private List<EmployeeInput> employees = new ArrayList<>();

    @NotNull(message = "outcome is required")
    private RosterOutcome outcome;

    // 免除状況の基準日。未指定なら当日
    private LocalDate asOf;

    public List<Employee> toEmployees() {
        return RosterSolveRequest.toEmployees(employees);
    }
}
