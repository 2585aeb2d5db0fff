package io.github.riemr.roster.presentation.controller;

import io.github.riemr.roster.application.dto.CarryForwardRequest;
import io.github.riemr.roster.application.dto.EmployeeStanding;
import io.github.riemr.roster.application.dto.RosterSolveRequest;
import io.github.riemr.roster.application.service.CarryForwardService;
import io.github.riemr.roster.application.service.RosterService;
import io.github.riemr.roster.domain.model.Employee;
import io.github.riemr.roster.domain.model.ShiftScheme;
import io.github.riemr.roster.engine.result.RosterOutcome;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/roster")
@RequiredArgsConstructor
public class RosterController {

    private final RosterService rosterService;
    private final CarryForwardService carryForwardService;

    /** 充足不能・制約過多も 200 で errors に入れて返す */
    @PostMapping("/solve")
    public RosterOutcome solve(@Valid @RequestBody RosterSolveRequest request) {
        return rosterService.solve(request.toProblem(), ShiftScheme.fromCode(request.getScheme()));
    }

    @PostMapping("/carry-forward")
    public List<EmployeeStanding> carryForward(@Valid @RequestBody CarryForwardRequest request) {
        List<Employee> next = carryForwardService.carryForward(request.toEmployees(), request.getOutcome());
        LocalDate asOf = request.getAsOf() != null ? request.getAsOf() : LocalDate.now();
        return carryForwardService.standings(next, asOf);
    }
}
