package io.github.riemr.roster.engine;

import io.github.riemr.roster.domain.model.AssignmentKey;
import io.github.riemr.roster.domain.model.Employee;
import io.github.riemr.roster.domain.model.EmployeeRole;
import io.github.riemr.roster.domain.model.Shift;
import io.github.riemr.roster.domain.rule.EligibilityRules;
import io.github.riemr.roster.domain.rule.HolidayImmunity;
import io.github.riemr.roster.engine.result.RosterOutcome;
import io.github.riemr.roster.engine.result.RosterRow;
import io.github.riemr.roster.engine.result.SummaryRow;
import io.github.riemr.roster.solver.SolveStatus;
import io.github.riemr.roster.solver.SolverResult;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;

import static io.github.riemr.roster.engine.RosterFixtures.HOLIDAY_MONDAY;
import static io.github.riemr.roster.engine.RosterFixtures.MONDAY;
import static io.github.riemr.roster.engine.RosterFixtures.employee;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RosterProjectorTest {

    private static final LocalDate FRIDAY = MONDAY.plusDays(4);
    private static final LocalDate SUNDAY = MONDAY.plusDays(6);

    private final RosterProjector projector = new RosterProjector();

    private RosterModel model() {
        List<Employee> team = List.of(employee("Alice", EmployeeRole.STANDARD, 3), employee("Dave", EmployeeRole.STANDARD, 5));
        RosterModel model = RosterFixtures.builder().build(new RosterProblem(team, Set.of(), List.of(FRIDAY, SUNDAY)),
                RosterFixtures.split(Set.of()));
        new FairnessObjective().apply(model);
        return model;
    }

    private static void set(long[] values, RosterModel model, String name, LocalDate date, Shift shift) {
        values[model.variable(new AssignmentKey(name, date, shift)).getIndex()] = 1;
    }

    @Test
    void projectsRowsInVariableOrder_andSummarizesInDisplayPoints() {
        RosterModel model = model();
        long[] values = new long[model.getLinearModel().variableCount()];
        set(values, model, "Alice", FRIDAY, Shift.WEEKDAY_EVENING);
        set(values, model, "Dave", SUNDAY, Shift.WEEKEND_MORNING);
        set(values, model, "Alice", SUNDAY, Shift.WEEKEND_EVENING);

        RosterOutcome outcome = projector.project(model,
                new SolverResult(SolveStatus.OPTIMAL, values, 10L, Duration.ofMillis(5)));

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.status()).isEqualTo(SolveStatus.OPTIMAL);
        assertThat(outcome.roster()).containsExactly(
                new RosterRow(FRIDAY, "Friday", "Alice", Shift.WEEKDAY_EVENING),
                new RosterRow(SUNDAY, "Sunday", "Dave", Shift.WEEKEND_MORNING),
                new RosterRow(SUNDAY, "Sunday", "Alice", Shift.WEEKEND_EVENING));
        assertThat(outcome.summary()).containsExactly(
                new SummaryRow("Alice", 3, 2.5, 5.5),
                new SummaryRow("Dave", 5, 1.5, 6.5));
        assertThat(outcome.pointSpread()).isEqualTo(1.0);
        assertThat(outcome.errors()).isEmpty();
    }

    @Test
    void employeeWithNoShiftsEarnsZero() {
        RosterModel model = model();
        long[] values = new long[model.getLinearModel().variableCount()];
        set(values, model, "Dave", FRIDAY, Shift.WEEKDAY_EVENING);

        RosterOutcome outcome = projector.project(model,
                new SolverResult(SolveStatus.FEASIBLE, values, null, Duration.ZERO));

        assertThat(outcome.summary().get(0)).isEqualTo(new SummaryRow("Alice", 3, 0.0, 3.0));
        assertThat(outcome.summary().get(1)).isEqualTo(new SummaryRow("Dave", 5, 1.0, 6.0));
    }

    @Test
    void holidayShiftEarnsPremiumPoints() {
        List<Employee> team = List.of(employee("Alice", EmployeeRole.STANDARD), employee("Dave", EmployeeRole.STANDARD, 2));
        RosterModel model = RosterFixtures.builder().build(
                new RosterProblem(team, Set.of(HOLIDAY_MONDAY), List.of(HOLIDAY_MONDAY)),
                RosterFixtures.split(Set.of(HOLIDAY_MONDAY)));
        new FairnessObjective().apply(model);
        long[] values = new long[model.getLinearModel().variableCount()];
        set(values, model, "Alice", HOLIDAY_MONDAY, Shift.HOLIDAY_MORNING);
        set(values, model, "Dave", HOLIDAY_MONDAY, Shift.HOLIDAY_EVENING);

        RosterOutcome outcome = projector.project(model,
                new SolverResult(SolveStatus.OPTIMAL, values, 20L, Duration.ZERO));

        assertThat(outcome.roster()).containsExactly(
                new RosterRow(HOLIDAY_MONDAY, "Monday", "Alice", Shift.HOLIDAY_MORNING),
                new RosterRow(HOLIDAY_MONDAY, "Monday", "Dave", Shift.HOLIDAY_EVENING));
        assertThat(outcome.summary()).containsExactly(
                new SummaryRow("Alice", 0, 1.5, 1.5),
                new SummaryRow("Dave", 2, 1.5, 3.5));
        assertThat(outcome.pointSpread()).isEqualTo(2.0);
    }

    @Test
    void spreadIsTakenBeforeConvertingToDisplayUnits() {
        RosterModelBuilder oddWeights = new RosterModelBuilder(
                new EligibilityRules(new HolidayImmunity()), new PointWeights(11, 14, 10));
        List<Employee> team = List.of(employee("Alice", EmployeeRole.STANDARD), employee("Dave", EmployeeRole.STANDARD, 1));
        RosterModel model = oddWeights.build(new RosterProblem(team, Set.of(), List.of(MONDAY)),
                RosterFixtures.split(Set.of()));
        new FairnessObjective().apply(model);
        long[] values = new long[model.getLinearModel().variableCount()];
        set(values, model, "Alice", MONDAY, Shift.WEEKDAY_EVENING);

        RosterOutcome outcome = projector.project(model,
                new SolverResult(SolveStatus.OPTIMAL, values, 1L, Duration.ZERO));

        assertThat(outcome.summary().get(0)).isEqualTo(new SummaryRow("Alice", 0, 1.1, 1.1));
        // 1.1 - 1.0 in doubles would leave a rounding tail
        assertThat(outcome.pointSpread()).isEqualTo(0.1);
    }

    @Test
    void refusesResultWithoutAssignment() {
        RosterModel model = model();

        assertThatThrownBy(() -> projector.project(model,
                SolverResult.withoutAssignment(SolveStatus.INFEASIBLE, Duration.ZERO)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
