package io.github.riemr.roster.solver;

import io.github.riemr.roster.domain.model.AssignmentKey;
import io.github.riemr.roster.domain.model.Employee;
import io.github.riemr.roster.domain.model.EmployeeRole;
import io.github.riemr.roster.domain.rule.CalendarClassifier;
import io.github.riemr.roster.engine.FairnessObjective;
import io.github.riemr.roster.engine.RosterFixtures;
import io.github.riemr.roster.engine.RosterModel;
import io.github.riemr.roster.engine.RosterProblem;
import io.github.riemr.roster.engine.model.LinearConstraint;
import io.github.riemr.roster.engine.model.ModelVariable;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static io.github.riemr.roster.engine.RosterFixtures.MONDAY;
import static io.github.riemr.roster.engine.RosterFixtures.days;
import static io.github.riemr.roster.engine.RosterFixtures.employee;
import static org.assertj.core.api.Assertions.assertThat;

class CpSatSolvingServiceTest {

    private final CpSatSolvingService service = new CpSatSolvingService(1, 42);

    private static RosterModel solvable(List<Employee> team, int days) {
        CalendarClassifier calendar = RosterFixtures.split(Set.of());
        RosterModel model = RosterFixtures.builder().build(new RosterProblem(team, Set.of(), days(MONDAY, days)), calendar);
        new FairnessObjective().apply(model);
        return model;
    }

    @Test
    void findsOptimalAssignmentSatisfyingEveryConstraint() {
        RosterModel model = solvable(RosterFixtures.mixedTeam(), 7);

        SolverResult result = service.solve(model, Duration.ofSeconds(10));

        assertThat(result.status()).isEqualTo(SolveStatus.OPTIMAL);
        for (LinearConstraint c : model.getLinearModel().getConstraints()) {
            assertThat(c.isSatisfied(result.values())).as(c.label()).isTrue();
        }
        long max = result.value(model.getMaxPoints());
        long min = result.value(model.getMinPoints());
        assertThat(result.objectiveValue()).isEqualTo(max - min);
    }

    @Test
    void equalTeamOnOneWeekendDay_splitsEvenly() {
        List<Employee> team = List.of(employee("Alice", EmployeeRole.STANDARD), employee("Dave", EmployeeRole.STANDARD));
        RosterModel model = RosterFixtures.builder().build(
                new RosterProblem(team, Set.of(), List.of(MONDAY.plusDays(5))), RosterFixtures.split(Set.of()));
        new FairnessObjective().apply(model);

        SolverResult result = service.solve(model, Duration.ofSeconds(10));

        assertThat(result.status()).isEqualTo(SolveStatus.OPTIMAL);
        assertThat(result.objectiveValue()).isZero();
    }

    @Test
    void restRulesTooTight_reportsInfeasible() {
        // one employee cannot cover two consecutive evenings
        RosterModel model = solvable(List.of(employee("Alice", EmployeeRole.STANDARD)), 2);

        SolverResult result = service.solve(model, Duration.ofSeconds(10));

        assertThat(result.status()).isEqualTo(SolveStatus.INFEASIBLE);
        assertThat(result.values()).isNull();
        assertThat(result.status().hasAssignment()).isFalse();
    }

    @Test
    void valuesAreIndexedByModelVariable() {
        RosterModel model = solvable(List.of(employee("Alice", EmployeeRole.STANDARD)), 1);

        SolverResult result = service.solve(model, Duration.ofSeconds(10));

        Map<AssignmentKey, ModelVariable> vars = model.getVariables();
        assertThat(vars).hasSize(1);
        assertThat(result.isTrue(vars.values().iterator().next())).isTrue();
        assertThat(result.values()).hasSize(model.getLinearModel().variableCount());
        assertThat(service.name()).isEqualTo("cp-sat");
    }
}
