package io.github.riemr.roster.engine;

import io.github.riemr.roster.domain.model.Employee;
import io.github.riemr.roster.domain.model.EmployeeRole;
import io.github.riemr.roster.domain.model.ShiftScheme;
import io.github.riemr.roster.domain.rule.CalendarClassifier;
import io.github.riemr.roster.domain.rule.EligibilityRules;
import io.github.riemr.roster.domain.rule.HolidayImmunity;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Shared test data. 2024-03-04 is a Monday.
 */
public final class RosterFixtures {

    public static final LocalDate MONDAY = LocalDate.of(2024, 3, 4);
    public static final LocalDate HOLIDAY_MONDAY = LocalDate.of(2024, 5, 6);

    private RosterFixtures() {
    }

    public static Employee employee(String name, EmployeeRole role) {
        return Employee.builder().name(name).team("Ops").role(role).build();
    }

    public static Employee employee(String name, EmployeeRole role, int ytdPoints) {
        return Employee.builder().name(name).team("Ops").role(role).ytdPoints(ytdPoints).build();
    }

    public static List<LocalDate> days(LocalDate start, int count) {
        List<LocalDate> out = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            out.add(start.plusDays(i));
        }
        return out;
    }

    public static List<Employee> mixedTeam() {
        return List.of(
                employee("Alice", EmployeeRole.STANDARD),
                employee("Bob", EmployeeRole.NO_EVENING),
                employee("Carol", EmployeeRole.WEEKEND_ONLY),
                employee("Dave", EmployeeRole.STANDARD));
    }

    public static RosterModelBuilder builder() {
        return new RosterModelBuilder(new EligibilityRules(new HolidayImmunity()), PointWeights.DEFAULT);
    }

    public static CalendarClassifier split(Set<LocalDate> holidays) {
        return new CalendarClassifier(ShiftScheme.SPLIT, false, holidays);
    }

    public static CalendarClassifier fullDay(Set<LocalDate> holidays) {
        return new CalendarClassifier(ShiftScheme.FULL_DAY, false, holidays);
    }
}
