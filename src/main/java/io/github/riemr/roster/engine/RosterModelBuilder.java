package io.github.riemr.roster.engine;

import io.github.riemr.roster.domain.model.AssignmentKey;
import io.github.riemr.roster.domain.model.Employee;
import io.github.riemr.roster.domain.model.Shift;
import io.github.riemr.roster.domain.rule.CalendarClassifier;
import io.github.riemr.roster.domain.rule.EligibilityRules;
import io.github.riemr.roster.engine.model.ConstraintKind;
import io.github.riemr.roster.engine.model.LinearConstraint;
import io.github.riemr.roster.engine.model.LinearExpr;
import io.github.riemr.roster.engine.model.ModelVariable;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * 割当変数とハード制約を組み立てる。
 * <ol>
 *   <li>変数列挙（日付 × 必要枠 × 勤務可能な従業員）</li>
 *   <li>充足制約（各枠ちょうど1名）。候補ゼロの枠があれば全件記録してここで打ち切る</li>
 *   <li>1日1枠</li>
 *   <li>夕方勤務の翌日は休み</li>
 *   <li>祝日の希望申請（申請者がいる枠は申請者の中から1名）</li>
 * </ol>
 * 後段は 1 の変数集合に依存するため、この順序で実行する。
 */
@Slf4j
public class RosterModelBuilder {

    private final EligibilityRules rules;
    private final PointWeights weights;

    public RosterModelBuilder(EligibilityRules rules, PointWeights weights) {
        this.rules = rules;
        this.weights = weights;
    }

    public RosterModel build(RosterProblem problem, CalendarClassifier calendar) {
        validateEmployees(problem.employees());
        List<LocalDate> dates = new ArrayList<>(new TreeSet<>(problem.dates()));

        RosterModel model = new RosterModel(problem.employees(), dates, calendar, weights);
        createVariables(model);
        addCoverageConstraints(model);
        if (!model.isStructurallyFeasible()) {
            log.warn("Roster model has {} unfillable slot(s); skipping remaining constraints",
                    model.getInfeasibilities().size());
            return model;
        }
        addOneShiftPerDayConstraints(model);
        addRestConstraints(model);
        addHolidayBidConstraints(model);

        if (log.isInfoEnabled()) {
            log.info("Roster model built: dates={}, slots={}, variables={}, constraints={}",
                    dates.size(), model.getSlots().size(), model.getVariables().size(),
                    model.getLinearModel().getConstraints().size());
        }
        return model;
    }

    private static void validateEmployees(List<Employee> employees) {
        Set<String> seen = new HashSet<>();
        for (Employee e : employees) {
            if (e.getName() == null || e.getName().isBlank()) {
                throw new IllegalArgumentException("employee name must not be blank");
            }
            if (e.getRole() == null) {
                throw new IllegalArgumentException("employee role is required: " + e.getName());
            }
            if (!seen.add(e.getName())) {
                throw new IllegalArgumentException("duplicate employee name: " + e.getName());
            }
        }
    }

    private void createVariables(RosterModel model) {
        CalendarClassifier calendar = model.getCalendar();
        for (LocalDate date : model.getDates()) {
            boolean holiday = calendar.isHoliday(date);
            for (Shift shift : calendar.shiftsFor(date)) {
                for (Employee e : model.getEmployees()) {
                    if (rules.canWork(e, date, shift, holiday)) {
                        model.addAssignment(new AssignmentKey(e.getName(), date, shift));
                    }
                }
            }
        }
    }

    private void addCoverageConstraints(RosterModel model) {
        CalendarClassifier calendar = model.getCalendar();
        for (LocalDate date : model.getDates()) {
            for (Shift shift : calendar.shiftsFor(date)) {
                List<String> candidates = new ArrayList<>();
                List<ModelVariable> vars = new ArrayList<>();
                for (Employee e : model.getEmployees()) {
                    ModelVariable v = model.variable(new AssignmentKey(e.getName(), date, shift));
                    if (v != null) {
                        candidates.add(e.getName());
                        vars.add(v);
                    }
                }
                if (vars.isEmpty()) {
                    Infeasibility gap = Infeasibility.noEligibleEmployee(date, shift);
                    log.debug("{}", gap.message());
                    model.addInfeasibility(gap);
                    continue;
                }
                model.addSlot(new CoverageSlot(date, shift, candidates, List.of()));
                model.getLinearModel().addConstraint(LinearConstraint.equalTo(
                        "cover_" + date + "_" + shift.name(), ConstraintKind.COVERAGE, LinearExpr.sum(vars), 1));
            }
        }
    }

    private void addOneShiftPerDayConstraints(RosterModel model) {
        for (Employee e : model.getEmployees()) {
            for (LocalDate date : model.getDates()) {
                List<ModelVariable> today = model.variablesOn(e.getName(), date);
                // 1 variable alone is already bounded by its domain
                if (today.size() > 1) {
                    model.getLinearModel().addConstraint(LinearConstraint.atMost(
                            "one_per_day_" + e.getName() + "_" + date, ConstraintKind.ONE_SHIFT_PER_DAY,
                            LinearExpr.sum(today), 1));
                }
            }
        }
    }

    /**
     * 夕方系の枠に入った翌日は勤務なし。
     * 対象は暦上で連続する日付の組のみで、入力の日付に欠けがある場合その前後はつながない。
     */
    private void addRestConstraints(RosterModel model) {
        List<LocalDate> dates = model.getDates();
        for (Employee e : model.getEmployees()) {
            for (int i = 0; i + 1 < dates.size(); i++) {
                LocalDate today = dates.get(i);
                LocalDate tomorrow = dates.get(i + 1);
                if (!today.plusDays(1).equals(tomorrow)) {
                    continue;
                }
                List<ModelVariable> evening = new ArrayList<>();
                for (Shift shift : model.getCalendar().shiftsFor(today)) {
                    if (!shift.isEvening()) continue;
                    ModelVariable v = model.variable(new AssignmentKey(e.getName(), today, shift));
                    if (v != null) evening.add(v);
                }
                List<ModelVariable> next = model.variablesOn(e.getName(), tomorrow);
                if (evening.isEmpty() || next.isEmpty()) {
                    continue;
                }
                LinearExpr expr = LinearExpr.builder().addAll(evening).addAll(next).build();
                model.getLinearModel().addConstraint(LinearConstraint.atMost(
                        "rest_" + e.getName() + "_" + today, ConstraintKind.REST, expr, 1));
            }
        }
    }

    private void addHolidayBidConstraints(RosterModel model) {
        List<CoverageSlot> slots = model.getSlots();
        for (int i = 0; i < slots.size(); i++) {
            CoverageSlot slot = slots.get(i);
            if (!model.getCalendar().isHoliday(slot.date())) {
                continue;
            }
            List<String> bidders = new ArrayList<>();
            List<ModelVariable> vars = new ArrayList<>();
            for (Employee e : model.getEmployees()) {
                if (!e.hasBidFor(slot.date())) continue;
                ModelVariable v = model.variable(new AssignmentKey(e.getName(), slot.date(), slot.shift()));
                if (v != null) {
                    bidders.add(e.getName());
                    vars.add(v);
                }
            }
            if (vars.isEmpty()) {
                continue;
            }
            model.replaceSlot(i, new CoverageSlot(slot.date(), slot.shift(), slot.candidates(), bidders));
            model.getLinearModel().addConstraint(LinearConstraint.equalTo(
                    "bid_" + slot.date() + "_" + slot.shift().name(), ConstraintKind.HOLIDAY_BID,
                    LinearExpr.sum(vars), 1));
        }
    }
}
