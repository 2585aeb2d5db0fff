package io.github.riemr.roster.engine;

import io.github.riemr.roster.domain.model.AssignmentKey;
import io.github.riemr.roster.domain.model.Employee;
import io.github.riemr.roster.domain.rule.CalendarClassifier;
import io.github.riemr.roster.engine.model.LinearExpr;
import io.github.riemr.roster.engine.model.LinearModel;
import io.github.riemr.roster.engine.model.ModelVariable;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 1回の求解で作られるモデル。割当変数は eligible な (従業員, 日付, 枠) にのみ存在する。
 * 変数の並びは 日付 → 枠 → 入力された従業員順。
 */
@Getter
public class RosterModel {

    private final LinearModel linearModel = new LinearModel();
    private final List<Employee> employees;
    private final List<LocalDate> dates;
    private final CalendarClassifier calendar;
    private final PointWeights weights;

    @Getter(AccessLevel.NONE)
    private final Map<AssignmentKey, ModelVariable> variables = new LinkedHashMap<>();
    @Getter(AccessLevel.NONE)
    private final List<CoverageSlot> slots = new ArrayList<>();
    @Getter(AccessLevel.NONE)
    private final List<Infeasibility> infeasibilities = new ArrayList<>();
    @Getter(AccessLevel.NONE)
    private final Map<String, LinearExpr> pointExpressions = new LinkedHashMap<>();

    @Setter(AccessLevel.PACKAGE)
    private ModelVariable maxPoints;
    @Setter(AccessLevel.PACKAGE)
    private ModelVariable minPoints;

    RosterModel(List<Employee> employees, List<LocalDate> dates, CalendarClassifier calendar, PointWeights weights) {
        this.employees = List.copyOf(employees);
        this.dates = List.copyOf(dates);
        this.calendar = calendar;
        this.weights = weights;
    }

    ModelVariable addAssignment(AssignmentKey key) {
        ModelVariable v = linearModel.newBoolVar(key.toString());
        variables.put(key, v);
        return v;
    }

    void addSlot(CoverageSlot slot) {
        slots.add(slot);
    }

    void replaceSlot(int index, CoverageSlot slot) {
        slots.set(index, slot);
    }

    void addInfeasibility(Infeasibility infeasibility) {
        infeasibilities.add(infeasibility);
    }

    void putPointExpression(String employeeName, LinearExpr expr) {
        pointExpressions.put(employeeName, expr);
    }

    public ModelVariable variable(AssignmentKey key) {
        return variables.get(key);
    }

    public Map<AssignmentKey, ModelVariable> getVariables() {
        return Collections.unmodifiableMap(variables);
    }

    public List<CoverageSlot> getSlots() {
        return Collections.unmodifiableList(slots);
    }

    public List<Infeasibility> getInfeasibilities() {
        return Collections.unmodifiableList(infeasibilities);
    }

    public Map<String, LinearExpr> getPointExpressions() {
        return Collections.unmodifiableMap(pointExpressions);
    }

    /** False when some required slot has no eligible employee. */
    public boolean isStructurallyFeasible() {
        return infeasibilities.isEmpty();
    }

    public List<ModelVariable> variablesOn(String employeeName, LocalDate date) {
        List<ModelVariable> out = new ArrayList<>();
        for (var shift : calendar.shiftsFor(date)) {
            ModelVariable v = variables.get(new AssignmentKey(employeeName, date, shift));
            if (v != null) out.add(v);
        }
        return out;
    }
}
