package io.github.riemr.roster.engine.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Solver-neutral linear program: variables, linear constraints, and one objective to minimize.
 * Not thread-safe; built by a single solve invocation and discarded afterwards.
 */
public class LinearModel {

    private final List<ModelVariable> variables = new ArrayList<>();
    private final List<LinearConstraint> constraints = new ArrayList<>();
    private LinearExpr objective;

    public ModelVariable newBoolVar(String name) {
        ModelVariable v = new ModelVariable(variables.size(), name, 0, 1, true);
        variables.add(v);
        return v;
    }

    public ModelVariable newIntVar(long lowerBound, long upperBound, String name) {
        ModelVariable v = new ModelVariable(variables.size(), name, lowerBound, upperBound, false);
        variables.add(v);
        return v;
    }

    public void addConstraint(LinearConstraint constraint) {
        constraints.add(constraint);
    }

    public void minimize(LinearExpr expr) {
        this.objective = expr;
    }

    public List<ModelVariable> getVariables() {
        return Collections.unmodifiableList(variables);
    }

    public List<LinearConstraint> getConstraints() {
        return Collections.unmodifiableList(constraints);
    }

    public LinearExpr getObjective() {
        return objective;
    }

    public boolean hasObjective() {
        return objective != null;
    }

    public int variableCount() {
        return variables.size();
    }

    public long countConstraints(ConstraintKind kind) {
        return constraints.stream().filter(c -> c.kind() == kind).count();
    }
}
