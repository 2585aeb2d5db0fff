package io.github.riemr.roster.engine;

import io.github.riemr.roster.domain.model.AssignmentKey;
import io.github.riemr.roster.domain.model.Employee;
import io.github.riemr.roster.engine.model.ConstraintKind;
import io.github.riemr.roster.engine.model.LinearConstraint;
import io.github.riemr.roster.engine.model.LinearExpr;
import io.github.riemr.roster.engine.model.LinearModel;
import io.github.riemr.roster.engine.model.ModelVariable;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Min-max fairness: minimize {@code max_points - min_points} over every employee's
 * projected total {@code ytd*scale + Σ weight·assignment}.
 */
public class FairnessObjective {

    public void apply(RosterModel model) {
        if (!model.isStructurallyFeasible()) {
            throw new IllegalStateException("fairness objective requires a structurally feasible model");
        }
        PointWeights weights = model.getWeights();
        LinearModel lp = model.getLinearModel();

        Map<String, LinearExpr.Builder> builders = new LinkedHashMap<>();
        long maxBase = 0;
        for (Employee e : model.getEmployees()) {
            long base = weights.scaled(e.getYtdPoints());
            maxBase = Math.max(maxBase, base);
            builders.put(e.getName(), LinearExpr.builder().addConstant(base));
        }
        long workload = 0;
        for (Map.Entry<AssignmentKey, ModelVariable> entry : model.getVariables().entrySet()) {
            int w = weights.weightOf(entry.getKey().shift());
            builders.get(entry.getKey().employeeName()).addTerm(entry.getValue(), w);
            workload += w;
        }

        long upperBound = maxBase + workload;
        ModelVariable max = lp.newIntVar(0, upperBound, "max_points");
        ModelVariable min = lp.newIntVar(0, upperBound, "min_points");

        for (Map.Entry<String, LinearExpr.Builder> entry : builders.entrySet()) {
            LinearExpr points = entry.getValue().build();
            model.putPointExpression(entry.getKey(), points);
            // max - points >= 0, min - points <= 0
            lp.addConstraint(LinearConstraint.atLeast("max_ge_" + entry.getKey(), ConstraintKind.FAIRNESS_UPPER,
                    LinearExpr.builder().addTerm(max, 1).addExpr(points, -1).build(), 0));
            lp.addConstraint(LinearConstraint.atMost("min_le_" + entry.getKey(), ConstraintKind.FAIRNESS_LOWER,
                    LinearExpr.builder().addTerm(min, 1).addExpr(points, -1).build(), 0));
        }
        model.setMaxPoints(max);
        model.setMinPoints(min);
        lp.minimize(LinearExpr.builder().addTerm(max, 1).addTerm(min, -1).build());
    }
}
