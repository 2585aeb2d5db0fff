package io.github.riemr.roster.solver;

import com.google.ortools.Loader;
import com.google.ortools.sat.CpModel;
import com.google.ortools.sat.CpSolver;
import com.google.ortools.sat.CpSolverStatus;
import com.google.ortools.sat.IntVar;
import com.google.ortools.sat.LinearExprBuilder;
import io.github.riemr.roster.engine.RosterModel;
import io.github.riemr.roster.engine.model.LinearConstraint;
import io.github.riemr.roster.engine.model.LinearExpr;
import io.github.riemr.roster.engine.model.LinearModel;
import io.github.riemr.roster.engine.model.ModelVariable;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;

/**
 * OR-tools CP-SAT backend. Translates the linear program one-to-one and solves it exactly.
 */
@Slf4j
public class CpSatSolvingService implements SolvingService {

    static {
        Loader.loadNativeLibraries();
    }

    private final int workers;
    private final Integer randomSeed;

    public CpSatSolvingService(int workers, Integer randomSeed) {
        this.workers = workers;
        this.randomSeed = randomSeed;
    }

    public CpSatSolvingService() {
        this(0, null);
    }

    @Override
    public String name() {
        return "cp-sat";
    }

    @Override
    public SolverResult solve(RosterModel model, Duration budget) {
        LinearModel lp = model.getLinearModel();
        CpModel cp = new CpModel();

        List<ModelVariable> variables = lp.getVariables();
        IntVar[] vars = new IntVar[variables.size()];
        for (ModelVariable v : variables) {
            vars[v.getIndex()] = v.isBoolean()
                    ? cp.newBoolVar(v.getName())
                    : cp.newIntVar(v.getLowerBound(), v.getUpperBound(), v.getName());
        }
        for (LinearConstraint c : lp.getConstraints()) {
            addConstraint(cp, vars, c);
        }
        if (lp.hasObjective()) {
            cp.minimize(toBuilder(vars, lp.getObjective()).add(lp.getObjective().getConstant()));
        }

        CpSolver solver = new CpSolver();
        solver.getParameters().setMaxTimeInSeconds(Math.max(0.001, budget.toMillis() / 1000.0));
        if (workers > 0) {
            solver.getParameters().setNumWorkers(workers);
        }
        if (randomSeed != null) {
            solver.getParameters().setRandomSeed(randomSeed);
        }

        long started = System.nanoTime();
        CpSolverStatus status = solver.solve(cp);
        Duration wall = Duration.ofNanos(System.nanoTime() - started);
        log.info("CP-SAT finished: status={}, wall={}ms, conflicts={}, branches={}",
                status, wall.toMillis(), solver.numConflicts(), solver.numBranches());

        switch (status) {
            case OPTIMAL:
            case FEASIBLE:
                long[] values = new long[vars.length];
                for (int i = 0; i < vars.length; i++) {
                    values[i] = solver.value(vars[i]);
                }
                Long objective = lp.hasObjective() ? Math.round(solver.objectiveValue()) : null;
                return new SolverResult(status == CpSolverStatus.OPTIMAL ? SolveStatus.OPTIMAL : SolveStatus.FEASIBLE,
                        values, objective, wall);
            case INFEASIBLE:
                return SolverResult.withoutAssignment(SolveStatus.INFEASIBLE, wall);
            case UNKNOWN:
                return SolverResult.withoutAssignment(SolveStatus.TIMEOUT_NO_SOLUTION, wall);
            default:
                throw new SolvingException("CP-SAT rejected the roster model: " + status
                        + " (" + cp.validate() + ")");
        }
    }

    private static void addConstraint(CpModel cp, IntVar[] vars, LinearConstraint c) {
        LinearExpr expr = c.expr();
        LinearExprBuilder lhs = toBuilder(vars, expr);
        // constant moves to the bounds
        long k = expr.getConstant();
        Long lb = c.lowerBound() == null ? null : c.lowerBound() - k;
        Long ub = c.upperBound() == null ? null : c.upperBound() - k;
        if (lb != null && lb.equals(ub)) {
            cp.addEquality(lhs, lb);
        } else if (lb != null && ub != null) {
            cp.addLinearConstraint(lhs, lb, ub);
        } else if (ub != null) {
            cp.addLessOrEqual(lhs, ub);
        } else {
            cp.addGreaterOrEqual(lhs, lb);
        }
    }

    private static LinearExprBuilder toBuilder(IntVar[] vars, LinearExpr expr) {
        LinearExprBuilder b = com.google.ortools.sat.LinearExpr.newBuilder();
        for (LinearExpr.Term t : expr.getTerms()) {
            b.addTerm(vars[t.variable().getIndex()], t.coefficient());
        }
        return b;
    }
}
