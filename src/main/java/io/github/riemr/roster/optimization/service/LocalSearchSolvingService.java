package io.github.riemr.roster.optimization.service;

import io.github.riemr.roster.domain.model.Employee;
import io.github.riemr.roster.domain.model.AssignmentKey;
import io.github.riemr.roster.engine.CoverageSlot;
import io.github.riemr.roster.engine.PointWeights;
import io.github.riemr.roster.engine.RosterModel;
import io.github.riemr.roster.engine.model.LinearConstraint;
import io.github.riemr.roster.engine.model.LinearExpr;
import io.github.riemr.roster.engine.model.ModelVariable;
import io.github.riemr.roster.optimization.entity.PointBaseline;
import io.github.riemr.roster.optimization.entity.SlotAssignment;
import io.github.riemr.roster.optimization.solution.RosterPlan;
import io.github.riemr.roster.solver.SolveStatus;
import io.github.riemr.roster.solver.SolverResult;
import io.github.riemr.roster.solver.SolvingException;
import io.github.riemr.roster.solver.SolvingService;
import lombok.extern.slf4j.Slf4j;
import org.optaplanner.core.api.score.buildin.hardsoft.HardSoftScore;
import org.optaplanner.core.api.solver.Solver;
import org.optaplanner.core.api.solver.SolverFactory;
import org.optaplanner.core.config.localsearch.LocalSearchPhaseConfig;
import org.optaplanner.core.config.phase.PhaseConfig;
import org.optaplanner.core.config.solver.SolverConfig;
import org.optaplanner.core.config.solver.termination.TerminationConfig;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * OptaPlanner によるヒューリスティック版。最適性は証明できないため、
 * ハード違反ゼロなら FEASIBLE、それ以外は TIMEOUT_NO_SOLUTION を返す。
 */
@Slf4j
public class LocalSearchSolvingService implements SolvingService {

    private final SolverConfig baseConfig;
    private final Duration unimprovedLimit;

    public LocalSearchSolvingService(SolverConfig baseConfig, Duration unimprovedLimit) {
        this.baseConfig = baseConfig;
        this.unimprovedLimit = unimprovedLimit;
    }

    @Override
    public String name() {
        return "local-search";
    }

    @Override
    public SolverResult solve(RosterModel model, Duration budget) {
        RosterPlan problem = toPlan(model);
        Solver<RosterPlan> solver = SolverFactory.<RosterPlan>create(configFor(budget)).buildSolver();

        long started = System.nanoTime();
        RosterPlan best;
        try {
            best = solver.solve(problem);
        } catch (RuntimeException e) {
            throw new SolvingException("local search failed: " + e.getMessage(), e);
        }
        Duration wall = Duration.ofNanos(System.nanoTime() - started);

        HardSoftScore score = best.getScore();
        log.info("Local search finished: score={}, wall={}ms", score, wall.toMillis());
        if (score == null || !score.isSolutionInitialized() || score.hardScore() < 0) {
            return SolverResult.withoutAssignment(SolveStatus.TIMEOUT_NO_SOLUTION, wall);
        }

        long[] values = toValues(model, best);
        for (LinearConstraint c : model.getLinearModel().getConstraints()) {
            if (c.kind().isHardRule() && !c.isSatisfied(values)) {
                log.warn("Local search result violates {}; discarding", c.label());
                return SolverResult.withoutAssignment(SolveStatus.TIMEOUT_NO_SOLUTION, wall);
            }
        }
        long max = Long.MIN_VALUE;
        long min = Long.MAX_VALUE;
        for (LinearExpr points : model.getPointExpressions().values()) {
            long p = points.evaluate(values);
            max = Math.max(max, p);
            min = Math.min(min, p);
        }
        if (model.getMaxPoints() != null) {
            long upper = model.getPointExpressions().isEmpty() ? 0 : max;
            long lower = model.getPointExpressions().isEmpty() ? 0 : min;
            values[model.getMaxPoints().getIndex()] = upper;
            values[model.getMinPoints().getIndex()] = lower;
        }
        long objective = model.getPointExpressions().isEmpty() ? 0 : max - min;
        return new SolverResult(SolveStatus.FEASIBLE, values, objective, wall);
    }

    RosterPlan toPlan(RosterModel model) {
        PointWeights weights = model.getWeights();
        Map<String, Employee> byName = model.getEmployees().stream()
                .collect(Collectors.toMap(Employee::getName, Function.identity()));
        List<SlotAssignment> entities = new ArrayList<>();
        for (CoverageSlot slot : model.getSlots()) {
            List<Employee> candidates = slot.effectiveCandidates().stream().map(byName::get).toList();
            entities.add(new SlotAssignment(slot.date(), slot.shift(), weights.weightOf(slot.shift()), candidates));
        }
        List<PointBaseline> baselines = model.getEmployees().stream()
                .map(e -> new PointBaseline(e.getName(), weights.scaled(e.getYtdPoints())))
                .toList();
        return new RosterPlan(model.getEmployees(), baselines, entities);
    }

    /** 各枠の選択から 0/1 ベクトルを作る。未割当の枠は何も立てない。 */
    static long[] toValues(RosterModel model, RosterPlan plan) {
        long[] values = new long[model.getLinearModel().variableCount()];
        for (SlotAssignment slot : plan.getSlotAssignments()) {
            if (slot.getAssignedEmployee() == null) continue;
            ModelVariable v = model.variable(
                    new AssignmentKey(slot.getAssignedEmployee().getName(), slot.getDate(), slot.getShift()));
            if (v != null) {
                values[v.getIndex()] = 1;
            }
        }
        return values;
    }

    private SolverConfig configFor(Duration budget) {
        SolverConfig config = baseConfig.copyConfig();
        TerminationConfig termination = new TerminationConfig().withSpentLimit(budget);
        if (unimprovedLimit != null && !unimprovedLimit.isZero() && !unimprovedLimit.isNegative()) {
            termination = termination.withUnimprovedSpentLimit(unimprovedLimit);
        }
        config.setTerminationConfig(termination);

        // 先行フェーズには必ずフェーズ終了条件が必要
        List<PhaseConfig> phases = new ArrayList<>(config.getPhaseConfigList());
        for (int i = 0; i < phases.size() - 1; i++) {
            if (phases.get(i) instanceof LocalSearchPhaseConfig ls) {
                LocalSearchPhaseConfig copy = ls.copyConfig();
                copy.setTerminationConfig(new TerminationConfig().withSpentLimit(budget.dividedBy(2)));
                phases.set(i, copy);
            }
        }
        config.setPhaseConfigList(phases);
        return config;
    }
}
