package io.github.riemr.roster.application.service;

import io.github.riemr.roster.config.RosterSettings;
import io.github.riemr.roster.domain.model.ShiftScheme;
import io.github.riemr.roster.domain.rule.CalendarClassifier;
import io.github.riemr.roster.engine.FairnessObjective;
import io.github.riemr.roster.engine.Infeasibility;
import io.github.riemr.roster.engine.RosterModel;
import io.github.riemr.roster.engine.RosterModelBuilder;
import io.github.riemr.roster.engine.RosterProblem;
import io.github.riemr.roster.engine.RosterProjector;
import io.github.riemr.roster.engine.result.RosterOutcome;
import io.github.riemr.roster.solver.SolveStatus;
import io.github.riemr.roster.solver.SolverResult;
import io.github.riemr.roster.solver.SolvingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 当番表の求解パイプライン。
 * モデル構築 → 充足不能枠のチェック → 公平性目的関数 → 求解 → 結果の射影。
 * 呼び出しごとに独立し、状態は持たない。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RosterService {

    private final RosterModelBuilder modelBuilder;
    private final FairnessObjective fairnessObjective;
    private final SolvingService solvingService;
    private final RosterProjector projector;
    private final RosterSettings settings;

    public RosterOutcome solve(RosterProblem problem) {
        return solve(problem, null);
    }

    /**
     * @param schemeOverride null なら設定値のスキームを使う
     */
    public RosterOutcome solve(RosterProblem problem, ShiftScheme schemeOverride) {
        ShiftScheme scheme = schemeOverride != null ? schemeOverride : settings.scheme();
        CalendarClassifier calendar = new CalendarClassifier(scheme, settings.weekdayMorningCovered(), problem.holidays());

        RosterModel model = modelBuilder.build(problem, calendar);
        if (!model.isStructurallyFeasible()) {
            List<String> errors = model.getInfeasibilities().stream().map(Infeasibility::message).toList();
            log.warn("Roster is structurally infeasible: {} slot(s) without eligible employee", errors.size());
            return RosterOutcome.failed(SolveStatus.INFEASIBLE, errors);
        }
        fairnessObjective.apply(model);

        SolverResult result = solvingService.solve(model, settings.timeBudget());
        log.info("Roster solve finished: backend={}, status={}, objective={}, wall={}ms",
                solvingService.name(), result.status(), result.objectiveValue(), result.wallTime().toMillis());
        if (!result.status().hasAssignment()) {
            log.warn("No roster found ({}): constraints too tight", result.status());
            return RosterOutcome.failed(result.status(), List.of(RosterOutcome.CONSTRAINTS_TOO_TIGHT));
        }
        return projector.project(model, result);
    }
}
