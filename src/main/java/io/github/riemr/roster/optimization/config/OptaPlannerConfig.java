package io.github.riemr.roster.optimization.config;

import io.github.riemr.roster.config.RosterSettings;
import io.github.riemr.roster.optimization.entity.SlotAssignment;
import io.github.riemr.roster.optimization.constraint.RosterConstraintProvider;
import io.github.riemr.roster.optimization.service.LocalSearchSolvingService;
import io.github.riemr.roster.optimization.solution.RosterPlan;
import org.optaplanner.core.config.constructionheuristic.ConstructionHeuristicPhaseConfig;
import org.optaplanner.core.config.constructionheuristic.ConstructionHeuristicType;
import org.optaplanner.core.config.heuristic.selector.common.SelectionOrder;
import org.optaplanner.core.config.heuristic.selector.entity.EntitySelectorConfig;
import org.optaplanner.core.config.heuristic.selector.move.composite.UnionMoveSelectorConfig;
import org.optaplanner.core.config.heuristic.selector.move.generic.ChangeMoveSelectorConfig;
import org.optaplanner.core.config.heuristic.selector.move.generic.SwapMoveSelectorConfig;
import org.optaplanner.core.config.heuristic.selector.value.ValueSelectorConfig;
import org.optaplanner.core.config.localsearch.LocalSearchPhaseConfig;
import org.optaplanner.core.config.localsearch.LocalSearchType;
import org.optaplanner.core.config.phase.PhaseConfig;
import org.optaplanner.core.config.score.director.ScoreDirectorFactoryConfig;
import org.optaplanner.core.config.solver.SolverConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Arrays;
import java.util.List;

/**
 * ローカルサーチ版ソルバーの構成。
 * CH(FIRST_FIT) → LS(LATE_ACCEPTANCE で多様化) → LS(TABU_SEARCH で収束)
 * 終了条件は求解ごとの時間予算から {@link LocalSearchSolvingService} が付与する。
 */
@Configuration
public class OptaPlannerConfig {

    @Bean
    public SolverConfig rosterSolverConfig() {
        SolverConfig solverConfig = new SolverConfig()
                .withSolutionClass(RosterPlan.class)
                .withEntityClasses(SlotAssignment.class);
        solverConfig.setScoreDirectorFactoryConfig(new ScoreDirectorFactoryConfig()
                .withConstraintProviderClass(RosterConstraintProvider.class));

        ConstructionHeuristicPhaseConfig construction = new ConstructionHeuristicPhaseConfig();
        construction.setConstructionHeuristicType(ConstructionHeuristicType.FIRST_FIT);

        // 先行フェーズの終了条件は LocalSearchSolvingService で設定する
        LocalSearchPhaseConfig diversify = new LocalSearchPhaseConfig();
        diversify.setLocalSearchType(LocalSearchType.LATE_ACCEPTANCE);
        diversify.setMoveSelectorConfig(changeAndSwap());

        LocalSearchPhaseConfig converge = new LocalSearchPhaseConfig();
        converge.setLocalSearchType(LocalSearchType.TABU_SEARCH);
        converge.setMoveSelectorConfig(changeAndSwap());

        solverConfig.setPhaseConfigList(List.<PhaseConfig>of(construction, diversify, converge));
        return solverConfig;
    }

    @Bean
    public LocalSearchSolvingService localSearchSolvingService(SolverConfig rosterSolverConfig, RosterSettings settings) {
        return new LocalSearchSolvingService(rosterSolverConfig, settings.localSearchUnimprovedLimit());
    }

    private UnionMoveSelectorConfig changeAndSwap() {
        ChangeMoveSelectorConfig change = new ChangeMoveSelectorConfig();
        change.setEntitySelectorConfig(new EntitySelectorConfig()
                .withEntityClass(SlotAssignment.class)
                .withSelectionOrder(SelectionOrder.RANDOM));
        change.setValueSelectorConfig(new ValueSelectorConfig()
                .withVariableName("assignedEmployee")
                .withSelectionOrder(SelectionOrder.RANDOM));

        // 予約枠どうしでも値域外の交換は OptaPlanner 側で除外される
        SwapMoveSelectorConfig swap = new SwapMoveSelectorConfig();
        swap.setEntitySelectorConfig(new EntitySelectorConfig()
                .withEntityClass(SlotAssignment.class)
                .withSelectionOrder(SelectionOrder.RANDOM));

        UnionMoveSelectorConfig union = new UnionMoveSelectorConfig();
        union.setMoveSelectorList(Arrays.asList(change, swap));
        return union;
    }
}
