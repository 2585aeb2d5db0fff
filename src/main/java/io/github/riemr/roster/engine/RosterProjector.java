package io.github.riemr.roster.engine;

import io.github.riemr.roster.domain.model.AssignmentKey;
import io.github.riemr.roster.domain.model.Employee;
import io.github.riemr.roster.engine.model.ModelVariable;
import io.github.riemr.roster.engine.result.RosterOutcome;
import io.github.riemr.roster.engine.result.RosterRow;
import io.github.riemr.roster.engine.result.SummaryRow;
import io.github.riemr.roster.solver.SolverResult;

import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns solved assignment values into the roster and points summary tables.
 */
public class RosterProjector {

    public RosterOutcome project(RosterModel model, SolverResult result) {
        if (!result.status().hasAssignment()) {
            throw new IllegalArgumentException("cannot project a result without assignment: " + result.status());
        }
        PointWeights weights = model.getWeights();

        List<RosterRow> roster = new ArrayList<>();
        Map<String, Long> earned = new LinkedHashMap<>();
        for (Employee e : model.getEmployees()) {
            earned.put(e.getName(), 0L);
        }
        // 変数は 日付 → 枠 → 従業員 の順に並んでいる
        for (Map.Entry<AssignmentKey, ModelVariable> entry : model.getVariables().entrySet()) {
            if (!result.isTrue(entry.getValue())) continue;
            AssignmentKey key = entry.getKey();
            roster.add(new RosterRow(key.date(),
                    key.date().getDayOfWeek().getDisplayName(TextStyle.FULL, Locale.ENGLISH),
                    key.employeeName(), key.shift()));
            earned.merge(key.employeeName(), (long) weights.weightOf(key.shift()), Long::sum);
        }

        List<SummaryRow> summary = new ArrayList<>();
        long max = Long.MIN_VALUE;
        long min = Long.MAX_VALUE;
        for (Employee e : model.getEmployees()) {
            long earnedScaled = earned.get(e.getName());
            long totalScaled = weights.scaled(e.getYtdPoints()) + earnedScaled;
            summary.add(new SummaryRow(e.getName(), e.getYtdPoints(),
                    weights.toDisplay(earnedScaled), weights.toDisplay(totalScaled)));
            max = Math.max(max, totalScaled);
            min = Math.min(min, totalScaled);
        }
        // 差はスケール済みの整数で取り、表示単位への変換は1回だけ
        Double spread = summary.isEmpty() ? null : weights.toDisplay(max - min);
        return new RosterOutcome(result.status(), roster, summary, List.of(), spread);
    }
}
