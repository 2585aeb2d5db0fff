package io.github.riemr.roster.optimization.constraint;

import io.github.riemr.roster.optimization.entity.PointBaseline;
import io.github.riemr.roster.optimization.entity.SlotAssignment;
import org.optaplanner.core.api.score.buildin.hardsoft.HardSoftScore;
import org.optaplanner.core.api.score.stream.Constraint;
import org.optaplanner.core.api.score.stream.ConstraintCollectors;
import org.optaplanner.core.api.score.stream.ConstraintFactory;
import org.optaplanner.core.api.score.stream.ConstraintProvider;
import org.optaplanner.core.api.score.stream.Joiners;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 当番表の制約定義。
 * <ul>
 *   <li>ハード: 1日1枠、夕方勤務の翌日は休み</li>
 *   <li>ソフト: 合計ポイントの最大と最小の差</li>
 * </ul>
 * 充足（各枠1名）と勤務可否は値域で保証されるため、ここでは扱わない。
 */
public class RosterConstraintProvider implements ConstraintProvider {

    @Override
    public Constraint[] defineConstraints(ConstraintFactory factory) {
        return new Constraint[] {
            employeeNotDoubleBooked(factory),
            restAfterEveningShift(factory),

            minimizePointSpread(factory)
        };
    }

    private Constraint employeeNotDoubleBooked(ConstraintFactory f) {
        return f.forEachUniquePair(SlotAssignment.class,
                        Joiners.equal(SlotAssignment::getDate),
                        Joiners.equal(SlotAssignment::getAssignedEmployee))
                .penalize(HardSoftScore.ONE_HARD)
                .asConstraint("Employee not double booked");
    }

    private Constraint restAfterEveningShift(ConstraintFactory f) {
        return f.forEach(SlotAssignment.class)
                .filter(SlotAssignment::isEvening)
                .join(SlotAssignment.class,
                        Joiners.equal(sa -> sa.getDate().plusDays(1), SlotAssignment::getDate),
                        Joiners.equal(SlotAssignment::getAssignedEmployee, SlotAssignment::getAssignedEmployee))
                .penalize(HardSoftScore.ONE_HARD)
                .asConstraint("Rest after evening shift");
    }

    private Constraint minimizePointSpread(ConstraintFactory f) {
        return f.forEach(SlotAssignment.class)
                .groupBy(ConstraintCollectors.<SlotAssignment>toList())
                .join(f.forEach(PointBaseline.class).groupBy(ConstraintCollectors.<PointBaseline>toList()))
                .penalize(HardSoftScore.ONE_SOFT, RosterConstraintProvider::pointSpread)
                .asConstraint("Minimize point spread");
    }

    static int pointSpread(List<SlotAssignment> slots, List<PointBaseline> baselines) {
        Map<String, Long> totals = new HashMap<>();
        for (PointBaseline b : baselines) {
            totals.put(b.getEmployeeName(), b.getBasePoints());
        }
        for (SlotAssignment sa : slots) {
            totals.merge(sa.getAssignedEmployee().getName(), (long) sa.getWeight(), Long::sum);
        }
        long max = Long.MIN_VALUE;
        long min = Long.MAX_VALUE;
        for (long total : totals.values()) {
            max = Math.max(max, total);
            min = Math.min(min, total);
        }
        return totals.isEmpty() ? 0 : (int) Math.min(Integer.MAX_VALUE, max - min);
    }
}
