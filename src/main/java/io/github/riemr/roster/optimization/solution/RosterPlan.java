package io.github.riemr.roster.optimization.solution;

import io.github.riemr.roster.domain.model.Employee;
import io.github.riemr.roster.optimization.entity.PointBaseline;
import io.github.riemr.roster.optimization.entity.SlotAssignment;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.optaplanner.core.api.domain.solution.PlanningEntityCollectionProperty;
import org.optaplanner.core.api.domain.solution.PlanningScore;
import org.optaplanner.core.api.domain.solution.PlanningSolution;
import org.optaplanner.core.api.domain.solution.ProblemFactCollectionProperty;
import org.optaplanner.core.api.score.buildin.hardsoft.HardSoftScore;

import java.util.List;

/**
 * 当番表のローカルサーチ用ソリューション。
 * 充足・勤務可否・祝日希望は各枠の値域で保証し、残りを制約で評価する。
 */
@PlanningSolution
@Getter
@Setter
@ToString
public class RosterPlan {

    @ProblemFactCollectionProperty
    private List<Employee> employeeList;

    @ProblemFactCollectionProperty
    private List<PointBaseline> baselineList;

    @PlanningEntityCollectionProperty
    private List<SlotAssignment> slotAssignments;

    @PlanningScore
    private HardSoftScore score;

    public RosterPlan() {
    }

    public RosterPlan(List<Employee> employeeList, List<PointBaseline> baselineList, List<SlotAssignment> slotAssignments) {
        this.employeeList = employeeList;
        this.baselineList = baselineList;
        this.slotAssignments = slotAssignments;
    }
}
