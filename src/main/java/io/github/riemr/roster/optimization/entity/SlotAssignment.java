package io.github.riemr.roster.optimization.entity;

import io.github.riemr.roster.domain.model.Employee;
import io.github.riemr.roster.domain.model.Shift;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.optaplanner.core.api.domain.entity.PlanningEntity;
import org.optaplanner.core.api.domain.lookup.PlanningId;
import org.optaplanner.core.api.domain.valuerange.ValueRangeProvider;
import org.optaplanner.core.api.domain.variable.PlanningVariable;

import java.time.LocalDate;
import java.util.Collections;
import java.util.List;

/**
 * 必要枠（日付 × 枠）1件につき1エンティティ。従業員を1名選ぶ。
 */
@PlanningEntity
@Getter
@Setter
@ToString
public class SlotAssignment {

    @PlanningId
    private String id; // date + "|" + shift

    private LocalDate date;
    private Shift shift;
    /** 枠のポイント（スケール済み） */
    private int weight;

    // 当該枠に割当変数を持つ従業員（予約枠なら申請者のみ）
    @ToString.Exclude
    private List<Employee> candidateEmployees = Collections.emptyList();

    @PlanningVariable(valueRangeProviderRefs = {"slotCandidates"})
    private Employee assignedEmployee;

    public SlotAssignment() {
    }

    public SlotAssignment(LocalDate date, Shift shift, int weight, List<Employee> candidateEmployees) {
        this.id = date + "|" + shift.name();
        this.date = date;
        this.shift = shift;
        this.weight = weight;
        this.candidateEmployees = candidateEmployees;
    }

    public boolean isEvening() {
        return shift.isEvening();
    }

    @ValueRangeProvider(id = "slotCandidates")
    public List<Employee> getSlotCandidates() {
        return candidateEmployees == null ? List.of() : candidateEmployees;
    }
}
