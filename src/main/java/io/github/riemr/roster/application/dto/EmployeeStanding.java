package io.github.riemr.roster.application.dto;

import io.github.riemr.roster.domain.model.Employee;
import io.github.riemr.roster.domain.model.HolidayStatus;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.time.LocalDate;

/**
 * 次期の従業員データ + 祝日免除状況。入力と同じ形なので次回の求解にそのまま渡せる。
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class EmployeeStanding extends EmployeeInput {

    /** この日以降は祝日勤務に入れる。免除なしなら null */
    private LocalDate immuneUntil;

    // Immune / Available
    private String holidayStatus;

    public static EmployeeStanding from(Employee e, LocalDate immuneUntil, HolidayStatus status) {
        EmployeeStanding out = new EmployeeStanding();
        out.setName(e.getName());
        out.setTeam(e.getTeam());
        out.setRole(e.getRole().getLabel());
        out.setYtdPoints(e.getYtdPoints());
        out.setBlackouts(e.getBlackouts().stream().sorted().toList());
        out.setHolidayBids(e.getHolidayBids().stream().sorted().toList());
        out.setLastSpecialDate(e.getLastSpecialDate());
        out.setImmuneUntil(immuneUntil);
        out.setHolidayStatus(status.getLabel());
        return out;
    }
}
