package io.github.riemr.roster.domain.rule;

import io.github.riemr.roster.domain.model.DayClass;
import io.github.riemr.roster.domain.model.Employee;
import io.github.riemr.roster.domain.model.Shift;

import java.time.LocalDate;

/**
 * 勤務可否の判定。副作用なし。
 * 判定順: 勤務不可日 → 祝日免除 → 日付区分と枠区分の一致 → 従業員区分の制限
 */
public class EligibilityRules {

    private final HolidayImmunity immunity;

    public EligibilityRules(HolidayImmunity immunity) {
        this.immunity = immunity;
    }

    public boolean canWork(Employee employee, LocalDate date, Shift shift, boolean isHoliday) {
        if (employee.isBlackedOut(date)) {
            return false;
        }
        if (isHoliday && immunity.isImmune(employee, date)) {
            return false;
        }
        if (shift.getDayClass() != DayClass.of(date, isHoliday)) {
            return false;
        }
        return employee.getRole().permits(shift);
    }
}
