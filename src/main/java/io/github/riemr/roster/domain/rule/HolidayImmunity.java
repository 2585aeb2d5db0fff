package io.github.riemr.roster.domain.rule;

import io.github.riemr.roster.domain.model.Employee;
import io.github.riemr.roster.domain.model.HolidayStatus;

import java.time.LocalDate;

/**
 * 祝日勤務後の免除期間。
 * 起点日の暦上の応当日（既定 2 年後）より前は祝日勤務に入れない。
 */
public class HolidayImmunity {

    public static final int DEFAULT_YEARS = 2;

    private final int years;

    public HolidayImmunity(int years) {
        if (years < 0) {
            throw new IllegalArgumentException("immunity years must be >= 0");
        }
        this.years = years;
    }

    public HolidayImmunity() {
        this(DEFAULT_YEARS);
    }

    /**
     * First day the employee may work a holiday shift again, or {@code null} if never immune.
     * plusYears clamps 29 Feb to 28 Feb when the target year has no leap day.
     */
    public LocalDate immunityEnd(Employee employee) {
        LocalDate last = employee.getLastSpecialDate();
        return last == null ? null : last.plusYears(years);
    }

    public boolean isImmune(Employee employee, LocalDate date) {
        LocalDate end = immunityEnd(employee);
        return end != null && date.isBefore(end);
    }

    public HolidayStatus statusOn(Employee employee, LocalDate date) {
        return isImmune(employee, date) ? HolidayStatus.IMMUNE : HolidayStatus.AVAILABLE;
    }
}
