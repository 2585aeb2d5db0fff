package io.github.riemr.roster.domain.model;

import java.time.DayOfWeek;
import java.time.LocalDate;

/**
 * 日付の区分。祝日 &gt; 週末 &gt; 平日 の優先順で判定される。
 */
public enum DayClass {
    WEEKDAY,
    WEEKEND,
    HOLIDAY;

    public static DayClass of(LocalDate date, boolean isHoliday) {
        if (isHoliday) {
            return HOLIDAY;
        }
        DayOfWeek dow = date.getDayOfWeek();
        return (dow == DayOfWeek.SATURDAY || dow == DayOfWeek.SUNDAY) ? WEEKEND : WEEKDAY;
    }
}
