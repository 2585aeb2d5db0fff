package io.github.riemr.roster.domain.model;

/**
 * 勤務枠。各枠は日付区分・夕方区分・所属スキームを持つ。
 * 宣言順が同一日内の表示順になる。
 */
public enum Shift {
    WEEKDAY_MORNING(DayClass.WEEKDAY, false, ShiftScheme.SPLIT),
    WEEKDAY_EVENING(DayClass.WEEKDAY, true, ShiftScheme.SPLIT),
    WEEKEND_MORNING(DayClass.WEEKEND, false, ShiftScheme.SPLIT),
    WEEKEND_EVENING(DayClass.WEEKEND, true, ShiftScheme.SPLIT),
    HOLIDAY_MORNING(DayClass.HOLIDAY, false, ShiftScheme.SPLIT),
    HOLIDAY_EVENING(DayClass.HOLIDAY, true, ShiftScheme.SPLIT),

    // full-day slots span the evening, so the rest rule and No-Evening role apply to them
    WEEKDAY_EVENING_ONLY(DayClass.WEEKDAY, true, ShiftScheme.FULL_DAY),
    WEEKEND_FULL_DAY(DayClass.WEEKEND, true, ShiftScheme.FULL_DAY),
    HOLIDAY_FULL_DAY(DayClass.HOLIDAY, true, ShiftScheme.FULL_DAY);

    private final DayClass dayClass;
    private final boolean evening;
    private final ShiftScheme scheme;

    Shift(DayClass dayClass, boolean evening, ShiftScheme scheme) {
        this.dayClass = dayClass;
        this.evening = evening;
        this.scheme = scheme;
    }

    public DayClass getDayClass() {
        return dayClass;
    }

    public boolean isEvening() {
        return evening;
    }

    public ShiftScheme getScheme() {
        return scheme;
    }
}
