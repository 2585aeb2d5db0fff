package io.github.riemr.roster.domain.rule;

import io.github.riemr.roster.domain.model.DayClass;
import io.github.riemr.roster.domain.model.Shift;
import io.github.riemr.roster.domain.model.ShiftScheme;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class CalendarClassifierTest {

    private static final LocalDate MONDAY = LocalDate.of(2024, 3, 4);
    private static final LocalDate SATURDAY = LocalDate.of(2024, 3, 9);
    private static final LocalDate HOLIDAY_SATURDAY = LocalDate.of(2024, 3, 16);

    @Test
    void holidayWinsOverWeekend() {
        CalendarClassifier calendar = new CalendarClassifier(ShiftScheme.SPLIT, false, Set.of(HOLIDAY_SATURDAY));

        assertThat(calendar.classify(MONDAY)).isEqualTo(DayClass.WEEKDAY);
        assertThat(calendar.classify(SATURDAY)).isEqualTo(DayClass.WEEKEND);
        assertThat(calendar.classify(HOLIDAY_SATURDAY)).isEqualTo(DayClass.HOLIDAY);
    }

    @Test
    void splitScheme_weekdayCoversEveningOnlyByDefault() {
        CalendarClassifier calendar = new CalendarClassifier(ShiftScheme.SPLIT, false, Set.of(HOLIDAY_SATURDAY));

        assertThat(calendar.shiftsFor(MONDAY)).containsExactly(Shift.WEEKDAY_EVENING);
        assertThat(calendar.shiftsFor(SATURDAY)).containsExactly(Shift.WEEKEND_MORNING, Shift.WEEKEND_EVENING);
        assertThat(calendar.shiftsFor(HOLIDAY_SATURDAY)).containsExactly(Shift.HOLIDAY_MORNING, Shift.HOLIDAY_EVENING);
    }

    @Test
    void splitScheme_weekdayMorningWhenCovered() {
        CalendarClassifier calendar = new CalendarClassifier(ShiftScheme.SPLIT, true, Set.of());

        assertThat(calendar.shiftsFor(MONDAY)).containsExactly(Shift.WEEKDAY_MORNING, Shift.WEEKDAY_EVENING);
    }

    @Test
    void fullDayScheme_oneShiftPerDay() {
        CalendarClassifier calendar = new CalendarClassifier(ShiftScheme.FULL_DAY, true, Set.of(HOLIDAY_SATURDAY));

        assertThat(calendar.shiftsFor(MONDAY)).containsExactly(Shift.WEEKDAY_EVENING_ONLY);
        assertThat(calendar.shiftsFor(SATURDAY)).containsExactly(Shift.WEEKEND_FULL_DAY);
        assertThat(calendar.shiftsFor(HOLIDAY_SATURDAY)).containsExactly(Shift.HOLIDAY_FULL_DAY);
    }

    @Test
    void shiftsAlwaysBelongToActiveScheme() {
        for (ShiftScheme scheme : ShiftScheme.values()) {
            CalendarClassifier calendar = new CalendarClassifier(scheme, true, Set.of(HOLIDAY_SATURDAY));
            for (int i = 0; i < 14; i++) {
                LocalDate date = MONDAY.plusDays(i);
                assertThat(calendar.shiftsFor(date))
                        .isNotEmpty()
                        .allMatch(s -> s.getScheme() == scheme)
                        .allMatch(s -> s.getDayClass() == calendar.classify(date));
            }
        }
    }

    @Test
    void nullSchemeDefaultsToSplit() {
        CalendarClassifier calendar = new CalendarClassifier(null, false, null);

        assertThat(calendar.getScheme()).isEqualTo(ShiftScheme.SPLIT);
        assertThat(calendar.isHoliday(MONDAY)).isFalse();
    }
}
