package io.github.riemr.roster.domain.rule;

import io.github.riemr.roster.domain.model.DayClass;
import io.github.riemr.roster.domain.model.Shift;
import io.github.riemr.roster.domain.model.ShiftScheme;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Maps each date to the shifts that must be covered that day under the active scheme.
 * Holiday classification wins over weekend, weekend over weekday.
 */
public class CalendarClassifier {

    private final ShiftScheme scheme;
    private final boolean weekdayMorningCovered;
    private final Set<LocalDate> holidays;

    public CalendarClassifier(ShiftScheme scheme, boolean weekdayMorningCovered, Set<LocalDate> holidays) {
        this.scheme = scheme == null ? ShiftScheme.SPLIT : scheme;
        this.weekdayMorningCovered = weekdayMorningCovered;
        this.holidays = holidays == null ? Set.of() : Set.copyOf(holidays);
    }

    public ShiftScheme getScheme() {
        return scheme;
    }

    public boolean isHoliday(LocalDate date) {
        return holidays.contains(date);
    }

    public DayClass classify(LocalDate date) {
        return DayClass.of(date, isHoliday(date));
    }

    /** Shifts of the active scheme for the date's class, in enum order (morning before evening). */
    public List<Shift> shiftsFor(LocalDate date) {
        DayClass dayClass = classify(date);
        List<Shift> out = new ArrayList<>(2);
        for (Shift shift : Shift.values()) {
            if (shift.getScheme() != scheme || shift.getDayClass() != dayClass) continue;
            if (shift == Shift.WEEKDAY_MORNING && !weekdayMorningCovered) continue;
            out.add(shift);
        }
        return out;
    }
}
