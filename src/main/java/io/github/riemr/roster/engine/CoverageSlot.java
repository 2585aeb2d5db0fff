package io.github.riemr.roster.engine;

import io.github.riemr.roster.domain.model.Shift;

import java.time.LocalDate;
import java.util.List;

/**
 * One required (date, shift) slot with the names of the employees holding a variable for it.
 * {@code reservedFor} lists the eligible bidders when the slot is a bid reservation, otherwise empty.
 */
public record CoverageSlot(LocalDate date, Shift shift, List<String> candidates, List<String> reservedFor) {

    public CoverageSlot {
        candidates = List.copyOf(candidates);
        reservedFor = List.copyOf(reservedFor);
    }

    public boolean isReserved() {
        return !reservedFor.isEmpty();
    }

    /** Employees the slot may actually go to: the bidders when reserved, else every candidate. */
    public List<String> effectiveCandidates() {
        return isReserved() ? reservedFor : candidates;
    }
}
