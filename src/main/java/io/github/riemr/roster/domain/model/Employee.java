package io.github.riemr.roster.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDate;
import java.util.Set;

/**
 * 当番対象の従業員。1回の求解の間は不変。
 * name が全体の結合キーになる。
 */
@Value
@Builder(toBuilder = true)
public class Employee {
    String name;
    String team;
    EmployeeRole role;
    /** 前期までの累積ポイント */
    int ytdPoints;
    @Singular
    Set<LocalDate> blackouts;
    @Singular
    Set<LocalDate> holidayBids;
    /** 直近で祝日勤務した日（免除期間の起点） */
    LocalDate lastSpecialDate;

    public boolean isBlackedOut(LocalDate date) {
        return blackouts.contains(date);
    }

    public boolean hasBidFor(LocalDate date) {
        return holidayBids.contains(date);
    }

    @Override
    public String toString() {
        return name;
    }
}
