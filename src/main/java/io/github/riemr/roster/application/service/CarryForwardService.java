package io.github.riemr.roster.application.service;

import io.github.riemr.roster.application.dto.EmployeeStanding;
import io.github.riemr.roster.domain.model.DayClass;
import io.github.riemr.roster.domain.model.Employee;
import io.github.riemr.roster.domain.rule.HolidayImmunity;
import io.github.riemr.roster.engine.result.RosterOutcome;
import io.github.riemr.roster.engine.result.RosterRow;
import io.github.riemr.roster.engine.result.SummaryRow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 確定した当番表を次期の従業員データに反映する。
 * ytdPoints は合計ポイントの切り捨て、lastSpecialDate は勤務した最新の祝日まで進める。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CarryForwardService {

    private final HolidayImmunity immunity;

    public List<Employee> carryForward(List<Employee> employees, RosterOutcome outcome) {
        if (outcome == null || !outcome.isSuccess()) {
            throw new IllegalArgumentException("carry-forward requires a successful roster outcome");
        }
        Map<String, SummaryRow> summary = outcome.summary().stream()
                .collect(Collectors.toMap(SummaryRow::employee, Function.identity(), (a, b) -> a));

        Map<String, LocalDate> latestHoliday = new HashMap<>();
        for (RosterRow row : outcome.roster()) {
            if (row.shift().getDayClass() != DayClass.HOLIDAY) continue;
            latestHoliday.merge(row.employee(), row.date(), (a, b) -> a.isAfter(b) ? a : b);
        }

        List<Employee> next = new ArrayList<>(employees.size());
        for (Employee e : employees) {
            SummaryRow row = summary.get(e.getName());
            if (row == null) {
                throw new IllegalArgumentException("employee not in roster summary: " + e.getName());
            }
            LocalDate last = e.getLastSpecialDate();
            LocalDate worked = latestHoliday.get(e.getName());
            if (worked != null && (last == null || worked.isAfter(last))) {
                last = worked;
            }
            next.add(e.toBuilder()
                    .ytdPoints((int) Math.floor(row.totalPoints()))
                    .lastSpecialDate(last)
                    .build());
        }
        log.info("Carried forward points for {} employee(s)", next.size());
        return next;
    }

    /** 基準日時点の祝日免除状況を付けて返す */
    public List<EmployeeStanding> standings(List<Employee> employees, LocalDate asOf) {
        return employees.stream()
                .map(e -> EmployeeStanding.from(e, immunity.immunityEnd(e), immunity.statusOn(e, asOf)))
                .toList();
    }
}
