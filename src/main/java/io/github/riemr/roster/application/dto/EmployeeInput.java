package io.github.riemr.roster.application.dto;

import io.github.riemr.roster.domain.model.Employee;
import io.github.riemr.roster.domain.model.EmployeeRole;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

@Data
public class EmployeeInput {
    @NotBlank(message = "name is required")
    private String name;

    @NotBlank(message = "team is required")
    private String team;

    // Standard / No-Evening (No-PM) / Weekend-Only
    @NotBlank(message = "role is required")
    private String role;

    @PositiveOrZero(message = "ytdPoints must be >= 0")
    private int ytdPoints;

    private List<LocalDate> blackouts = new ArrayList<>();
    private List<LocalDate> holidayBids = new ArrayList<>();
    private LocalDate lastSpecialDate;

    /* -------- DTO ⇔ Domain 変換 -------- */
    public Employee toDomain() {
        return Employee.builder()
                .name(name.trim())
                .team(team.trim())
                .role(EmployeeRole.fromCode(role))
                .ytdPoints(ytdPoints)
                .blackouts(blackouts == null ? List.of() : blackouts)
                .holidayBids(holidayBids == null ? List.of() : holidayBids)
                .lastSpecialDate(lastSpecialDate)
                .build();
    }
}
