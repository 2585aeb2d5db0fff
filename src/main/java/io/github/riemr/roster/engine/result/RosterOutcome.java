package io.github.riemr.roster.engine.result;

import io.github.riemr.roster.solver.SolveStatus;

import java.util.List;

/**
 * 求解結果。成功なら全枠が埋まった当番表、失敗なら理由のみ（部分的な当番表は返さない）。
 */
public record RosterOutcome(
        SolveStatus status,
        List<RosterRow> roster,
        List<SummaryRow> summary,
        List<String> errors,
        Double pointSpread
) {

    public static final String CONSTRAINTS_TOO_TIGHT =
            "Logic conflict: constraints (rest rules or holiday bidding) are too tight to find a fair balance.";

    public RosterOutcome {
        roster = roster == null ? List.of() : List.copyOf(roster);
        summary = summary == null ? List.of() : List.copyOf(summary);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static RosterOutcome failed(SolveStatus status, List<String> errors) {
        return new RosterOutcome(status, List.of(), List.of(), errors, null);
    }

    public boolean isSuccess() {
        return status != null && status.hasAssignment() && errors.isEmpty();
    }
}
