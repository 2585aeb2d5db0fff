package io.github.riemr.roster.domain.model;

/**
 * 祝日勤務の可否（基準日時点）。
 */
public enum HolidayStatus {
    IMMUNE("Immune"),
    AVAILABLE("Available");

    private final String label;

    HolidayStatus(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
