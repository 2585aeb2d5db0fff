package io.github.riemr.roster.domain.model;

/**
 * 従業員区分。区分ごとに勤務できない枠を定義する（閉じた集合）。
 */
public enum EmployeeRole {

    STANDARD("Standard") {
        @Override
        public boolean permits(Shift shift) {
            return true;
        }
    },

    /** 夕方枠（全日区分含む）には入らない */
    NO_EVENING("No-Evening") {
        @Override
        public boolean permits(Shift shift) {
            return !shift.isEvening();
        }
    },

    /** 週末・祝日のみ */
    WEEKEND_ONLY("Weekend-Only") {
        @Override
        public boolean permits(Shift shift) {
            return shift.getDayClass() != DayClass.WEEKDAY;
        }
    };

    private final String label;

    EmployeeRole(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public abstract boolean permits(Shift shift);

    /**
     * Accepts enum names and the labels used by roster spreadsheets
     * ("Standard", "No-PM", "No-Evening", "Weekend-Only").
     */
    public static EmployeeRole fromCode(String code) {
        if (code == null || code.isBlank()) {
            return null;
        }
        String normalized = code.trim().toUpperCase().replace('-', '_').replace(' ', '_');
        if ("NO_PM".equals(normalized)) {
            return NO_EVENING;
        }
        try {
            return EmployeeRole.valueOf(normalized);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unknown employee role: " + code);
        }
    }
}
