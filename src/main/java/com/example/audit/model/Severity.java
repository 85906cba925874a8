package com.example.audit.model;

/**
 * Severity ranking used when two findings are combined.
 * <p>
 * Findings carry their severity as the raw label reported by a strategy; this enum only
 * decides which of two labels ranks higher. Labels are matched after trimming, with the
 * exact spelling below. Anything else ranks {@code 0}, below {@link #INFO}.
 */
public enum Severity {

    INFORMATIONAL("Informational", 1),
    INFO("Info", 1),
    LOW("Low", 2),
    MEDIUM("Medium", 3),
    HIGH("High", 4),
    CRITICAL("Critical", 5);

    /** Rank given to labels outside the table. */
    public static final int UNKNOWN_RANK = 0;

    private final String label;
    private final int rank;

    Severity(String label, int rank) {
        this.label = label;
        this.rank = rank;
    }

    public String label() {
        return label;
    }

    public int rank() {
        return rank;
    }

    /**
     * Returns the rank of a severity label, or {@link #UNKNOWN_RANK} if it is not recognized.
     */
    public static int rank(String severity) {
        if (severity == null) return UNKNOWN_RANK;
        String trimmed = severity.strip();
        for (Severity s : values()) {
            if (s.label.equals(trimmed)) {
                return s.rank;
            }
        }
        return UNKNOWN_RANK;
    }

    /**
     * Returns the higher-ranked of two labels. On equal rank the first one is kept.
     */
    public static String higher(String first, String second) {
        return rank(first) >= rank(second) ? first : second;
    }
}
