package io.agentrelay.model;

public enum Priority {
    ROUTINE("routine", 0),
    ELEVATED("elevated", 1),
    CRITICAL("critical", 2),
    URGENT("urgent", 3);

    private final String label;
    private final int rank;

    Priority(String label, int rank) {
        this.label = label;
        this.rank = rank;
    }

    public String label() {
        return label;
    }

    public int rank() {
        return rank;
    }

    public static Priority fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return ROUTINE;
        }
        for (Priority value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim()) || value.label.equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown priority: " + raw);
    }
}
