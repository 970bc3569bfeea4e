package org.carma.allocation.model;

/**
 * Selects which revision strategies run after the deciding phase of a round.
 * Used for ablation comparisons between the strategies.
 */
public enum AllocationMode {
    OFFLINE("Offline", false, false),
    NO_STRATEGY("No Strategy", false, false),
    REACTIVATE_ONLY("Reactivate Only", true, false),
    REASSIGN_ONLY("Reassign Only", false, true),
    BOTH("Reactivate + Reassign", true, true);

    private final String displayName;
    private final boolean reactivation;
    private final boolean reassignment;

    AllocationMode(String displayName, boolean reactivation, boolean reassignment) {
        this.displayName = displayName;
        this.reactivation = reactivation;
        this.reassignment = reassignment;
    }

    public boolean runsReactivation() {
        return reactivation;
    }

    public boolean runsReassignment() {
        return reassignment;
    }

    /**
     * Offline mode sees its whole batch at once and orders it before deciding.
     */
    public boolean isBatch() {
        return this == OFFLINE;
    }

    public boolean revises() {
        return reactivation || reassignment;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Parse a configuration value such as "both", "reassign_only" or "REACTIVATE-ONLY".
     */
    public static AllocationMode parse(String value) {
        String normalized = value.trim().toUpperCase().replace('-', '_').replace(' ', '_');
        return AllocationMode.valueOf(normalized);
    }

    @Override
    public String toString() {
        return displayName;
    }
}
