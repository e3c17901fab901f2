package com.migrationanalyzer.core.model;

/**
 * Severity levels shared by dependencies, findings and advisories.
 *
 * <p>Declaration order is significant: later constants are more severe, so
 * {@link #isAtLeast(Severity)} and {@code compareTo} can be used for thresholds.</p>
 *
 * @since 1.0.0
 */
public enum Severity {
    /**
     * Nothing to report.
     */
    OK,

    /**
     * Minor issue, fix when convenient.
     */
    LOW,

    /**
     * Should be reviewed before migrating.
     */
    MEDIUM,

    /**
     * Likely to break or endanger the migration.
     */
    HIGH,

    /**
     * Known vulnerability or blocking issue.
     */
    CRITICAL;

    /**
     * Returns true if this severity is the same as or more severe than {@code other}.
     *
     * @param other severity to compare against
     * @return true if at least as severe
     */
    public boolean isAtLeast(Severity other) {
        return compareTo(other) >= 0;
    }
}
