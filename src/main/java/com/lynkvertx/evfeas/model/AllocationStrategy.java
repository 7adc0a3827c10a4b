package com.lynkvertx.evfeas.model;

/**
 * How Level 2 / Level 3 charger counts are derived from the hourly headroom.
 */
public enum AllocationStrategy {
    /** No charger counts are derived */
    NONE,
    /** Both counts computed independently against the full headroom */
    AUTO,
    /** Caller fixes the Level 3 count, Level 2 fills what is left */
    FIXED_L3,
    /** Caller fixes the Level 2 count, Level 3 fills what is left */
    FIXED_L2
}
