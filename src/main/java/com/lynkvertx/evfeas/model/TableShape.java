package com.lynkvertx.evfeas.model;

/**
 * Layout of an uploaded usage table.
 */
public enum TableShape {
    /** One row per timestamp with a single power/energy column */
    TALL,
    /** One row per day with one column per intraday slot, or a daily total column */
    WIDE
}
