package com.lynkvertx.evfeas.model;

import lombok.Value;

/**
 * A table after header location, tagged with the layout it was classified as.
 */
@Value
public class ClassifiedTable {
    TableShape shape;
    RawTable table;
    /** Index of the data row that was promoted to header, or -1 when the original header was kept */
    int promotedHeaderRow;
    int timeOfDayColumnCount;
}
