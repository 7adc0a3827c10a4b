package com.lynkvertx.evfeas.model;

import lombok.Value;

/** A decoded upload together with the file name it came from. */
@Value
public class NamedTable {
    String name;
    RawTable table;
}
