package com.lynkvertx.evfeas.model;

import lombok.Value;

/**
 * Advisory notice about precision loss. Never blocks computation.
 */
@Value
public class DataQualityWarning {

    public enum Code {
        DAILY_TOTAL_APPROXIMATION
    }

    Code code;
    String message;
}
