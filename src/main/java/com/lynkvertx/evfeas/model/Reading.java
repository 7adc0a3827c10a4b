package com.lynkvertx.evfeas.model;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/** One power observation: naive local timestamp and demand in kW. */
@Value
public class Reading {
    LocalDateTime timestamp;
    BigDecimal powerKw;

    public int hourOfDay() {
        return timestamp.getHour();
    }
}
