package com.backtester.simulator;

import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Value;

/** Outcome of a successful fill decision: when and at what price the order executes. */
@Value
public class Fill {

    LocalDate date;
    BigDecimal price;
}
