package com.backtester.domain.vo;

import com.backtester.exception.ValidationException;
import java.math.BigDecimal;
import java.math.MathContext;
import lombok.Value;

/**
 * A percentage such as 2.5 (meaning 2.5%). Used to express stop and limit distances
 * from a base price.
 */
@Value
public class PercentNumber {

    private static final BigDecimal ONE_HUNDRED = BigDecimal.valueOf(100);

    BigDecimal percent;

    public PercentNumber(BigDecimal percent) {
        if (percent == null) {
            throw new ValidationException("Percent value is required");
        }
        this.percent = percent;
    }

    public static PercentNumber of(BigDecimal percent) {
        return new PercentNumber(percent);
    }

    public static PercentNumber of(String percent) {
        return new PercentNumber(new BigDecimal(percent));
    }

    /** 2.5% as 0.025. */
    public BigDecimal asFraction() {
        return percent.divide(ONE_HUNDRED, MathContext.DECIMAL64);
    }
}
