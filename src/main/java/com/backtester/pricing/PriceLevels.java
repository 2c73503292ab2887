package com.backtester.pricing;

import com.backtester.domain.vo.PercentNumber;
import com.backtester.exception.ValidationException;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Converts percentage distances from a base price into absolute stop and limit levels.
 *
 * <p>Long targets sit above the base and long stops below it; short levels mirror
 * that. Results are not rounded; use {@link #roundToTick} before submitting orders.
 */
public final class PriceLevels {

    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    private PriceLevels() {}

    public static BigDecimal longProfitTarget(BigDecimal basePrice, PercentNumber percent) {
        return basePrice.multiply(BigDecimal.ONE.add(percent.asFraction()), MathContext.DECIMAL64);
    }

    public static BigDecimal shortProfitTarget(BigDecimal basePrice, PercentNumber percent) {
        return basePrice.multiply(BigDecimal.ONE.subtract(percent.asFraction()), MathContext.DECIMAL64);
    }

    public static BigDecimal longStopLoss(BigDecimal basePrice, PercentNumber percent) {
        return basePrice.multiply(BigDecimal.ONE.subtract(percent.asFraction()), MathContext.DECIMAL64);
    }

    public static BigDecimal shortStopLoss(BigDecimal basePrice, PercentNumber percent) {
        return basePrice.multiply(BigDecimal.ONE.add(percent.asFraction()), MathContext.DECIMAL64);
    }

    /**
     * Rounds to the nearest multiple of {@code tick}. A remainder of exactly half a
     * tick rounds up.
     */
    public static BigDecimal roundToTick(BigDecimal price, BigDecimal tick) {
        if (tick == null || tick.signum() <= 0) {
            throw new ValidationException("Tick size must be positive: " + tick);
        }
        BigDecimal remainder = price.remainder(tick);
        BigDecimal roundedDown = price.subtract(remainder);
        BigDecimal rounded = remainder.compareTo(tick.divide(TWO)) < 0 ? roundedDown : roundedDown.add(tick);
        return rounded.setScale(Math.max(tick.stripTrailingZeros().scale(), 0), RoundingMode.HALF_UP);
    }
}
