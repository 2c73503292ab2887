package com.backtester.domain.model;

import com.backtester.exception.ValidationException;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/**
 * One instrument's open/high/low/close for one trading date.
 *
 * <p>Bars are validated on construction so that fill decisions never have to deal
 * with a high below the open or a non-positive price.
 */
@Value
public class PriceBar {

    LocalDate date;
    BigDecimal open;
    BigDecimal high;
    BigDecimal low;
    BigDecimal close;

    /** Traded volume. Zero when the data source does not provide it. */
    long volume;

    @Builder
    public PriceBar(
            LocalDate date, BigDecimal open, BigDecimal high, BigDecimal low, BigDecimal close, long volume) {
        if (date == null) {
            throw new ValidationException("Price bar date is required");
        }
        requirePositive("open", open, date);
        requirePositive("high", high, date);
        requirePositive("low", low, date);
        requirePositive("close", close, date);
        if (high.compareTo(low) < 0
                || high.compareTo(open) < 0
                || high.compareTo(close) < 0
                || low.compareTo(open) > 0
                || low.compareTo(close) > 0) {
            throw new ValidationException(String.format(
                    "Inconsistent bar on %s: O=%s H=%s L=%s C=%s", date, open, high, low, close));
        }
        if (volume < 0) {
            throw new ValidationException("Negative volume on " + date + ": " + volume);
        }
        this.date = date;
        this.open = open;
        this.high = high;
        this.low = low;
        this.close = close;
        this.volume = volume;
    }

    public static PriceBar of(LocalDate date, String open, String high, String low, String close) {
        return new PriceBar(
                date, new BigDecimal(open), new BigDecimal(high), new BigDecimal(low), new BigDecimal(close), 0L);
    }

    private static void requirePositive(String field, BigDecimal value, LocalDate date) {
        if (value == null || value.signum() <= 0) {
            throw new ValidationException("Price bar " + field + " must be positive on " + date + ": " + value);
        }
    }
}
