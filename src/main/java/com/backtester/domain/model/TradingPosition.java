package com.backtester.domain.model;

import com.backtester.domain.enums.PositionSide;
import com.backtester.domain.enums.PositionState;
import com.backtester.domain.vo.TradingVolume;
import com.backtester.event.PositionEvent;
import com.backtester.event.PositionEventListener;
import com.backtester.event.PositionEventType;
import com.backtester.exception.PositionStateException;
import com.backtester.exception.ValidationException;
import java.math.BigDecimal;
import java.math.MathContext;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

/**
 * One position unit: a single entry fill and, eventually, its exit.
 *
 * <p>While open the unit accumulates every bar observed after its entry date. The
 * entry bar itself is kept separately, so the history only holds bars strictly after
 * the entry date, in increasing date order, none later than the exit date.
 *
 * <p>A unit is closed exactly once. Closing notifies the registered listeners with a
 * CLOSED {@link PositionEvent}; a second close attempt is a precondition violation.
 *
 * <p>Returns are fractions: 0.1 is a 10% gain. Short returns are sign-inverted so a
 * positive return is always a winning trade.
 */
@Getter
public class TradingPosition {

    private static final BigDecimal ONE_HUNDRED = BigDecimal.valueOf(100);

    private final long positionId;
    private final String tradingSymbol;
    private final PositionSide side;
    private final BigDecimal entryPrice;
    private final PriceBar entryBar;
    private final TradingVolume volume;

    @Setter
    private BigDecimal stopLoss;

    @Setter
    private BigDecimal profitTarget;

    /** Initial risk level used for R-multiple calculation. Null until set. */
    private BigDecimal rMultipleStop;

    private PositionState state = PositionState.OPEN;
    private LocalDate exitDate;
    private BigDecimal exitPrice;

    @Getter(AccessLevel.NONE)
    private final List<PriceBar> barHistory = new ArrayList<>();

    @Getter(AccessLevel.NONE)
    private final List<PositionEventListener> listeners = new ArrayList<>();

    public TradingPosition(
            long positionId,
            String tradingSymbol,
            PositionSide side,
            BigDecimal entryPrice,
            PriceBar entryBar,
            TradingVolume volume) {
        if (tradingSymbol == null || tradingSymbol.isBlank()) {
            throw new ValidationException("Position trading symbol is required");
        }
        if (side == null) {
            throw new ValidationException("Position side is required for " + tradingSymbol);
        }
        if (entryPrice == null || entryPrice.signum() <= 0) {
            throw new ValidationException("Entry price must be positive for " + tradingSymbol + ": " + entryPrice);
        }
        if (entryBar == null) {
            throw new ValidationException("Entry bar is required for " + tradingSymbol);
        }
        if (volume == null) {
            throw new ValidationException("Position volume is required for " + tradingSymbol);
        }
        this.positionId = positionId;
        this.tradingSymbol = tradingSymbol;
        this.side = side;
        this.entryPrice = entryPrice;
        this.entryBar = entryBar;
        this.volume = volume;
    }

    public LocalDate getEntryDate() {
        return entryBar.getDate();
    }

    public boolean isLongPosition() {
        return side == PositionSide.LONG;
    }

    public boolean isShortPosition() {
        return side == PositionSide.SHORT;
    }

    public boolean isPositionOpen() {
        return state == PositionState.OPEN;
    }

    public boolean isPositionClosed() {
        return state == PositionState.CLOSED;
    }

    public void addListener(PositionEventListener listener) {
        listeners.add(listener);
    }

    /**
     * Appends a bar observed while the unit is open. Bars must postdate the entry date
     * and the previously appended bar.
     */
    public void addBar(PriceBar bar) {
        if (isPositionClosed()) {
            throw new PositionStateException(
                    "Cannot add bar on " + bar.getDate() + " to closed position " + positionId);
        }
        LocalDate lastDate = getLastDate();
        if (!bar.getDate().isAfter(lastDate)) {
            throw new PositionStateException(String.format(
                    "Position %d (%s): bar date %s must be after %s", positionId, tradingSymbol, bar.getDate(), lastDate));
        }
        barHistory.add(bar);
    }

    /** Bars observed after the entry date, oldest first. */
    public List<PriceBar> getBarHistory() {
        return Collections.unmodifiableList(barHistory);
    }

    /** Entry bar plus every bar observed while open. */
    public int getNumBarsInPosition() {
        return barHistory.size() + 1;
    }

    public BigDecimal getLastClose() {
        return barHistory.isEmpty()
                ? entryBar.getClose()
                : barHistory.get(barHistory.size() - 1).getClose();
    }

    public void setRMultipleStop(BigDecimal rMultipleStop) {
        if (rMultipleStop == null || rMultipleStop.signum() <= 0) {
            throw new ValidationException("R-multiple stop must be positive: " + rMultipleStop);
        }
        this.rMultipleStop = rMultipleStop;
    }

    public boolean isRMultipleStopSet() {
        return rMultipleStop != null;
    }

    public void close(LocalDate exitDate, BigDecimal exitPrice) {
        if (isPositionClosed()) {
            throw new PositionStateException(
                    "Position " + positionId + " (" + tradingSymbol + ") is already closed on " + this.exitDate);
        }
        if (exitDate == null || exitDate.isBefore(getLastDate())) {
            throw new PositionStateException(String.format(
                    "Position %d (%s): exit date %s precedes %s", positionId, tradingSymbol, exitDate, getLastDate()));
        }
        if (exitPrice == null || exitPrice.signum() <= 0) {
            throw new PositionStateException(
                    "Position " + positionId + " (" + tradingSymbol + "): exit price must be positive: " + exitPrice);
        }
        this.exitDate = exitDate;
        this.exitPrice = exitPrice;
        this.state = PositionState.CLOSED;

        PositionEvent event = new PositionEvent(this, this, PositionEventType.CLOSED);
        for (PositionEventListener listener : List.copyOf(listeners)) {
            listener.onPositionEvent(event);
        }
    }

    /**
     * Fractional return of the trade: against the exit price once closed, against the
     * last observed close while open.
     */
    public BigDecimal getTradeReturn() {
        BigDecimal reference = isPositionClosed() ? exitPrice : getLastClose();
        BigDecimal longReturn = reference.subtract(entryPrice).divide(entryPrice, MathContext.DECIMAL64);
        return isLongPosition() ? longReturn : longReturn.negate();
    }

    public BigDecimal getPercentReturn() {
        return getTradeReturn().multiply(ONE_HUNDRED);
    }

    public BigDecimal getTradeReturnMultiplier() {
        return BigDecimal.ONE.add(getTradeReturn());
    }

    public boolean isWinningPosition() {
        return getTradeReturn().signum() > 0;
    }

    public boolean isLosingPosition() {
        return !isWinningPosition();
    }

    /**
     * Reward relative to the initial risk defined by the R-multiple stop.
     * Only available for closed units with a stop set.
     */
    public BigDecimal getRMultiple() {
        if (isPositionOpen()) {
            throw new PositionStateException("R-multiple not available for open position " + positionId);
        }
        if (!isRMultipleStopSet()) {
            throw new PositionStateException("R-multiple stop not set for position " + positionId);
        }
        if (isLongPosition()) {
            if (isWinningPosition()) {
                return exitPrice.subtract(entryPrice).divide(entryPrice.subtract(rMultipleStop), MathContext.DECIMAL64);
            }
            if (exitPrice.compareTo(rMultipleStop) == 0) {
                return BigDecimal.ONE.negate();
            }
            return rMultipleStop.divide(exitPrice, MathContext.DECIMAL64).negate();
        }
        if (isWinningPosition()) {
            return entryPrice.subtract(exitPrice).divide(rMultipleStop.subtract(entryPrice), MathContext.DECIMAL64);
        }
        return exitPrice.divide(rMultipleStop, MathContext.DECIMAL64).negate();
    }

    private LocalDate getLastDate() {
        return barHistory.isEmpty()
                ? entryBar.getDate()
                : barHistory.get(barHistory.size() - 1).getDate();
    }

    @Override
    public String toString() {
        return String.format(
                "TradingPosition[id=%d, %s %s %s @ %s on %s, state=%s, exit=%s @ %s, bars=%d]",
                positionId,
                side,
                volume.getVolume(),
                tradingSymbol,
                entryPrice,
                getEntryDate(),
                state,
                exitPrice,
                exitDate,
                barHistory.size());
    }
}
