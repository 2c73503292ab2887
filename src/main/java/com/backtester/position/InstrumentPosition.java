package com.backtester.position;

import com.backtester.domain.enums.PositionSide;
import com.backtester.domain.model.PriceBar;
import com.backtester.domain.model.TradingPosition;
import com.backtester.domain.vo.TradingVolume;
import com.backtester.exception.InstrumentPositionException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.Getter;

/**
 * All open position units on one symbol, in the order they were added.
 *
 * <p>The instrument is flat with no units, otherwise long or short with every unit on
 * the same side. Unit numbers are 1-based and follow pyramiding order; closing a unit
 * renumbers the ones after it.
 */
public class InstrumentPosition {

    @Getter
    private final String tradingSymbol;

    private final List<TradingPosition> openPositions = new ArrayList<>();

    public InstrumentPosition(String tradingSymbol) {
        this.tradingSymbol = tradingSymbol;
    }

    public boolean isFlat() {
        return openPositions.isEmpty();
    }

    public boolean isLong() {
        return !isFlat() && openPositions.get(0).isLongPosition();
    }

    public boolean isShort() {
        return !isFlat() && openPositions.get(0).isShortPosition();
    }

    public int getNumPositionUnits() {
        return openPositions.size();
    }

    public List<TradingPosition> getOpenPositions() {
        return Collections.unmodifiableList(openPositions);
    }

    public void addPosition(TradingPosition position) {
        if (position.isPositionClosed()) {
            throw new InstrumentPositionException(
                    "Cannot add closed position " + position.getPositionId() + " to " + tradingSymbol);
        }
        if (!tradingSymbol.equals(position.getTradingSymbol())) {
            throw new InstrumentPositionException(String.format(
                    "Position %d is for %s, not %s", position.getPositionId(), position.getTradingSymbol(), tradingSymbol));
        }
        if (!isFlat() && currentSide() != position.getSide()) {
            throw new InstrumentPositionException(String.format(
                    "Cannot add %s unit to %s position in %s", position.getSide(), currentSide(), tradingSymbol));
        }
        openPositions.add(position);
    }

    /** Appends the bar to every open unit entered before the bar date. */
    public void addBar(PriceBar bar) {
        for (TradingPosition position : openPositions) {
            if (position.getEntryDate().isBefore(bar.getDate())) {
                position.addBar(bar);
            }
        }
    }

    public TradingPosition getPosition(int unitNumber) {
        checkUnitNumber(unitNumber);
        return openPositions.get(unitNumber - 1);
    }

    public BigDecimal getFillPrice(int unitNumber) {
        return getPosition(unitNumber).getEntryPrice();
    }

    public void setRMultipleStop(BigDecimal rMultipleStop, int unitNumber) {
        getPosition(unitNumber).setRMultipleStop(rMultipleStop);
    }

    public TradingVolume getVolumeInAllUnits() {
        requireOpen("volume");
        return openPositions.stream()
                .map(TradingPosition::getVolume)
                .reduce(TradingVolume::add)
                .orElseThrow();
    }

    /** Closes and removes one unit. Units after it move up one number. */
    public void closeUnitPosition(LocalDate exitDate, BigDecimal exitPrice, int unitNumber) {
        checkUnitNumber(unitNumber);
        TradingPosition position = openPositions.get(unitNumber - 1);
        position.close(exitDate, exitPrice);
        openPositions.remove(unitNumber - 1);
    }

    public void closeAllPositions(LocalDate exitDate, BigDecimal exitPrice) {
        requireOpen("close");
        for (TradingPosition position : List.copyOf(openPositions)) {
            position.close(exitDate, exitPrice);
            openPositions.remove(position);
        }
    }

    private PositionSide currentSide() {
        return openPositions.get(0).getSide();
    }

    private void checkUnitNumber(int unitNumber) {
        if (unitNumber < 1 || unitNumber > openPositions.size()) {
            throw new InstrumentPositionException(String.format(
                    "Unit %d does not exist in %s (open units: %d)", unitNumber, tradingSymbol, openPositions.size()));
        }
    }

    private void requireOpen(String action) {
        if (isFlat()) {
            throw new InstrumentPositionException("Cannot " + action + ": " + tradingSymbol + " is flat");
        }
    }
}
