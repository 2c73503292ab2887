package com.backtester.position;

import com.backtester.domain.model.PriceBar;
import com.backtester.domain.model.TradingPosition;
import com.backtester.domain.vo.TradingVolume;
import com.backtester.exception.InstrumentPositionException;
import com.backtester.exception.UnknownSymbolException;
import com.backtester.portfolio.Portfolio;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Position book for a backtest run: one {@link InstrumentPosition} per registered
 * symbol.
 *
 * <p>Symbols must be registered with {@link #addInstrument} before use. Any operation
 * on an unregistered symbol throws {@link UnknownSymbolException}.
 */
public class InstrumentPositionLedger {

    private static final Logger log = LoggerFactory.getLogger(InstrumentPositionLedger.class);

    /** Instrument positions indexed by trading symbol, in registration order. */
    private final Map<String, InstrumentPosition> instruments = new LinkedHashMap<>();

    public void addInstrument(String tradingSymbol) {
        if (instruments.containsKey(tradingSymbol)) {
            throw new InstrumentPositionException("Instrument already registered: " + tradingSymbol);
        }
        instruments.put(tradingSymbol, new InstrumentPosition(tradingSymbol));
    }

    public InstrumentPosition getInstrumentPosition(String tradingSymbol) {
        InstrumentPosition instrument = instruments.get(tradingSymbol);
        if (instrument == null) {
            throw new UnknownSymbolException("Instrument position", tradingSymbol);
        }
        return instrument;
    }

    public boolean isLongPosition(String tradingSymbol) {
        return getInstrumentPosition(tradingSymbol).isLong();
    }

    public boolean isShortPosition(String tradingSymbol) {
        return getInstrumentPosition(tradingSymbol).isShort();
    }

    public boolean isFlatPosition(String tradingSymbol) {
        return getInstrumentPosition(tradingSymbol).isFlat();
    }

    public TradingVolume getVolumeInAllUnits(String tradingSymbol) {
        return getInstrumentPosition(tradingSymbol).getVolumeInAllUnits();
    }

    public int getNumPositionUnits(String tradingSymbol) {
        return getInstrumentPosition(tradingSymbol).getNumPositionUnits();
    }

    public TradingPosition getTradingPosition(String tradingSymbol, int unitNumber) {
        return getInstrumentPosition(tradingSymbol).getPosition(unitNumber);
    }

    public void addPosition(TradingPosition position) {
        getInstrumentPosition(position.getTradingSymbol()).addPosition(position);
        log.debug("Position opened: {}", position);
    }

    public void addBar(String tradingSymbol, PriceBar bar) {
        getInstrumentPosition(tradingSymbol).addBar(bar);
    }

    /**
     * Appends the day's bar to every open unit. Flat symbols and symbols without a bar
     * on {@code date} are skipped.
     */
    public void addBarForOpenPositions(LocalDate date, Portfolio portfolio) {
        for (InstrumentPosition instrument : instruments.values()) {
            if (instrument.isFlat()) {
                continue;
            }
            portfolio.getSecurity(instrument.getTradingSymbol())
                    .findBar(date)
                    .ifPresent(instrument::addBar);
        }
    }

    public void closeAllPositions(String tradingSymbol, LocalDate exitDate, BigDecimal exitPrice) {
        InstrumentPosition instrument = getInstrumentPosition(tradingSymbol);
        int units = instrument.getNumPositionUnits();
        instrument.closeAllPositions(exitDate, exitPrice);
        log.debug("Closed {} unit(s) of {} @ {} on {}", units, tradingSymbol, exitPrice, exitDate);
    }

    public void closeUnitPosition(String tradingSymbol, LocalDate exitDate, BigDecimal exitPrice, int unitNumber) {
        getInstrumentPosition(tradingSymbol).closeUnitPosition(exitDate, exitPrice, unitNumber);
        log.debug("Closed unit {} of {} @ {} on {}", unitNumber, tradingSymbol, exitPrice, exitDate);
    }

    public int getNumInstruments() {
        return instruments.size();
    }

    public Set<String> getSymbols() {
        return Collections.unmodifiableSet(instruments.keySet());
    }
}
