package com.backtester.portfolio;

import com.backtester.domain.model.PriceBar;
import com.backtester.exception.ValidationException;
import java.time.LocalDate;
import java.util.Collection;
import java.util.Collections;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import lombok.Getter;

/**
 * A traded instrument and its daily bar series.
 */
public class Security implements PriceBarSource {

    @Getter
    private final String symbol;

    private final NavigableMap<LocalDate, PriceBar> bars = new TreeMap<>();

    public Security(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            throw new ValidationException("Security symbol is required");
        }
        this.symbol = symbol;
    }

    public Security(String symbol, Collection<PriceBar> bars) {
        this(symbol);
        bars.forEach(this::addBar);
    }

    /** Bars are immutable once recorded; a second bar for the same date is rejected. */
    public void addBar(PriceBar bar) {
        PriceBar existing = bars.putIfAbsent(bar.getDate(), bar);
        if (existing != null) {
            throw new ValidationException(symbol + " already has a bar on " + bar.getDate());
        }
    }

    @Override
    public Optional<PriceBar> findBar(LocalDate date) {
        return Optional.ofNullable(bars.get(date));
    }

    public Set<LocalDate> getDates() {
        return Collections.unmodifiableSet(bars.navigableKeySet());
    }

    public int getNumBars() {
        return bars.size();
    }
}
