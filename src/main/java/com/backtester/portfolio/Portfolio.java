package com.backtester.portfolio;

import com.backtester.exception.UnknownSymbolException;
import com.backtester.exception.ValidationException;
import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import lombok.Getter;

/**
 * The set of instruments a backtest trades. Symbols iterate in the order they were
 * added.
 */
public class Portfolio {

    @Getter
    private final String name;

    private final Map<String, Security> securities = new LinkedHashMap<>();

    public Portfolio(String name) {
        this.name = name;
    }

    public void addSecurity(Security security) {
        if (securities.putIfAbsent(security.getSymbol(), security) != null) {
            throw new ValidationException("Portfolio " + name + " already contains " + security.getSymbol());
        }
    }

    public Optional<Security> findSecurity(String symbol) {
        return Optional.ofNullable(securities.get(symbol));
    }

    public Security getSecurity(String symbol) {
        return findSecurity(symbol).orElseThrow(() -> new UnknownSymbolException("Security", symbol));
    }

    public Set<String> getSymbols() {
        return Collections.unmodifiableSet(securities.keySet());
    }

    public int getNumSecurities() {
        return securities.size();
    }

    /** Every date on which at least one security has a bar, ascending. */
    public SortedSet<LocalDate> getAllDates() {
        SortedSet<LocalDate> dates = new TreeSet<>();
        securities.values().forEach(security -> dates.addAll(security.getDates()));
        return dates;
    }
}
