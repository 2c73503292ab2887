package com.backtester.portfolio;

import com.backtester.domain.model.PriceBar;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Bars for one instrument, queryable by exact date. An empty result means the
 * instrument did not trade that day.
 */
public interface PriceBarSource {

    Optional<PriceBar> findBar(LocalDate date);
}
