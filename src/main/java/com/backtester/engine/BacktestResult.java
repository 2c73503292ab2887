package com.backtester.engine;

import com.backtester.broker.StrategyBroker;
import com.backtester.history.ClosedTradeCollection;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class BacktestResult {

    StrategyBroker broker;
    ClosedTradeCollection closedTrades;
    int datesProcessed;
    LocalDate firstDate;
    LocalDate lastDate;
}
