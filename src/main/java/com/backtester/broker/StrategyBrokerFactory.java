package com.backtester.broker;

import com.backtester.history.ClosedTradeCollection;
import com.backtester.portfolio.Portfolio;
import com.backtester.pricing.TickPolicy;
import org.springframework.stereotype.Service;

/**
 * Creates one {@link StrategyBroker} per backtest run, wired to the configured tick
 * policy. Brokers hold run state and are never shared between runs.
 */
@Service
public class StrategyBrokerFactory {

    private final TickPolicy tickPolicy;

    public StrategyBrokerFactory(TickPolicy tickPolicy) {
        this.tickPolicy = tickPolicy;
    }

    public StrategyBroker createBroker(Portfolio portfolio) {
        return new StrategyBroker(portfolio, tickPolicy);
    }

    public StrategyBroker createBroker(Portfolio portfolio, ClosedTradeCollection closedTradeCollection) {
        return new StrategyBroker(portfolio, tickPolicy, closedTradeCollection);
    }
}
