package com.backtester.engine;

import com.backtester.broker.StrategyBroker;
import java.time.LocalDate;

/**
 * Trading logic driven by the backtest loop. Called once per date after the broker
 * has resolved that date's pending orders; orders placed here are dated {@code date}
 * and become eligible on the next bar.
 */
@FunctionalInterface
public interface BarStrategy {

    void onBar(LocalDate date, StrategyBroker broker);
}
