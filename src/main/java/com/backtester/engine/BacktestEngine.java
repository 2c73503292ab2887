package com.backtester.engine;

import com.backtester.broker.StrategyBroker;
import com.backtester.broker.StrategyBrokerFactory;
import com.backtester.exception.BaseException;
import com.backtester.portfolio.Portfolio;
import java.time.LocalDate;
import java.util.SortedSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Drives a strategy through a portfolio's bar history, one date at a time.
 *
 * <p>For each date on which any security has a bar, in ascending order, the broker
 * first resolves pending orders against that date's bars and the strategy is then
 * asked for new orders. Runs are single-threaded and deterministic.
 */
@Service
public class BacktestEngine {

    private static final Logger log = LoggerFactory.getLogger(BacktestEngine.class);

    private final StrategyBrokerFactory brokerFactory;

    public BacktestEngine(StrategyBrokerFactory brokerFactory) {
        this.brokerFactory = brokerFactory;
    }

    public BacktestResult run(Portfolio portfolio, BarStrategy strategy) {
        return run(brokerFactory.createBroker(portfolio), strategy);
    }

    /**
     * Runs a strategy against a caller-supplied broker.
     *
     * <p>Any error ends the run and is rethrown. Fatal errors and unexpected runtime
     * failures are logged at ERROR. Non-fatal {@link BaseException}s are caller misuse
     * that left the engine state unchanged and are logged at WARN.
     */
    public BacktestResult run(StrategyBroker broker, BarStrategy strategy) {
        Portfolio portfolio = broker.getPortfolio();
        SortedSet<LocalDate> dates = portfolio.getAllDates();
        log.info("Backtest started: portfolio={} securities={} dates={}",
                portfolio.getName(), portfolio.getNumSecurities(), dates.size());

        int processed = 0;
        for (LocalDate date : dates) {
            try {
                broker.processPendingOrders(date);
                strategy.onBar(date, broker);
            } catch (RuntimeException e) {
                logAbort(date, e);
                throw e;
            }
            processed++;
        }

        log.info("Backtest finished: portfolio={} dates={} trades={} open={} closed={}",
                portfolio.getName(), processed, broker.getTotalTrades(), broker.getOpenTrades(),
                broker.getClosedTrades());

        return BacktestResult.builder()
                .broker(broker)
                .closedTrades(broker.getClosedTradeCollection())
                .datesProcessed(processed)
                .firstDate(dates.isEmpty() ? null : dates.first())
                .lastDate(dates.isEmpty() ? null : dates.last())
                .build();
    }

    private void logAbort(LocalDate date, RuntimeException e) {
        if (e instanceof BaseException be) {
            if (be.isFatal()) {
                log.error("Backtest aborted on {} [{}]: {}", date, be.getErrorCode().getCode(), be.getMessage(), be);
            } else {
                log.warn("Backtest stopped on {} [{}]: {}", date, be.getErrorCode().getCode(), be.getMessage());
            }
        } else {
            log.error("Backtest aborted on {}: {}", date, e.getMessage(), e);
        }
    }
}
