package com.backtester.broker;

import com.backtester.domain.enums.PositionSide;
import com.backtester.domain.model.PriceBar;
import com.backtester.domain.model.StrategyTransaction;
import com.backtester.domain.model.TradingOrder;
import com.backtester.domain.model.TradingPosition;
import com.backtester.domain.vo.PercentNumber;
import com.backtester.domain.vo.TradingVolume;
import com.backtester.event.OrderEvent;
import com.backtester.event.OrderEventListener;
import com.backtester.event.PositionEvent;
import com.backtester.event.PositionEventListener;
import com.backtester.exception.InconsistentStateException;
import com.backtester.exception.StrategyBrokerException;
import com.backtester.exception.UnknownSymbolException;
import com.backtester.history.ClosedPositionHistory;
import com.backtester.history.ClosedTradeCollection;
import com.backtester.portfolio.Portfolio;
import com.backtester.position.InstrumentPosition;
import com.backtester.position.InstrumentPositionLedger;
import com.backtester.pricing.PriceLevels;
import com.backtester.pricing.TickPolicy;
import com.backtester.simulator.PendingOrderBook;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The only component a strategy talks to.
 *
 * <p>Strategies submit entries and exits here; the broker turns them into orders on its
 * {@link PendingOrderBook}, and reacts to the book's fill and cancel events by opening
 * and closing units in its {@link InstrumentPositionLedger}. Every unit the broker opens
 * gets a {@link StrategyTransaction}, and every unit that closes is handed to the
 * {@link ClosedTradeCollection} exactly once.
 *
 * <p>Exit requests always cover every open unit of the symbol. They are rejected with a
 * {@link StrategyBrokerException}, leaving all state untouched, when the symbol does not
 * hold a position on the matching side.
 *
 * <p>One broker serves one backtest run and is not thread-safe.
 */
public class StrategyBroker implements OrderEventListener, PositionEventListener {

    private static final Logger log = LoggerFactory.getLogger(StrategyBroker.class);

    private final Portfolio portfolio;
    private final TickPolicy tickPolicy;
    private final ClosedTradeCollection closedTradeCollection;

    private final PendingOrderBook orderBook;
    private final InstrumentPositionLedger ledger = new InstrumentPositionLedger();
    private final StrategyTransactionManager transactions = new StrategyTransactionManager();

    private long nextOrderId = 1;
    private long nextPositionId = 1;

    public StrategyBroker(Portfolio portfolio, TickPolicy tickPolicy) {
        this(portfolio, tickPolicy, new ClosedPositionHistory());
    }

    public StrategyBroker(Portfolio portfolio, TickPolicy tickPolicy, ClosedTradeCollection closedTradeCollection) {
        this(portfolio, tickPolicy, closedTradeCollection, new PendingOrderBook());
    }

    StrategyBroker(
            Portfolio portfolio,
            TickPolicy tickPolicy,
            ClosedTradeCollection closedTradeCollection,
            PendingOrderBook orderBook) {
        this.portfolio = portfolio;
        this.tickPolicy = tickPolicy;
        this.closedTradeCollection = closedTradeCollection;
        this.orderBook = orderBook;
        portfolio.getSymbols().forEach(ledger::addInstrument);
        orderBook.addListener(this);
    }

    // ---- Entries ----

    public void enterLongOnOpen(String symbol, LocalDate orderDate, TradingVolume volume) {
        enterLongOnOpen(symbol, orderDate, volume, null, null);
    }

    /**
     * Submits a market-on-open long entry. The stop loss and profit target, when given,
     * are copied onto the unit the entry opens.
     */
    public void enterLongOnOpen(
            String symbol, LocalDate orderDate, TradingVolume volume, BigDecimal stopLoss, BigDecimal profitTarget) {
        submit(TradingOrder.marketEntry(
                nextOrderId++, PositionSide.LONG, symbol, volume, orderDate, stopLoss, profitTarget));
    }

    public void enterShortOnOpen(String symbol, LocalDate orderDate, TradingVolume volume) {
        enterShortOnOpen(symbol, orderDate, volume, null, null);
    }

    public void enterShortOnOpen(
            String symbol, LocalDate orderDate, TradingVolume volume, BigDecimal stopLoss, BigDecimal profitTarget) {
        submit(TradingOrder.marketEntry(
                nextOrderId++, PositionSide.SHORT, symbol, volume, orderDate, stopLoss, profitTarget));
    }

    // ---- Exits ----

    public void exitLongAllUnitsOnOpen(String symbol, LocalDate orderDate) {
        requireLong(symbol, "exitLongAllUnitsOnOpen", orderDate);
        exitLongAllUnitsOnOpen(symbol, orderDate, ledger.getVolumeInAllUnits(symbol));
    }

    public void exitLongAllUnitsOnOpen(String symbol, LocalDate orderDate, TradingVolume volume) {
        requireLong(symbol, "exitLongAllUnitsOnOpen", orderDate);
        submit(TradingOrder.marketExit(nextOrderId++, PositionSide.LONG, symbol, volume, orderDate));
    }

    public void exitShortAllUnitsOnOpen(String symbol, LocalDate orderDate) {
        requireShort(symbol, "exitShortAllUnitsOnOpen", orderDate);
        submit(TradingOrder.marketExit(
                nextOrderId++, PositionSide.SHORT, symbol, ledger.getVolumeInAllUnits(symbol), orderDate));
    }

    public void exitLongAllUnitsAtLimit(String symbol, LocalDate orderDate, BigDecimal limitPrice) {
        requireLong(symbol, "exitLongAllUnitsAtLimit", orderDate);
        submit(TradingOrder.limitExit(
                nextOrderId++, PositionSide.LONG, symbol, ledger.getVolumeInAllUnits(symbol), orderDate, limitPrice));
    }

    public void exitLongAllUnitsAtLimit(
            String symbol, LocalDate orderDate, BigDecimal limitBasePrice, PercentNumber percent) {
        requireLong(symbol, "exitLongAllUnitsAtLimit", orderDate);
        BigDecimal limitPrice = roundToTick(symbol, PriceLevels.longProfitTarget(limitBasePrice, percent));
        exitLongAllUnitsAtLimit(symbol, orderDate, limitPrice);
    }

    public void exitShortAllUnitsAtLimit(String symbol, LocalDate orderDate, BigDecimal limitPrice) {
        requireShort(symbol, "exitShortAllUnitsAtLimit", orderDate);
        submit(TradingOrder.limitExit(
                nextOrderId++, PositionSide.SHORT, symbol, ledger.getVolumeInAllUnits(symbol), orderDate, limitPrice));
    }

    public void exitShortAllUnitsAtLimit(
            String symbol, LocalDate orderDate, BigDecimal limitBasePrice, PercentNumber percent) {
        requireShort(symbol, "exitShortAllUnitsAtLimit", orderDate);
        BigDecimal limitPrice = roundToTick(symbol, PriceLevels.shortProfitTarget(limitBasePrice, percent));
        exitShortAllUnitsAtLimit(symbol, orderDate, limitPrice);
    }

    public void exitLongAllUnitsAtStop(String symbol, LocalDate orderDate, BigDecimal stopPrice) {
        requireLong(symbol, "exitLongAllUnitsAtStop", orderDate);
        submit(TradingOrder.stopExit(
                nextOrderId++, PositionSide.LONG, symbol, ledger.getVolumeInAllUnits(symbol), orderDate, stopPrice));
    }

    public void exitLongAllUnitsAtStop(
            String symbol, LocalDate orderDate, BigDecimal stopBasePrice, PercentNumber percent) {
        requireLong(symbol, "exitLongAllUnitsAtStop", orderDate);
        BigDecimal stopPrice = roundToTick(symbol, PriceLevels.longStopLoss(stopBasePrice, percent));
        exitLongAllUnitsAtStop(symbol, orderDate, stopPrice);
    }

    public void exitShortAllUnitsAtStop(String symbol, LocalDate orderDate, BigDecimal stopPrice) {
        requireShort(symbol, "exitShortAllUnitsAtStop", orderDate);
        submit(TradingOrder.stopExit(
                nextOrderId++, PositionSide.SHORT, symbol, ledger.getVolumeInAllUnits(symbol), orderDate, stopPrice));
    }

    public void exitShortAllUnitsAtStop(
            String symbol, LocalDate orderDate, BigDecimal stopBasePrice, PercentNumber percent) {
        requireShort(symbol, "exitShortAllUnitsAtStop", orderDate);
        BigDecimal stopPrice = roundToTick(symbol, PriceLevels.shortStopLoss(stopBasePrice, percent));
        exitShortAllUnitsAtStop(symbol, orderDate, stopPrice);
    }

    /**
     * Runs the per-date pass: open units first receive the day's bar, then pending
     * orders are resolved against it.
     */
    public void processPendingOrders(LocalDate processingDate) {
        ledger.addBarForOpenPositions(processingDate, portfolio);
        orderBook.processPendingOrders(processingDate, ledger, portfolio);
    }

    // ---- Queries ----

    public boolean isLongPosition(String symbol) {
        return ledger.isLongPosition(symbol);
    }

    public boolean isShortPosition(String symbol) {
        return ledger.isShortPosition(symbol);
    }

    public boolean isFlatPosition(String symbol) {
        return ledger.isFlatPosition(symbol);
    }

    public InstrumentPosition getInstrumentPosition(String symbol) {
        return ledger.getInstrumentPosition(symbol);
    }

    public List<TradingOrder> getPendingOrders() {
        return orderBook.getPendingOrders();
    }

    public int getTotalTrades() {
        return transactions.getTotalTrades();
    }

    public int getOpenTrades() {
        return transactions.getOpenTrades();
    }

    public int getClosedTrades() {
        return transactions.getClosedTrades();
    }

    public List<StrategyTransaction> getStrategyTransactions() {
        return transactions.getStrategyTransactions();
    }

    public ClosedTradeCollection getClosedTradeCollection() {
        return closedTradeCollection;
    }

    public Portfolio getPortfolio() {
        return portfolio;
    }

    public BigDecimal getTick(String symbol) {
        requireKnownSymbol(symbol);
        return tickPolicy.getTick(symbol);
    }

    // ---- Order and position callbacks ----

    @Override
    public void onOrderEvent(OrderEvent event) {
        TradingOrder order = event.getOrder();
        switch (event.getEventType()) {
            case FILLED -> {
                if (order.isEntryOrder()) {
                    entryOrderExecuted(order);
                } else {
                    exitOrderExecuted(order);
                }
            }
            case CANCELED -> log.debug(
                    "Order {} ({} {}) canceled", order.getId(), order.getKind(), order.getTradingSymbol());
        }
    }

    @Override
    public void onPositionEvent(PositionEvent event) {
        TradingPosition position = event.getPosition();
        switch (event.getEventType()) {
            case CLOSED -> {
                if (transactions.findStrategyTransaction(position.getPositionId()).isEmpty()) {
                    throw new InconsistentStateException(
                            "No strategy transaction for closed position " + position.getPositionId(),
                            Map.of("positionId", position.getPositionId(), "symbol", position.getTradingSymbol()));
                }
                closedTradeCollection.addClosedPosition(position);
                log.debug("Position closed: {}", position);
            }
        }
    }

    private void entryOrderExecuted(TradingOrder order) {
        TradingPosition position = new TradingPosition(
                nextPositionId++,
                order.getTradingSymbol(),
                order.getKind().getPositionSide(),
                order.getFillPrice(),
                getEntryBar(order.getTradingSymbol(), order.getFillDate()),
                order.getVolume());
        position.setStopLoss(order.getStopLoss());
        position.setProfitTarget(order.getProfitTarget());
        position.addListener(this);

        ledger.addPosition(position);
        transactions.addStrategyTransaction(new StrategyTransaction(order, position));
    }

    private void exitOrderExecuted(TradingOrder order) {
        String symbol = order.getTradingSymbol();
        for (TradingPosition position : ledger.getInstrumentPosition(symbol).getOpenPositions()) {
            transactions.completeTransaction(position.getPositionId(), order);
        }
        ledger.closeAllPositions(symbol, order.getFillDate(), order.getFillPrice());
    }

    private PriceBar getEntryBar(String symbol, LocalDate fillDate) {
        return portfolio.getSecurity(symbol)
                .findBar(fillDate)
                .orElseThrow(() -> new InconsistentStateException(
                        "No bar for " + symbol + " on fill date " + fillDate,
                        Map.of("symbol", symbol, "date", fillDate)));
    }

    // ---- Helpers ----

    private void submit(TradingOrder order) {
        requireKnownSymbol(order.getTradingSymbol());
        orderBook.addOrder(order);
    }

    private void requireKnownSymbol(String symbol) {
        if (portfolio.findSecurity(symbol).isEmpty()) {
            throw new UnknownSymbolException("Security", symbol);
        }
    }

    private BigDecimal roundToTick(String symbol, BigDecimal price) {
        return PriceLevels.roundToTick(price, getTick(symbol));
    }

    private void requireLong(String symbol, String operation, LocalDate orderDate) {
        if (!ledger.isLongPosition(symbol)) {
            throw new StrategyBrokerException(
                    operation + ": no long position in " + symbol + " on " + orderDate,
                    Map.of("symbol", symbol, "orderDate", orderDate));
        }
    }

    private void requireShort(String symbol, String operation, LocalDate orderDate) {
        if (!ledger.isShortPosition(symbol)) {
            throw new StrategyBrokerException(
                    operation + ": no short position in " + symbol + " on " + orderDate,
                    Map.of("symbol", symbol, "orderDate", orderDate));
        }
    }
}
