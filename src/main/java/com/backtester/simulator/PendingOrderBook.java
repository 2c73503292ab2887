package com.backtester.simulator;

import com.backtester.domain.enums.OrderGroup;
import com.backtester.domain.model.PriceBar;
import com.backtester.domain.model.TradingOrder;
import com.backtester.event.OrderEvent;
import com.backtester.event.OrderEventListener;
import com.backtester.event.OrderEventType;
import com.backtester.exception.OrderStateException;
import com.backtester.portfolio.Portfolio;
import com.backtester.position.InstrumentPositionLedger;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds pending orders and resolves them once per simulated date.
 *
 * <p>Orders are bucketed by {@link OrderGroup}. A date pass walks the groups in priority
 * order (market exits, market entries, stop exits, limit exits) and each group in
 * submission order. Exits therefore release a position before a same-day entry opens a
 * new unit, and a stop that fills closes the position before a limit on the same bar
 * gets a chance to.
 *
 * <p>Every resolved order leaves the book and is announced to the registered
 * {@link OrderEventListener}s synchronously. Listeners may change position state during
 * the pass; later orders in the same pass see that state.
 */
public class PendingOrderBook {

    private static final Logger log = LoggerFactory.getLogger(PendingOrderBook.class);

    private final Map<OrderGroup, List<TradingOrder>> pendingOrders = new EnumMap<>(OrderGroup.class);

    private final List<OrderEventListener> listeners = new ArrayList<>();

    private final FillSimulator fillSimulator;

    public PendingOrderBook() {
        this(new FillSimulator());
    }

    public PendingOrderBook(FillSimulator fillSimulator) {
        this.fillSimulator = fillSimulator;
        for (OrderGroup group : OrderGroup.values()) {
            pendingOrders.put(group, new ArrayList<>());
        }
    }

    public void addListener(OrderEventListener listener) {
        listeners.add(listener);
    }

    /**
     * Queues an order for resolution.
     *
     * @throws OrderStateException if the order is null or already resolved
     */
    public void addOrder(TradingOrder order) {
        if (order == null) {
            throw new OrderStateException("Cannot add a null order to the order book");
        }
        if (!order.isPending()) {
            throw new OrderStateException(
                    "Order " + order.getId() + " (" + order.getKind() + ") is " + order.getState() + ", not pending");
        }
        pendingOrders.get(order.getGroup()).add(order);
        log.debug(
                "Order queued: id={} {} {} vol={} date={}",
                order.getId(),
                order.getKind(),
                order.getTradingSymbol(),
                order.getVolume().getVolume(),
                order.getOrderDate());
    }

    /** All pending orders, oldest order date first, then in submission order. */
    public List<TradingOrder> getPendingOrders() {
        List<TradingOrder> all = new ArrayList<>();
        pendingOrders.values().forEach(all::addAll);
        all.sort(Comparator.comparing(TradingOrder::getOrderDate).thenComparingLong(TradingOrder::getId));
        return Collections.unmodifiableList(all);
    }

    public int getNumMarketExitOrders() {
        return pendingOrders.get(OrderGroup.MARKET_EXIT).size();
    }

    public int getNumMarketEntryOrders() {
        return pendingOrders.get(OrderGroup.MARKET_ENTRY).size();
    }

    public int getNumStopExitOrders() {
        return pendingOrders.get(OrderGroup.STOP_EXIT).size();
    }

    public int getNumLimitExitOrders() {
        return pendingOrders.get(OrderGroup.LIMIT_EXIT).size();
    }

    public int getNumPendingOrders() {
        return pendingOrders.values().stream().mapToInt(List::size).sum();
    }

    /**
     * Resolves every order that is eligible on {@code date}.
     *
     * <p>An order is eligible when the date is after its order date and its symbol has a
     * bar on that date. Eligible exits on a symbol that is already flat are canceled
     * without simulation; every other eligible order is filled or canceled by the
     * {@link FillSimulator}. Ineligible orders stay pending. An exit stamped with
     * {@code date} itself is canceled straight away when its symbol is flat.
     *
     * <p>An eligible entry whose symbol holds units on the other side is canceled too;
     * the position must be exited before the side can flip.
     */
    public void processPendingOrders(LocalDate date, InstrumentPositionLedger ledger, Portfolio portfolio) {
        for (OrderGroup group : OrderGroup.inProcessingOrder()) {
            List<TradingOrder> orders = pendingOrders.get(group);
            if (!orders.isEmpty()) {
                log.debug("{} on {}: {} pending", group.getDescription(), date, orders.size());
            }
            for (TradingOrder order : List.copyOf(orders)) {
                String symbol = order.getTradingSymbol();

                if (order.isExitOrder() && order.getOrderDate().equals(date) && ledger.isFlatPosition(symbol)) {
                    orders.remove(order);
                    cancel(order, "position already flat");
                    continue;
                }

                if (!date.isAfter(order.getOrderDate())) {
                    continue;
                }
                Optional<PriceBar> bar = portfolio.getSecurity(symbol).findBar(date);
                if (bar.isEmpty()) {
                    continue;
                }

                orders.remove(order);
                if (order.isExitOrder() && ledger.isFlatPosition(symbol)) {
                    cancel(order, "position already flat");
                    continue;
                }
                if (order.isEntryOrder() && holdsOppositeSide(order, ledger)) {
                    cancel(order, "opposite position open");
                    continue;
                }

                Optional<Fill> fill = fillSimulator.resolve(order, bar.get());
                if (fill.isPresent()) {
                    execute(order, fill.get());
                } else {
                    cancel(order, "not triggered on " + date);
                }
            }
        }
    }

    // ---- Resolution ----

    private boolean holdsOppositeSide(TradingOrder order, InstrumentPositionLedger ledger) {
        String symbol = order.getTradingSymbol();
        return switch (order.getKind().getPositionSide()) {
            case LONG -> ledger.isShortPosition(symbol);
            case SHORT -> ledger.isLongPosition(symbol);
        };
    }

    private void execute(TradingOrder order, Fill fill) {
        order.markExecuted(fill.getDate(), fill.getPrice());
        log.debug(
                "Order filled: id={} {} {} vol={} @ {} on {}",
                order.getId(),
                order.getKind(),
                order.getTradingSymbol(),
                order.getVolume().getVolume(),
                fill.getPrice(),
                fill.getDate());
        publish(order, OrderEventType.FILLED);
    }

    private void cancel(TradingOrder order, String reason) {
        order.markCanceled();
        log.debug("Order canceled: id={} {} {} ({})", order.getId(), order.getKind(), order.getTradingSymbol(), reason);
        publish(order, OrderEventType.CANCELED);
    }

    private void publish(TradingOrder order, OrderEventType eventType) {
        OrderEvent event = new OrderEvent(this, order, eventType);
        for (OrderEventListener listener : List.copyOf(listeners)) {
            listener.onOrderEvent(event);
        }
    }
}
