package com.backtester.simulator;

import com.backtester.domain.model.PriceBar;
import com.backtester.domain.model.TradingOrder;
import com.backtester.exception.OrderStateException;
import java.math.BigDecimal;
import java.util.Optional;

/**
 * Decides whether a pending order fills on a given bar and at what price.
 *
 * <p>Fill rules (the bar must postdate the order date):
 * <ul>
 *   <li>Market entry/exit: always fills at the open</li>
 *   <li>Limit exit long: fills when high &gt; limit, at the open if the bar gaps above the limit</li>
 *   <li>Limit exit short: fills when low &lt; limit, at the open if the bar gaps below the limit</li>
 *   <li>Stop exit long: fills when low &lt; stop, at the open if the bar gaps below the stop</li>
 *   <li>Stop exit short: fills when high &gt; stop, at the open if the bar gaps above the stop</li>
 * </ul>
 *
 * <p>The order is never mutated; the caller applies the returned fill.
 */
public class FillSimulator {

    public Optional<Fill> resolve(TradingOrder order, PriceBar bar) {
        if (!order.isPending()) {
            throw new OrderStateException(String.format(
                    "Order %d (%s %s) is %s and cannot be simulated",
                    order.getId(), order.getKind(), order.getTradingSymbol(), order.getState()));
        }
        if (!bar.getDate().isAfter(order.getOrderDate())) {
            throw new OrderStateException(String.format(
                    "Order %d (%s %s): bar date %s must be after order date %s",
                    order.getId(), order.getKind(), order.getTradingSymbol(), bar.getDate(), order.getOrderDate()));
        }

        BigDecimal open = bar.getOpen();
        BigDecimal trigger = order.getTriggerPrice();
        BigDecimal fillPrice =
                switch (order.getKind()) {
                    case MARKET_ENTRY_LONG, MARKET_ENTRY_SHORT, MARKET_EXIT_LONG, MARKET_EXIT_SHORT -> open;
                    case LIMIT_EXIT_LONG, STOP_EXIT_SHORT -> bar.getHigh().compareTo(trigger) > 0
                            ? max(open, trigger)
                            : null;
                    case LIMIT_EXIT_SHORT, STOP_EXIT_LONG -> bar.getLow().compareTo(trigger) < 0
                            ? min(open, trigger)
                            : null;
                };
        return Optional.ofNullable(fillPrice).map(price -> new Fill(bar.getDate(), price));
    }

    // Open beyond the trigger means the bar gapped through it.

    private static BigDecimal max(BigDecimal open, BigDecimal trigger) {
        return open.compareTo(trigger) > 0 ? open : trigger;
    }

    private static BigDecimal min(BigDecimal open, BigDecimal trigger) {
        return open.compareTo(trigger) < 0 ? open : trigger;
    }
}
