package com.backtester.domain.model;

import com.backtester.domain.enums.OrderGroup;
import com.backtester.domain.enums.OrderKind;
import com.backtester.domain.enums.OrderState;
import com.backtester.domain.enums.PositionSide;
import com.backtester.domain.vo.TradingVolume;
import com.backtester.exception.OrderStateException;
import com.backtester.exception.ValidationException;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * One trading intent submitted by a strategy through the broker.
 *
 * <p>All eight order types share this class; {@link OrderKind} is the discriminant and
 * decides which of the optional price fields are meaningful:
 * <ul>
 *   <li>market entries may carry a stop loss and a profit target that are copied onto
 *       the position unit the entry creates</li>
 *   <li>limit and stop exits carry the trigger price</li>
 *   <li>market exits carry neither</li>
 * </ul>
 *
 * <p>The lifecycle is PENDING, then exactly one of EXECUTED or CANCELED. Fields other
 * than the lifecycle fields never change after construction.
 */
@Getter
@ToString
public class TradingOrder {

    private final long id;
    private final String tradingSymbol;
    private final OrderKind kind;
    private final TradingVolume volume;
    private final LocalDate orderDate;

    /** Stop loss to attach to the resulting position unit. Entry orders only, may be null. */
    private final BigDecimal stopLoss;

    /** Profit target to attach to the resulting position unit. Entry orders only, may be null. */
    private final BigDecimal profitTarget;

    /** Limit or stop level. Conditional exits only. */
    private final BigDecimal triggerPrice;

    private OrderState state = OrderState.PENDING;
    private LocalDate fillDate;
    private BigDecimal fillPrice;

    @Builder(access = AccessLevel.PRIVATE)
    private TradingOrder(
            long id,
            String tradingSymbol,
            OrderKind kind,
            TradingVolume volume,
            LocalDate orderDate,
            BigDecimal stopLoss,
            BigDecimal profitTarget,
            BigDecimal triggerPrice) {
        if (tradingSymbol == null || tradingSymbol.isBlank()) {
            throw new ValidationException("Order trading symbol is required");
        }
        if (volume == null) {
            throw new ValidationException("Order volume is required for " + tradingSymbol);
        }
        if (orderDate == null) {
            throw new ValidationException("Order date is required for " + tradingSymbol);
        }
        if (kind.isConditional() && (triggerPrice == null || triggerPrice.signum() <= 0)) {
            throw new ValidationException(kind + " order for " + tradingSymbol + " needs a positive trigger price");
        }
        requireNonNegative("stop loss", stopLoss, tradingSymbol);
        requireNonNegative("profit target", profitTarget, tradingSymbol);
        this.id = id;
        this.tradingSymbol = tradingSymbol;
        this.kind = kind;
        this.volume = volume;
        this.orderDate = orderDate;
        this.stopLoss = stopLoss;
        this.profitTarget = profitTarget;
        this.triggerPrice = triggerPrice;
    }

    public static TradingOrder marketEntry(
            long id,
            PositionSide side,
            String tradingSymbol,
            TradingVolume volume,
            LocalDate orderDate,
            BigDecimal stopLoss,
            BigDecimal profitTarget) {
        return TradingOrder.builder()
                .id(id)
                .kind(side == PositionSide.LONG ? OrderKind.MARKET_ENTRY_LONG : OrderKind.MARKET_ENTRY_SHORT)
                .tradingSymbol(tradingSymbol)
                .volume(volume)
                .orderDate(orderDate)
                .stopLoss(stopLoss)
                .profitTarget(profitTarget)
                .build();
    }

    public static TradingOrder marketExit(
            long id, PositionSide side, String tradingSymbol, TradingVolume volume, LocalDate orderDate) {
        return TradingOrder.builder()
                .id(id)
                .kind(side == PositionSide.LONG ? OrderKind.MARKET_EXIT_LONG : OrderKind.MARKET_EXIT_SHORT)
                .tradingSymbol(tradingSymbol)
                .volume(volume)
                .orderDate(orderDate)
                .build();
    }

    public static TradingOrder limitExit(
            long id,
            PositionSide side,
            String tradingSymbol,
            TradingVolume volume,
            LocalDate orderDate,
            BigDecimal limitPrice) {
        return TradingOrder.builder()
                .id(id)
                .kind(side == PositionSide.LONG ? OrderKind.LIMIT_EXIT_LONG : OrderKind.LIMIT_EXIT_SHORT)
                .tradingSymbol(tradingSymbol)
                .volume(volume)
                .orderDate(orderDate)
                .triggerPrice(limitPrice)
                .build();
    }

    public static TradingOrder stopExit(
            long id,
            PositionSide side,
            String tradingSymbol,
            TradingVolume volume,
            LocalDate orderDate,
            BigDecimal stopPrice) {
        return TradingOrder.builder()
                .id(id)
                .kind(side == PositionSide.LONG ? OrderKind.STOP_EXIT_LONG : OrderKind.STOP_EXIT_SHORT)
                .tradingSymbol(tradingSymbol)
                .volume(volume)
                .orderDate(orderDate)
                .triggerPrice(stopPrice)
                .build();
    }

    /**
     * Records the fill. The fill date must postdate the order date, and for conditional
     * exits the price must sit on the correct side of the trigger.
     */
    public void markExecuted(LocalDate fillDate, BigDecimal fillPrice) {
        requirePending("execute");
        if (fillDate == null || !fillDate.isAfter(orderDate)) {
            throw new OrderStateException(String.format(
                    "Order %d (%s %s): fill date %s must be after order date %s",
                    id, kind, tradingSymbol, fillDate, orderDate));
        }
        if (fillPrice == null || fillPrice.signum() <= 0) {
            throw new OrderStateException(
                    String.format("Order %d (%s %s): fill price must be positive: %s", id, kind, tradingSymbol, fillPrice));
        }
        validateFillAgainstTrigger(fillPrice);
        this.fillDate = fillDate;
        this.fillPrice = fillPrice;
        this.state = OrderState.EXECUTED;
    }

    public void markCanceled() {
        requirePending("cancel");
        this.state = OrderState.CANCELED;
    }

    public boolean isPending() {
        return state == OrderState.PENDING;
    }

    public boolean isExecuted() {
        return state == OrderState.EXECUTED;
    }

    public boolean isCanceled() {
        return state == OrderState.CANCELED;
    }

    public boolean isEntryOrder() {
        return kind.isEntry();
    }

    public boolean isExitOrder() {
        return kind.isExit();
    }

    public boolean isLongOrder() {
        return kind.getPositionSide() == PositionSide.LONG;
    }

    public boolean isShortOrder() {
        return kind.getPositionSide() == PositionSide.SHORT;
    }

    public boolean isMarketOrder() {
        return kind.isMarket();
    }

    public boolean isStopOrder() {
        return kind.getGroup() == OrderGroup.STOP_EXIT;
    }

    public boolean isLimitOrder() {
        return kind.getGroup() == OrderGroup.LIMIT_EXIT;
    }

    public OrderGroup getGroup() {
        return kind.getGroup();
    }

    private void validateFillAgainstTrigger(BigDecimal price) {
        boolean consistent =
                switch (kind) {
                    case LIMIT_EXIT_LONG, STOP_EXIT_SHORT -> price.compareTo(triggerPrice) >= 0;
                    case LIMIT_EXIT_SHORT, STOP_EXIT_LONG -> price.compareTo(triggerPrice) <= 0;
                    case MARKET_ENTRY_LONG, MARKET_ENTRY_SHORT, MARKET_EXIT_LONG, MARKET_EXIT_SHORT -> true;
                };
        if (!consistent) {
            throw new OrderStateException(String.format(
                    "Order %d (%s %s): fill price %s is inconsistent with trigger %s",
                    id, kind, tradingSymbol, price, triggerPrice));
        }
    }

    private void requirePending(String action) {
        if (state != OrderState.PENDING) {
            throw new OrderStateException(
                    String.format("Cannot %s order %d (%s %s): already %s", action, id, kind, tradingSymbol, state));
        }
    }

    private static void requireNonNegative(String field, BigDecimal value, String tradingSymbol) {
        if (value != null && value.signum() < 0) {
            throw new ValidationException("Negative " + field + " for " + tradingSymbol + ": " + value);
        }
    }
}
