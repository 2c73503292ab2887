package com.backtester.event;

import com.backtester.domain.model.TradingOrder;
import org.springframework.context.ApplicationEvent;

/**
 * Published by the pending order book when it resolves a pending order during the
 * per-date pass.
 */
public class OrderEvent extends ApplicationEvent {

    private final TradingOrder order;
    private final OrderEventType eventType;

    /**
     * @param source    the order book that resolved the order
     * @param order     the resolved order
     * @param eventType how the order was resolved
     */
    public OrderEvent(Object source, TradingOrder order, OrderEventType eventType) {
        super(source);
        this.order = order;
        this.eventType = eventType;
    }

    public TradingOrder getOrder() {
        return order;
    }

    public OrderEventType getEventType() {
        return eventType;
    }
}
