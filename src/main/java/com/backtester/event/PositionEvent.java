package com.backtester.event;

import com.backtester.domain.model.TradingPosition;
import org.springframework.context.ApplicationEvent;

/**
 * Published when a position unit changes lifecycle state. CLOSED events are what the
 * broker turns into closed-trade publications.
 */
public class PositionEvent extends ApplicationEvent {

    private final TradingPosition position;
    private final PositionEventType eventType;

    public PositionEvent(Object source, TradingPosition position, PositionEventType eventType) {
        super(source);
        this.position = position;
        this.eventType = eventType;
    }

    public TradingPosition getPosition() {
        return position;
    }

    public PositionEventType getEventType() {
        return eventType;
    }
}
