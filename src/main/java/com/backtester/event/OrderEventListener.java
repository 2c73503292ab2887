package com.backtester.event;

@FunctionalInterface
public interface OrderEventListener {

    void onOrderEvent(OrderEvent event);
}
