package com.backtester.event;

@FunctionalInterface
public interface PositionEventListener {

    void onPositionEvent(PositionEvent event);
}
