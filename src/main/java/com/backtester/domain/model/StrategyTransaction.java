package com.backtester.domain.model;

import com.backtester.domain.enums.TransactionState;
import com.backtester.exception.PositionStateException;
import com.backtester.exception.ValidationException;
import java.util.Optional;
import lombok.Getter;

/**
 * Links one executed entry order to the position unit it created and, once the
 * closing order executes, to that exit order.
 */
@Getter
public class StrategyTransaction {

    private final TradingOrder entryOrder;
    private final TradingPosition position;
    private TradingOrder exitOrder;
    private TransactionState state = TransactionState.OPEN;

    public StrategyTransaction(TradingOrder entryOrder, TradingPosition position) {
        if (entryOrder == null || position == null) {
            throw new ValidationException("Strategy transaction needs both an entry order and a position");
        }
        if (!entryOrder.isEntryOrder()) {
            throw new ValidationException("Order " + entryOrder.getId() + " is not an entry order");
        }
        this.entryOrder = entryOrder;
        this.position = position;
    }

    public long getPositionId() {
        return position.getPositionId();
    }

    public Optional<TradingOrder> findExitOrder() {
        return Optional.ofNullable(exitOrder);
    }

    public boolean isTransactionOpen() {
        return state == TransactionState.OPEN;
    }

    public boolean isTransactionComplete() {
        return state == TransactionState.COMPLETE;
    }

    public void complete(TradingOrder exitOrder) {
        if (isTransactionComplete()) {
            throw new PositionStateException(
                    "Transaction for position " + getPositionId() + " is already complete");
        }
        if (exitOrder == null || !exitOrder.isExitOrder()) {
            throw new ValidationException("Transaction for position " + getPositionId() + " needs an exit order");
        }
        this.exitOrder = exitOrder;
        this.state = TransactionState.COMPLETE;
    }
}
