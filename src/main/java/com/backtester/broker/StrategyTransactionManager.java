package com.backtester.broker;

import com.backtester.domain.model.StrategyTransaction;
import com.backtester.domain.model.TradingOrder;
import com.backtester.exception.InconsistentStateException;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Strategy transactions indexed by the id of the position unit each one created.
 */
public class StrategyTransactionManager {

    private final Map<Long, StrategyTransaction> transactions = new LinkedHashMap<>();

    private int openTrades;
    private int closedTrades;

    public void addStrategyTransaction(StrategyTransaction transaction) {
        long positionId = transaction.getPositionId();
        if (transactions.containsKey(positionId)) {
            throw new InconsistentStateException(
                    "Strategy transaction already recorded for position " + positionId,
                    Map.of("positionId", positionId));
        }
        transactions.put(positionId, transaction);
        if (transaction.isTransactionOpen()) {
            openTrades++;
        } else {
            closedTrades++;
        }
    }

    public Optional<StrategyTransaction> findStrategyTransaction(long positionId) {
        return Optional.ofNullable(transactions.get(positionId));
    }

    /**
     * Completes the open transaction of a position unit with the order that closed it.
     *
     * @throws InconsistentStateException if no transaction exists for the unit
     */
    public void completeTransaction(long positionId, TradingOrder exitOrder) {
        StrategyTransaction transaction = findStrategyTransaction(positionId)
                .orElseThrow(() -> new InconsistentStateException(
                        "No strategy transaction for position " + positionId,
                        Map.of("positionId", positionId, "exitOrderId", exitOrder.getId())));
        transaction.complete(exitOrder);
        openTrades--;
        closedTrades++;
    }

    public int getTotalTrades() {
        return transactions.size();
    }

    public int getOpenTrades() {
        return openTrades;
    }

    public int getClosedTrades() {
        return closedTrades;
    }

    /** All transactions ordered by entry date; same-day entries keep creation order. */
    public List<StrategyTransaction> getStrategyTransactions() {
        return transactions.values().stream()
                .sorted(Comparator.comparing(transaction -> transaction.getPosition().getEntryDate()))
                .toList();
    }
}
