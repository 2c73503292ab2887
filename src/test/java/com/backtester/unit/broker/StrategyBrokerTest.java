package com.backtester.unit.broker;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import com.backtester.broker.StrategyBroker;
import com.backtester.domain.enums.OrderKind;
import com.backtester.domain.enums.PositionSide;
import com.backtester.domain.model.PriceBar;
import com.backtester.domain.model.TradingOrder;
import com.backtester.domain.model.TradingPosition;
import com.backtester.domain.vo.PercentNumber;
import com.backtester.domain.vo.TradingVolume;
import com.backtester.event.OrderEvent;
import com.backtester.event.OrderEventType;
import com.backtester.event.PositionEvent;
import com.backtester.event.PositionEventType;
import com.backtester.exception.ErrorCode;
import com.backtester.exception.InconsistentStateException;
import com.backtester.exception.StrategyBrokerException;
import com.backtester.exception.UnknownSymbolException;
import com.backtester.history.ClosedTradeCollection;
import com.backtester.portfolio.Portfolio;
import com.backtester.portfolio.Security;
import com.backtester.pricing.ConfiguredTickPolicy;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Unit tests for StrategyBroker covering order submission, state checks on exits,
 * percent-based price levels, fill callbacks and closed-trade publication.
 */
@ExtendWith(MockitoExtension.class)
class StrategyBrokerTest {

    private static final String SYMBOL = "IBM";
    private static final LocalDate D1 = LocalDate.of(2024, 1, 8);
    private static final LocalDate D2 = D1.plusDays(1);
    private static final LocalDate D3 = D1.plusDays(2);
    private static final LocalDate D4 = D1.plusDays(3);
    private static final TradingVolume VOLUME = TradingVolume.shares(100);

    @Mock
    private ClosedTradeCollection closedTrades;

    private StrategyBroker broker;

    @BeforeEach
    void setUp() {
        Portfolio portfolio = new Portfolio("broker-test");
        portfolio.addSecurity(new Security(SYMBOL, List.of(
                PriceBar.of(D1, "100", "101", "99", "100"),
                PriceBar.of(D2, "100", "102", "98", "101"),
                PriceBar.of(D3, "101", "112", "98", "110"),
                PriceBar.of(D4, "109", "111", "104", "105"))));
        broker = new StrategyBroker(
                portfolio, new ConfiguredTickPolicy(Map.of(SYMBOL, new BigDecimal("0.25")), new BigDecimal("0.01")),
                closedTrades);
    }

    private void goLong() {
        broker.enterLongOnOpen(SYMBOL, D1, VOLUME);
        broker.processPendingOrders(D2);
    }

    private void goShort() {
        broker.enterShortOnOpen(SYMBOL, D1, VOLUME);
        broker.processPendingOrders(D2);
    }

    @Nested
    @DisplayName("Entries")
    class Entries {

        @Test
        @DisplayName("Entry is pending until the next bar, then opens a unit at the open")
        void entryOpensUnit() {
            broker.enterLongOnOpen(SYMBOL, D1, VOLUME, new BigDecimal("95"), new BigDecimal("110"));

            assertThat(broker.getPendingOrders()).hasSize(1);
            assertThat(broker.isFlatPosition(SYMBOL)).isTrue();

            broker.processPendingOrders(D2);

            assertThat(broker.isLongPosition(SYMBOL)).isTrue();
            assertThat(broker.getPendingOrders()).isEmpty();
            TradingPosition unit = broker.getInstrumentPosition(SYMBOL).getPosition(1);
            assertThat(unit.getEntryPrice()).isEqualByComparingTo("100");
            assertThat(unit.getEntryDate()).isEqualTo(D2);
            assertThat(unit.getStopLoss()).isEqualByComparingTo("95");
            assertThat(unit.getProfitTarget()).isEqualByComparingTo("110");
            assertThat(broker.getTotalTrades()).isEqualTo(1);
            assertThat(broker.getOpenTrades()).isEqualTo(1);
        }

        @Test
        @DisplayName("Entry without stop or target leaves them unset")
        void entryWithoutLevels() {
            goShort();

            TradingPosition unit = broker.getInstrumentPosition(SYMBOL).getPosition(1);
            assertThat(broker.isShortPosition(SYMBOL)).isTrue();
            assertThat(unit.getStopLoss()).isNull();
            assertThat(unit.getProfitTarget()).isNull();
        }

        @Test
        @DisplayName("Entry for a symbol outside the portfolio is rejected")
        void unknownSymbolRejected() {
            UnknownSymbolException e =
                    catchThrowableOfType(() -> broker.enterLongOnOpen("NOPE", D1, VOLUME), UnknownSymbolException.class);

            assertThat(e.getErrorCode()).isEqualTo(ErrorCode.NOT_FOUND);
            assertThat(e.isFatal()).isFalse();
            assertThat(broker.getPendingOrders()).isEmpty();
        }

        @Test
        @DisplayName("Each unit gets its own transaction, sorted by entry date")
        void transactionsPerUnit() {
            goLong();
            broker.enterLongOnOpen(SYMBOL, D2, VOLUME);
            broker.processPendingOrders(D3);

            assertThat(broker.getStrategyTransactions())
                    .extracting(transaction -> transaction.getPosition().getEntryDate())
                    .containsExactly(D2, D3);
            assertThat(broker.getInstrumentPosition(SYMBOL).getNumPositionUnits()).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("Exit Preconditions")
    class ExitPreconditions {

        @Test
        @DisplayName("Every exit on a flat symbol is rejected without queuing an order")
        void flatExitsRejected() {
            StrategyBrokerException e = catchThrowableOfType(
                    () -> broker.exitLongAllUnitsOnOpen(SYMBOL, D1), StrategyBrokerException.class);
            assertThat(e.getErrorCode()).isEqualTo(ErrorCode.INVALID_STATE);
            assertThat(e.isFatal()).isFalse();
            assertThat(e.getDetails()).containsEntry("symbol", SYMBOL).containsEntry("orderDate", D1);

            assertThatThrownBy(() -> broker.exitShortAllUnitsOnOpen(SYMBOL, D1))
                    .isInstanceOf(StrategyBrokerException.class);
            assertThatThrownBy(() -> broker.exitLongAllUnitsAtLimit(SYMBOL, D1, new BigDecimal("110")))
                    .isInstanceOf(StrategyBrokerException.class);
            assertThatThrownBy(() -> broker.exitShortAllUnitsAtLimit(SYMBOL, D1, new BigDecimal("90")))
                    .isInstanceOf(StrategyBrokerException.class);
            assertThatThrownBy(() -> broker.exitLongAllUnitsAtStop(SYMBOL, D1, new BigDecimal("90")))
                    .isInstanceOf(StrategyBrokerException.class);
            assertThatThrownBy(() -> broker.exitShortAllUnitsAtStop(SYMBOL, D1, BigDecimal.TEN, PercentNumber.of("2")))
                    .isInstanceOf(StrategyBrokerException.class);

            assertThat(broker.getPendingOrders()).isEmpty();
            assertThat(broker.isFlatPosition(SYMBOL)).isTrue();
        }

        @Test
        @DisplayName("Short exit on a long position is rejected")
        void wrongSideRejected() {
            goLong();

            assertThatThrownBy(() -> broker.exitShortAllUnitsOnOpen(SYMBOL, D2))
                    .isInstanceOf(StrategyBrokerException.class)
                    .hasMessageContaining("no short position");
            assertThat(broker.getPendingOrders()).isEmpty();
            assertThat(broker.isLongPosition(SYMBOL)).isTrue();
        }
    }

    @Nested
    @DisplayName("Exit Orders")
    class ExitOrders {

        @Test
        @DisplayName("Exit volume covers every open unit")
        void exitVolumeCoversAllUnits() {
            goLong();
            broker.enterLongOnOpen(SYMBOL, D2, TradingVolume.shares(50));
            broker.processPendingOrders(D3);

            broker.exitLongAllUnitsAtStop(SYMBOL, D3, new BigDecimal("99"));

            TradingOrder stop = broker.getPendingOrders().get(0);
            assertThat(stop.getKind()).isEqualTo(OrderKind.STOP_EXIT_LONG);
            assertThat(stop.getVolume()).isEqualTo(TradingVolume.shares(150));
        }

        @Test
        @DisplayName("Percent limit is computed from the base and rounded to the symbol tick")
        void percentLimitRounded() {
            goLong();

            // 101.3 * 1.10 = 111.43, nearest 0.25 tick is 111.50
            broker.exitLongAllUnitsAtLimit(SYMBOL, D2, new BigDecimal("101.3"), PercentNumber.of("10"));

            assertThat(broker.getPendingOrders().get(0).getTriggerPrice()).isEqualByComparingTo("111.50");
        }

        @Test
        @DisplayName("Percent stop on a short sits above the base")
        void percentShortStop() {
            goShort();

            broker.exitShortAllUnitsAtStop(SYMBOL, D2, new BigDecimal("100"), PercentNumber.of("2"));

            TradingOrder stop = broker.getPendingOrders().get(0);
            assertThat(stop.getKind()).isEqualTo(OrderKind.STOP_EXIT_SHORT);
            assertThat(stop.getTriggerPrice()).isEqualByComparingTo("102");
        }

        @Test
        @DisplayName("Filled exit closes all units and publishes each one")
        void exitClosesAndPublishes() {
            goLong();
            broker.enterLongOnOpen(SYMBOL, D2, VOLUME);
            broker.processPendingOrders(D3);
            broker.exitLongAllUnitsOnOpen(SYMBOL, D3);

            broker.processPendingOrders(D4);

            ArgumentCaptor<TradingPosition> captor = ArgumentCaptor.forClass(TradingPosition.class);
            verify(closedTrades, times(2)).addClosedPosition(captor.capture());
            assertThat(captor.getAllValues()).allSatisfy(position -> {
                assertThat(position.isPositionClosed()).isTrue();
                assertThat(position.getExitPrice()).isEqualByComparingTo("109");
                assertThat(position.getExitDate()).isEqualTo(D4);
            });
            assertThat(broker.isFlatPosition(SYMBOL)).isTrue();
            assertThat(broker.getOpenTrades()).isZero();
            assertThat(broker.getClosedTrades()).isEqualTo(2);
            assertThat(broker.getStrategyTransactions())
                    .allSatisfy(transaction -> assertThat(transaction.isTransactionComplete()).isTrue());
        }

        @Test
        @DisplayName("Untriggered limit is canceled and the position stays open")
        void untriggeredLimitCanceled() {
            goLong();
            broker.exitLongAllUnitsAtLimit(SYMBOL, D2, new BigDecimal("120"));

            broker.processPendingOrders(D3);

            assertThat(broker.isLongPosition(SYMBOL)).isTrue();
            assertThat(broker.getPendingOrders()).isEmpty();
            verify(closedTrades, never()).addClosedPosition(any());
        }
    }

    @Nested
    @DisplayName("Consistency Checks")
    class ConsistencyChecks {

        @Test
        @DisplayName("Entry fill on a date without a bar is an inconsistent state")
        void entryFillWithoutBar() {
            TradingOrder order = TradingOrder.marketEntry(99, PositionSide.LONG, SYMBOL, VOLUME, D4, null, null);
            order.markExecuted(D4.plusDays(10), new BigDecimal("100"));

            assertThatThrownBy(() -> broker.onOrderEvent(new OrderEvent(this, order, OrderEventType.FILLED)))
                    .isInstanceOf(InconsistentStateException.class)
                    .hasFieldOrPropertyWithValue("errorCode", ErrorCode.INTERNAL_ERROR);
            assertThat(broker.isFlatPosition(SYMBOL)).isTrue();
        }

        @Test
        @DisplayName("Closed position without a transaction is an inconsistent state")
        void closedPositionWithoutTransaction() {
            PriceBar bar = PriceBar.of(D1, "100", "101", "99", "100");
            TradingPosition stray =
                    new TradingPosition(777, SYMBOL, PositionSide.LONG, new BigDecimal("100"), bar, VOLUME);
            stray.close(D2, new BigDecimal("101"));

            InconsistentStateException e = catchThrowableOfType(
                    () -> broker.onPositionEvent(new PositionEvent(this, stray, PositionEventType.CLOSED)),
                    InconsistentStateException.class);

            assertThat(e.getErrorCode()).isEqualTo(ErrorCode.INTERNAL_ERROR);
            assertThat(e.isFatal()).isTrue();
            verify(closedTrades, never()).addClosedPosition(any());
        }

        @Test
        @DisplayName("Tick lookup for an unknown symbol fails")
        void unknownTick() {
            assertThat(broker.getTick(SYMBOL)).isEqualByComparingTo("0.25");
            assertThatThrownBy(() -> broker.getTick("NOPE")).isInstanceOf(UnknownSymbolException.class);
        }
    }
}
