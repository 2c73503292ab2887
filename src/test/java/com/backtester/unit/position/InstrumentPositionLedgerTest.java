package com.backtester.unit.position;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.backtester.domain.enums.PositionSide;
import com.backtester.domain.model.PriceBar;
import com.backtester.domain.model.TradingPosition;
import com.backtester.domain.vo.TradingVolume;
import com.backtester.exception.InstrumentPositionException;
import com.backtester.exception.UnknownSymbolException;
import com.backtester.portfolio.Portfolio;
import com.backtester.portfolio.Security;
import com.backtester.position.InstrumentPositionLedger;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InstrumentPositionLedgerTest {

    private static final LocalDate DAY1 = LocalDate.of(2024, 7, 1);
    private static final LocalDate DAY2 = DAY1.plusDays(1);

    private InstrumentPositionLedger ledger;
    private Portfolio portfolio;

    @BeforeEach
    void setUp() {
        portfolio = new Portfolio("ledger");
        portfolio.addSecurity(new Security("AAA", List.of(
                PriceBar.of(DAY1, "10", "11", "9", "10"), PriceBar.of(DAY2, "10", "12", "10", "11"))));
        portfolio.addSecurity(new Security("BBB", List.of(PriceBar.of(DAY1, "20", "21", "19", "20"))));
        portfolio.addSecurity(new Security("CCC", List.of(PriceBar.of(DAY2, "30", "31", "29", "30"))));

        ledger = new InstrumentPositionLedger();
        portfolio.getSymbols().forEach(ledger::addInstrument);
    }

    private TradingPosition openLong(String symbol, long id) {
        PriceBar entryBar = portfolio.getSecurity(symbol).findBar(DAY1).orElseThrow();
        TradingPosition position =
                new TradingPosition(id, symbol, PositionSide.LONG, entryBar.getOpen(), entryBar, TradingVolume.shares(5));
        ledger.addPosition(position);
        return position;
    }

    @Test
    void registeredSymbols_startFlat() {
        assertThat(ledger.getNumInstruments()).isEqualTo(3);
        assertThat(ledger.getSymbols()).containsExactly("AAA", "BBB", "CCC");
        assertThat(ledger.isFlatPosition("AAA")).isTrue();
    }

    @Test
    void duplicateInstrument_rejected() {
        assertThatThrownBy(() -> ledger.addInstrument("AAA")).isInstanceOf(InstrumentPositionException.class);
    }

    @Test
    void unknownSymbol_throwsUnknownSymbol() {
        assertThatThrownBy(() -> ledger.isLongPosition("ZZZ"))
                .isInstanceOf(UnknownSymbolException.class)
                .hasMessageContaining("ZZZ");
    }

    @Test
    void addPosition_tracksUnitsPerSymbol() {
        TradingPosition first = openLong("AAA", 1);
        openLong("AAA", 2);

        assertThat(ledger.isLongPosition("AAA")).isTrue();
        assertThat(ledger.isShortPosition("AAA")).isFalse();
        assertThat(ledger.getNumPositionUnits("AAA")).isEqualTo(2);
        assertThat(ledger.getVolumeInAllUnits("AAA")).isEqualTo(TradingVolume.shares(10));
        assertThat(ledger.getTradingPosition("AAA", 1)).isSameAs(first);
        assertThat(ledger.isFlatPosition("BBB")).isTrue();
    }

    @Test
    void addBarForOpenPositions_skipsFlatAndMissingBars() {
        TradingPosition aaa = openLong("AAA", 1);
        TradingPosition bbb = openLong("BBB", 2);

        ledger.addBarForOpenPositions(DAY2, portfolio);

        assertThat(aaa.getBarHistory()).extracting(PriceBar::getDate).containsExactly(DAY2);
        // BBB has no DAY2 bar, CCC is flat
        assertThat(bbb.getBarHistory()).isEmpty();
    }

    @Test
    void closeAllPositions_flattensSymbol() {
        TradingPosition first = openLong("AAA", 1);
        TradingPosition second = openLong("AAA", 2);

        ledger.closeAllPositions("AAA", DAY2, new BigDecimal("11"));

        assertThat(ledger.isFlatPosition("AAA")).isTrue();
        assertThat(first.isPositionClosed()).isTrue();
        assertThat(second.getExitPrice()).isEqualByComparingTo("11");
    }

    @Test
    void closeUnitPosition_closesOnlyThatUnit() {
        openLong("AAA", 1);
        TradingPosition second = openLong("AAA", 2);

        ledger.closeUnitPosition("AAA", DAY2, new BigDecimal("11"), 2);

        assertThat(second.isPositionClosed()).isTrue();
        assertThat(ledger.getNumPositionUnits("AAA")).isEqualTo(1);
    }
}
