package com.backtester.unit.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.backtester.domain.enums.VolumeUnit;
import com.backtester.domain.vo.PercentNumber;
import com.backtester.domain.vo.TradingVolume;
import com.backtester.exception.ValidationException;
import org.junit.jupiter.api.Test;

class TradingVolumeTest {

    @Test
    void add_sumsSameUnit() {
        TradingVolume total = TradingVolume.contracts(3).add(TradingVolume.contracts(2));

        assertThat(total.getVolume()).isEqualTo(5);
        assertThat(total.getUnit()).isEqualTo(VolumeUnit.CONTRACTS);
    }

    @Test
    void add_rejectsMixedUnits() {
        assertThatThrownBy(() -> TradingVolume.shares(1).add(TradingVolume.contracts(1)))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void nonPositiveVolume_rejected() {
        assertThatThrownBy(() -> TradingVolume.shares(0)).isInstanceOf(ValidationException.class);
    }

    @Test
    void percentNumber_asFraction() {
        assertThat(PercentNumber.of("2.5").asFraction()).isEqualByComparingTo("0.025");
    }
}
