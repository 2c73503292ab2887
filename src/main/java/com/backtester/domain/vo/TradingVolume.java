package com.backtester.domain.vo;

import com.backtester.domain.enums.VolumeUnit;
import com.backtester.exception.ValidationException;
import lombok.Value;

/**
 * Immutable, unsigned order or position size. The side lives on the order kind or
 * position, never on the volume.
 */
@Value
public class TradingVolume {

    long volume;
    VolumeUnit unit;

    public TradingVolume(long volume, VolumeUnit unit) {
        if (volume <= 0) {
            throw new ValidationException("Trading volume must be positive: " + volume);
        }
        if (unit == null) {
            throw new ValidationException("Trading volume unit is required");
        }
        this.volume = volume;
        this.unit = unit;
    }

    public static TradingVolume shares(long volume) {
        return new TradingVolume(volume, VolumeUnit.SHARES);
    }

    public static TradingVolume contracts(long volume) {
        return new TradingVolume(volume, VolumeUnit.CONTRACTS);
    }

    public TradingVolume add(TradingVolume other) {
        if (other.unit != unit) {
            throw new ValidationException("Cannot add " + other.unit + " volume to " + unit + " volume");
        }
        return new TradingVolume(volume + other.volume, unit);
    }
}
