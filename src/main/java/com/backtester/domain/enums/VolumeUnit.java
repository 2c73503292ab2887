package com.backtester.domain.enums;

public enum VolumeUnit {
    SHARES,
    CONTRACTS
}
