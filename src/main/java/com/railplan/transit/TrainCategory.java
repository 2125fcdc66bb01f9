package com.railplan.transit;

/** Service category of a train, used when generating services to pick default performance values. */
public enum TrainCategory {
    HIGH_SPEED (300),
    INTERCITY (160),
    REGIONAL (160),
    FREIGHT (100);

    public final double defaultMaxSpeedKmh;

    TrainCategory (double defaultMaxSpeedKmh) {
        this.defaultMaxSpeedKmh = defaultMaxSpeedKmh;
    }
}
