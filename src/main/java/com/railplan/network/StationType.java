package com.railplan.network;

public enum StationType {
    STATION,
    INTERCHANGE,
    DEPOT
}
