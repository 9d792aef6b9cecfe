package com.ensemble.anomaly.detector.graph;

public enum ActorType {
    CUSTOMER,
    MERCHANT
}
