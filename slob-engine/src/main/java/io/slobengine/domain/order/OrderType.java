package io.slobengine.domain.order;

public enum OrderType {
    LIMIT,
    STOP
}
