package io.slobengine.domain.trade;

public enum TradeStatus {
    OPEN,
    CLOSED
}
