package io.slobengine.domain.order;

/**
 * Order status as tracked locally and reported by the venue.
 */
public enum OrderStatus {
    PENDING,
    PLACED,
    PARTIAL,
    FILLED,
    REJECTED,
    CANCELLED;

    public boolean isLive() {
        return this == PENDING || this == PLACED || this == PARTIAL;
    }
}
