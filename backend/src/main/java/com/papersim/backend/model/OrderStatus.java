package com.papersim.backend.model;

/**
 * Paper order lifecycle. Every order starts PENDING and ends in exactly one terminal state.
 */
public enum OrderStatus {
    PENDING,
    FILLED,
    CANCELLED,
    REJECTED;

    public boolean isTerminal() {
        return this != PENDING;
    }

    public boolean canTransitionTo(OrderStatus target) {
        if (target == null) return false;
        return this == PENDING && target != PENDING;
    }
}
