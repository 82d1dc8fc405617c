package com.papersim.backend.model;

/**
 * Why the risk manager closed a position, in evaluation priority order.
 */
public enum ExitReason {
    STOP_LOSS,
    TAKE_PROFIT,
    TRAILING_STOP
}
