package com.metricsql.logical;

/**
 * Join kinds between select blocks.
 */
public enum JoinKind {
    INNER,
    LEFT,
    RIGHT,
    FULL
}
