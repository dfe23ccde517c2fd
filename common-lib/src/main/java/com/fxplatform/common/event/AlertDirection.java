package com.fxplatform.common.event;

/**
 * {@code BOTH} triggers on a move of more than 1% away from the threshold in either direction.
 */
public enum AlertDirection {
    ABOVE,
    BELOW,
    BOTH
}
