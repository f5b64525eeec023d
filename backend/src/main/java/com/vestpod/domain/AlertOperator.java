package com.vestpod.domain;

/**
 * ABOVE/BELOW apply to price targets; CHANGE_UP/CHANGE_DOWN to percentage change alerts.
 */
public enum AlertOperator {
    ABOVE,
    BELOW,
    CHANGE_UP,
    CHANGE_DOWN
}
