package com.vestpod.domain;

/**
 * Alert lifecycle. TRIGGERED is terminal.
 */
public enum AlertState {
    ACTIVE,
    TRIGGERED
}
