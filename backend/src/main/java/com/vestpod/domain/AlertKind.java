package com.vestpod.domain;

public enum AlertKind {
    PRICE_TARGET,
    PERCENTAGE_CHANGE,
    MATURITY_REMINDER
}
