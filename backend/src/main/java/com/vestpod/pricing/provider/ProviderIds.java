package com.vestpod.pricing.provider;

/**
 * Provider ids used in configuration (chains, budgets) and recorded as quote source.
 */
public final class ProviderIds {

    public static final String MASSIVE = "massive";
    public static final String ALPHA_VANTAGE = "alpha-vantage";
    public static final String COINGECKO = "coingecko";
    public static final String GOLD_API = "gold-api";
    public static final String METALS_API = "metals-api";

    private ProviderIds() {}
}
