package com.vestpod.domain;

/**
 * Asset classes. UNLISTED assets have no market symbol and are never priced by a provider.
 */
public enum AssetClass {
    EQUITY,
    CRYPTO,
    COMMODITY,
    UNLISTED;

    public boolean isListed() {
        return this != UNLISTED;
    }
}
