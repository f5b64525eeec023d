package com.vestpod.pricing.provider;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Precious metal codes accepted by the commodity providers.
 */
final class MetalSymbols {

    static final Map<String, String> NAMES = Map.of(
            "XAU", "Gold",
            "XAG", "Silver",
            "XPT", "Platinum",
            "XPD", "Palladium"
    );

    private MetalSymbols() {}

    static Optional<String> normalize(String symbol) {
        if (symbol == null) {
            return Optional.empty();
        }
        String upper = symbol.trim().toUpperCase(Locale.ROOT);
        return NAMES.containsKey(upper) ? Optional.of(upper) : Optional.empty();
    }
}
