package com.vestpod.pricing.config;

import com.vestpod.common.WindowKind;
import com.vestpod.domain.AssetClass;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pricing module configuration. Documented in application.yml under vestpod.pricing.
 */
@ConfigurationProperties(prefix = "vestpod.pricing")
@Validated
@Getter
@Setter
public class PricingProperties {

    /**
     * Upper bound for one HTTP call to a provider, in seconds. A timeout counts as a retryable network error.
     */
    @Min(1)
    private int timeoutSeconds = 10;

    @Valid
    private RetryProperties retry = new RetryProperties();

    /**
     * Where call budgets are counted: "memory" (single instance) or "mongo" (shared by all instances).
     */
    private String budgetStore = "memory";

    /**
     * Provider id -> connection and budget settings. Ids: massive, alpha-vantage, coingecko, gold-api, metals-api.
     */
    @Valid
    private Map<String, ProviderProperties> providers = new LinkedHashMap<>();

    /**
     * Asset class -> provider ids in priority order. The first entry is the primary source.
     */
    private Map<AssetClass, List<String>> chains = new EnumMap<>(AssetClass.class);

    @Valid
    private CoinGeckoProperties coingecko = new CoinGeckoProperties();

    @Getter
    @Setter
    public static class RetryProperties {
        /** Retries after the first attempt (total attempts = max-retries + 1). */
        @Min(0)
        private int maxRetries = 3;
        /** Delay before the first retry. */
        @Min(0)
        private long initialDelayMs = 1000;
        /** Factor applied to the delay for every further retry. */
        @DecimalMin("1.0")
        private double multiplier = 2.0;
    }

    @Getter
    @Setter
    public static class ProviderProperties {
        private boolean enabled = true;
        private String baseUrl;
        /** Empty for keyless providers. Read from the environment, never committed. */
        private String apiKey;
        /** Call budgets; every window must have headroom for a call to go out. */
        @Valid
        private List<WindowProperties> windows = new ArrayList<>();
        /** Minimum spacing between two requests; 0 disables pacing. */
        private long pacingIntervalMs = 0;
        /** How long a request may wait for its pacing slot before it is skipped as rate limited. */
        private long pacingTimeoutMs = 60_000;
    }

    @Getter
    @Setter
    public static class WindowProperties {
        @NotNull
        private WindowKind kind;
        @Min(1)
        private int limit;
    }

    @Getter
    @Setter
    public static class CoinGeckoProperties {
        /** Ticker (any case) -> CoinGecko coin id. Takes precedence over the coins/list lookup. */
        private Map<String, String> symbolToCoinId = new HashMap<>();
        /** TTL in hours for the coins/list index. */
        @Min(1)
        private int coinsListCacheTtlHours = 24;
    }
}
