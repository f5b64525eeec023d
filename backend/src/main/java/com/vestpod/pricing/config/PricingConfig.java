package com.vestpod.pricing.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.vestpod.common.BackoffExecutor;
import com.vestpod.common.BudgetWindow;
import com.vestpod.common.InMemoryProviderBudgetStore;
import com.vestpod.common.ProviderBudgetStore;
import com.vestpod.common.RateLimiter;
import com.vestpod.common.RetryPolicy;
import com.vestpod.domain.AssetClass;
import com.vestpod.domain.ProviderBudgetRepository;
import com.vestpod.pricing.QuoteException;
import com.vestpod.pricing.QuoteFallbackCoordinator;
import com.vestpod.pricing.QuoteProvider;
import com.vestpod.pricing.budget.MongoProviderBudgetStore;
import com.vestpod.pricing.provider.AlphaVantageQuoteProvider;
import com.vestpod.pricing.provider.CoinGeckoQuoteProvider;
import com.vestpod.pricing.provider.CoinGeckoSymbolResolver;
import com.vestpod.pricing.provider.GoldApiQuoteProvider;
import com.vestpod.pricing.provider.MassiveQuoteProvider;
import com.vestpod.pricing.provider.MetalsApiQuoteProvider;
import com.vestpod.pricing.provider.ProviderIds;
import com.vestpod.pricing.provider.QuoteHttpSupport;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Pricing module wiring: call budgets, retry, providers and the per-asset-class fallback chains.
 * Chains naming an unknown provider, or a provider without its credentials, fail startup.
 */
@Configuration
@EnableConfigurationProperties(PricingProperties.class)
@Slf4j
public class PricingConfig {

    /** Providers that refuse requests without an API key. */
    static final Set<String> KEYED_PROVIDERS = Set.of(ProviderIds.MASSIVE, ProviderIds.ALPHA_VANTAGE, ProviderIds.METALS_API);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ProviderBudgetStore providerBudgetStore(PricingProperties properties, ProviderBudgetRepository repository) {
        String store = properties.getBudgetStore();
        if ("mongo".equalsIgnoreCase(store)) {
            log.info("Provider call budgets shared through MongoDB");
            return new MongoProviderBudgetStore(repository);
        }
        if (store != null && !"memory".equalsIgnoreCase(store)) {
            throw new IllegalStateException("Unknown vestpod.pricing.budget-store: " + store + " (expected memory or mongo)");
        }
        return new InMemoryProviderBudgetStore();
    }

    @Bean
    public RateLimiter providerRateLimiter(PricingProperties properties, ProviderBudgetStore store, Clock clock) {
        return new RateLimiter(budgetWindows(properties), store, clock);
    }

    @Bean
    public BackoffExecutor quoteBackoffExecutor(PricingProperties properties) {
        PricingProperties.RetryProperties retry = properties.getRetry();
        RetryPolicy policy = new RetryPolicy(retry.getInitialDelayMs(), retry.getMultiplier(), retry.getMaxRetries());
        return new BackoffExecutor(policy, e -> e instanceof QuoteException q && q.isRetryable());
    }

    @Bean
    public Cache<String, Map<String, String>> coinsListCache(PricingProperties properties) {
        return Caffeine.newBuilder()
                .expireAfterWrite(properties.getCoingecko().getCoinsListCacheTtlHours(), TimeUnit.HOURS)
                .maximumSize(1)
                .build();
    }

    @Bean
    public CoinGeckoSymbolResolver coinGeckoSymbolResolver(PricingProperties properties,
                                                           Cache<String, Map<String, String>> coinsListCache) {
        return new CoinGeckoSymbolResolver(properties.getCoingecko().getSymbolToCoinId(), coinsListCache);
    }

    @Bean
    public QuoteHttpSupport quoteHttpSupport(PricingProperties properties, WebClient.Builder webClientBuilder,
                                             BackoffExecutor quoteBackoffExecutor, RateLimiter providerRateLimiter,
                                             ObjectMapper objectMapper, Clock clock) {
        return new QuoteHttpSupport(webClientBuilder, quoteBackoffExecutor, providerRateLimiter, null,
                Duration.ofSeconds(Math.max(1, properties.getTimeoutSeconds())), objectMapper, clock);
    }

    @Bean
    public QuoteFallbackCoordinator quoteFallbackCoordinator(PricingProperties properties, QuoteHttpSupport quoteHttpSupport,
                                                             CoinGeckoSymbolResolver coinGeckoSymbolResolver) {
        Map<String, QuoteProvider> providers = createProviders(properties, quoteHttpSupport, coinGeckoSymbolResolver);
        Map<AssetClass, List<QuoteProvider>> chains = buildChains(properties, providers);
        chains.forEach((assetClass, chain) -> log.info("Quote chain {}: {}", assetClass,
                chain.stream().map(QuoteProvider::getProviderId).toList()));
        return new QuoteFallbackCoordinator(chains);
    }

    static Map<String, List<BudgetWindow>> budgetWindows(PricingProperties properties) {
        Map<String, List<BudgetWindow>> windows = new LinkedHashMap<>();
        properties.getProviders().forEach((id, provider) -> {
            List<BudgetWindow> list = new ArrayList<>();
            for (PricingProperties.WindowProperties w : provider.getWindows()) {
                if (w.getKind() == null) {
                    throw new IllegalStateException("Budget window without kind for provider " + id);
                }
                list.add(new BudgetWindow(w.getKind(), w.getLimit()));
            }
            if (!list.isEmpty()) {
                windows.put(id, list);
            }
        });
        return windows;
    }

    /**
     * One client per enabled provider. Unknown ids in vestpod.pricing.providers are rejected.
     */
    static Map<String, QuoteProvider> createProviders(PricingProperties properties, QuoteHttpSupport support,
                                                      CoinGeckoSymbolResolver symbolResolver) {
        Map<String, QuoteProvider> providers = new LinkedHashMap<>();
        properties.getProviders().forEach((id, p) -> {
            if (!p.isEnabled()) {
                log.info("Quote provider {} disabled", id);
                return;
            }
            if (p.getBaseUrl() == null || p.getBaseUrl().isBlank()) {
                throw new IllegalStateException("Missing base-url for quote provider " + id);
            }
            QuoteHttpSupport providerSupport = support.withPacer(pacer(id, p));
            QuoteProvider provider = switch (id) {
                case ProviderIds.MASSIVE -> new MassiveQuoteProvider(p.getBaseUrl(), p.getApiKey(), providerSupport);
                case ProviderIds.ALPHA_VANTAGE -> new AlphaVantageQuoteProvider(p.getBaseUrl(), p.getApiKey(), providerSupport);
                case ProviderIds.COINGECKO -> new CoinGeckoQuoteProvider(p.getBaseUrl(), p.getApiKey(), symbolResolver, providerSupport);
                case ProviderIds.GOLD_API -> new GoldApiQuoteProvider(p.getBaseUrl(), providerSupport);
                case ProviderIds.METALS_API -> new MetalsApiQuoteProvider(p.getBaseUrl(), p.getApiKey(), providerSupport);
                default -> throw new IllegalStateException("Unknown quote provider: " + id);
            };
            providers.put(id, provider);
        });
        return providers;
    }

    /**
     * Resolves configured chains against the enabled providers. Disabled providers are left out of a chain;
     * a chain that ends up empty, or that names a keyed provider without a key, fails startup.
     */
    static Map<AssetClass, List<QuoteProvider>> buildChains(PricingProperties properties, Map<String, QuoteProvider> providers) {
        Map<AssetClass, List<QuoteProvider>> chains = new EnumMap<>(AssetClass.class);
        properties.getChains().forEach((assetClass, ids) -> {
            if (!assetClass.isListed()) {
                throw new IllegalStateException("Asset class " + assetClass + " is never priced and cannot have a chain");
            }
            List<QuoteProvider> chain = new ArrayList<>();
            for (String id : ids) {
                PricingProperties.ProviderProperties p = properties.getProviders().get(id);
                if (p == null) {
                    throw new IllegalStateException("Chain for " + assetClass + " names unknown provider " + id);
                }
                if (!p.isEnabled()) {
                    log.warn("Provider {} is disabled, skipping it in the {} chain", id, assetClass);
                    continue;
                }
                if (KEYED_PROVIDERS.contains(id) && (p.getApiKey() == null || p.getApiKey().isBlank())) {
                    throw new IllegalStateException("Missing API key for quote provider " + id);
                }
                chain.add(providers.get(id));
            }
            if (chain.isEmpty()) {
                throw new IllegalStateException("No enabled provider for asset class " + assetClass);
            }
            chains.put(assetClass, chain);
        });
        return chains;
    }

    private static io.github.resilience4j.ratelimiter.RateLimiter pacer(String id, PricingProperties.ProviderProperties p) {
        if (p.getPacingIntervalMs() <= 0) {
            return null;
        }
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofMillis(p.getPacingIntervalMs()))
                .limitForPeriod(1)
                .timeoutDuration(Duration.ofMillis(Math.max(0L, p.getPacingTimeoutMs())))
                .build();
        return io.github.resilience4j.ratelimiter.RateLimiter.of(id + "-pacing", config);
    }
}
