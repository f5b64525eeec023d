package com.vestpod.pricing.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vestpod.common.BackoffExecutor;
import com.vestpod.common.ProviderBudget;
import com.vestpod.common.RateLimiter;
import com.vestpod.common.RetriesExhaustedException;
import com.vestpod.common.WindowCounter;
import com.vestpod.pricing.Quote;
import com.vestpod.pricing.QuoteException;
import com.vestpod.pricing.QuoteProvider;
import com.vestpod.pricing.QuoteResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;

/**
 * Base for JSON-over-HTTP providers. Every attempt (retries included) charges the call budget first,
 * then waits for the pacer, then issues the GET with a bounded timeout.
 */
@Slf4j
public abstract class AbstractHttpQuoteProvider implements QuoteProvider {

    protected static final int PRICE_SCALE = 8;
    protected static final RoundingMode ROUNDING = RoundingMode.HALF_UP;

    private final String providerId;
    private final WebClient webClient;
    private final BackoffExecutor backoffExecutor;
    private final RateLimiter rateLimiter;
    private final io.github.resilience4j.ratelimiter.RateLimiter pacer;
    private final Duration timeout;
    protected final ObjectMapper objectMapper;
    protected final Clock clock;

    protected AbstractHttpQuoteProvider(String providerId, QuoteHttpSupport support) {
        this.providerId = providerId;
        this.webClient = support.webClientBuilder().build();
        this.backoffExecutor = support.backoffExecutor();
        this.rateLimiter = support.rateLimiter();
        this.pacer = support.pacer();
        this.timeout = support.timeout();
        this.objectMapper = support.objectMapper();
        this.clock = support.clock();
    }

    @Override
    public String getProviderId() {
        return providerId;
    }

    /**
     * Sequential per-symbol batch for providers without a batch endpoint.
     */
    protected Map<String, QuoteResult> fetchEachSymbol(List<String> symbols) {
        Map<String, QuoteResult> results = new LinkedHashMap<>();
        for (String symbol : new LinkedHashSet<>(symbols)) {
            if (Thread.currentThread().isInterrupted()) {
                throw new CancellationException(providerId + " batch cancelled");
            }
            try {
                results.put(symbol, QuoteResult.success(fetchQuote(symbol)));
            } catch (QuoteException e) {
                log.debug("{} quote failed for {}: {}", providerId, symbol, e.getMessage());
                results.put(symbol, QuoteResult.failure(e));
            }
        }
        return results;
    }

    /**
     * GET with budget, pacing, timeout and backoff. Returns the parsed body.
     *
     * @throws QuoteException classified failure; retryable failures that outlived every attempt come back as EXHAUSTED
     */
    protected JsonNode getJson(String operation, URI uri) {
        try {
            return backoffExecutor.execute(providerId + " " + operation, () -> attempt(uri));
        } catch (RetriesExhaustedException e) {
            throw QuoteException.exhausted(providerId, e);
        }
    }

    private static String spentWindows(ProviderBudget budget) {
        StringJoiner spent = new StringJoiner(", ", " (", ")").setEmptyValue("");
        for (WindowCounter counter : budget.getCounters()) {
            if (counter.remaining() == 0) {
                spent.add(counter.getKind() + " " + counter.getCount() + "/" + counter.getLimit()
                        + ", resets at " + counter.getWindowResetAt());
            }
        }
        return spent.toString();
    }

    private JsonNode attempt(URI uri) {
        if (!rateLimiter.tryAcquire(providerId)) {
            String spent = rateLimiter.status(providerId).map(AbstractHttpQuoteProvider::spentWindows).orElse("");
            log.info("{} call refused, budget spent{}", providerId, spent);
            throw QuoteException.rateLimited(providerId, "call budget spent for this window" + spent);
        }
        if (pacer != null && !pacer.acquirePermission()) {
            throw QuoteException.rateLimited(providerId, "request pacing wait timed out");
        }
        String body = exchange(uri);
        if (body == null || body.isBlank()) {
            throw QuoteException.parse(providerId, providerId + " returned an empty body");
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw QuoteException.parse(providerId, providerId + " returned malformed JSON", e);
        }
    }

    private String exchange(URI uri) {
        try {
            return webClient.get()
                    .uri(uri)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(timeout)
                    .block();
        } catch (WebClientResponseException e) {
            throw QuoteException.fromStatus(providerId, e.getStatusCode().value(), e.getStatusText(), e);
        } catch (WebClientRequestException e) {
            throw QuoteException.network(providerId, e.getMessage(), e);
        } catch (RuntimeException e) {
            if (hasCause(e, InterruptedException.class)) {
                Thread.currentThread().interrupt();
                CancellationException cancelled = new CancellationException(providerId + " request interrupted");
                cancelled.initCause(e);
                throw cancelled;
            }
            if (hasCause(e, TimeoutException.class)) {
                throw QuoteException.network(providerId, "timed out after " + timeout.toMillis() + "ms", e);
            }
            throw QuoteException.network(providerId, e.getMessage(), e);
        }
    }

    /**
     * Validated positive price from a JSON number or numeric string.
     */
    protected BigDecimal requirePrice(JsonNode node, String symbol) {
        BigDecimal price = null;
        if (node != null && node.isNumber()) {
            price = node.decimalValue();
        } else if (node != null && node.isTextual() && !node.asText().isBlank()) {
            try {
                price = new BigDecimal(node.asText().trim());
            } catch (NumberFormatException e) {
                throw QuoteException.parse(providerId, "Non-numeric price for " + symbol + ": " + node.asText(), e);
            }
        }
        if (price == null || price.signum() <= 0) {
            throw QuoteException.parse(providerId, "No usable price for " + symbol);
        }
        return price.setScale(PRICE_SCALE, ROUNDING);
    }

    protected Quote quote(String symbol, BigDecimal price, java.time.Instant observedAt) {
        return new Quote(symbol, price, providerId, observedAt != null ? observedAt : clock.instant());
    }

    private static boolean hasCause(Throwable t, Class<? extends Throwable> type) {
        Throwable current = t;
        while (current != null) {
            if (type.isInstance(current)) {
                return true;
            }
            if (current.getCause() == current) {
                return false;
            }
            current = current.getCause();
        }
        return false;
    }
}
