package com.vestpod.pricing.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vestpod.common.BackoffExecutor;
import com.vestpod.common.RateLimiter;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.time.Duration;

/**
 * Shared plumbing handed to every HTTP provider: client, retry, call budgets, timeout.
 *
 * @param pacer optional Resilience4j limiter that spaces out requests to one provider; null for none
 */
public record QuoteHttpSupport(
        WebClient.Builder webClientBuilder,
        BackoffExecutor backoffExecutor,
        RateLimiter rateLimiter,
        io.github.resilience4j.ratelimiter.RateLimiter pacer,
        Duration timeout,
        ObjectMapper objectMapper,
        Clock clock) {

    public QuoteHttpSupport withPacer(io.github.resilience4j.ratelimiter.RateLimiter pacer) {
        return new QuoteHttpSupport(webClientBuilder, backoffExecutor, rateLimiter, pacer, timeout, objectMapper, clock);
    }
}
