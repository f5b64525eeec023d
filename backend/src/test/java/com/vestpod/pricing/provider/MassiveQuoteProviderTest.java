package com.vestpod.pricing.provider;

import com.vestpod.common.BudgetWindow;
import com.vestpod.common.WindowKind;
import com.vestpod.pricing.Quote;
import com.vestpod.pricing.QuoteErrorKind;
import com.vestpod.pricing.QuoteException;
import com.vestpod.pricing.QuoteResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MassiveQuoteProviderTest {

    private static final String AAPL_SNAPSHOT = """
            {"status":"OK","ticker":{"ticker":"AAPL","day":{"c":189.5},"lastTrade":{"p":190.12},"prevDay":{"c":188.0}}}
            """;

    private static MassiveQuoteProvider provider(StubExchange stub) {
        return new MassiveQuoteProvider("https://api.polygon.io", "test-key", stub.support());
    }

    @Test
    @DisplayName("single quote uses the last trade price and the ticker snapshot endpoint")
    void singleQuote() {
        StubExchange stub = StubExchange.always(HttpStatus.OK, AAPL_SNAPSHOT);

        Quote quote = provider(stub).fetchQuote("aapl");

        assertThat(quote.price()).isEqualByComparingTo("190.12");
        assertThat(quote.sourceProviderId()).isEqualTo(ProviderIds.MASSIVE);
        assertThat(quote.observedAt()).isEqualTo(StubExchange.NOW);
        assertThat(stub.requests).hasSize(1);
        assertThat(stub.requests.get(0).getPath()).isEqualTo("/v2/snapshot/locale/us/markets/stocks/tickers/AAPL");
        assertThat(stub.requests.get(0).getQuery()).contains("apiKey=test-key");
    }

    @Test
    @DisplayName("falls back to the day close when there is no last trade")
    void dayCloseFallback() {
        StubExchange stub = StubExchange.always(HttpStatus.OK,
                "{\"ticker\":{\"ticker\":\"AAPL\",\"day\":{\"c\":189.5}}}");

        assertThat(provider(stub).fetchQuote("AAPL").price()).isEqualByComparingTo("189.5");
    }

    @Test
    @DisplayName("404 means unknown symbol and is not retried")
    void notFound() {
        StubExchange stub = StubExchange.always(HttpStatus.NOT_FOUND, "{\"status\":\"NOT_FOUND\"}");

        assertThatThrownBy(() -> provider(stub).fetchQuote("NOPE"))
                .isInstanceOfSatisfying(QuoteException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(QuoteErrorKind.CLIENT);
                    assertThat(e.isEscalatable()).isFalse();
                });
        assertThat(stub.requests).hasSize(1);
    }

    @Test
    @DisplayName("5xx is retried maxRetries times then reported as exhausted (escalatable)")
    void serverErrorExhausts() {
        StubExchange stub = StubExchange.always(HttpStatus.BAD_GATEWAY, "{}");

        assertThatThrownBy(() -> provider(stub).fetchQuote("AAPL"))
                .isInstanceOfSatisfying(QuoteException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(QuoteErrorKind.EXHAUSTED);
                    assertThat(e.getStatusCode()).isEqualTo(502);
                    assertThat(e.isEscalatable()).isTrue();
                });
        assertThat(stub.requests).hasSize(4);
    }

    @Test
    @DisplayName("429 then 200 succeeds on the second attempt")
    void throttledThenOk() {
        AtomicInteger calls = new AtomicInteger();
        StubExchange stub = new StubExchange(uri -> calls.incrementAndGet() == 1
                ? StubExchange.json(HttpStatus.TOO_MANY_REQUESTS, "{}")
                : StubExchange.json(HttpStatus.OK, AAPL_SNAPSHOT));

        assertThat(provider(stub).fetchQuote("AAPL").price()).isEqualByComparingTo("190.12");
        assertThat(stub.requests).hasSize(2);
    }

    @Test
    @DisplayName("connection failure is a retryable network error")
    void networkError() {
        StubExchange stub = new StubExchange(uri -> Mono.error(new IllegalStateException("connection reset")));

        assertThatThrownBy(() -> provider(stub).fetchQuote("AAPL"))
                .isInstanceOfSatisfying(QuoteException.class,
                        e -> assertThat(e.getKind()).isEqualTo(QuoteErrorKind.EXHAUSTED));
        assertThat(stub.requests).hasSize(4);
    }

    @Test
    @DisplayName("a response slower than the timeout counts as a network error")
    void timeout() {
        StubExchange stub = new StubExchange(uri -> Mono.never());

        assertThatThrownBy(() -> provider(stub).fetchQuote("AAPL"))
                .isInstanceOfSatisfying(QuoteException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(QuoteErrorKind.EXHAUSTED);
                    assertThat(e.getCause().getCause()).isInstanceOfSatisfying(QuoteException.class,
                            last -> assertThat(last.getKind()).isEqualTo(QuoteErrorKind.NETWORK));
                });
    }

    @Test
    @DisplayName("malformed JSON is a terminal parse error")
    void malformedJson() {
        StubExchange stub = StubExchange.always(HttpStatus.OK, "<html>oops</html>");

        assertThatThrownBy(() -> provider(stub).fetchQuote("AAPL"))
                .isInstanceOfSatisfying(QuoteException.class,
                        e -> assertThat(e.getKind()).isEqualTo(QuoteErrorKind.PARSE));
        assertThat(stub.requests).hasSize(1);
    }

    @Test
    @DisplayName("batch: one request for all tickers, a ticker missing from the answer is unknown")
    void batch() {
        StubExchange stub = StubExchange.always(HttpStatus.OK, """
                {"status":"OK","tickers":[
                  {"ticker":"AAPL","lastTrade":{"p":190.12}},
                  {"ticker":"MSFT","day":{"c":410.5}}
                ]}
                """);

        Map<String, QuoteResult> results = provider(stub).fetchBatch(List.of("AAPL", "MSFT", "NOPE"));

        assertThat(results).containsOnlyKeys("AAPL", "MSFT", "NOPE");
        assertThat(results.get("AAPL").getQuote().price()).isEqualByComparingTo("190.12");
        assertThat(results.get("MSFT").getQuote().price()).isEqualByComparingTo("410.5");
        assertThat(results.get("NOPE").getError().getKind()).isEqualTo(QuoteErrorKind.CLIENT);
        assertThat(stub.requests).hasSize(1);
        assertThat(stub.requests.get(0).getQuery()).contains("tickers=AAPL,MSFT,NOPE");
    }

    @Test
    @DisplayName("batch: a failing request only fails its own tickers, earlier chunks keep their quotes")
    void failedChunkIsolated() {
        List<String> tickers = IntStream.range(0, MassiveQuoteProvider.BATCH_SIZE + 1)
                .mapToObj(i -> String.format("T%03d", i))
                .toList();
        String firstChunk = tickers.subList(0, MassiveQuoteProvider.BATCH_SIZE).stream()
                .map(t -> "{\"ticker\":\"" + t + "\",\"lastTrade\":{\"p\":10.5}}")
                .collect(Collectors.joining(",", "{\"status\":\"OK\",\"tickers\":[", "]}"));
        StubExchange stub = new StubExchange(uri -> uri.getQuery().contains("T100")
                ? StubExchange.json(HttpStatus.BAD_GATEWAY, "{}")
                : StubExchange.json(HttpStatus.OK, firstChunk));

        Map<String, QuoteResult> results = provider(stub).fetchBatch(tickers);

        assertThat(results).hasSize(MassiveQuoteProvider.BATCH_SIZE + 1);
        assertThat(results.values().stream().filter(QuoteResult::isSuccess)).hasSize(MassiveQuoteProvider.BATCH_SIZE);
        assertThat(results.get("T000").getQuote().price()).isEqualByComparingTo("10.5");
        QuoteException last = results.get("T100").getError();
        assertThat(last.getKind()).isEqualTo(QuoteErrorKind.EXHAUSTED);
        assertThat(last.getStatusCode()).isEqualTo(502);
        assertThat(last.isEscalatable()).isTrue();
        assertThat(stub.requests).hasSize(5);
    }

    @Test
    @DisplayName("batch: when every request fails the whole batch throws")
    void allChunksFailed() {
        StubExchange stub = StubExchange.always(HttpStatus.BAD_GATEWAY, "{}");

        assertThatThrownBy(() -> provider(stub).fetchBatch(List.of("AAPL", "MSFT")))
                .isInstanceOfSatisfying(QuoteException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(QuoteErrorKind.EXHAUSTED);
                    assertThat(e.getStatusCode()).isEqualTo(502);
                });
    }

    @Test
    @DisplayName("spent call budget: no request goes out and the error is RATE_LIMITED")
    void budgetSpent() {
        StubExchange stub = StubExchange.always(HttpStatus.OK, AAPL_SNAPSHOT);
        MassiveQuoteProvider provider = new MassiveQuoteProvider("https://api.polygon.io", "k",
                stub.support(Map.of(ProviderIds.MASSIVE, List.of(new BudgetWindow(WindowKind.MINUTE, 1)))));

        provider.fetchQuote("AAPL");
        assertThatThrownBy(() -> provider.fetchQuote("AAPL"))
                .isInstanceOfSatisfying(QuoteException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(QuoteErrorKind.RATE_LIMITED);
                    assertThat(e.getMessage()).contains("MINUTE 1/1, resets at 2025-06-02T14:01:00Z");
                });
        assertThat(stub.requests).hasSize(1);
    }

    @Test
    @DisplayName("retries charge the budget too")
    void retriesChargeBudget() {
        StubExchange stub = StubExchange.always(HttpStatus.SERVICE_UNAVAILABLE, "{}");
        MassiveQuoteProvider provider = new MassiveQuoteProvider("https://api.polygon.io", "k",
                stub.support(Map.of(ProviderIds.MASSIVE, List.of(new BudgetWindow(WindowKind.MINUTE, 2)))));

        assertThatThrownBy(() -> provider.fetchQuote("AAPL"))
                .isInstanceOfSatisfying(QuoteException.class,
                        e -> assertThat(e.getKind()).isEqualTo(QuoteErrorKind.RATE_LIMITED));
        assertThat(stub.requests).hasSize(2);
    }
}
