package com.vestpod.pricing.provider;

import com.vestpod.pricing.Quote;
import com.vestpod.pricing.QuoteErrorKind;
import com.vestpod.pricing.QuoteException;
import com.vestpod.pricing.QuoteResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GoldApiQuoteProviderTest {

    private static GoldApiQuoteProvider provider(StubExchange stub) {
        return new GoldApiQuoteProvider("https://api.gold-api.com", stub.support());
    }

    @Test
    @DisplayName("spot price per ounce with the provider's update time")
    void spotPrice() {
        StubExchange stub = StubExchange.always(HttpStatus.OK,
                "{\"name\":\"Gold\",\"price\":2345.6,\"symbol\":\"XAU\",\"updatedAt\":\"2025-06-02T13:59:01Z\"}");

        Quote quote = provider(stub).fetchQuote("xau");

        assertThat(quote.price()).isEqualByComparingTo("2345.6");
        assertThat(quote.observedAt()).isEqualTo(Instant.parse("2025-06-02T13:59:01Z"));
        assertThat(stub.requests.get(0).getPath()).isEqualTo("/price/XAU");
    }

    @Test
    @DisplayName("symbols other than XAU, XAG, XPT, XPD are rejected without a request")
    void invalidSymbol() {
        StubExchange stub = StubExchange.always(HttpStatus.OK, "{}");

        assertThatThrownBy(() -> provider(stub).fetchQuote("BTC"))
                .isInstanceOfSatisfying(QuoteException.class,
                        e -> assertThat(e.getKind()).isEqualTo(QuoteErrorKind.CLIENT));
        assertThat(stub.requests).isEmpty();
    }

    @Test
    @DisplayName("batch requests each metal separately; one failure does not hide the others")
    void batch() {
        StubExchange stub = new StubExchange(uri -> uri.getPath().endsWith("XAG")
                ? StubExchange.json(HttpStatus.OK, "{\"name\":\"Silver\",\"price\":0}")
                : StubExchange.json(HttpStatus.OK, "{\"name\":\"Gold\",\"price\":2345.6,\"symbol\":\"XAU\"}"));

        Map<String, QuoteResult> results = provider(stub).fetchBatch(List.of("XAU", "XAG", "OIL"));

        assertThat(results).containsOnlyKeys("XAU", "XAG", "OIL");
        assertThat(results.get("XAU").isSuccess()).isTrue();
        assertThat(results.get("XAU").getQuote().observedAt()).isEqualTo(StubExchange.NOW);
        assertThat(results.get("XAG").getError().getKind()).isEqualTo(QuoteErrorKind.PARSE);
        assertThat(results.get("OIL").getError().getKind()).isEqualTo(QuoteErrorKind.CLIENT);
        assertThat(stub.requests).hasSize(2);
    }
}
