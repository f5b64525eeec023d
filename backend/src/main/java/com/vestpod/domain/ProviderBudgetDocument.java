package com.vestpod.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Shared provider budget counters for multi-instance deployments. Versioned for optimistic updates.
 */
@Document(collection = "provider_budgets")
@NoArgsConstructor
@Getter
@Setter
public class ProviderBudgetDocument {

    /** Provider id. */
    @Id
    private String id;
    @Version
    private Long version;
    private List<Window> windows = new ArrayList<>();

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Window {
        private String kind;
        private int limit;
        private int count;
        private Instant windowResetAt;
    }
}
