package com.pricecheck.pricing.config;

import com.pricecheck.pricing.adapter.SourceAdapter;
import com.pricecheck.pricing.client.RateLimitedCachingClient;

import java.util.List;

/**
 * Enabled sources in registration order, each adapter paired with the client it owns.
 */
public record RegisteredSources(List<SourceAdapter> adapters, List<RateLimitedCachingClient> clients) {

    public RegisteredSources {
        adapters = List.copyOf(adapters);
        clients  = List.copyOf(clients);
    }
}
