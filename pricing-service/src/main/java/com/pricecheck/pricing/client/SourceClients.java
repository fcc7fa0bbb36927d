package com.pricecheck.pricing.client;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The per-source clients built at startup, keyed by source id in registration order.
 * Exposes cache maintenance without handing the clients themselves to callers.
 */
public class SourceClients {

    private final Map<String, RateLimitedCachingClient> clients = new LinkedHashMap<>();

    public SourceClients(List<RateLimitedCachingClient> clients) {
        for (RateLimitedCachingClient client : clients) {
            this.clients.put(client.getSourceId(), client);
        }
    }

    public Map<String, ResponseCache.CacheStats> cacheStats() {
        Map<String, ResponseCache.CacheStats> stats = new LinkedHashMap<>();
        clients.forEach((id, client) -> stats.put(id, client.cacheStats()));
        return Collections.unmodifiableMap(stats);
    }

    public void clearCaches() {
        clients.values().forEach(RateLimitedCachingClient::clearCache);
    }

    public List<String> sourceIds() {
        return List.copyOf(clients.keySet());
    }
}
