package com.pricecheck.pricing.client;

import com.pricecheck.common.exception.TransientSourceException;
import org.springframework.http.HttpMethod;

import java.util.Map;

/**
 * Performs a single HTTP exchange against one source host. No retry, caching or pacing; those
 * belong to {@link RateLimitedCachingClient}.
 */
public interface HttpTransport {

    /**
     * @return the response for any HTTP status
     * @throws TransientSourceException on connection failure, I/O error or timeout
     */
    TransportResponse execute(HttpMethod method, String path, Map<String, String> params);
}
