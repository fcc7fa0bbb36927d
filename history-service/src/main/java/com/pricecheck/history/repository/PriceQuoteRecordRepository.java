package com.pricecheck.history.repository;

import com.pricecheck.history.model.PriceQuoteRecord;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

import java.time.LocalDateTime;

@Repository
public interface PriceQuoteRecordRepository extends ReactiveCrudRepository<PriceQuoteRecord, Long> {

    Flux<PriceQuoteRecord> findByPriceCheckId(Long priceCheckId);

    @Query("""
        SELECT * FROM price_quote
        WHERE item_key = :itemKey
          AND league = :league
          AND game = :game
        ORDER BY fetched_at DESC, id DESC
        LIMIT :limit
        """)
    Flux<PriceQuoteRecord> findRecent(String itemKey, String league, String game, int limit);

    @Query("""
        SELECT * FROM price_quote
        WHERE item_key = :itemKey
          AND league = :league
          AND game = :game
          AND fetched_at >= :since
        ORDER BY fetched_at ASC
        """)
    Flux<PriceQuoteRecord> findSince(String itemKey, String league, String game, LocalDateTime since);
}
