package com.pricecheck.history.repository;

import com.pricecheck.history.model.PriceCheckRecord;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface PriceCheckRecordRepository extends ReactiveCrudRepository<PriceCheckRecord, Long> {

    @Query("""
        SELECT * FROM price_check
        WHERE item_key = :itemKey
          AND league = :league
          AND game = :game
        ORDER BY checked_at DESC
        LIMIT :limit
        """)
    Flux<PriceCheckRecord> findRecent(String itemKey, String league, String game, int limit);
}
