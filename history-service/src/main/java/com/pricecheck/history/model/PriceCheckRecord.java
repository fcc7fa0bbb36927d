package com.pricecheck.history.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * One persisted arbitration round: the item, its market and the decision that was returned.
 * The quotes behind it live in {@code price_quote} rows pointing back here.
 *
 * Column mapping (R2DBC snake_case convention):
 *   itemName       → item_name
 *   itemKey        → item_key        normalized name used for lookups
 *   baseType       → base_type
 *   chaosValue     → chaos_value
 *   decisionSource → decision_source
 *   quoteCount     → quote_count
 *   checkedAt      → checked_at      UTC
 */
@Data
@NoArgsConstructor
@Table("price_check")
public class PriceCheckRecord {

    @Id
    private Long id;

    private String itemName;

    private String itemKey;

    private String baseType;

    private String rarity;

    private String category;

    private String league;

    private String game;

    private double chaosValue;

    private String confidence;

    private String decisionSource;

    private int quoteCount;

    private LocalDateTime checkedAt;
}
