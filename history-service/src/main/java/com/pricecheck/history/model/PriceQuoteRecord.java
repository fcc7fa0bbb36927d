package com.pricecheck.history.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * One source quote. {@code priceCheckId} is null for quotes submitted on their own.
 */
@Data
@NoArgsConstructor
@Table("price_quote")
public class PriceQuoteRecord {

    @Id
    private Long id;

    private Long priceCheckId;

    private String itemName;

    private String itemKey;

    private String league;

    private String game;

    private String sourceId;

    private double chaosValue;

    private int sampleSize;

    private boolean lowConfidence;

    private LocalDateTime fetchedAt;
}
