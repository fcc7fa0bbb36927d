package com.pricecheck.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.pricecheck.common.exception.InvalidIdentityException;

/**
 * Structured description of the item being priced, as produced by the item-text parser.
 *
 * <p>At least one of {@code name} / {@code baseType} must be non-blank for the identity to be
 * priceable. {@code stackSize} below 1 is coerced to 1.
 */
public record ItemIdentity(
    @JsonProperty("name")      String name,
    @JsonProperty("baseType")  String baseType,
    @JsonProperty("rarity")    Rarity rarity,
    @JsonProperty("category")  String category,
    @JsonProperty("stackSize") int stackSize
) {
    public ItemIdentity {
        rarity    = rarity == null ? Rarity.UNKNOWN : rarity;
        stackSize = Math.max(1, stackSize);
    }

    public static ItemIdentity of(String name, String baseType, Rarity rarity) {
        return new ItemIdentity(name, baseType, rarity, null, 1);
    }

    public static ItemIdentity currency(String name) {
        return new ItemIdentity(name, null, Rarity.CURRENCY, "currency", 1);
    }

    public static ItemIdentity unique(String name, String baseType) {
        return new ItemIdentity(name, baseType, Rarity.UNIQUE, null, 1);
    }

    @JsonIgnore
    public boolean isValid() {
        return !isBlank(name) || !isBlank(baseType);
    }

    /**
     * @throws InvalidIdentityException when both name and base type are blank
     */
    public ItemIdentity requireValid() {
        if (!isValid()) {
            throw new InvalidIdentityException("Item identity needs a name or a base type");
        }
        return this;
    }

    /** Name when present, otherwise base type. Never {@code null} for a valid identity. */
    @JsonIgnore
    public String displayName() {
        return !isBlank(name) ? name.trim() : (baseType == null ? null : baseType.trim());
    }

    @JsonIgnore
    public boolean hasBaseType() {
        return !isBlank(baseType);
    }

    @JsonIgnore
    public boolean hasCategory() {
        return !isBlank(category);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
