package com.ai.storeassistant.dto;

import java.math.BigDecimal;

/**
 * One product quoted back to the visitor. Stock is null when the catalog does not report it.
 */
public final class CatalogItem {

    private final String name;
    private final BigDecimal price;
    private final Integer stock;

    public CatalogItem(String name, BigDecimal price, Integer stock) {
        this.name = name;
        this.price = price;
        this.stock = stock;
    }

    public String getName() {
        return name;
    }

    public BigDecimal getPrice() {
        return price;
    }

    public Integer getStock() {
        return stock;
    }
}
