package com.ai.storeassistant.service;

import com.ai.storeassistant.dto.CatalogResult;
import com.ai.storeassistant.exception.AdapterUnavailableException;

/**
 * Product, stock and price lookup against the store catalog.
 */
public interface CatalogLookup {

    /**
     * @throws AdapterUnavailableException when the catalog cannot be reached or read
     */
    CatalogResult search(String query);
}
