package com.ai.storeassistant.dto;

import java.util.Collections;
import java.util.List;

/**
 * Product lookup outcome. {@code followUp} asks the engine to close its reply with a narrowing question.
 * A category listing carries category names and no items.
 */
public final class CatalogResult {

    private final boolean found;
    private final List<CatalogItem> items;
    private final List<String> categories;
    private final boolean followUp;

    private CatalogResult(boolean found, List<CatalogItem> items, List<String> categories, boolean followUp) {
        this.found = found;
        this.items = items == null ? Collections.emptyList() : List.copyOf(items);
        this.categories = categories == null ? Collections.emptyList() : List.copyOf(categories);
        this.followUp = followUp;
    }

    public static CatalogResult found(List<CatalogItem> items) {
        return new CatalogResult(items != null && !items.isEmpty(), items, null, false);
    }

    public static CatalogResult foundNeedingFollowUp(List<CatalogItem> items) {
        return new CatalogResult(items != null && !items.isEmpty(), items, null, true);
    }

    public static CatalogResult categories(List<String> categories) {
        return new CatalogResult(categories != null && !categories.isEmpty(), null, categories, true);
    }

    public static CatalogResult notFound() {
        return new CatalogResult(false, null, null, false);
    }

    public boolean isFound() {
        return found;
    }

    public List<CatalogItem> getItems() {
        return items;
    }

    public List<String> getCategories() {
        return categories;
    }

    public boolean isCategoryListing() {
        return !categories.isEmpty();
    }

    public boolean isFollowUp() {
        return followUp;
    }
}
