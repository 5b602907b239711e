package com.ai.storeassistant.service;

import com.ai.storeassistant.config.AssistantProperties;
import com.ai.storeassistant.dto.CatalogItem;
import com.ai.storeassistant.dto.CatalogResult;
import com.ai.storeassistant.exception.AdapterUnavailableException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Catalog lookup over a FakeStore-style REST API ({@code GET /products},
 * {@code GET /products/categories}). Query words are matched against product title and category.
 */
@Service
public class FakeStoreCatalogClient implements CatalogLookup {

    private static final Logger log = LoggerFactory.getLogger(FakeStoreCatalogClient.class);

    private static final String ADAPTER = "catalog";

    private static final Set<String> STOP_WORDS = Set.of(
            "a", "an", "the", "do", "does", "you", "your", "have", "has", "got", "any", "some", "is", "are",
            "there", "what", "which", "how", "much", "many", "in", "on", "of", "for", "to", "i", "me", "my",
            "we", "can", "could", "would", "like", "want", "need", "looking", "please", "sell", "carry",
            "stock", "price", "prices", "cost", "costs", "buy", "available", "left", "it", "they", "them",
            "store", "shop", "with", "and", "or", "show", "list", "tell", "about", "get"
    );

    private static final Set<String> GENERIC_WORDS = Set.of(
            "product", "products", "item", "items", "thing", "things", "catalog", "stuff", "category", "categories",
            "kind", "kinds", "type", "types", "department", "departments"
    );

    private static final Pattern CATEGORY_QUESTION = Pattern.compile(
            "\\b(categor(y|ies)|departments?|kinds? of (products|things|items)|types? of (products|things|items))\\b",
            Pattern.CASE_INSENSITIVE
    );

    private final RestTemplate restTemplate;
    private final ObjectMapper mapper;
    private final AssistantProperties.Catalog settings;

    public FakeStoreCatalogClient(RestTemplate lookupRestTemplate, ObjectMapper mapper, AssistantProperties properties) {
        this.restTemplate = lookupRestTemplate;
        this.mapper = mapper;
        this.settings = properties.getCatalog();
    }

    @Override
    public CatalogResult search(String query) {
        Set<String> terms = extractTerms(query);
        if (terms.isEmpty() && isCategoryQuestion(query)) {
            return listCategories();
        }
        JsonNode products = fetchArray("/products");
        int limit = Math.max(1, settings.getMaxItems());

        if (terms.isEmpty()) {
            List<CatalogItem> firstItems = new ArrayList<>();
            for (JsonNode product : products) {
                if (firstItems.size() >= limit) break;
                firstItems.add(toItem(product));
            }
            return firstItems.isEmpty() ? CatalogResult.notFound() : CatalogResult.foundNeedingFollowUp(firstItems);
        }

        List<CatalogItem> matches = new ArrayList<>();
        for (JsonNode product : products) {
            if (matches.size() >= limit) break;
            String haystack = (product.path("title").asText("") + " " + product.path("category").asText(""))
                    .toLowerCase(Locale.ROOT);
            if (terms.stream().anyMatch(haystack::contains)) {
                matches.add(toItem(product));
            }
        }
        log.debug("Catalog search terms={} matches={}", terms, matches.size());
        return matches.isEmpty() ? CatalogResult.notFound() : CatalogResult.found(matches);
    }

    private CatalogResult listCategories() {
        List<String> categories = new ArrayList<>();
        for (JsonNode category : fetchArray("/products/categories")) {
            if (StringUtils.isNotBlank(category.asText())) {
                categories.add(category.asText());
            }
        }
        log.debug("Catalog categories={}", categories);
        return categories.isEmpty() ? CatalogResult.notFound() : CatalogResult.categories(categories);
    }

    static boolean isCategoryQuestion(String query) {
        return query != null && CATEGORY_QUESTION.matcher(query).find();
    }

    private JsonNode fetchArray(String path) {
        String url = StringUtils.removeEnd(settings.getBaseUrl(), "/") + path;
        String body;
        try {
            body = restTemplate.getForObject(url, String.class);
        } catch (RestClientException e) {
            log.warn("Catalog request to {} failed: {}", url, e.getMessage());
            throw new AdapterUnavailableException(ADAPTER, "Products service is currently unavailable", e);
        }
        if (StringUtils.isBlank(body)) {
            throw new AdapterUnavailableException(ADAPTER, "Products service returned an empty body");
        }
        try {
            JsonNode root = mapper.readTree(body);
            if (!root.isArray()) {
                throw new AdapterUnavailableException(ADAPTER, "Products service returned an unexpected payload");
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new AdapterUnavailableException(ADAPTER, "Products service returned invalid JSON", e);
        }
    }

    static Set<String> extractTerms(String query) {
        Set<String> terms = new LinkedHashSet<>();
        if (StringUtils.isBlank(query)) return terms;
        for (String raw : query.toLowerCase(Locale.ROOT).split("[^a-z0-9'-]+")) {
            String word = StringUtils.strip(raw, "'-");
            if (StringUtils.isBlank(word) || word.length() < 3) continue;
            if (STOP_WORDS.contains(word) || GENERIC_WORDS.contains(word)) continue;
            terms.add(singular(word));
        }
        return terms;
    }

    private static String singular(String word) {
        if (word.endsWith("ies") && word.length() > 4) return word.substring(0, word.length() - 3) + "y";
        if (word.endsWith("es") && (word.endsWith("ches") || word.endsWith("shes") || word.endsWith("xes"))) {
            return word.substring(0, word.length() - 2);
        }
        if (word.endsWith("s") && !word.endsWith("ss") && word.length() > 3) return word.substring(0, word.length() - 1);
        return word;
    }

    private CatalogItem toItem(JsonNode product) {
        JsonNode price = product.path("price");
        JsonNode stock = product.path("stock");
        return new CatalogItem(
                product.path("title").asText(""),
                price.isNumber() ? price.decimalValue() : null,
                stock.isInt() ? Integer.valueOf(stock.intValue()) : null);
    }
}
