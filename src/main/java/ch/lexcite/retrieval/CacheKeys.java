package ch.lexcite.retrieval;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Cache key namespaces. Search keys hash the canonical JSON of the filters,
 * so equal filters share an entry whatever the field order.
 */
public final class CacheKeys {

    public static final String FEDERAL_SEARCH = "federal_search:";
    public static final String FEDERAL_DECISION = "federal_decision:";
    public static final String CANTONAL_SEARCH = "cantonal_search:";
    public static final String CANTONAL_DECISION = "cantonal_decision:";
    public static final String COMMENTARY_SEARCH = "commentary_search:";
    public static final String COMMENTARY = "commentary:";
    public static final String LEGISLATIVE_ACTS = "legislative_acts";

    private CacheKeys() {
    }

    /**
     * @return {@code prefix} followed by the SHA-256 of the canonical filter JSON
     */
    public static String search(String prefix, Object filters, ObjectMapper objectMapper) {
        return prefix + sha256(canonicalJson(filters, objectMapper));
    }

    public static String record(String prefix, String id) {
        return prefix + id.trim();
    }

    public static String legislativeActs(String language) {
        return language == null || language.isBlank()
            ? LEGISLATIVE_ACTS
            : LEGISLATIVE_ACTS + ":" + language.toLowerCase(Locale.ROOT);
    }

    /**
     * Serializes filters with object keys in alphabetical order.
     */
    public static String canonicalJson(Object filters, ObjectMapper objectMapper) {
        try {
            Object tree = objectMapper.convertValue(filters, Map.class);
            return objectMapper.writer()
                .with(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .writeValueAsString(tree);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Filters cannot be serialized: " + e.getMessage(), e);
        }
    }

    static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
