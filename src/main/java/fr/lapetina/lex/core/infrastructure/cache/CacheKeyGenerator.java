package fr.lapetina.lex.core.infrastructure.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.apache.commons.codec.digest.DigestUtils;

import java.util.Objects;

/**
 * Derives stable cache keys from semantic inputs.
 *
 * Inputs are serialized to canonical JSON (object fields sorted, map entries
 * sorted by key) and hashed with SHA-256. The stored key is
 * {@code {namespace}:{categoryPrefix}:{first 16 hex chars}}.
 */
public final class CacheKeyGenerator {

    static final int DIGEST_LENGTH = 16;

    private static final ObjectMapper CANONICAL_MAPPER = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .configure(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, true)
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .build();

    private final String namespace;

    public CacheKeyGenerator(String namespace) {
        this.namespace = Objects.requireNonNull(namespace, "Namespace is required");
    }

    public String key(CacheCategory category, Object keyInputs) {
        String digest = DigestUtils.sha256Hex(canonicalJson(keyInputs)).substring(0, DIGEST_LENGTH);
        return namespace + ":" + category.keyPrefix() + ":" + digest;
    }

    /**
     * Glob matching every key of a category, or every key of the namespace when the
     * pattern is null.
     */
    public String glob(String pattern) {
        return pattern == null ? namespace + ":*" : namespace + ":" + pattern + ":*";
    }

    public String getNamespace() {
        return namespace;
    }

    /**
     * Canonical JSON of an arbitrary value. Equal inputs always produce equal strings,
     * regardless of map insertion order.
     */
    public static String canonicalJson(Object value) {
        try {
            return CANONICAL_MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Key inputs are not serializable: " + e.getOriginalMessage(), e);
        }
    }
}
