package org.longtrace.records;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectReader;
import org.jetbrains.annotations.Nullable;
import org.longtrace.exceptions.InvalidAttributesException;
import org.longtrace.utils.JsonUtil;

import java.util.Map;

/**
 * A validated JSON document attached to a log or span.
 * Instances always hold well-formed, compact JSON.
 */
public final class Attributes {

    private static final ObjectReader STRICT_READER = JsonUtil.mapper().reader()
            .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private final String json;

    private Attributes(String json) {
        this.json = json;
    }

    /**
     * Validates and normalizes raw JSON text. A {@code null} input means "no attributes".
     *
     * @throws InvalidAttributesException if the text is not exactly one JSON document
     */
    @Nullable
    public static Attributes parse(@Nullable String rawJson) {
        if (rawJson == null) return null;
        try {
            JsonNode node = STRICT_READER.readTree(rawJson);
            if (node == null || node.isMissingNode()) {
                throw new InvalidAttributesException("Attributes must be a JSON document, got empty input", null);
            }
            return new Attributes(JsonUtil.mapper().writeValueAsString(node));
        } catch (JsonProcessingException e) {
            throw new InvalidAttributesException("Attributes are not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    @Nullable
    public static Attributes of(@Nullable Map<String, ?> values) {
        if (values == null) return null;
        try {
            return new Attributes(JsonUtil.mapper().writeValueAsString(values));
        } catch (JsonProcessingException e) {
            throw new InvalidAttributesException("Attributes cannot be serialized to JSON: " + e.getOriginalMessage(), e);
        }
    }

    public String json() {
        return json;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Attributes other && json.equals(other.json);
    }

    @Override
    public int hashCode() {
        return json.hashCode();
    }

    @Override
    public String toString() {
        return json;
    }
}
