package com.insightpulse.kgengine.util;

import com.insightpulse.kgengine.exception.DimensionMismatchException;
import com.insightpulse.kgengine.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Validates inputs to the node and edge stores before anything reaches the database.
 *
 * Slugs: lowercase alphanumeric segments joined by one of - _ . : /
 * Examples of valid slugs:
 * - service:gateway
 * - repo:archi-agent-framework
 * - migration:042
 * - schema:kg
 *
 * Property bags hold strings, numbers, booleans, nested maps and lists of those. Null values are rejected.
 */
@Slf4j
public class GraphInputValidator {

    public static final int MAX_SLUG_LENGTH = 200;

    private static final Pattern SLUG_PATTERN = Pattern.compile("^[a-z0-9]+([-_.:/][a-z0-9]+)*$");

    private static final int MAX_PROPERTY_DEPTH = 16;

    private GraphInputValidator() {
    }

    /**
     * @param slug The slug to validate
     * @throws ValidationException if the slug is blank, too long or malformed
     */
    public static void validateSlug(String slug) {
        if (slug == null || slug.isBlank()) {
            throw new ValidationException("Slug cannot be null or blank");
        }
        if (slug.length() > MAX_SLUG_LENGTH) {
            throw new ValidationException("Slug too long (max " + MAX_SLUG_LENGTH + " characters): " + slug.length());
        }
        if (!SLUG_PATTERN.matcher(slug).matches()) {
            throw new ValidationException("Invalid slug. Use lowercase alphanumeric segments joined by - _ . : or /. "
                    + "Received: " + sanitizeForLogging(slug));
        }
    }

    /**
     * Checks that every value in an open property map is of a supported kind.
     *
     * @param field name of the map being checked, used in error messages
     * @param properties the map, may be null
     */
    public static void validateProperties(String field, Map<String, Object> properties) {
        if (properties == null) {
            return;
        }
        validateMap(field, properties, 0);
    }

    private static void validateMap(String path, Map<?, ?> map, int depth) {
        if (depth > MAX_PROPERTY_DEPTH) {
            throw new ValidationException(path + " is nested deeper than " + MAX_PROPERTY_DEPTH + " levels");
        }
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            if (!(entry.getKey() instanceof String key) || key.isBlank()) {
                throw new ValidationException(path + " contains a blank or non-string key");
            }
            validateValue(path + "." + key, entry.getValue(), depth);
        }
    }

    private static void validateValue(String path, Object value, int depth) {
        if (value == null) {
            throw new ValidationException(path + " must not be null");
        }
        if (value instanceof String || value instanceof Boolean) {
            return;
        }
        if (value instanceof Number number) {
            double asDouble = number.doubleValue();
            if (Double.isNaN(asDouble) || Double.isInfinite(asDouble)) {
                throw new ValidationException(path + " must be a finite number");
            }
            return;
        }
        if (value instanceof Map<?, ?> nested) {
            validateMap(path, nested, depth + 1);
            return;
        }
        if (value instanceof List<?> list) {
            for (int i = 0; i < list.size(); i++) {
                validateValue(path + "[" + i + "]", list.get(i), depth + 1);
            }
            return;
        }
        throw new ValidationException(path + " has unsupported value type " + value.getClass().getSimpleName());
    }

    /**
     * @param vector embedding or query vector
     * @param dimensions configured dimensionality
     * @throws DimensionMismatchException if the length is wrong
     * @throws ValidationException if the vector is null, all zeros, or contains NaN/infinity
     */
    public static void validateVector(float[] vector, int dimensions) {
        if (vector == null) {
            throw new ValidationException("Vector cannot be null");
        }
        if (vector.length != dimensions) {
            throw new DimensionMismatchException(dimensions, vector.length);
        }
        boolean allZero = true;
        for (float component : vector) {
            if (Float.isNaN(component) || Float.isInfinite(component)) {
                throw new ValidationException("Vector contains a non-finite component");
            }
            if (component != 0.0f) {
                allZero = false;
            }
        }
        if (allZero) {
            throw new ValidationException("Zero vector has no direction; cosine similarity is undefined");
        }
    }

    public static void validateWeight(double weight) {
        if (Double.isNaN(weight) || Double.isInfinite(weight)) {
            throw new ValidationException("Edge weight must be finite");
        }
    }

    /**
     * Truncate and strip control characters so user input can be logged safely.
     */
    public static String sanitizeForLogging(String input) {
        if (input == null) return "null";

        String sanitized = input.length() > 100 ? input.substring(0, 100) + "..." : input;
        return sanitized.replaceAll("[\\r\\n\\t]", " ");
    }
}
