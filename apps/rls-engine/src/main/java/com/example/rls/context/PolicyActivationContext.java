package com.example.rls.context;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Drives whether a conditional policy takes part in evaluation at all.
 */
public record PolicyActivationContext(
        String environment,
        Map<String, Object> features,
        Instant timestamp,
        ZoneId zone
) {
    public PolicyActivationContext {
        environment = environment != null ? environment : "";
        features = ContextMaps.copyOrEmpty(features);
        timestamp = timestamp != null ? timestamp : Instant.now();
        zone = zone != null ? zone : ZoneOffset.UTC;
    }

    public static PolicyActivationContext of(String environment, Map<String, Object> features, Instant timestamp) {
        return new PolicyActivationContext(environment, features, timestamp, ZoneOffset.UTC);
    }

    /**
     * Builds a context from the "enabled feature list" representation.
     */
    public static PolicyActivationContext withEnabledFeatures(
            String environment, Collection<String> enabledFeatures, Instant timestamp, ZoneId zone) {
        Map<String, Object> features = new LinkedHashMap<>();
        if (enabledFeatures != null) {
            enabledFeatures.forEach(feature -> features.put(feature, Boolean.TRUE));
        }
        return new PolicyActivationContext(environment, features, timestamp, zone);
    }

    public int hour() {
        return timestamp.atZone(zone).getHour();
    }

    /**
     * Truthiness of a feature flag: booleans as-is, numbers when non-zero,
     * strings when non-blank and not "false", anything else when present.
     */
    public boolean isFeatureEnabled(String feature) {
        Object value = features.get(feature);
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean flag) {
            return flag;
        }
        if (value instanceof Number number) {
            return number.doubleValue() != 0d;
        }
        if (value instanceof String text) {
            return !text.isBlank() && !"false".equalsIgnoreCase(text.trim());
        }
        return true;
    }
}
