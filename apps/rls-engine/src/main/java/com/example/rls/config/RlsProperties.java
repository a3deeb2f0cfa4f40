package com.example.rls.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Set;

/**
 * Configuration properties for the row-level security engine.
 *
 * <pre>
 * app:
 *   rls:
 *     environment: production
 *     features:
 *       strict-rls: true
 *     time-zone: Europe/Berlin
 *     bypass-roles: [superuser]
 *     exclude-tables: [migrations, audit_log]
 *     audit:
 *       log-allowed: false
 *       sample-rate: 0.25
 * </pre>
 */
@ConfigurationProperties(prefix = "app.rls")
public record RlsProperties(
        String environment,
        Map<String, Boolean> features,
        ZoneId timeZone,
        boolean requireRegisteredTables,
        Set<String> bypassRoles,
        Set<String> excludeTables,
        AuditProperties audit,
        ResolverCacheProperties resolverCache
) {
    public RlsProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
        if (features == null) {
            features = Map.of();
        }
        if (timeZone == null) {
            timeZone = ZoneOffset.UTC;
        }
        bypassRoles = bypassRoles != null ? Set.copyOf(bypassRoles) : Set.of();
        excludeTables = excludeTables != null ? Set.copyOf(excludeTables) : Set.of();
        if (audit == null) {
            audit = AuditProperties.defaults();
        }
        if (resolverCache == null) {
            resolverCache = ResolverCacheProperties.defaults();
        }
    }

    public record AuditProperties(
            Boolean enabled,
            Boolean logAllowed,
            Boolean logDenied,
            Boolean logFilters,
            Double sampleRate
    ) {
        public AuditProperties {
            if (enabled == null) {
                enabled = true;
            }
            if (logAllowed == null) {
                logAllowed = false;
            }
            if (logDenied == null) {
                logDenied = true;
            }
            if (logFilters == null) {
                logFilters = false;
            }
            if (sampleRate == null || sampleRate < 0d || sampleRate > 1d) {
                sampleRate = 1.0d;
            }
        }

        public static AuditProperties defaults() {
            return new AuditProperties(true, false, true, false, 1.0d);
        }
    }

    /**
     * TTL cache for context resolver results. Entries only expire; nothing
     * invalidates them on write.
     */
    public record ResolverCacheProperties(
            Duration ttl,
            Integer maxEntries
    ) {
        public ResolverCacheProperties {
            if (ttl == null) {
                ttl = Duration.ofMinutes(5);
            }
            if (maxEntries == null || maxEntries <= 0) {
                maxEntries = 10_000;
            }
        }

        public static ResolverCacheProperties defaults() {
            return new ResolverCacheProperties(Duration.ofMinutes(5), 10_000);
        }
    }

    public static RlsProperties defaults() {
        return new RlsProperties(null, null, null, false, null, null, null, null);
    }
}
