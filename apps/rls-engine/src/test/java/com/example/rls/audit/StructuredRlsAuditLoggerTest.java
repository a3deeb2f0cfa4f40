package com.example.rls.audit;

import com.example.rls.config.RlsProperties.AuditProperties;
import com.example.rls.context.Operation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("StructuredRlsAuditLogger")
class StructuredRlsAuditLoggerTest {

    @Mock
    private ObjectMapper objectMapper;

    @Mock
    private RlsMetrics metrics;

    private static final Map<String, Object> EXTRA = Map.of("user_id", "u1");

    @Nested
    @DisplayName("Flags")
    class Flags {

        @Test
        @DisplayName("should log denials but not allows by default")
        void shouldLogOnlyDenialsByDefault() throws Exception {
            when(objectMapper.writeValueAsString(any())).thenReturn("{}");
            StructuredRlsAuditLogger logger =
                    new StructuredRlsAuditLogger(objectMapper, AuditProperties.defaults(), metrics);

            logger.logAllow(Operation.READ, "posts", "allow-all", EXTRA);
            logger.logDeny(Operation.DELETE, "posts", "no-delete", EXTRA);

            @SuppressWarnings("unchecked")
            ArgumentCaptor<Map<String, Object>> captor = ArgumentCaptor.forClass(Map.class);
            verify(objectMapper).writeValueAsString(captor.capture());
            assertThat(captor.getValue())
                    .containsEntry("outcome", "DENY")
                    .containsEntry("operation", "delete")
                    .containsEntry("table", "posts")
                    .containsEntry("policy_name", "no-delete")
                    .containsEntry("user_id", "u1");
        }

        @Test
        @DisplayName("should count every decision regardless of the log flags")
        void shouldAlwaysRecordMetrics() {
            StructuredRlsAuditLogger logger = new StructuredRlsAuditLogger(objectMapper,
                    new AuditProperties(true, false, false, false, 1.0d), metrics);

            logger.logAllow(Operation.READ, "posts", null, EXTRA);
            logger.logDeny(Operation.UPDATE, "posts", null, EXTRA);
            logger.logFilter("posts", List.of("tenant"), EXTRA);

            verify(metrics).recordDecision(true, Operation.READ, "posts");
            verify(metrics).recordDecision(false, Operation.UPDATE, "posts");
            verify(metrics).recordFilter("posts", 1);
        }

        @Test
        @DisplayName("should log filters when enabled")
        void shouldLogFilters() throws Exception {
            when(objectMapper.writeValueAsString(any())).thenReturn("{}");
            StructuredRlsAuditLogger logger = new StructuredRlsAuditLogger(objectMapper,
                    new AuditProperties(true, false, true, true, 1.0d), null);

            logger.logFilter("posts", List.of("tenant", "soft-delete"), EXTRA);

            @SuppressWarnings("unchecked")
            ArgumentCaptor<Map<String, Object>> captor = ArgumentCaptor.forClass(Map.class);
            verify(objectMapper).writeValueAsString(captor.capture());
            assertThat(captor.getValue())
                    .containsEntry("outcome", "FILTER")
                    .containsEntry("applied_filters", List.of("tenant", "soft-delete"));
        }
    }

    @Nested
    @DisplayName("Sampling")
    class Sampling {

        @Test
        @DisplayName("should sample out allows but never denials")
        void shouldNeverSampleDenials() throws Exception {
            when(objectMapper.writeValueAsString(any())).thenReturn("{}");
            StructuredRlsAuditLogger logger = new StructuredRlsAuditLogger(objectMapper,
                    new AuditProperties(true, true, true, false, 0.5d), null, () -> 0.9d);

            logger.logAllow(Operation.READ, "posts", "allow-all", EXTRA);
            logger.logDeny(Operation.READ, "posts", "ban", EXTRA);

            @SuppressWarnings("unchecked")
            ArgumentCaptor<Map<String, Object>> captor = ArgumentCaptor.forClass(Map.class);
            verify(objectMapper).writeValueAsString(captor.capture());
            assertThat(captor.getValue()).containsEntry("outcome", "DENY");
        }

        @Test
        @DisplayName("should keep allows that fall inside the sample")
        void shouldKeepSampledAllows() throws Exception {
            when(objectMapper.writeValueAsString(any())).thenReturn("{}");
            StructuredRlsAuditLogger logger = new StructuredRlsAuditLogger(objectMapper,
                    new AuditProperties(true, true, false, false, 0.5d), null, () -> 0.1d);

            logger.logAllow(Operation.READ, "posts", "allow-all", EXTRA);

            verify(objectMapper).writeValueAsString(any());
        }

        @Test
        @DisplayName("should not serialize anything when allows are disabled")
        void shouldSkipDisabledAllows() throws Exception {
            StructuredRlsAuditLogger logger =
                    new StructuredRlsAuditLogger(objectMapper, AuditProperties.defaults(), null);

            logger.logAllow(Operation.READ, "posts", "allow-all", EXTRA);

            verify(objectMapper, never()).writeValueAsString(any());
        }
    }

    @Test
    @DisplayName("should fall back to a plain message when serialization fails")
    void shouldFallBackOnSerializationFailure() throws Exception {
        when(objectMapper.writeValueAsString(any())).thenThrow(new JsonProcessingException("bad") {
        });
        StructuredRlsAuditLogger logger =
                new StructuredRlsAuditLogger(objectMapper, AuditProperties.defaults(), null);

        assertThatCode(() -> logger.logDeny(Operation.DELETE, "posts", "no-delete", EXTRA))
                .doesNotThrowAnyException();
    }
}
