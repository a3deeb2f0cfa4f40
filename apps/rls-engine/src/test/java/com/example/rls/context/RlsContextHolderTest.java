package com.example.rls.context;

import com.example.rls.exception.RlsContextException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.Map;

import static com.example.rls.util.AuthContextTestBuilder.anAuthContext;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RlsContextHolder")
class RlsContextHolderTest {

    @Test
    @DisplayName("should expose the context written into the subscription")
    void shouldExposeContext() {
        AuthContext auth = anAuthContext().withUserId("u1").build();

        StepVerifier.create(RlsContextHolder.getContext()
                        .contextWrite(RlsContextHolder.withContext(new RlsContext(auth, Map.of("request_id", "r1")))))
                .assertNext(rls -> {
                    assertThat(rls.auth().userId()).isEqualTo("u1");
                    assertThat(rls.toEvaluationContext().metaValue("request_id")).isEqualTo("r1");
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("should fail closed when no context is present")
    void shouldFailWithoutContext() {
        StepVerifier.create(RlsContextHolder.getContext())
                .expectErrorSatisfies(error -> assertThat(error)
                        .isInstanceOf(RlsContextException.class))
                .verify();
        StepVerifier.create(RlsContextHolder.getContextIfPresent())
                .verifyComplete();
        StepVerifier.create(RlsContextHolder.hasContext())
                .expectNext(false)
                .verifyComplete();
    }

    @Test
    @DisplayName("should keep concurrent subscriptions isolated")
    void shouldIsolateConcurrentSubscriptions() {
        Flux<String> users = Flux.range(0, 20)
                .flatMap(i -> Mono.delay(Duration.ofMillis(i % 3))
                        .publishOn(Schedulers.parallel())
                        .then(RlsContextHolder.getContext())
                        .map(rls -> i + ":" + rls.auth().userId())
                        .contextWrite(RlsContextHolder.withAuth(anAuthContext().withUserId("user-" + i).build())));

        StepVerifier.create(users.collectList())
                .assertNext(results -> assertThat(results)
                        .hasSize(20)
                        .allSatisfy(entry -> {
                            String[] parts = entry.split(":");
                            assertThat(parts[1]).isEqualTo("user-" + parts[0]);
                        }))
                .verifyComplete();
    }
}
