package com.example.rls.config;

import com.example.rls.context.PolicyActivationContext;
import com.example.rls.engine.ActivationContextProvider;
import lombok.RequiredArgsConstructor;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Activation context from {@code app.rls.*}: configured environment and
 * feature flags, current time from the injected {@link Clock}.
 */
@RequiredArgsConstructor
public class PropertiesActivationContextProvider implements ActivationContextProvider {

    private final RlsProperties properties;
    private final Clock clock;

    @Override
    public PolicyActivationContext current() {
        Map<String, Object> features = new LinkedHashMap<>(properties.features());
        return new PolicyActivationContext(properties.environment(), features, clock.instant(), properties.timeZone());
    }
}
