package com.example.fleetsafety.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class CompanyConfigResolverTest {

    private FleetSafetyProperties properties;
    private AtomicInteger lookups;

    @BeforeEach
    void setUp() {
        properties = new FleetSafetyProperties();
        properties.getDefaults().setUsageLimits(new CompanyConfig.UsageLimits(4));
        properties.getCompanies().put(7L, CompanyConfig.builder()
                .escalationPolicy(CompanyConfig.EscalationPolicy.builder().intervalMinutes(3).build())
                .build());
        lookups = new AtomicInteger();
    }

    private CompanyConfigResolver resolver() {
        PropertiesCompanyConfigSource delegate = new PropertiesCompanyConfigSource(properties);
        return new CompanyConfigResolver(properties, companyId -> {
            lookups.incrementAndGet();
            return delegate.findOverrides(companyId);
        });
    }

    @Test
    void resolve_layersBuiltInServiceDefaultsAndCompany() {
        CompanyConfig config = resolver().resolve(7L);

        assertThat(config.getUsageLimits().getMaxRevalidationsPerEvent()).isEqualTo(4);
        assertThat(config.getEscalationPolicy().getIntervalMinutes()).isEqualTo(3);
        assertThat(config.getEscalationPolicy().getMaxEscalations()).isEqualTo(3);
        assertThat(config.getSlaPolicies()).containsKey("critical");
    }

    @Test
    void resolve_unknownCompanyGetsServiceDefaults() {
        CompanyConfig config = resolver().resolve(99L);

        assertThat(config.getUsageLimits().getMaxRevalidationsPerEvent()).isEqualTo(4);
        assertThat(config.getEscalationPolicy().getIntervalMinutes()).isEqualTo(10);
    }

    @Test
    void resolve_nullCompanySkipsOverrides() {
        CompanyConfig config = resolver().resolve(null);

        assertThat(config.getUsageLimits().getMaxRevalidationsPerEvent()).isEqualTo(4);
        assertThat(lookups.get()).isZero();
    }

    @Test
    void resolve_cachesUntilInvalidated() {
        CompanyConfigResolver resolver = resolver();

        resolver.resolve(7L);
        resolver.resolve(7L);
        assertThat(lookups.get()).isEqualTo(1);

        resolver.invalidate(7L);
        resolver.resolve(7L);
        assertThat(lookups.get()).isEqualTo(2);
    }

    @Test
    void findOverrides_emptyForUnconfiguredCompany() {
        PropertiesCompanyConfigSource source = new PropertiesCompanyConfigSource(properties);

        assertThat(source.findOverrides(7L)).isPresent();
        assertThat(source.findOverrides(8L)).isEqualTo(Optional.empty());
        assertThat(source.findOverrides(null)).isEmpty();
    }
}
