package com.example.fleetsafety.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Resolves the effective configuration for a company:
 * built-in defaults, then {@code fleet-safety.defaults}, then the company's
 * own overrides. Resolved trees are cached per company.
 */
@Slf4j
@Component
public class CompanyConfigResolver {

    private static final long NO_COMPANY = -1L;

    private final FleetSafetyProperties properties;
    private final CompanyConfigSource source;
    private final Cache<Long, CompanyConfig> cache;

    public CompanyConfigResolver(FleetSafetyProperties properties, CompanyConfigSource source) {
        this.properties = properties;
        this.source = source;
        this.cache = Caffeine.newBuilder()
                .maximumSize(properties.getCompanyConfigCache().getMaximumSize())
                .expireAfterWrite(Duration.ofSeconds(properties.getCompanyConfigCache().getExpireAfterWriteSeconds()))
                .build();
    }

    public CompanyConfig resolve(Long companyId) {
        return cache.get(companyId != null ? companyId : NO_COMPANY, this::load);
    }

    /** Drop the cached tree after a company's overrides change. */
    public void invalidate(Long companyId) {
        cache.invalidate(companyId != null ? companyId : NO_COMPANY);
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    private CompanyConfig load(Long key) {
        CompanyConfig serviceDefaults = CompanyConfigMerger.merge(CompanyConfig.builtIn(), properties.getDefaults());
        if (key == NO_COMPANY) {
            return serviceDefaults;
        }
        return source.findOverrides(key)
                .map(overrides -> {
                    log.debug("Applying configuration overrides for company {}", key);
                    return CompanyConfigMerger.merge(serviceDefaults, overrides);
                })
                .orElse(serviceDefaults);
    }
}
