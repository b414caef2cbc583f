package com.example.fleetsafety.config;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Reads company overrides from {@code fleet-safety.companies.<id>}.
 */
@Component
@RequiredArgsConstructor
public class PropertiesCompanyConfigSource implements CompanyConfigSource {

    private final FleetSafetyProperties properties;

    @Override
    public Optional<CompanyConfig> findOverrides(Long companyId) {
        if (companyId == null) return Optional.empty();
        return Optional.ofNullable(properties.getCompanies().get(companyId));
    }
}
