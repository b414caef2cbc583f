package com.example.fleetsafety.config;

import java.util.Optional;

/**
 * Where per-company overrides come from. The default implementation reads
 * them from application properties; a database or admin-API backed source can
 * replace it.
 */
public interface CompanyConfigSource {

    Optional<CompanyConfig> findOverrides(Long companyId);
}
