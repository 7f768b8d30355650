package com.hhplus.storefront.domain.settings;

import java.util.Optional;

/**
 * Settings Repository Interface (Domain Layer - Port)
 */
public interface SettingsRepository {

    Optional<Setting> findByKey(String key);

    Setting save(Setting setting);
}
