package com.hhplus.storefront.infrastructure.persistence.settings;

import com.hhplus.storefront.domain.settings.Setting;
import com.hhplus.storefront.domain.settings.SettingsRepository;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * MySQL 기반 Settings Repository 구현 (settings 키/값 테이블)
 */
@Repository
@Primary
public class MySQLSettingsRepository implements SettingsRepository {

    private final SettingJpaRepository settingJpaRepository;

    public MySQLSettingsRepository(SettingJpaRepository settingJpaRepository) {
        this.settingJpaRepository = settingJpaRepository;
    }

    @Override
    public Optional<Setting> findByKey(String key) {
        return settingJpaRepository.findById(key);
    }

    @Override
    public Setting save(Setting setting) {
        return settingJpaRepository.save(setting);
    }
}
