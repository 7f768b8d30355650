package com.hhplus.storefront.infrastructure.persistence.settings;

import com.hhplus.storefront.domain.settings.Setting;
import org.springframework.data.jpa.repository.JpaRepository;

public interface SettingJpaRepository extends JpaRepository<Setting, String> {
}
