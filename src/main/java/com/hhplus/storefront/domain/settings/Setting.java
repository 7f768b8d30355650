package com.hhplus.storefront.domain.settings;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * Setting 도메인 엔티티 (키/값 설정)
 * 결제 안내 문구 등 운영자가 바꾸는 단순 설정을 보관한다.
 */
@Entity
@Table(name = "settings")
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Setting {
    @Id
    @Column(name = "setting_key", length = 100)
    private String key;

    @Column(name = "setting_value", nullable = false, length = 4000)
    private String value;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public static Setting of(String key, String value) {
        return Setting.builder()
                .key(key)
                .value(value)
                .updatedAt(LocalDateTime.now())
                .build();
    }

    public void changeValue(String newValue) {
        this.value = newValue;
        this.updatedAt = LocalDateTime.now();
    }
}
