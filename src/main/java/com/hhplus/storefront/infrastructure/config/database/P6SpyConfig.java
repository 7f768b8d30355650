package com.hhplus.storefront.infrastructure.config.database;

import com.p6spy.engine.spy.P6SpyOptions;
import jakarta.annotation.PostConstruct;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

/**
 * P6Spy 설정 클래스
 *
 * test 프로필에서만 활성화된다.
 * 바인딩 인자가 채워진 SQL을 P6SpyPrettySqlFormatter로 여러 줄 포맷해 출력한다.
 */
@Configuration
@Profile("test")
public class P6SpyConfig {

    @PostConstruct
    public void registerMessageFormat() {
        P6SpyOptions.getActiveInstance().setLogMessageFormat(P6SpyPrettySqlFormatter.class.getName());
    }
}
