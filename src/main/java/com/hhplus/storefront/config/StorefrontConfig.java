package com.hhplus.storefront.config;

import com.hhplus.storefront.domain.order.OrderTransitionPolicy;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * StorefrontConfig - 도메인 정책 Bean 등록
 *
 * 서비스는 설정 객체 대신 OrderTransitionPolicy를 주입받는다.
 */
@Configuration
@EnableConfigurationProperties(StorefrontProperties.class)
public class StorefrontConfig {

    @Bean
    public OrderTransitionPolicy orderTransitionPolicy(StorefrontProperties properties) {
        return properties.getTransitionPolicy();
    }
}
