package com.hhplus.storefront;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

/**
 * Storefront 애플리케이션 메인 클래스
 *
 * 활성화된 기능:
 * - @EnableAsync: 커밋 후 알림 리스너 비동기 실행
 * - @EnableRetry: RetryConfig에서 활성화 (비관적 락 획득 실패 재시도)
 */
@EnableAsync
@SpringBootApplication
public class StorefrontApplication {

    public static void main(String[] args) {
        SpringApplication.run(StorefrontApplication.class, args);
    }

}
