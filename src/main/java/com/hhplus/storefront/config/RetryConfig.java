package com.hhplus.storefront.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.retry.annotation.EnableRetry;

/**
 * RetryConfig - Spring Retry 설정 클래스
 *
 * 역할:
 * - @Retryable 어노테이션 활성화
 * - 재시도 인터셉터가 @Transactional보다 바깥에서 동작하므로 재시도마다 새 트랜잭션이 시작됨
 *
 * 적용 대상:
 * - 주문 상태 변경 / 결제 증빙 기록: 비관적 락 획득 실패 (PessimisticLockingFailureException)
 * - 장바구니 첫 담기 경합: (user_id, product_id) 유니크 제약 위반 (DataIntegrityViolationException)
 *   또는 갭 락 교착 (PessimisticLockingFailureException)
 */
@Configuration
@EnableRetry
public class RetryConfig {
    // @Retryable 설정은 각 메서드에서 정의
}
