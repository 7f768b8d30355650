package com.hhplus.storefront.domain.operator;

import java.util.Set;

/**
 * Operator Identity Interface (Domain Layer - Port)
 *
 * 운영자 권한 판별. 상태 변경, 카탈로그 관리, 결제 안내 설정 변경에서 사용된다.
 * 서비스는 설정을 직접 읽지 않고 이 포트를 주입받는다 (테스트에서 가짜 운영자 주입 가능).
 */
public interface OperatorIdentity {

    boolean isOperator(Long userId);

    /**
     * 알림을 받을 운영자 ID 목록
     */
    Set<Long> operatorIds();

    /**
     * 운영자 권한 검증
     *
     * @throws UnauthorizedException 운영자가 아님
     */
    default void requireOperator(Long userId) {
        if (userId == null || !isOperator(userId)) {
            throw new UnauthorizedException(userId);
        }
    }
}
