package com.hhplus.storefront.infrastructure.aop;

import com.hhplus.storefront.common.exception.ErrorCode;
import com.hhplus.storefront.common.exception.SystemException;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.CannotCreateTransactionException;

/**
 * 저장소 연결 실패를 SystemException(STORE_UNAVAILABLE)으로 변환하는 AOP
 *
 * 실행 순서:
 * - HIGHEST_PRECEDENCE: 재시도/트랜잭션 인터셉터보다 바깥에서 동작
 *   (트랜잭션 시작 자체가 실패하는 CannotCreateTransactionException도 잡기 위함)
 * - 변환 시점에는 트랜잭션이 이미 롤백되었으므로 부분 반영된 상태는 없음
 *
 * 적용 대상: application 패키지의 모든 @Service 공개 메서드
 */
@Slf4j
@Aspect
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class StoreAccessExceptionTranslator {

    @Around("within(com.hhplus.storefront.application..*) && @within(org.springframework.stereotype.Service)")
    public Object translate(ProceedingJoinPoint joinPoint) throws Throwable {
        try {
            return joinPoint.proceed();
        } catch (DataAccessResourceFailureException | CannotCreateTransactionException e) {
            log.error("[StoreAccess] 저장소 연결 실패 - method={}, error={}",
                    joinPoint.getSignature().toShortString(), e.getMessage(), e);
            throw new SystemException(ErrorCode.STORE_UNAVAILABLE, e);
        }
    }
}
