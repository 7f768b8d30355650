package com.hhplus.storefront.common.exception;

/**
 * SystemException - 시스템/인프라 계층 오류 예외
 *
 * 역할:
 * - 저장소 연결 불가 등 현재 작업을 중단해야 하는 오류
 * - 트랜잭션 롤백으로 부분 상태는 남지 않음
 * - 항상 서버 오류(5XX)로 응답
 */
public class SystemException extends BizException {

    public SystemException(ErrorCode errorCode) {
        super(errorCode);
    }

    public SystemException(ErrorCode errorCode, Throwable cause) {
        super(errorCode, cause);
    }

    public SystemException(ErrorCode errorCode, String detailMessage) {
        super(errorCode, detailMessage);
    }
}
