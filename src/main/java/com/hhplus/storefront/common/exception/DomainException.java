package com.hhplus.storefront.common.exception;

/**
 * DomainException - 도메인 규칙 위반 예외
 *
 * 역할:
 * - 장바구니/주문/결제 증빙/상태 전환 규칙 위반 시 발생
 * - 모두 호출자(전송 계층)가 사용자 메시지로 변환하는 복구 가능한 상황
 * - 일반적으로 클라이언트 오류(4XX)로 응답
 *
 * 사용 예:
 * - ProductUnavailableException: 판매 중지 상품 담기
 * - NotOrderOwnerException: 타인의 주문에 결제 증빙 제출
 * - OrderAlreadyTerminalException: 종료된 주문의 상태 변경
 */
public class DomainException extends BizException {

    public DomainException(ErrorCode errorCode) {
        super(errorCode);
    }

    public DomainException(ErrorCode errorCode, Throwable cause) {
        super(errorCode, cause);
    }

    public DomainException(ErrorCode errorCode, String detailMessage) {
        super(errorCode, detailMessage);
    }
}
