package com.hhplus.storefront.common.exception;

/**
 * ErrorCode - 비즈니스 예외 코드 정의
 *
 * 역할:
 * - 모든 비즈니스 예외의 코드와 메시지 정의
 * - HTTP 상태 코드 매핑
 * - 전송 계층(채팅/REST)에 일관된 에러 응답 제공
 *
 * 코드 형식: {LAYER}_{DOMAIN}_{ERROR}
 * 예: DOMAIN_ORDER_NOT_FOUND, SYSTEM_STORE_UNAVAILABLE
 */
public enum ErrorCode {

    // ========== Domain Layer Errors (4XX) ==========

    // Product Domain
    PRODUCT_NOT_FOUND("DOMAIN_PRODUCT_NOT_FOUND", "상품을 찾을 수 없습니다", 404),
    PRODUCT_UNAVAILABLE("DOMAIN_PRODUCT_UNAVAILABLE", "판매 중인 상품이 아닙니다", 400),
    INVALID_PRODUCT("DOMAIN_PRODUCT_INVALID", "유효하지 않은 상품 정보입니다", 400),

    // Cart Domain
    INVALID_QUANTITY("DOMAIN_CART_INVALID_QUANTITY", "수량은 1 이상 1000 이하여야 합니다", 400),

    // Order Domain
    INVALID_CHECKOUT_DETAILS("DOMAIN_ORDER_INVALID_CHECKOUT_DETAILS", "주문자 정보가 올바르지 않습니다", 400),
    ORDER_NOT_FOUND("DOMAIN_ORDER_NOT_FOUND", "주문을 찾을 수 없습니다", 404),
    NOT_ORDER_OWNER("DOMAIN_ORDER_NOT_OWNER", "본인의 주문이 아닙니다", 403),
    ORDER_ALREADY_TERMINAL("DOMAIN_ORDER_ALREADY_TERMINAL", "이미 종료된 주문입니다", 409),
    INVALID_STATUS_TRANSITION("DOMAIN_ORDER_INVALID_STATUS_TRANSITION", "허용되지 않는 주문 상태 변경입니다", 409),

    // Operator Domain
    UNAUTHORIZED("DOMAIN_OPERATOR_UNAUTHORIZED", "운영자 권한이 필요합니다", 403),

    // Settings Domain
    INVALID_SETTING("DOMAIN_SETTINGS_INVALID", "유효하지 않은 설정 값입니다", 400),

    // ========== System Errors (5XX) ==========

    STORE_UNAVAILABLE("SYSTEM_STORE_UNAVAILABLE", "저장소에 연결할 수 없습니다", 503),
    INTERNAL_SERVER_ERROR("SYSTEM_INTERNAL_SERVER_ERROR", "서버 내부 오류가 발생했습니다", 500);

    private final String code;
    private final String message;
    private final int statusCode;

    ErrorCode(String code, String message, int statusCode) {
        this.code = code;
        this.message = message;
        this.statusCode = statusCode;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
