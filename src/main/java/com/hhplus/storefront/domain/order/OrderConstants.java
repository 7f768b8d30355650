package com.hhplus.storefront.domain.order;

/**
 * OrderConstants - 주문 도메인 상수
 */
public class OrderConstants {

    /** 고객 "내 주문" 조회 건수 */
    public static final int MY_ORDERS_LIMIT = 20;

    /** 운영자 주문 목록 조회 건수 */
    public static final int OPERATOR_ORDERS_LIMIT = 50;

    /** 연락처에 연속으로 포함되어야 하는 최소 숫자 자릿수 */
    public static final int MIN_PHONE_DIGITS = 7;

    /** 사진 증빙만 제출된 경우의 결제 수단 기본값 */
    public static final String UNKNOWN_PAYMENT_METHOD = "UNKNOWN";

    /** 사진 증빙만 제출된 경우의 결제 참조 기본값 */
    public static final String PHOTO_PROOF_REFERENCE = "PHOTO_PROOF";

    private OrderConstants() {
        throw new AssertionError("OrderConstants는 인스턴스화할 수 없습니다");
    }
}
