package com.hhplus.storefront.domain.order;

import lombok.Getter;

/**
 * OrderStatus - 도메인 값 객체 (Enum)
 *
 * 주문의 생명주기 상태를 나타냅니다.
 * - NEW: 예약된 초기 상태 (결제 전 주문 생성 흐름용)
 * - WAIT_PAYMENT: 주문 생성됨, 결제 확인 대기 중 (체크아웃 직후 상태)
 * - PAID: 운영자가 결제를 확인함
 * - PACKING: 포장 중
 * - SHIPPED: 배송 중
 * - DONE: 완료 (종료 상태)
 * - CANCELED: 취소 (종료 상태)
 *
 * 진행 순서(step):
 * NEW → WAIT_PAYMENT → PAID → PACKING → SHIPPED → DONE
 * 종료 상태(DONE, CANCELED)에서는 어떤 상태로도 변경할 수 없다.
 */
@Getter
public enum OrderStatus {
    NEW("신규", 0),
    WAIT_PAYMENT("결제 대기", 1),
    PAID("결제 완료", 2),
    PACKING("포장 중", 3),
    SHIPPED("배송 중", 4),
    DONE("완료", 5),
    CANCELED("취소", 5);

    private final String displayName;
    private final int step;

    OrderStatus(String displayName, int step) {
        this.displayName = displayName;
        this.step = step;
    }

    public boolean isTerminal() {
        return this == DONE || this == CANCELED;
    }

    /**
     * 문자열에서 OrderStatus로 변환
     *
     * @throws IllegalArgumentException 알 수 없는 상태 문자열
     */
    public static OrderStatus fromString(String status) {
        if (status == null || status.isBlank()) {
            throw new IllegalArgumentException("주문 상태가 비어 있습니다");
        }
        try {
            return OrderStatus.valueOf(status.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("유효하지 않은 주문 상태입니다: " + status);
        }
    }
}
