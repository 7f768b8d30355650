package com.hhplus.storefront.domain.order.event;

import com.hhplus.storefront.domain.order.OrderStatus;
import lombok.Getter;
import lombok.ToString;

/**
 * 주문 상태 변경 이벤트
 *
 * 용도: 상태 변경 사실을 고객에게 알림 (트랜잭션 커밋 후 비동기 처리)
 * 발행 시점: OrderStatusService.changeStatus() 트랜잭션 내부
 * 리스너: OrderNotificationEventListener
 */
@Getter
@ToString
public class OrderStatusChangedEvent {

    private final Long orderId;
    private final Long userId;
    private final OrderStatus oldStatus;
    private final OrderStatus newStatus;

    public OrderStatusChangedEvent(Long orderId, Long userId, OrderStatus oldStatus, OrderStatus newStatus) {
        this.orderId = orderId;
        this.userId = userId;
        this.oldStatus = oldStatus;
        this.newStatus = newStatus;
    }
}
