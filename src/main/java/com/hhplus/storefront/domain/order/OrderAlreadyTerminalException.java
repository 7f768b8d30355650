package com.hhplus.storefront.domain.order;

import com.hhplus.storefront.common.exception.DomainException;
import com.hhplus.storefront.common.exception.ErrorCode;

/**
 * 종료 상태(DONE, CANCELED)의 주문에 상태 변경을 시도할 때 발생하는 예외
 */
public class OrderAlreadyTerminalException extends DomainException {

    public OrderAlreadyTerminalException(Long orderId, OrderStatus currentStatus) {
        super(ErrorCode.ORDER_ALREADY_TERMINAL, "Order ID: " + orderId + ", 현재 상태: " + currentStatus);
    }
}
