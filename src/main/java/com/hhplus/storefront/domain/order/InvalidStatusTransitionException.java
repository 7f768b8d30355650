package com.hhplus.storefront.domain.order;

import com.hhplus.storefront.common.exception.DomainException;
import com.hhplus.storefront.common.exception.ErrorCode;

/**
 * FORWARD_ONLY 정책에서 역방향 상태 전환을 시도할 때 발생하는 예외
 */
public class InvalidStatusTransitionException extends DomainException {

    public InvalidStatusTransitionException(Long orderId, OrderStatus from, OrderStatus to) {
        super(ErrorCode.INVALID_STATUS_TRANSITION, "Order ID: " + orderId + ", " + from + " → " + to);
    }
}
