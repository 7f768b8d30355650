package com.hhplus.storefront.domain.order;

import com.hhplus.storefront.common.exception.DomainException;
import com.hhplus.storefront.common.exception.ErrorCode;

/**
 * 주문 소유자가 아닌 사용자가 결제 증빙 제출/주문 조회를 시도할 때 발생하는 예외
 */
public class NotOrderOwnerException extends DomainException {

    public NotOrderOwnerException(Long orderId, Long requesterUserId) {
        super(ErrorCode.NOT_ORDER_OWNER, "Order ID: " + orderId + ", User ID: " + requesterUserId);
    }
}
