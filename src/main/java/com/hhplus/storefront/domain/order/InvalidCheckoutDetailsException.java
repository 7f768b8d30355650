package com.hhplus.storefront.domain.order;

import com.hhplus.storefront.common.exception.DomainException;
import com.hhplus.storefront.common.exception.ErrorCode;

public class InvalidCheckoutDetailsException extends DomainException {

    public InvalidCheckoutDetailsException(String detail) {
        super(ErrorCode.INVALID_CHECKOUT_DETAILS, detail);
    }
}
