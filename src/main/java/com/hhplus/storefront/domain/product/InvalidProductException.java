package com.hhplus.storefront.domain.product;

import com.hhplus.storefront.common.exception.DomainException;
import com.hhplus.storefront.common.exception.ErrorCode;

/**
 * 상품 생성/수정 값이 규칙에 맞지 않을 때 발생하는 예외
 */
public class InvalidProductException extends DomainException {

    public InvalidProductException(String detailMessage) {
        super(ErrorCode.INVALID_PRODUCT, detailMessage);
    }
}
