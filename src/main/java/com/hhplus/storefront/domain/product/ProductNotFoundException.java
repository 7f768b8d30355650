package com.hhplus.storefront.domain.product;

import com.hhplus.storefront.common.exception.DomainException;
import com.hhplus.storefront.common.exception.ErrorCode;

/**
 * 상품을 찾을 수 없을 때 발생하는 예외 (관리자 상품 수정 시)
 */
public class ProductNotFoundException extends DomainException {

    public ProductNotFoundException(Long productId) {
        super(ErrorCode.PRODUCT_NOT_FOUND, "Product ID: " + productId);
    }
}
