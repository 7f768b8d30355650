package com.hhplus.storefront.domain.product;

import com.hhplus.storefront.common.exception.DomainException;
import com.hhplus.storefront.common.exception.ErrorCode;

/**
 * 상품이 없거나 판매 중지 상태일 때 발생하는 예외
 * 장바구니 담기, 상품 상세 조회 시 사용
 */
public class ProductUnavailableException extends DomainException {

    public ProductUnavailableException(Long productId) {
        super(ErrorCode.PRODUCT_UNAVAILABLE, "Product ID: " + productId);
    }
}
