package com.hhplus.storefront.domain.product;

/**
 * ProductConstants - 상품 도메인 상수
 */
public class ProductConstants {

    /** 상품 최소 가격 (0원 허용, 무료 상품) */
    public static final long MIN_PRICE = 0L;

    /** 상품 최대 가격 (최대 장바구니 수량과 곱해도 long 범위 안) */
    public static final long MAX_PRICE = 1_000_000_000_000L;

    /** 수정 가능한 필드 */
    public static final String FIELD_NAME = "name";
    public static final String FIELD_PRICE = "price";
    public static final String FIELD_DESCRIPTION = "description";
    public static final String FIELD_PHOTO = "photo";

    private ProductConstants() {
        throw new AssertionError("ProductConstants는 인스턴스화할 수 없습니다");
    }
}
