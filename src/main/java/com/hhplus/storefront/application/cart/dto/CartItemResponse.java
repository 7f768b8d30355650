package com.hhplus.storefront.application.cart.dto;

import com.hhplus.storefront.domain.cart.CartItem;
import com.hhplus.storefront.domain.product.Product;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 장바구니 라인 응답 - 현재 카탈로그의 상품명/단가로 조인된 값
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CartItemResponse {
    private Long productId;
    private String productName;
    private Long unitPrice;
    private Integer quantity;
    private Long subtotal;

    public static CartItemResponse of(CartItem item, Product product) {
        return CartItemResponse.builder()
                .productId(item.getProductId())
                .productName(product.getName())
                .unitPrice(product.getPrice())
                .quantity(item.getQuantity())
                .subtotal(item.subtotal(product.getPrice()))
                .build();
    }
}
