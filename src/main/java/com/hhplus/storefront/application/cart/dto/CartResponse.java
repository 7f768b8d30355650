package com.hhplus.storefront.application.cart.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 장바구니 조회 응답 (Application layer 내부 DTO)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CartResponse {
    private Long userId;
    private List<CartItemResponse> items;
    private Integer totalQuantity;
    private Long totalAmount;

    public boolean isEmpty() {
        return items == null || items.isEmpty();
    }

    public static CartResponse of(Long userId, List<CartItemResponse> items) {
        return CartResponse.builder()
                .userId(userId)
                .items(items)
                .totalQuantity(items.stream().mapToInt(CartItemResponse::getQuantity).sum())
                .totalAmount(items.stream().mapToLong(CartItemResponse::getSubtotal).reduce(0L, Math::addExact))
                .build();
    }
}
